/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index;

import org.apache.lucene.util.BytesRef;

import java.io.IOException;

/**
 * Multi-valued ordered string column. Each document holds an ascending set of ordinals,
 * consumed one at a time after {@link #setDocument(int)}.
 *
 * Instances keep a per-document cursor and must not be shared between threads.
 */
public abstract class SortedSetValues {

    /**
     * Returned by {@link #nextOrd()} once the current document has no more ordinals.
     */
    public static final long NO_MORE_ORDS = -1;

    protected SortedSetValues() {}

    /**
     * Positions the ordinal cursor on a document.
     */
    public abstract void setDocument(int docID);

    /**
     * @return the next ordinal of the current document, or {@link #NO_MORE_ORDS}
     */
    public abstract long nextOrd() throws IOException;

    /**
     * Returns the term of an ordinal. The returned bytes may be overwritten by the next call on
     * this instance.
     */
    public abstract BytesRef lookupOrd(long ord) throws IOException;

    /**
     * @return number of distinct terms
     */
    public abstract long getValueCount();

    /**
     * Finds the ordinal of a term.
     *
     * @return the ordinal if the term exists, otherwise {@code -insertionPoint - 1}
     */
    public long lookupTerm(BytesRef key) throws IOException {
        long low = 0;
        long high = getValueCount() - 1;
        while (low <= high) {
            long mid = (low + high) >>> 1;
            int cmp = lookupOrd(mid).compareTo(key);
            if (cmp < 0) {
                low = mid + 1;
            } else if (cmp > 0) {
                high = mid - 1;
            } else {
                return mid;
            }
        }
        return -(low + 1);
    }

    /**
     * @return a new enumeration over all terms in ordinal order
     */
    public abstract OrdinalTermsEnum termsEnum() throws IOException;
}
