/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index;

import org.apache.lucene.util.BytesRef;

import java.io.IOException;

/**
 * Single-valued ordered string column. Each document holds at most one ordinal; ordinals are
 * dense, start at {@code 0} and follow the byte order of the terms they stand for.
 *
 * Instances carry lookup scratch state and must not be shared between threads.
 */
public abstract class SortedValues {

    protected SortedValues() {}

    /**
     * @return the ordinal of the document's value, or {@code -1} if it has none
     */
    public abstract int getOrd(int docID);

    /**
     * Returns the term of an ordinal. The returned bytes may be overwritten by the next call on
     * this instance.
     *
     * @param ord ordinal in {@code [0, getValueCount())}
     */
    public abstract BytesRef lookupOrd(int ord) throws IOException;

    /**
     * @return number of distinct terms
     */
    public abstract int getValueCount();

    /**
     * Returns the term of the document's value, or {@code null} if it has none.
     */
    public BytesRef get(int docID) throws IOException {
        int ord = getOrd(docID);
        return ord == -1 ? null : lookupOrd(ord);
    }

    /**
     * Finds the ordinal of a term.
     *
     * @return the ordinal if the term exists, otherwise {@code -insertionPoint - 1}
     */
    public int lookupTerm(BytesRef key) throws IOException {
        int low = 0;
        int high = getValueCount() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
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
