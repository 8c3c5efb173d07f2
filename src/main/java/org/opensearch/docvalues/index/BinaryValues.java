/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index;

import org.apache.lucene.util.BytesRef;

/**
 * Random-access view of a binary column: one byte sequence per document.
 */
public abstract class BinaryValues {

    protected BinaryValues() {}

    /**
     * Returns the bytes of a document. Documents without a value read as an empty sequence.
     * The returned reference is never reused by this instance, but its backing array is shared
     * and must not be modified.
     *
     * @param docID document in {@code [0, maxDoc)}
     */
    public abstract BytesRef get(int docID);
}
