/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index;

/**
 * Random-access view of a numeric column: one 64-bit value per document.
 */
public abstract class NumericValues {

    protected NumericValues() {}

    /**
     * Returns the value of a document. Documents without a value read as {@code 0}; use the
     * producer's docs-with-field bits to tell them apart.
     *
     * @param docID document in {@code [0, maxDoc)}
     */
    public abstract long get(int docID);
}
