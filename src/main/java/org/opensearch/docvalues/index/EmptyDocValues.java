/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index;

import org.apache.lucene.util.BytesRef;

/**
 * Views over columns whose dictionary has no terms: no document has a value.
 */
public final class EmptyDocValues {

    /**
     * Sorted column without terms. Every document reads ordinal {@code -1}.
     */
    public static final SortedValues EMPTY_SORTED = new SortedValues() {
        @Override
        public int getOrd(int docID) {
            return -1;
        }

        @Override
        public BytesRef lookupOrd(int ord) {
            throw new IllegalArgumentException("ordinal " + ord + " is out of bounds: the column has no terms");
        }

        @Override
        public int getValueCount() {
            return 0;
        }

        @Override
        public OrdinalTermsEnum termsEnum() {
            return OrdinalTermsEnum.EMPTY;
        }
    };

    /**
     * Sorted-set column without terms. Every document is empty.
     */
    public static final SortedSetValues EMPTY_SORTED_SET = new SortedSetValues() {
        @Override
        public void setDocument(int docID) {}

        @Override
        public long nextOrd() {
            return NO_MORE_ORDS;
        }

        @Override
        public BytesRef lookupOrd(long ord) {
            throw new IllegalArgumentException("ordinal " + ord + " is out of bounds: the column has no terms");
        }

        @Override
        public long getValueCount() {
            return 0;
        }

        @Override
        public OrdinalTermsEnum termsEnum() {
            return OrdinalTermsEnum.EMPTY;
        }
    };

    private EmptyDocValues() {}
}
