/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index;

import org.apache.lucene.util.Bits;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Presence bits derived from ordered columns, which persist no bitset of their own.
 *
 * The returned bits read through the given view and inherit its threading restrictions.
 */
public final class DocsWithValue {

    private DocsWithValue() {}

    /**
     * A document is present when its ordinal is not {@code -1}.
     */
    public static Bits sorted(SortedValues values, int maxDoc) {
        return new SortedBits(values, maxDoc);
    }

    /**
     * A document is present when it has at least one ordinal.
     */
    public static Bits sortedSet(SortedSetValues values, int maxDoc) {
        return new SortedSetBits(values, maxDoc);
    }

    private static final class SortedBits implements Bits {
        private final SortedValues values;
        private final int maxDoc;

        SortedBits(SortedValues values, int maxDoc) {
            this.values = values;
            this.maxDoc = maxDoc;
        }

        @Override
        public boolean get(int index) {
            return values.getOrd(index) >= 0;
        }

        @Override
        public int length() {
            return maxDoc;
        }
    }

    private static final class SortedSetBits implements Bits {
        private final SortedSetValues values;
        private final int maxDoc;

        SortedSetBits(SortedSetValues values, int maxDoc) {
            this.values = values;
            this.maxDoc = maxDoc;
        }

        @Override
        public boolean get(int index) {
            values.setDocument(index);
            try {
                return values.nextOrd() != SortedSetValues.NO_MORE_ORDS;
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        @Override
        public int length() {
            return maxDoc;
        }
    }
}
