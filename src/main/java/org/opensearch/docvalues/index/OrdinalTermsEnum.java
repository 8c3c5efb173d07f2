/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index;

import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefIterator;

import java.io.IOException;

/**
 * Ascending enumeration over the terms of an ordered column, paired with their ordinals.
 *
 * A fresh enum is unpositioned: {@link #next()} returns the first term. Seeking repositions it
 * and enumeration continues from the new position. Instances are not thread-safe.
 */
public abstract class OrdinalTermsEnum implements BytesRefIterator {

    /**
     * Result of {@link #seekCeil(BytesRef)}.
     */
    public enum SeekStatus {
        /** No term is greater than or equal to the target; the enum is exhausted. */
        END,
        /** The exact target was found. */
        FOUND,
        /** Positioned on the smallest term greater than the target. */
        NOT_FOUND
    }

    /**
     * Enum over an empty column.
     */
    public static final OrdinalTermsEnum EMPTY = new OrdinalTermsEnum() {
        @Override
        public BytesRef next() {
            return null;
        }

        @Override
        public SeekStatus seekCeil(BytesRef text) {
            return SeekStatus.END;
        }

        @Override
        public void seekExact(long ord) {
            throw new IllegalArgumentException("ordinal " + ord + " is out of bounds: the column has no terms");
        }

        @Override
        public BytesRef term() {
            throw new IllegalStateException("enum over an empty column is never positioned");
        }

        @Override
        public long ord() {
            throw new IllegalStateException("enum over an empty column is never positioned");
        }
    };

    protected OrdinalTermsEnum() {}

    /**
     * Advances to the next term.
     *
     * @return the next term, or {@code null} once the enum is exhausted
     */
    @Override
    public abstract BytesRef next() throws IOException;

    /**
     * Positions the enum on the smallest term greater than or equal to {@code text}.
     */
    public abstract SeekStatus seekCeil(BytesRef text) throws IOException;

    /**
     * Positions the enum on {@code text} if it exists. The position is undefined when this
     * returns {@code false}.
     */
    public boolean seekExact(BytesRef text) throws IOException {
        return seekCeil(text) == SeekStatus.FOUND;
    }

    /**
     * Positions the enum on the term with this ordinal.
     */
    public abstract void seekExact(long ord) throws IOException;

    /**
     * @return the current term; the bytes may change once the enum moves
     */
    public abstract BytesRef term() throws IOException;

    /**
     * @return the ordinal of the current term
     */
    public abstract long ord() throws IOException;
}
