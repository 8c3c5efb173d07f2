/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index.codec.memory;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.store.DataInput;

/**
 * Physical encodings of a numeric column, identified on disk by a one-byte code.
 */
@AllArgsConstructor
public enum NumericEncoding {
    /** Per-block minimum plus bit-packed deltas. */
    DELTA((byte) 0, true),
    /** Up to 256 distinct values, each document storing a packed index into the table. */
    TABLE((byte) 1, true),
    /** One unsigned byte per document. */
    UNCOMPRESSED((byte) 2, false),
    /** {@code min + mult * quotient} with block-packed quotients. */
    GCD((byte) 3, true);

    @Getter
    private final byte code;
    private final boolean packed;

    /**
     * @return whether the metadata record carries a packed-ints version for this encoding
     */
    public boolean hasPackedIntsVersion() {
        return packed;
    }

    public static NumericEncoding fromCode(byte code, DataInput in) throws CorruptIndexException {
        for (NumericEncoding encoding : values()) {
            if (encoding.code == code) {
                return encoding;
            }
        }
        throw new CorruptIndexException("Unknown numeric encoding: " + code, in);
    }
}
