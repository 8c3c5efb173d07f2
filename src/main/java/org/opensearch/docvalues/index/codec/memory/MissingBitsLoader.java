/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index.codec.memory;

import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.store.IndexInput;
import org.apache.lucene.util.FixedBitSet;

import java.io.IOException;

/**
 * Reads the presence bitset stored ahead of a numeric column or after a binary blob: little-endian
 * 64-bit words, bit {@code d} set when document {@code d} has a value.
 */
final class MissingBitsLoader {

    private MissingBitsLoader() {}

    static FixedBitSet load(IndexInput data, long offset, long length, int maxDoc) throws IOException {
        long requiredWords = FixedBitSet.bits2words(maxDoc);
        if (length % Long.BYTES != 0 || length / Long.BYTES < requiredWords || length / Long.BYTES > Integer.MAX_VALUE) {
            throw new CorruptIndexException(
                String.format("Invalid missing bitset length %d for %d documents", length, maxDoc),
                data
            );
        }
        data.seek(offset);
        long[] bits = new long[(int) (length / Long.BYTES)];
        for (int i = 0; i < bits.length; i++) {
            bits[i] = data.readLong();
        }
        return new FixedBitSet(bits, maxDoc);
    }
}
