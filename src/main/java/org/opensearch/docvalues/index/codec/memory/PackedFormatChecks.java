/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index.codec.memory;

import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.store.DataInput;
import org.apache.lucene.util.packed.PackedInts;

/**
 * Turns packed-ints parameters read from a file into {@link CorruptIndexException}s when Lucene's
 * packed readers would reject them.
 */
final class PackedFormatChecks {

    /** Smallest block size Lucene's block-packed readers accept. */
    static final int MIN_BLOCK_SIZE = 64;
    /** Largest block size Lucene's block-packed readers accept. */
    static final int MAX_BLOCK_SIZE = 1 << 27;

    private PackedFormatChecks() {}

    /**
     * A block size must be a power of two within [{@link #MIN_BLOCK_SIZE}, {@link #MAX_BLOCK_SIZE}].
     */
    static void checkBlockSize(int blockSize, DataInput in) throws CorruptIndexException {
        if (blockSize < MIN_BLOCK_SIZE || blockSize > MAX_BLOCK_SIZE || (blockSize & (blockSize - 1)) != 0) {
            throw new CorruptIndexException("Invalid block size: " + blockSize, in);
        }
    }

    static void checkPackedIntsVersion(int packedIntsVersion, DataInput in) throws CorruptIndexException {
        if (packedIntsVersion < PackedInts.VERSION_START || packedIntsVersion > PackedInts.VERSION_CURRENT) {
            throw new CorruptIndexException(
                String.format(
                    "Unsupported packed ints version %d, expected [%d, %d]",
                    packedIntsVersion,
                    PackedInts.VERSION_START,
                    PackedInts.VERSION_CURRENT
                ),
                in
            );
        }
    }

    static void checkBitsPerValue(int bitsPerValue, DataInput in) throws CorruptIndexException {
        if (bitsPerValue < 1 || bitsPerValue > 64) {
            throw new CorruptIndexException("Invalid bits per value: " + bitsPerValue, in);
        }
    }

    static PackedInts.Format format(int formatId, DataInput in) throws CorruptIndexException {
        try {
            return PackedInts.Format.byId(formatId);
        } catch (IllegalArgumentException e) {
            throw new CorruptIndexException("Unknown packed ints format: " + formatId, in, e);
        }
    }
}
