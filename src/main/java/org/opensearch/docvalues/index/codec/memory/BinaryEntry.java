/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index.codec.memory;

import lombok.Builder;
import lombok.Value;

/**
 * Catalog record locating a binary column: a blob of {@code numBytes} bytes, the optional missing
 * bitset and, for variable-width values, a monotonic table of end addresses.
 */
@Value
@Builder
public class BinaryEntry {

    long offset;
    long numBytes;
    long missingOffset;
    long missingBytes;
    int minLength;
    int maxLength;

    /**
     * Packed-ints format version of the address table, {@code -1} for fixed-width values.
     */
    int packedIntsVersion;

    /**
     * Block size of the address table, {@code 0} for fixed-width values.
     */
    int blockSize;

    public boolean isFixedLength() {
        return minLength == maxLength;
    }

    /**
     * @return where the address table starts
     */
    public long addressesOffset() {
        return offset + numBytes + missingBytes;
    }
}
