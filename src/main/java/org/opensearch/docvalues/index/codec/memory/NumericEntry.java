/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index.codec.memory;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Catalog record locating a numeric column in the data file.
 */
@Value
@Builder
public class NumericEntry {

    /**
     * Start of the column. The missing bitset, when present, comes first.
     */
    long offset;

    /**
     * Start of the missing bitset, or {@code -1} when every document has a value.
     */
    long missingOffset;

    /**
     * Length of the missing bitset in bytes, {@code 0} without bitset.
     */
    long missingBytes;

    @NonNull
    NumericEncoding encoding;

    /**
     * Packed-ints format version, {@code -1} for {@link NumericEncoding#UNCOMPRESSED}.
     */
    int packedIntsVersion;

    /**
     * @return where the encoded values start
     */
    public long valuesOffset() {
        return offset + missingBytes;
    }
}
