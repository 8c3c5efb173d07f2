/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index.codec.memory;

import org.opensearch.docvalues.index.SegmentDocValuesState;

import java.io.IOException;

/**
 * Doc-values format that loads every column fully into heap on first access.
 *
 * <p>A segment carries two files. The metadata file ({@value #METADATA_EXTENSION}) is a catalog of
 * per-field records; the data file ({@value #DATA_EXTENSION}) holds the encoded columns the records
 * point into. Both start with a {@code CodecUtil} header of the same version and, since
 * {@link #VERSION_CHECKSUM}, end with a checksum footer.
 *
 * @see MemoryDocValuesProducer for the read path
 * @see MemoryDocValuesMetadata for the catalog layout
 */
public final class MemoryDocValuesFormat {

    public static final String FORMAT_NAME = "Memory";

    public static final String DATA_CODEC = "MemoryDocValuesData";
    public static final String DATA_EXTENSION = "mdvd";
    public static final String METADATA_CODEC = "MemoryDocValuesMetadata";
    public static final String METADATA_EXTENSION = "mdvm";

    public static final int VERSION_START = 0;
    public static final int VERSION_GCD_COMPRESSION = 1;
    public static final int VERSION_CHECKSUM = 2;
    public static final int VERSION_CURRENT = VERSION_CHECKSUM;

    /** Record tag of a numeric column. */
    public static final byte NUMBER = 0;
    /** Record tag of a binary column. */
    public static final byte BYTES = 1;
    /** Record tag of a term dictionary. */
    public static final byte DICTIONARY = 2;

    /** Terminates the record list of the metadata file. */
    public static final int END_OF_FIELDS = -1;

    public String getName() {
        return FORMAT_NAME;
    }

    /**
     * Opens the read side of this format for one segment.
     */
    public MemoryDocValuesProducer fieldsProducer(SegmentDocValuesState state) throws IOException {
        return MemoryDocValuesProducer.open(state, DATA_CODEC, DATA_EXTENSION, METADATA_CODEC, METADATA_EXTENSION);
    }
}
