/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index.codec.memory;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.lucene.codecs.CodecUtil;
import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.index.IndexFileNames;
import org.apache.lucene.store.ChecksumIndexInput;
import org.apache.lucene.store.IndexInput;
import org.apache.lucene.util.IOUtils;
import org.opensearch.docvalues.index.DocValuesField;
import org.opensearch.docvalues.index.DocValuesFields;
import org.opensearch.docvalues.index.SegmentDocValuesState;

import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.opensearch.docvalues.index.codec.memory.MemoryDocValuesFormat.BYTES;
import static org.opensearch.docvalues.index.codec.memory.MemoryDocValuesFormat.DICTIONARY;
import static org.opensearch.docvalues.index.codec.memory.MemoryDocValuesFormat.END_OF_FIELDS;
import static org.opensearch.docvalues.index.codec.memory.MemoryDocValuesFormat.NUMBER;
import static org.opensearch.docvalues.index.codec.memory.MemoryDocValuesFormat.VERSION_CHECKSUM;
import static org.opensearch.docvalues.index.codec.memory.MemoryDocValuesFormat.VERSION_CURRENT;
import static org.opensearch.docvalues.index.codec.memory.MemoryDocValuesFormat.VERSION_GCD_COMPRESSION;
import static org.opensearch.docvalues.index.codec.memory.MemoryDocValuesFormat.VERSION_START;

/**
 * Catalog of one segment: where each field's column and dictionary live in the data file.
 *
 * <h2>File Format</h2>
 * <pre>
 * Header          CodecUtil header (codec name, version)
 * Records         repeated until fieldNumber == -1:
 *   fieldNumber   vint
 *   tag           byte: 0 = NUMBER, 1 = BYTES, 2 = DICTIONARY
 *   NUMBER        offset:long, missingOffset:long, [missingBytes:long],
 *                 encoding:byte, [packedIntsVersion:vint unless UNCOMPRESSED]
 *   BYTES         offset:long, numBytes:long, missingOffset:long, [missingBytes:long],
 *                 minLength:vint, maxLength:vint, [packedIntsVersion:vint, blockSize:vint unless fixed]
 *   DICTIONARY    offset:long, ordinalCount:vlong
 * Terminator      vint -1
 * Footer          CodecUtil footer, since version 2
 * </pre>
 * {@code missingBytes} is present only when {@code missingOffset != -1}.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class MemoryDocValuesMetadata {

    private final int version;
    private final Map<Integer, NumericEntry> numerics;
    private final Map<Integer, BinaryEntry> binaries;
    private final Map<Integer, DictionaryEntry> dictionaries;

    /**
     * Reads and verifies the metadata file of a segment. The file is closed on every path.
     *
     * @throws CorruptIndexException if a record is malformed or the checksum does not match
     */
    public static MemoryDocValuesMetadata read(SegmentDocValuesState state, String metaCodec, String metaExtension) throws IOException {
        String metaName = IndexFileNames.segmentFileName(state.getSegmentName(), state.getSegmentSuffix(), metaExtension);
        ChecksumIndexInput in = state.getDirectory().openChecksumInput(metaName, state.getContext());
        boolean success = false;
        try {
            MemoryDocValuesMetadata metadata = read(in, metaCodec, state.getFields());
            success = true;
            return metadata;
        } finally {
            if (success) {
                IOUtils.close(in);
            } else {
                IOUtils.closeWhileHandlingException(in);
            }
        }
    }

    static MemoryDocValuesMetadata read(ChecksumIndexInput in, String metaCodec, DocValuesFields fields) throws IOException {
        int version = CodecUtil.checkHeader(in, metaCodec, VERSION_START, VERSION_CURRENT);
        Map<Integer, NumericEntry> numerics = new HashMap<>();
        Map<Integer, BinaryEntry> binaries = new HashMap<>();
        Map<Integer, DictionaryEntry> dictionaries = new HashMap<>();

        int fieldNumber = in.readVInt();
        while (fieldNumber != END_OF_FIELDS) {
            DocValuesField field = fields.fieldInfo(fieldNumber);
            if (field == null) {
                throw new CorruptIndexException("Invalid field number: " + fieldNumber, in);
            }
            byte tag = in.readByte();
            switch (tag) {
                case NUMBER:
                    putOnce(numerics, fieldNumber, readNumericEntry(in, version), in);
                    break;
                case BYTES:
                    putOnce(binaries, fieldNumber, readBinaryEntry(in), in);
                    break;
                case DICTIONARY:
                    putOnce(dictionaries, fieldNumber, readDictionaryEntry(in), in);
                    break;
                default:
                    throw new CorruptIndexException(String.format("Invalid entry type %d for field %s", tag, field.getName()), in);
            }
            fieldNumber = in.readVInt();
        }

        if (version >= VERSION_CHECKSUM) {
            CodecUtil.checkFooter(in);
        } else if (in.getFilePointer() != in.length()) {
            throw new CorruptIndexException(
                String.format("Did not read all metadata: read %d of %d bytes", in.getFilePointer(), in.length()),
                in
            );
        }
        return new MemoryDocValuesMetadata(
            version,
            Collections.unmodifiableMap(numerics),
            Collections.unmodifiableMap(binaries),
            Collections.unmodifiableMap(dictionaries)
        );
    }

    public NumericEntry numeric(int fieldNumber) {
        return numerics.get(fieldNumber);
    }

    public BinaryEntry binary(int fieldNumber) {
        return binaries.get(fieldNumber);
    }

    public DictionaryEntry dictionary(int fieldNumber) {
        return dictionaries.get(fieldNumber);
    }

    private static NumericEntry readNumericEntry(IndexInput in, int version) throws IOException {
        long offset = readOffset(in, "offset");
        long missingOffset = in.readLong();
        long missingBytes = readMissingBytes(in, missingOffset);
        NumericEncoding encoding = NumericEncoding.fromCode(in.readByte(), in);
        if (encoding == NumericEncoding.GCD && version < VERSION_GCD_COMPRESSION) {
            throw new CorruptIndexException("GCD compression is not supported before version " + VERSION_GCD_COMPRESSION, in);
        }
        int packedIntsVersion = -1;
        if (encoding.hasPackedIntsVersion()) {
            packedIntsVersion = in.readVInt();
            PackedFormatChecks.checkPackedIntsVersion(packedIntsVersion, in);
        }
        return NumericEntry.builder()
            .offset(offset)
            .missingOffset(missingOffset)
            .missingBytes(missingBytes)
            .encoding(encoding)
            .packedIntsVersion(packedIntsVersion)
            .build();
    }

    private static BinaryEntry readBinaryEntry(IndexInput in) throws IOException {
        long offset = readOffset(in, "offset");
        long numBytes = readOffset(in, "numBytes");
        long missingOffset = in.readLong();
        long missingBytes = readMissingBytes(in, missingOffset);
        int minLength = in.readVInt();
        int maxLength = in.readVInt();
        if (minLength < 0 || minLength > maxLength) {
            throw new CorruptIndexException(String.format("Invalid value lengths: min=%d, max=%d", minLength, maxLength), in);
        }
        BinaryEntry.BinaryEntryBuilder builder = BinaryEntry.builder()
            .offset(offset)
            .numBytes(numBytes)
            .missingOffset(missingOffset)
            .missingBytes(missingBytes)
            .minLength(minLength)
            .maxLength(maxLength)
            .packedIntsVersion(-1);
        if (minLength != maxLength) {
            int packedIntsVersion = in.readVInt();
            PackedFormatChecks.checkPackedIntsVersion(packedIntsVersion, in);
            int blockSize = in.readVInt();
            PackedFormatChecks.checkBlockSize(blockSize, in);
            builder.packedIntsVersion(packedIntsVersion).blockSize(blockSize);
        }
        return builder.build();
    }

    private static DictionaryEntry readDictionaryEntry(IndexInput in) throws IOException {
        long offset = readOffset(in, "offset");
        long ordinalCount = in.readVLong();
        if (ordinalCount < 0) {
            throw new CorruptIndexException("Negative ordinal count: " + ordinalCount, in);
        }
        return DictionaryEntry.builder().offset(offset).ordinalCount(ordinalCount).build();
    }

    private static long readOffset(IndexInput in, String name) throws IOException {
        long value = in.readLong();
        if (value < 0) {
            throw new CorruptIndexException(String.format("Negative %s: %d", name, value), in);
        }
        return value;
    }

    private static long readMissingBytes(IndexInput in, long missingOffset) throws IOException {
        if (missingOffset == -1) {
            return 0;
        }
        if (missingOffset < 0) {
            throw new CorruptIndexException("Invalid missing offset: " + missingOffset, in);
        }
        return readOffset(in, "missingBytes");
    }

    private static <T> void putOnce(Map<Integer, T> entries, int fieldNumber, T entry, IndexInput in) throws CorruptIndexException {
        if (entries.put(fieldNumber, entry) != null) {
            throw new CorruptIndexException("Duplicate record for field number " + fieldNumber, in);
        }
    }
}
