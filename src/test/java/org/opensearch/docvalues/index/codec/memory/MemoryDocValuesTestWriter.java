/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index.codec.memory;

import lombok.extern.log4j.Log4j2;
import org.apache.lucene.codecs.CodecUtil;
import org.apache.lucene.index.IndexFileNames;
import org.apache.lucene.store.ByteBuffersDataOutput;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.IOContext;
import org.apache.lucene.store.IndexOutput;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.FixedBitSet;
import org.apache.lucene.util.IOUtils;
import org.apache.lucene.util.packed.BlockPackedWriter;
import org.apache.lucene.util.packed.MonotonicBlockPackedWriter;
import org.apache.lucene.util.packed.PackedInts;
import org.opensearch.docvalues.index.fst.OrdinalDictionaryBuilder;

import java.io.Closeable;
import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Writes a segment in the {@link MemoryDocValuesFormat} so the read path can be tested.
 *
 * Values are given per document; a {@code null} entry marks a document without value and makes the
 * writer emit a missing bitset. Fields are written in call order. {@link #finish()} writes the
 * terminator and, for checksum versions, the footers.
 *
 * <h2>Usage</h2>
 * <pre>
 * try (MemoryDocValuesTestWriter writer = new MemoryDocValuesTestWriter(directory, SEGMENT_NAME, maxDoc)) {
 *     writer.addNumeric(0, values, NumericEncoding.DELTA);
 *     writer.finish();
 * }
 * </pre>
 */
@Log4j2
final class MemoryDocValuesTestWriter implements Closeable {

    static final int DEFAULT_BLOCK_SIZE = 64;

    private final IndexOutput meta;
    private final IndexOutput data;
    private final int maxDoc;
    private final int version;
    private boolean finished;

    MemoryDocValuesTestWriter(Directory directory, String segmentName, int maxDoc) throws IOException {
        this(directory, segmentName, maxDoc, MemoryDocValuesFormat.VERSION_CURRENT, MemoryDocValuesFormat.VERSION_CURRENT);
    }

    MemoryDocValuesTestWriter(Directory directory, String segmentName, int maxDoc, int metaVersion, int dataVersion) throws IOException {
        this.maxDoc = maxDoc;
        this.version = metaVersion;
        String metaName = IndexFileNames.segmentFileName(segmentName, "", MemoryDocValuesFormat.METADATA_EXTENSION);
        String dataName = IndexFileNames.segmentFileName(segmentName, "", MemoryDocValuesFormat.DATA_EXTENSION);
        IndexOutput metaOut = null;
        IndexOutput dataOut = null;
        boolean success = false;
        try {
            metaOut = directory.createOutput(metaName, IOContext.DEFAULT);
            dataOut = directory.createOutput(dataName, IOContext.DEFAULT);
            CodecUtil.writeHeader(metaOut, MemoryDocValuesFormat.METADATA_CODEC, metaVersion);
            CodecUtil.writeHeader(dataOut, MemoryDocValuesFormat.DATA_CODEC, dataVersion);
            success = true;
        } finally {
            if (success == false) {
                IOUtils.closeWhileHandlingException(metaOut, dataOut);
            }
        }
        this.meta = metaOut;
        this.data = dataOut;
    }

    void addNumeric(int fieldNumber, long[] values, NumericEncoding encoding) throws IOException {
        Long[] boxed = new Long[values.length];
        for (int i = 0; i < values.length; i++) {
            boxed[i] = values[i];
        }
        addNumeric(fieldNumber, boxed, encoding);
    }

    /**
     * Writes a numeric column. Documents without value are stored as {@code 0}.
     */
    void addNumeric(int fieldNumber, Long[] values, NumericEncoding encoding) throws IOException {
        checkDocCount(values.length);
        long[] stored = new long[maxDoc];
        for (int i = 0; i < maxDoc; i++) {
            stored[i] = values[i] == null ? 0 : values[i];
        }
        long offset = data.getFilePointer();
        long[] missing = writeMissing(values);

        meta.writeVInt(fieldNumber);
        meta.writeByte(MemoryDocValuesFormat.NUMBER);
        meta.writeLong(offset);
        writeMissingRecord(missing);
        meta.writeByte(encoding.getCode());
        if (encoding.hasPackedIntsVersion()) {
            meta.writeVInt(PackedInts.VERSION_CURRENT);
        }

        switch (encoding) {
            case TABLE:
                long[] table = Arrays.stream(stored).distinct().sorted().toArray();
                long[] ords = new long[maxDoc];
                for (int i = 0; i < maxDoc; i++) {
                    ords[i] = Arrays.binarySearch(table, stored[i]);
                }
                writeTable(table, ords);
                break;
            case DELTA:
                data.writeVInt(DEFAULT_BLOCK_SIZE);
                writeBlockPacked(stored);
                break;
            case UNCOMPRESSED:
                for (long value : stored) {
                    if (value < 0 || value > 0xFF) {
                        throw new IllegalArgumentException("value " + value + " does not fit an unsigned byte");
                    }
                    data.writeByte((byte) value);
                }
                break;
            case GCD:
                writeGcd(stored);
                break;
            default:
                throw new AssertionError();
        }
        log.trace("Wrote numeric field {} as {}", fieldNumber, encoding);
    }

    /**
     * Writes a TABLE column from an explicit table, which may hold more entries than a reader accepts.
     */
    void addNumericTable(int fieldNumber, long[] table, long[] ords) throws IOException {
        checkDocCount(ords.length);
        meta.writeVInt(fieldNumber);
        meta.writeByte(MemoryDocValuesFormat.NUMBER);
        meta.writeLong(data.getFilePointer());
        meta.writeLong(-1);
        meta.writeByte(NumericEncoding.TABLE.getCode());
        meta.writeVInt(PackedInts.VERSION_CURRENT);
        writeTable(table, ords);
    }

    void addBinary(int fieldNumber, BytesRef[] values) throws IOException {
        addBinary(fieldNumber, values, DEFAULT_BLOCK_SIZE);
    }

    /**
     * Writes a binary column; values of different lengths get an address table with the given block size.
     */
    void addBinary(int fieldNumber, BytesRef[] values, int addressBlockSize) throws IOException {
        checkDocCount(values.length);
        long offset = data.getFilePointer();
        int minLength = maxDoc == 0 ? 0 : Integer.MAX_VALUE;
        int maxLength = 0;
        long[] addresses = new long[maxDoc];
        long address = 0;
        for (int i = 0; i < maxDoc; i++) {
            BytesRef value = values[i] == null ? new BytesRef() : values[i];
            data.writeBytes(value.bytes, value.offset, value.length);
            minLength = Math.min(minLength, value.length);
            maxLength = Math.max(maxLength, value.length);
            address += value.length;
            addresses[i] = address;
        }
        long numBytes = data.getFilePointer() - offset;
        long[] missing = writeMissing(values);

        meta.writeVInt(fieldNumber);
        meta.writeByte(MemoryDocValuesFormat.BYTES);
        meta.writeLong(offset);
        meta.writeLong(numBytes);
        writeMissingRecord(missing);
        meta.writeVInt(minLength);
        meta.writeVInt(maxLength);
        if (minLength != maxLength) {
            meta.writeVInt(PackedInts.VERSION_CURRENT);
            meta.writeVInt(addressBlockSize);
            MonotonicBlockPackedWriter writer = new MonotonicBlockPackedWriter(data, addressBlockSize);
            for (long end : addresses) {
                writer.add(end);
            }
            writer.finish();
        }
        log.trace("Wrote binary field {}: {} bytes, lengths [{}, {}]", fieldNumber, numBytes, minLength, maxLength);
    }

    /**
     * Writes a sorted field: the dictionary of distinct values plus one ordinal per document, {@code -1} without value.
     */
    void addSorted(int fieldNumber, BytesRef[] values) throws IOException {
        checkDocCount(values.length);
        List<BytesRef> dictionary = new ArrayList<>(new TreeSet<>(nonNull(Arrays.asList(values))));
        writeDictionary(fieldNumber, dictionary);
        if (dictionary.isEmpty()) {
            return;
        }
        long[] ords = new long[maxDoc];
        for (int i = 0; i < maxDoc; i++) {
            ords[i] = values[i] == null ? -1 : dictionaryOrd(dictionary, values[i]);
        }
        addNumeric(fieldNumber, ords, NumericEncoding.DELTA);
    }

    void addSortedSet(int fieldNumber, BytesRef[][] values) throws IOException {
        addSortedSet(fieldNumber, values, DEFAULT_BLOCK_SIZE);
    }

    /**
     * Writes a sorted-set field: the dictionary of all values plus, per document, the vlong deltas of
     * its distinct ordinals in ascending order.
     */
    void addSortedSet(int fieldNumber, BytesRef[][] values, int addressBlockSize) throws IOException {
        checkDocCount(values.length);
        TreeSet<BytesRef> unique = new TreeSet<>();
        for (BytesRef[] document : values) {
            unique.addAll(nonNull(Arrays.asList(document)));
        }
        List<BytesRef> dictionary = new ArrayList<>(unique);
        writeDictionary(fieldNumber, dictionary);
        if (dictionary.isEmpty()) {
            return;
        }
        BytesRef[] encoded = new BytesRef[maxDoc];
        for (int i = 0; i < maxDoc; i++) {
            TreeSet<Long> ords = new TreeSet<>();
            for (BytesRef value : values[i]) {
                ords.add((long) dictionaryOrd(dictionary, value));
            }
            ByteBuffersDataOutput deltas = new ByteBuffersDataOutput();
            long previous = 0;
            for (long ord : ords) {
                deltas.writeVLong(ord - previous);
                previous = ord;
            }
            encoded[i] = new BytesRef(deltas.toArrayCopy());
        }
        addBinary(fieldNumber, encoded, addressBlockSize);
    }

    /**
     * Writes only the field number and tag of a record; the rest is up to the caller.
     */
    void addRawRecordHeader(int fieldNumber, byte tag) throws IOException {
        meta.writeVInt(fieldNumber);
        meta.writeByte(tag);
    }

    void addRawLongs(long... values) throws IOException {
        for (long value : values) {
            meta.writeLong(value);
        }
    }

    void addRawByte(byte value) throws IOException {
        meta.writeByte(value);
    }

    void finish() throws IOException {
        if (finished) {
            throw new IllegalStateException("finish() was already called");
        }
        finished = true;
        meta.writeVInt(MemoryDocValuesFormat.END_OF_FIELDS);
        if (version >= MemoryDocValuesFormat.VERSION_CHECKSUM) {
            CodecUtil.writeFooter(meta);
            CodecUtil.writeFooter(data);
        }
    }

    @Override
    public void close() throws IOException {
        IOUtils.close(meta, data);
    }

    private void writeTable(long[] table, long[] ords) throws IOException {
        data.writeVInt(table.length);
        for (long value : table) {
            data.writeLong(value);
        }
        int bitsPerValue = PackedInts.bitsRequired(Math.max(0, table.length - 1));
        data.writeVInt(PackedInts.Format.PACKED.getId());
        data.writeVInt(bitsPerValue);
        PackedInts.Writer writer = PackedInts.getWriterNoHeader(
            data,
            PackedInts.Format.PACKED,
            ords.length,
            bitsPerValue,
            PackedInts.DEFAULT_BUFFER_SIZE
        );
        for (long ord : ords) {
            writer.add(ord);
        }
        writer.finish();
    }

    private void writeBlockPacked(long[] values) throws IOException {
        BlockPackedWriter writer = new BlockPackedWriter(data, DEFAULT_BLOCK_SIZE);
        for (long value : values) {
            writer.add(value);
        }
        writer.finish();
    }

    private void writeGcd(long[] values) throws IOException {
        long min = Long.MAX_VALUE;
        for (long value : values) {
            min = Math.min(min, value);
        }
        BigInteger gcd = BigInteger.ZERO;
        for (long value : values) {
            gcd = gcd.gcd(BigInteger.valueOf(value).subtract(BigInteger.valueOf(min)));
        }
        long mult = gcd.signum() == 0 ? 1 : gcd.longValueExact();
        long[] quotients = new long[values.length];
        for (int i = 0; i < values.length; i++) {
            quotients[i] = BigInteger.valueOf(values[i]).subtract(BigInteger.valueOf(min)).divide(BigInteger.valueOf(mult)).longValue();
        }
        data.writeLong(values.length == 0 ? 0 : min);
        data.writeLong(mult);
        data.writeVInt(DEFAULT_BLOCK_SIZE);
        writeBlockPacked(quotients);
    }

    private void writeDictionary(int fieldNumber, List<BytesRef> terms) throws IOException {
        meta.writeVInt(fieldNumber);
        meta.writeByte(MemoryDocValuesFormat.DICTIONARY);
        meta.writeLong(data.getFilePointer());
        meta.writeVLong(terms.size());
        if (terms.isEmpty() == false) {
            OrdinalDictionaryBuilder.write(data, terms);
        }
    }

    /**
     * Writes the missing bitset if any document lacks a value.
     *
     * @return {@code {missingOffset, missingBytes}}
     */
    private long[] writeMissing(Object[] values) throws IOException {
        FixedBitSet present = new FixedBitSet(maxDoc);
        boolean anyMissing = false;
        for (int i = 0; i < maxDoc; i++) {
            if (values[i] != null) {
                present.set(i);
            } else {
                anyMissing = true;
            }
        }
        if (anyMissing == false) {
            return new long[] { -1, 0 };
        }
        long missingOffset = data.getFilePointer();
        for (long word : present.getBits()) {
            data.writeLong(word);
        }
        return new long[] { missingOffset, data.getFilePointer() - missingOffset };
    }

    private void writeMissingRecord(long[] missing) throws IOException {
        meta.writeLong(missing[0]);
        if (missing[0] != -1) {
            meta.writeLong(missing[1]);
        }
    }

    private void checkDocCount(int count) {
        if (count != maxDoc) {
            throw new IllegalArgumentException("expected " + maxDoc + " values, got " + count);
        }
    }

    private static int dictionaryOrd(List<BytesRef> dictionary, BytesRef value) {
        int ord = Collections.binarySearch(dictionary, value);
        assert ord >= 0 : value + " is not in the dictionary";
        return ord;
    }

    private static List<BytesRef> nonNull(List<BytesRef> values) {
        List<BytesRef> result = new ArrayList<>();
        for (BytesRef value : values) {
            if (value != null) {
                result.add(value);
            }
        }
        return result;
    }
}
