/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index.codec.memory;

import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.store.IndexInput;
import org.apache.lucene.util.Accountable;
import org.apache.lucene.util.RamUsageEstimator;
import org.apache.lucene.util.packed.BlockPackedReaderIterator;
import org.apache.lucene.util.packed.PackedInts;
import org.apache.lucene.util.packed.PackedLongValues;
import org.opensearch.docvalues.index.NumericValues;

import java.io.IOException;

/**
 * Heap-resident numeric column. One final variant per {@link NumericEncoding}; all of them are
 * immutable after {@link #load} and safe to share between threads.
 */
public abstract class MemoryNumericValues extends NumericValues implements Accountable {

    /** Largest number of distinct values a TABLE column may declare. */
    public static final int MAX_TABLE_SIZE = 256;

    private MemoryNumericValues() {}

    /**
     * @return the encoding this column was decoded from
     */
    public abstract NumericEncoding encoding();

    /**
     * Decodes the column described by {@code entry}.
     *
     * @param data input positioned anywhere; it is moved to the values of the column
     * @param maxDoc number of documents of the segment
     */
    public static MemoryNumericValues load(IndexInput data, NumericEntry entry, int maxDoc) throws IOException {
        data.seek(entry.valuesOffset());
        switch (entry.getEncoding()) {
            case TABLE:
                int size = data.readVInt();
                if (size < 0 || size > MAX_TABLE_SIZE) {
                    throw new CorruptIndexException(
                        String.format("TABLE encoding cannot have more than %d distinct values, got %d", MAX_TABLE_SIZE, size),
                        data
                    );
                }
                long[] decode = new long[size];
                for (int i = 0; i < size; i++) {
                    decode[i] = data.readLong();
                }
                PackedInts.Format format = PackedFormatChecks.format(data.readVInt(), data);
                int bitsPerValue = data.readVInt();
                PackedFormatChecks.checkBitsPerValue(bitsPerValue, data);
                PackedInts.Reader ords = PackedInts.getReaderNoHeader(data, format, entry.getPackedIntsVersion(), maxDoc, bitsPerValue);
                return new Table(decode, ords);
            case DELTA:
                int blockSize = data.readVInt();
                return new Delta(readBlockPacked(data, entry.getPackedIntsVersion(), blockSize, maxDoc));
            case UNCOMPRESSED:
                byte[] bytes = new byte[maxDoc];
                data.readBytes(bytes, 0, bytes.length);
                return new Uncompressed(bytes);
            case GCD:
                long min = data.readLong();
                long mult = data.readLong();
                int quotientBlockSize = data.readVInt();
                return new Gcd(min, mult, readBlockPacked(data, entry.getPackedIntsVersion(), quotientBlockSize, maxDoc));
            default:
                throw new AssertionError();
        }
    }

    /**
     * Drains a block-packed stream into a random-access copy.
     */
    private static PackedLongValues readBlockPacked(IndexInput data, int packedIntsVersion, int blockSize, int maxDoc)
        throws IOException {
        PackedFormatChecks.checkBlockSize(blockSize, data);
        BlockPackedReaderIterator iterator = new BlockPackedReaderIterator(data, packedIntsVersion, blockSize, maxDoc);
        PackedLongValues.Builder values = PackedLongValues.packedBuilder(PackedInts.COMPACT);
        for (int i = 0; i < maxDoc; i++) {
            values.add(iterator.next());
        }
        return values.build();
    }

    /**
     * Values looked up in a table of at most {@value #MAX_TABLE_SIZE} entries.
     */
    public static final class Table extends MemoryNumericValues {
        private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(Table.class);

        private final long[] decode;
        private final PackedInts.Reader ords;

        Table(long[] decode, PackedInts.Reader ords) {
            this.decode = decode;
            this.ords = ords;
        }

        @Override
        public long get(int docID) {
            return decode[(int) ords.get(docID)];
        }

        @Override
        public NumericEncoding encoding() {
            return NumericEncoding.TABLE;
        }

        @Override
        public long ramBytesUsed() {
            return BASE_RAM_BYTES_USED + RamUsageEstimator.sizeOf(decode) + ords.ramBytesUsed();
        }
    }

    public static final class Delta extends MemoryNumericValues {
        private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(Delta.class);

        private final PackedLongValues values;

        Delta(PackedLongValues values) {
            this.values = values;
        }

        @Override
        public long get(int docID) {
            return values.get(docID);
        }

        @Override
        public NumericEncoding encoding() {
            return NumericEncoding.DELTA;
        }

        @Override
        public long ramBytesUsed() {
            return BASE_RAM_BYTES_USED + values.ramBytesUsed();
        }
    }

    /**
     * One unsigned byte per document.
     */
    public static final class Uncompressed extends MemoryNumericValues {
        private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(Uncompressed.class);

        private final byte[] bytes;

        Uncompressed(byte[] bytes) {
            this.bytes = bytes;
        }

        @Override
        public long get(int docID) {
            return Byte.toUnsignedLong(bytes[docID]);
        }

        @Override
        public NumericEncoding encoding() {
            return NumericEncoding.UNCOMPRESSED;
        }

        @Override
        public long ramBytesUsed() {
            return BASE_RAM_BYTES_USED + RamUsageEstimator.sizeOf(bytes);
        }
    }

    public static final class Gcd extends MemoryNumericValues {
        private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(Gcd.class);

        private final long min;
        private final long mult;
        private final PackedLongValues quotients;

        Gcd(long min, long mult, PackedLongValues quotients) {
            this.min = min;
            this.mult = mult;
            this.quotients = quotients;
        }

        @Override
        public long get(int docID) {
            return min + mult * quotients.get(docID);
        }

        @Override
        public NumericEncoding encoding() {
            return NumericEncoding.GCD;
        }

        @Override
        public long ramBytesUsed() {
            return BASE_RAM_BYTES_USED + quotients.ramBytesUsed();
        }
    }
}
