/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index.codec.memory;

import org.apache.lucene.store.IndexInput;
import org.apache.lucene.util.Accountable;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.PagedBytes;
import org.apache.lucene.util.RamUsageEstimator;
import org.apache.lucene.util.packed.MonotonicBlockPackedReader;
import org.opensearch.docvalues.index.BinaryValues;

import java.io.IOException;

/**
 * Heap-resident binary column backed by a frozen {@link PagedBytes} copy of the blob.
 *
 * Every {@link #get(int)} returns a new {@link BytesRef}, so instances can be shared between threads.
 */
public abstract class MemoryBinaryValues extends BinaryValues implements Accountable {

    private static final int PAGE_BITS = 16;

    final PagedBytes.Reader bytes;

    private MemoryBinaryValues(PagedBytes.Reader bytes) {
        this.bytes = bytes;
    }

    public abstract boolean isFixedLength();

    /**
     * Copies the column described by {@code entry} into heap.
     *
     * @param data input positioned anywhere; it is moved past the blob and, if any, the address table
     */
    public static MemoryBinaryValues load(IndexInput data, BinaryEntry entry, int maxDoc) throws IOException {
        data.seek(entry.getOffset());
        PagedBytes pagedBytes = new PagedBytes(PAGE_BITS);
        pagedBytes.copy(data, entry.getNumBytes());
        PagedBytes.Reader reader = pagedBytes.freeze(true);
        if (entry.isFixedLength()) {
            return new Fixed(reader, entry.getMinLength());
        }
        data.seek(entry.addressesOffset());
        MonotonicBlockPackedReader addresses = MonotonicBlockPackedReader.of(
            data,
            entry.getPackedIntsVersion(),
            entry.getBlockSize(),
            maxDoc
        );
        return new Variable(reader, addresses);
    }

    /**
     * All values have the same length; document {@code d} starts at {@code d * length}.
     */
    public static final class Fixed extends MemoryBinaryValues {
        private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(Fixed.class);

        private final int length;

        Fixed(PagedBytes.Reader bytes, int length) {
            super(bytes);
            this.length = length;
        }

        @Override
        public BytesRef get(int docID) {
            BytesRef term = new BytesRef();
            if (length > 0) {
                bytes.fillSlice(term, (long) length * docID, length);
            }
            return term;
        }

        @Override
        public boolean isFixedLength() {
            return true;
        }

        @Override
        public long ramBytesUsed() {
            return BASE_RAM_BYTES_USED + bytes.ramBytesUsed();
        }
    }

    /**
     * Values delimited by a table of end addresses; document {@code d} spans
     * {@code [end(d - 1), end(d))} with {@code end(-1) = 0}.
     */
    public static final class Variable extends MemoryBinaryValues {
        private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(Variable.class);

        private final MonotonicBlockPackedReader addresses;

        Variable(PagedBytes.Reader bytes, MonotonicBlockPackedReader addresses) {
            super(bytes);
            this.addresses = addresses;
        }

        @Override
        public BytesRef get(int docID) {
            long start = docID == 0 ? 0 : addresses.get(docID - 1);
            long end = addresses.get(docID);
            BytesRef term = new BytesRef();
            if (end > start) {
                bytes.fillSlice(term, start, Math.toIntExact(end - start));
            }
            return term;
        }

        @Override
        public boolean isFixedLength() {
            return false;
        }

        @Override
        public long ramBytesUsed() {
            return BASE_RAM_BYTES_USED + bytes.ramBytesUsed() + addresses.ramBytesUsed();
        }
    }
}
