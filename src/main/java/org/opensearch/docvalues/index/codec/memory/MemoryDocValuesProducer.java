/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index.codec.memory;

import lombok.extern.log4j.Log4j2;
import org.apache.lucene.codecs.CodecUtil;
import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.index.DocValuesType;
import org.apache.lucene.index.IndexFileNames;
import org.apache.lucene.store.AlreadyClosedException;
import org.apache.lucene.store.IndexInput;
import org.apache.lucene.util.Accountable;
import org.apache.lucene.util.Bits;
import org.apache.lucene.util.IOUtils;
import org.apache.lucene.util.RamUsageEstimator;
import org.apache.lucene.util.fst.FST;
import org.apache.lucene.util.fst.PositiveIntOutputs;
import org.opensearch.docvalues.index.BinaryValues;
import org.opensearch.docvalues.index.DocValuesField;
import org.opensearch.docvalues.index.DocsWithValue;
import org.opensearch.docvalues.index.EmptyDocValues;
import org.opensearch.docvalues.index.NumericValues;
import org.opensearch.docvalues.index.SegmentDocValuesState;
import org.opensearch.docvalues.index.SortedSetValues;
import org.opensearch.docvalues.index.SortedValues;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reads the doc values of one segment written in the {@link MemoryDocValuesFormat}.
 *
 * <p>Opening the producer reads the whole metadata catalog and keeps the data file open. Columns,
 * dictionaries and missing bitsets are decoded into heap the first time a field is asked for and
 * then reused for the lifetime of the producer. Decoding reads through a private clone of the data
 * input, so any number of threads may request fields concurrently; each field is decoded at most once.
 *
 * <p>Numeric and binary views are shared between callers. Sorted and sorted-set views are created
 * per call because they carry lookup state; they share the decoded column and dictionary.
 *
 * <h2>Usage</h2>
 * <pre>
 * try (MemoryDocValuesProducer producer = MemoryDocValuesProducer.open(state)) {
 *     NumericValues prices = producer.getNumeric(state.getFields().fieldInfo("price"));
 *     long price = prices.get(docId);
 * }
 * </pre>
 *
 * @see MemoryDocValuesMetadata for the catalog layout
 */
@Log4j2
public final class MemoryDocValuesProducer implements Closeable, Accountable {

    private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(MemoryDocValuesProducer.class);

    private final MemoryDocValuesMetadata metadata;
    private final IndexInput data;
    private final int maxDoc;
    private final String segmentName;
    private final AtomicLong ramBytesUsed;
    private final AtomicBoolean closed = new AtomicBoolean();

    private final FieldInstanceCache<MemoryNumericValues> numericInstances = new FieldInstanceCache<>();
    private final FieldInstanceCache<MemoryBinaryValues> binaryInstances = new FieldInstanceCache<>();
    private final FieldInstanceCache<FST<Long>> dictionaryInstances = new FieldInstanceCache<>();
    private final FieldInstanceCache<Bits> missingInstances = new FieldInstanceCache<>();

    private MemoryDocValuesProducer(MemoryDocValuesMetadata metadata, IndexInput data, int maxDoc, String segmentName) {
        this.metadata = metadata;
        this.data = data;
        this.maxDoc = maxDoc;
        this.segmentName = segmentName;
        this.ramBytesUsed = new AtomicLong(BASE_RAM_BYTES_USED);
    }

    /**
     * Opens a producer with the default codec names and extensions.
     */
    public static MemoryDocValuesProducer open(SegmentDocValuesState state) throws IOException {
        return open(
            state,
            MemoryDocValuesFormat.DATA_CODEC,
            MemoryDocValuesFormat.DATA_EXTENSION,
            MemoryDocValuesFormat.METADATA_CODEC,
            MemoryDocValuesFormat.METADATA_EXTENSION
        );
    }

    /**
     * Opens a producer for one segment.
     *
     * @param state     segment files, document count and field registry
     * @param dataCodec codec name expected in the data file header
     * @param dataExt   data file extension
     * @param metaCodec codec name expected in the metadata file header
     * @param metaExt   metadata file extension
     * @throws CorruptIndexException if either file is malformed or their versions differ
     * @throws IOException if an I/O error occurs
     */
    public static MemoryDocValuesProducer open(
        SegmentDocValuesState state,
        String dataCodec,
        String dataExt,
        String metaCodec,
        String metaExt
    ) throws IOException {
        MemoryDocValuesMetadata metadata = MemoryDocValuesMetadata.read(state, metaCodec, metaExt);
        String dataName = IndexFileNames.segmentFileName(state.getSegmentName(), state.getSegmentSuffix(), dataExt);
        IndexInput data = state.getDirectory().openInput(dataName, state.getContext());
        try {
            int version = CodecUtil.checkHeader(data, dataCodec, MemoryDocValuesFormat.VERSION_START, MemoryDocValuesFormat.VERSION_CURRENT);
            if (version != metadata.getVersion()) {
                throw new CorruptIndexException(
                    String.format("Format versions mismatch: meta=%d, data=%d", metadata.getVersion(), version),
                    data
                );
            }
            if (version >= MemoryDocValuesFormat.VERSION_CHECKSUM) {
                // validates the footer structure; the full checksum is left to checkIntegrity
                CodecUtil.retrieveChecksum(data);
            }

            log.debug(
                "Opened memory doc values: segment={}, version={}, maxDoc={}, numerics={}, binaries={}, dictionaries={}",
                state.getSegmentName(),
                version,
                state.getMaxDoc(),
                metadata.getNumerics().size(),
                metadata.getBinaries().size(),
                metadata.getDictionaries().size()
            );
            return new MemoryDocValuesProducer(metadata, data, state.getMaxDoc(), state.getSegmentName());
        } catch (Exception e) {
            IOUtils.closeWhileHandlingException(data);
            throw e;
        }
    }

    /**
     * Returns the shared numeric view of a {@link DocValuesType#NUMERIC} field.
     */
    public NumericValues getNumeric(DocValuesField field) throws IOException {
        ensureOpen();
        requireType(field, DocValuesType.NUMERIC);
        return loadNumeric(field);
    }

    /**
     * Returns the shared binary view of a {@link DocValuesType#BINARY} field.
     */
    public BinaryValues getBinary(DocValuesField field) throws IOException {
        ensureOpen();
        requireType(field, DocValuesType.BINARY);
        return loadBinary(field);
    }

    /**
     * Returns a new sorted view of a {@link DocValuesType#SORTED} field. Views share the decoded
     * ordinals and dictionary but not their lookup state.
     */
    public SortedValues getSorted(DocValuesField field) throws IOException {
        ensureOpen();
        requireType(field, DocValuesType.SORTED);
        DictionaryEntry entry = requireDictionaryEntry(field);
        if (entry.isEmpty()) {
            return EmptyDocValues.EMPTY_SORTED;
        }
        if (entry.getOrdinalCount() > Integer.MAX_VALUE) {
            throw new CorruptIndexException(
                String.format("Sorted field %s has %d terms, more than a sorted column can address", field.getName(), entry.getOrdinalCount()),
                data.toString()
            );
        }
        MemoryNumericValues ordinals = loadNumeric(field);
        FST<Long> dictionary = loadDictionary(field, entry);
        return new DictionarySortedValues(ordinals, dictionary, (int) entry.getOrdinalCount());
    }

    /**
     * Returns a new sorted-set view of a {@link DocValuesType#SORTED_SET} field.
     */
    public SortedSetValues getSortedSet(DocValuesField field) throws IOException {
        ensureOpen();
        requireType(field, DocValuesType.SORTED_SET);
        DictionaryEntry entry = requireDictionaryEntry(field);
        if (entry.isEmpty()) {
            return EmptyDocValues.EMPTY_SORTED_SET;
        }
        MemoryBinaryValues docOrdinals = loadBinary(field);
        FST<Long> dictionary = loadDictionary(field, entry);
        return new DictionarySortedSetValues(docOrdinals, dictionary, entry.getOrdinalCount());
    }

    /**
     * Returns which documents have a value. Numeric and binary fields use their stored bitset, or
     * match every document when none was written; sorted and sorted-set fields derive presence
     * from their ordinals.
     */
    public Bits getDocsWithField(DocValuesField field) throws IOException {
        ensureOpen();
        switch (field.getType()) {
            case SORTED:
                return DocsWithValue.sorted(getSorted(field), maxDoc);
            case SORTED_SET:
                return DocsWithValue.sortedSet(getSortedSet(field), maxDoc);
            case NUMERIC:
                NumericEntry numericEntry = requireEntry(field, metadata.numeric(field.getNumber()), "numeric");
                return getMissingBits(field, numericEntry.getMissingOffset(), numericEntry.getMissingBytes());
            case BINARY:
                BinaryEntry binaryEntry = requireEntry(field, metadata.binary(field.getNumber()), "binary");
                return getMissingBits(field, binaryEntry.getMissingOffset(), binaryEntry.getMissingBytes());
            default:
                throw new IllegalArgumentException(String.format("Field %s has unsupported type %s", field.getName(), field.getType()));
        }
    }

    /**
     * Verifies the checksum of the whole data file. Files older than
     * {@link MemoryDocValuesFormat#VERSION_CHECKSUM} carry no checksum and always pass.
     */
    public void checkIntegrity() throws IOException {
        ensureOpen();
        if (metadata.getVersion() >= MemoryDocValuesFormat.VERSION_CHECKSUM) {
            CodecUtil.checksumEntireFile(data);
        }
    }

    /**
     * @return approximate heap held by this producer: its own footprint plus every decoded instance
     */
    @Override
    public long ramBytesUsed() {
        return ramBytesUsed.get();
    }

    public int getVersion() {
        return metadata.getVersion();
    }

    /**
     * Closes the data file. Decoded instances stay valid for callers that still hold them.
     *
     * @throws AlreadyClosedException if the producer was already closed
     */
    @Override
    public void close() throws IOException {
        if (closed.compareAndSet(false, true) == false) {
            throw new AlreadyClosedException("Memory doc values of segment " + segmentName + " are already closed");
        }
        data.close();
        log.debug("Closed memory doc values: segment={}, ramBytesUsed={}", segmentName, ramBytesUsed.get());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(segment=" + segmentName + ", version=" + metadata.getVersion() + ")";
    }

    MemoryDocValuesMetadata metadata() {
        return metadata;
    }

    private MemoryNumericValues loadNumeric(DocValuesField field) throws IOException {
        NumericEntry entry = requireEntry(field, metadata.numeric(field.getNumber()), "numeric");
        return numericInstances.getOrLoad(field.getNumber(), () -> {
            MemoryNumericValues values = MemoryNumericValues.load(data.clone(), entry, maxDoc);
            account(field, values.encoding() + " numeric column", values);
            return values;
        });
    }

    private MemoryBinaryValues loadBinary(DocValuesField field) throws IOException {
        BinaryEntry entry = requireEntry(field, metadata.binary(field.getNumber()), "binary");
        return binaryInstances.getOrLoad(field.getNumber(), () -> {
            MemoryBinaryValues values = MemoryBinaryValues.load(data.clone(), entry, maxDoc);
            account(field, (values.isFixedLength() ? "fixed" : "variable") + " binary column", values);
            return values;
        });
    }

    private FST<Long> loadDictionary(DocValuesField field, DictionaryEntry entry) throws IOException {
        return dictionaryInstances.getOrLoad(field.getNumber(), () -> {
            IndexInput in = data.clone();
            in.seek(entry.getOffset());
            FST<Long> dictionary = new FST<>(FST.readMetadata(in, PositiveIntOutputs.getSingleton()), in);
            account(field, "dictionary of " + entry.getOrdinalCount() + " terms", dictionary);
            return dictionary;
        });
    }

    private Bits getMissingBits(DocValuesField field, long offset, long length) throws IOException {
        if (offset == -1) {
            return new Bits.MatchAllBits(maxDoc);
        }
        return missingInstances.getOrLoad(field.getNumber(), () -> {
            Bits bits = MissingBitsLoader.load(data.clone(), offset, length, maxDoc);
            ramBytesUsed.addAndGet(length);
            log.debug("Loaded missing bitset: segment={}, field={}, bytes={}", segmentName, field.getName(), length);
            return bits;
        });
    }

    private void account(DocValuesField field, String description, Accountable instance) {
        long bytes = instance.ramBytesUsed();
        ramBytesUsed.addAndGet(bytes);
        log.debug("Loaded {}: segment={}, field={}, bytes={}", description, segmentName, field.getName(), bytes);
    }

    private DictionaryEntry requireDictionaryEntry(DocValuesField field) {
        return requireEntry(field, metadata.dictionary(field.getNumber()), "dictionary");
    }

    private static <T> T requireEntry(DocValuesField field, T entry, String kind) {
        if (entry == null) {
            throw new IllegalArgumentException(String.format("Field %s has no %s record in this segment", field.getName(), kind));
        }
        return entry;
    }

    private static void requireType(DocValuesField field, DocValuesType expected) {
        if (field.getType() != expected) {
            throw new IllegalArgumentException(
                String.format("Field %s was indexed as %s, cannot read it as %s", field.getName(), field.getType(), expected)
            );
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new AlreadyClosedException("Memory doc values of segment " + segmentName + " are already closed");
        }
    }
}
