/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index.codec.memory;

import org.apache.lucene.store.ByteArrayDataInput;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.fst.BytesRefFSTEnum;
import org.apache.lucene.util.fst.FST;
import org.opensearch.docvalues.index.OrdinalTermsEnum;
import org.opensearch.docvalues.index.SortedSetValues;
import org.opensearch.docvalues.index.fst.DictionaryLookup;

import java.io.IOException;

/**
 * Multi-valued ordered column. Each document's value in the binary column is the list of its
 * ordinals in ascending order, stored as vlong deltas from the previous ordinal (the first from 0).
 *
 * Not thread-safe: the document cursor and lookup state belong to this view.
 */
public final class DictionarySortedSetValues extends SortedSetValues {

    private final MemoryBinaryValues docOrdinals;
    private final FST<Long> fst;
    private final long valueCount;
    private final DictionaryLookup lookup;
    private final BytesRefFSTEnum<Long> fstEnum;
    private final ByteArrayDataInput input = new ByteArrayDataInput();
    private long currentOrd;

    DictionarySortedSetValues(MemoryBinaryValues docOrdinals, FST<Long> fst, long valueCount) {
        this.docOrdinals = docOrdinals;
        this.fst = fst;
        this.valueCount = valueCount;
        this.lookup = new DictionaryLookup(fst);
        this.fstEnum = new BytesRefFSTEnum<>(fst);
    }

    @Override
    public void setDocument(int docID) {
        BytesRef ref = docOrdinals.get(docID);
        input.reset(ref.bytes, ref.offset, ref.length);
        currentOrd = 0;
    }

    @Override
    public long nextOrd() throws IOException {
        if (input.eof()) {
            return NO_MORE_ORDS;
        }
        currentOrd += input.readVLong();
        return currentOrd;
    }

    @Override
    public BytesRef lookupOrd(long ord) throws IOException {
        if (ord < 0 || ord >= valueCount) {
            throw new IllegalArgumentException(String.format("ordinal %d is out of bounds [0, %d)", ord, valueCount));
        }
        BytesRef term = lookup.termOf(ord);
        if (term == null) {
            throw new IllegalStateException("Dictionary has no term for ordinal " + ord);
        }
        return term;
    }

    @Override
    public long lookupTerm(BytesRef key) throws IOException {
        BytesRefFSTEnum.InputOutput<Long> ceil = fstEnum.seekCeil(key);
        if (ceil == null) {
            return -valueCount - 1;
        }
        long ord = ceil.output;
        return ceil.input.bytesEquals(key) ? ord : -ord - 1;
    }

    @Override
    public long getValueCount() {
        return valueCount;
    }

    @Override
    public OrdinalTermsEnum termsEnum() {
        return new DictionaryTermsEnum(fst, valueCount);
    }

    MemoryBinaryValues docOrdinals() {
        return docOrdinals;
    }

    FST<Long> dictionary() {
        return fst;
    }
}
