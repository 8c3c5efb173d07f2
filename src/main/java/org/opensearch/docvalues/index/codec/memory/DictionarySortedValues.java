/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index.codec.memory;

import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.fst.BytesRefFSTEnum;
import org.apache.lucene.util.fst.FST;
import org.opensearch.docvalues.index.OrdinalTermsEnum;
import org.opensearch.docvalues.index.SortedValues;
import org.opensearch.docvalues.index.fst.DictionaryLookup;

import java.io.IOException;

/**
 * Single-valued ordered column: per-document ordinals from a numeric column, terms from an
 * {@link FST} mapping each term to its ordinal.
 *
 * The ordinals and the FST are shared; the lookup scratch state is private to this view, so each
 * thread needs its own instance.
 */
public final class DictionarySortedValues extends SortedValues {

    private final MemoryNumericValues ordinals;
    private final FST<Long> fst;
    private final int valueCount;
    private final DictionaryLookup lookup;
    private final BytesRefFSTEnum<Long> fstEnum;

    DictionarySortedValues(MemoryNumericValues ordinals, FST<Long> fst, int valueCount) {
        this.ordinals = ordinals;
        this.fst = fst;
        this.valueCount = valueCount;
        this.lookup = new DictionaryLookup(fst);
        this.fstEnum = new BytesRefFSTEnum<>(fst);
    }

    @Override
    public int getOrd(int docID) {
        return (int) ordinals.get(docID);
    }

    @Override
    public BytesRef lookupOrd(int ord) throws IOException {
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
    public int lookupTerm(BytesRef key) throws IOException {
        BytesRefFSTEnum.InputOutput<Long> ceil = fstEnum.seekCeil(key);
        if (ceil == null) {
            return -valueCount - 1;
        }
        int ord = ceil.output.intValue();
        return ceil.input.bytesEquals(key) ? ord : -ord - 1;
    }

    @Override
    public int getValueCount() {
        return valueCount;
    }

    @Override
    public OrdinalTermsEnum termsEnum() {
        return new DictionaryTermsEnum(fst, valueCount);
    }

    MemoryNumericValues ordinals() {
        return ordinals;
    }

    FST<Long> dictionary() {
        return fst;
    }
}
