/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index.codec.memory;

import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.fst.BytesRefFSTEnum;
import org.apache.lucene.util.fst.FST;
import org.opensearch.docvalues.index.OrdinalTermsEnum;
import org.opensearch.docvalues.index.fst.DictionaryLookup;

import java.io.IOException;

/**
 * Terms of a dictionary in ordinal order, with seeks by term and by ordinal.
 */
final class DictionaryTermsEnum extends OrdinalTermsEnum {

    private final BytesRefFSTEnum<Long> fstEnum;
    private final DictionaryLookup lookup;
    private final long valueCount;
    private BytesRefFSTEnum.InputOutput<Long> current;

    DictionaryTermsEnum(FST<Long> fst, long valueCount) {
        this.fstEnum = new BytesRefFSTEnum<>(fst);
        this.lookup = new DictionaryLookup(fst);
        this.valueCount = valueCount;
    }

    @Override
    public BytesRef next() throws IOException {
        current = fstEnum.next();
        return current == null ? null : current.input;
    }

    @Override
    public SeekStatus seekCeil(BytesRef text) throws IOException {
        current = fstEnum.seekCeil(text);
        if (current == null) {
            return SeekStatus.END;
        }
        return current.input.bytesEquals(text) ? SeekStatus.FOUND : SeekStatus.NOT_FOUND;
    }

    @Override
    public boolean seekExact(BytesRef text) throws IOException {
        current = fstEnum.seekExact(text);
        return current != null;
    }

    @Override
    public void seekExact(long ord) throws IOException {
        if (ord < 0 || ord >= valueCount) {
            throw new IllegalArgumentException(String.format("ordinal %d is out of bounds [0, %d)", ord, valueCount));
        }
        BytesRef term = lookup.termOf(ord);
        if (term == null || seekExact(term) == false) {
            throw new IllegalStateException("Dictionary has no term for ordinal " + ord);
        }
    }

    @Override
    public BytesRef term() {
        return positioned().input;
    }

    @Override
    public long ord() {
        return positioned().output;
    }

    private BytesRefFSTEnum.InputOutput<Long> positioned() {
        if (current == null) {
            throw new IllegalStateException("terms enum is not positioned on a term");
        }
        return current;
    }
}
