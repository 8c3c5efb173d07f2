/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues;

import org.apache.lucene.index.DocValuesType;
import org.apache.lucene.store.Directory;
import org.apache.lucene.tests.util.LuceneTestCase;
import org.apache.lucene.util.BytesRef;
import org.opensearch.docvalues.index.DocValuesField;
import org.opensearch.docvalues.index.DocValuesFields;
import org.opensearch.docvalues.index.SegmentDocValuesState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Base class for doc-values tests: randomized Lucene test infrastructure plus small factories for
 * fields and segment state.
 */
public abstract class DocValuesTestCase extends LuceneTestCase {

    protected static final String SEGMENT_NAME = "_0";

    protected static DocValuesField field(String name, int number, DocValuesType type) {
        return DocValuesField.builder().name(name).number(number).type(type).build();
    }

    protected static DocValuesFields fields(DocValuesField... fields) {
        return new DocValuesFields(Arrays.asList(fields));
    }

    protected static SegmentDocValuesState state(Directory directory, int maxDoc, DocValuesFields fields) {
        return SegmentDocValuesState.builder().directory(directory).segmentName(SEGMENT_NAME).maxDoc(maxDoc).fields(fields).build();
    }

    protected static BytesRef term(String value) {
        return new BytesRef(value);
    }

    protected static List<BytesRef> terms(String... values) {
        List<BytesRef> terms = new ArrayList<>(values.length);
        for (String value : values) {
            terms.add(new BytesRef(value));
        }
        return terms;
    }
}
