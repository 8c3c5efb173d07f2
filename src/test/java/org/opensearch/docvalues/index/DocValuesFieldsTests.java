/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index;

import org.apache.lucene.index.DocValuesType;
import org.opensearch.docvalues.DocValuesTestCase;

import java.util.ArrayList;
import java.util.List;

public class DocValuesFieldsTests extends DocValuesTestCase {

    public void testLookupByNumberAndName() {
        DocValuesField price = field("price", 3, DocValuesType.NUMERIC);
        DocValuesField color = field("color", 1, DocValuesType.SORTED);
        DocValuesFields fields = fields(price, color);

        assertEquals(2, fields.size());
        assertSame(price, fields.fieldInfo(3));
        assertSame(color, fields.fieldInfo("color"));
        assertNull(fields.fieldInfo(2));
        assertNull(fields.fieldInfo("size"));
    }

    public void testIteratesInFieldNumberOrder() {
        DocValuesFields fields = fields(
            field("c", 7, DocValuesType.BINARY),
            field("a", 0, DocValuesType.NUMERIC),
            field("b", 4, DocValuesType.SORTED_SET)
        );
        List<Integer> numbers = new ArrayList<>();
        for (DocValuesField field : fields) {
            numbers.add(field.getNumber());
        }
        assertEquals(List.of(0, 4, 7), numbers);
    }

    public void testRejectsDuplicates() {
        IllegalArgumentException e = expectThrows(
            IllegalArgumentException.class,
            () -> fields(field("a", 1, DocValuesType.NUMERIC), field("b", 1, DocValuesType.BINARY))
        );
        assertTrue(e.getMessage(), e.getMessage().contains("Field number 1"));

        expectThrows(
            IllegalArgumentException.class,
            () -> fields(field("a", 1, DocValuesType.NUMERIC), field("a", 2, DocValuesType.BINARY))
        );
        expectThrows(IllegalArgumentException.class, () -> fields(field("a", -1, DocValuesType.NUMERIC)));
    }
}
