/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Registry of the doc-values fields of one segment, addressable by number and by name.
 */
public final class DocValuesFields implements Iterable<DocValuesField> {

    private final Map<Integer, DocValuesField> byNumber;
    private final Map<String, DocValuesField> byName;

    public DocValuesFields(Collection<DocValuesField> fields) {
        Map<Integer, DocValuesField> numbers = new TreeMap<>();
        Map<String, DocValuesField> names = new HashMap<>();
        for (DocValuesField field : fields) {
            if (field.getNumber() < 0) {
                throw new IllegalArgumentException("Field number must be non-negative, got " + field.getNumber() + " for " + field.getName());
            }
            DocValuesField previous = numbers.put(field.getNumber(), field);
            if (previous != null) {
                throw new IllegalArgumentException(
                    String.format("Field number %d is used by both [%s] and [%s]", field.getNumber(), previous.getName(), field.getName())
                );
            }
            if (names.put(field.getName(), field) != null) {
                throw new IllegalArgumentException("Duplicate field name [" + field.getName() + "]");
            }
        }
        this.byNumber = Collections.unmodifiableMap(numbers);
        this.byName = Collections.unmodifiableMap(names);
    }

    /**
     * @return the field with this number, or {@code null} if the segment has none
     */
    public DocValuesField fieldInfo(int fieldNumber) {
        return byNumber.get(fieldNumber);
    }

    /**
     * @return the field with this name, or {@code null} if the segment has none
     */
    public DocValuesField fieldInfo(String fieldName) {
        return byName.get(fieldName);
    }

    public int size() {
        return byNumber.size();
    }

    /**
     * Iterates the fields in ascending field-number order.
     */
    @Override
    public Iterator<DocValuesField> iterator() {
        return byNumber.values().iterator();
    }
}
