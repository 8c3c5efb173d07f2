/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.apache.lucene.index.DocValuesType;

/**
 * Handle of a doc-values field within one segment.
 *
 * The field registry of the index assigns the number and the declared type when the segment is
 * written; both stay fixed for the lifetime of the segment.
 *
 * @see DocValuesFields for the per-segment registry
 */
@Value
@Builder
public class DocValuesField {

    /**
     * Field name, unique within the segment.
     */
    @NonNull
    String name;

    /**
     * Stable, non-negative field number. Metadata records are keyed by this number.
     */
    int number;

    /**
     * Declared value type. Only {@link DocValuesType#NUMERIC}, {@link DocValuesType#BINARY},
     * {@link DocValuesType#SORTED} and {@link DocValuesType#SORTED_SET} can be read.
     */
    @NonNull
    DocValuesType type;
}
