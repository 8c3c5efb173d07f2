/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.IOContext;

/**
 * Everything a doc-values producer needs to locate and open the files of one segment.
 */
@Value
@Builder
public class SegmentDocValuesState {

    /**
     * Directory holding the segment files.
     */
    @NonNull
    Directory directory;

    /**
     * Segment name, e.g. {@code _0}.
     */
    @NonNull
    String segmentName;

    /**
     * Optional suffix appended to the segment name when several formats share a segment.
     */
    @NonNull
    @Builder.Default
    String segmentSuffix = "";

    /**
     * Number of documents in the segment. Every per-document read is bounded by this value.
     */
    int maxDoc;

    /**
     * Field registry of the segment.
     */
    @NonNull
    DocValuesFields fields;

    /**
     * Context used when opening the segment files.
     */
    @NonNull
    @Builder.Default
    IOContext context = IOContext.DEFAULT;
}
