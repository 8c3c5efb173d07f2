/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index.codec.memory;

import lombok.Builder;
import lombok.Value;

/**
 * Catalog record of a term dictionary.
 */
@Value
@Builder
public class DictionaryEntry {

    long offset;

    /**
     * Number of terms. A dictionary without terms is not written.
     */
    long ordinalCount;

    public boolean isEmpty() {
        return ordinalCount == 0;
    }
}
