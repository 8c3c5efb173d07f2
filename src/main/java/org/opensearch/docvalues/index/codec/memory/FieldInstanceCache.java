/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index.codec.memory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-field memo of decoded instances. Each field number gets its own slot, and an instance is
 * built under that slot's monitor only, so loading one field never blocks readers of another.
 * Entries are never evicted; a load that throws leaves the slot empty for the next caller.
 *
 * @param <T> type of the cached instance
 */
final class FieldInstanceCache<T> {

    /**
     * Builds the instance of a field.
     */
    @FunctionalInterface
    interface InstanceLoader<T> {
        T load() throws IOException;
    }

    private final Map<Integer, Slot<T>> slots = new ConcurrentHashMap<>();

    T getOrLoad(int fieldNumber, InstanceLoader<T> loader) throws IOException {
        return slots.computeIfAbsent(fieldNumber, k -> new Slot<>()).get(loader);
    }

    /**
     * @return the instance of a field if it was already built
     */
    T getIfLoaded(int fieldNumber) {
        Slot<T> slot = slots.get(fieldNumber);
        return slot == null ? null : slot.instance;
    }

    int size() {
        int loaded = 0;
        for (Slot<T> slot : slots.values()) {
            if (slot.instance != null) {
                loaded++;
            }
        }
        return loaded;
    }

    private static final class Slot<T> {
        private volatile T instance;

        T get(InstanceLoader<T> loader) throws IOException {
            T result = instance;
            if (result == null) {
                synchronized (this) {
                    result = instance;
                    if (result == null) {
                        result = loader.load();
                        instance = result;
                    }
                }
            }
            return result;
        }
    }
}
