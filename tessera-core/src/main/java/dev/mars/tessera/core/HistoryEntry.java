/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.tessera.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One append-only record in a workflow instance's history log.
 * The creation entry has a null {@code fromState} and {@code transition}.
 */
public record HistoryEntry(String actor,
                           String description,
                           Map<String, Object> data,
                           String fromState,
                           String toState,
                           String transition,
                           Instant timestamp) {

    public HistoryEntry {
        Objects.requireNonNull(toState, "To state cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        data = data == null ? Map.of() : frozenCopy(data);
    }

    public static HistoryEntry created(String actor, String initialState, Instant timestamp) {
        return new HistoryEntry(actor, "Workflow instance created", Map.of(), null, initialState, null, timestamp);
    }

    public boolean isCreation() {
        return fromState == null && transition == null;
    }

    private static Map<String, Object> frozenCopy(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(String.valueOf(k), frozenValue(v)));
        return Collections.unmodifiableMap(copy);
    }

    @SuppressWarnings("unchecked")
    private static Object frozenValue(Object value) {
        if (value instanceof Map) {
            return frozenCopy((Map<String, ?>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object element : (List<Object>) value) {
                copy.add(frozenValue(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
