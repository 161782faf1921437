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

package dev.mars.tessera.messaging;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Message emitted for every routed event and every committed transition.
 *
 * @param eventType  the routed event type, or {@code transition.committed}
 * @param instanceId the workflow instance involved, if any
 * @param workerName the worker that handled the event, if any
 * @param success    whether the call succeeded
 * @param result     the worker result or transition details
 * @param error      the failure message when {@code success} is false
 * @param timestamp  when the outcome was recorded
 */
public record RoutingEvent(String eventType,
                           String instanceId,
                           String workerName,
                           boolean success,
                           Map<String, Object> result,
                           String error,
                           Instant timestamp) {

    public static final String TRANSITION_COMMITTED = "transition.committed";

    public RoutingEvent {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        result = result == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }

    public static RoutingEvent success(String eventType, String instanceId, String workerName,
                                       Map<String, Object> result, Instant timestamp) {
        return new RoutingEvent(eventType, instanceId, workerName, true, result, null, timestamp);
    }

    public static RoutingEvent failure(String eventType, String instanceId, String workerName,
                                       String error, Instant timestamp) {
        return new RoutingEvent(eventType, instanceId, workerName, false, Map.of(), error, timestamp);
    }
}
