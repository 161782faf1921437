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

package dev.mars.tessera.worker;

import dev.mars.tessera.core.exceptions.WorkerException;

import java.util.Map;

/**
 * A pluggable unit of business logic that the router dispatches events to.
 *
 * <p>Implementations must be idempotent per event: the orchestrator stops waiting on a call that
 * exceeds its timeout but cannot cancel it, and may deliver the same event to a fallback worker
 * or retry it. Implementations must also be safe for concurrent calls.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface Worker {

    /**
     * Unique name used for explicit routing, fallback chains and pattern steps.
     */
    String getName();

    /**
     * Processes one event.
     *
     * @param eventType the event type being delivered
     * @param payload   the event payload; never null
     * @return the result map recorded by the caller
     * @throws WorkerException if the worker cannot process the event
     */
    Map<String, Object> processEvent(String eventType, Map<String, Object> payload) throws WorkerException;

    /**
     * Cheap capability check used by routing. Must not do any real processing.
     */
    boolean canHandle(String eventType);

    /**
     * Reports the worker's health. May block; callers bound the call with a timeout.
     */
    default WorkerHealth checkHealth() throws Exception {
        return WorkerHealth.healthy();
    }
}
