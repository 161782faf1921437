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

package dev.mars.tessera.orchestration;

import java.util.Objects;

/**
 * The worker selected for an event type and the stage that selected it.
 */
public record RoutingDecision(String eventType, String workerName, RoutingStrategy strategy) {

    public RoutingDecision {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Objects.requireNonNull(workerName, "Worker name cannot be null");
        Objects.requireNonNull(strategy, "Strategy cannot be null");
    }
}
