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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a routed call.
 *
 * @param decision           the routing decision, or null for a direct dispatch
 * @param handledBy          the worker that produced the result; differs from the selected worker
 *                           when a fallback succeeded
 * @param result             the worker's result
 * @param attemptedFallbacks fallback workers invoked, in order
 */
public record RoutingOutcome(RoutingDecision decision,
                             String handledBy,
                             Map<String, Object> result,
                             List<String> attemptedFallbacks) {

    public RoutingOutcome {
        result = result != null ? Collections.unmodifiableMap(new LinkedHashMap<>(result)) : Map.of();
        attemptedFallbacks = attemptedFallbacks != null ? List.copyOf(attemptedFallbacks) : List.of();
    }

    public boolean isFallbackUsed() {
        return !attemptedFallbacks.isEmpty();
    }
}
