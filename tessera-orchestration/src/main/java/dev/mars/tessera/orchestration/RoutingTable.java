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

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Static and learned routing data: explicit event type mappings, the event-type prefix table and
 * per-worker fallback chains.
 *
 * <p>The explicit map is the memoization target of the router and may be written concurrently
 * with lookups; the prefix table and fallback chains are expected to be configured up front.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class RoutingTable {

    private static final Logger logger = Logger.getLogger(RoutingTable.class.getName());

    private final Map<String, String> explicitRoutes = new ConcurrentHashMap<>();
    private final Map<String, String> prefixRoutes = new ConcurrentHashMap<>();
    private final Map<String, List<String>> fallbackChains = new ConcurrentHashMap<>();

    /**
     * A table pre-populated with the standard domain prefixes.
     */
    public static RoutingTable withDefaultPrefixes() {
        return new RoutingTable()
                .prefix("lead", "Nyra")
                .prefix("book", "Solari")
                .prefix("order", "Solari")
                .prefix("payment", "Solari")
                .prefix("workflow", "Ruvo")
                .prefix("task", "Ruvo")
                .prefix("content", "Elan")
                .prefix("community", "Sage")
                .prefix("member", "Sage")
                .prefix("audience", "Zevi")
                .prefix("segment", "Zevi")
                .prefix("campaign", "Liora");
    }

    public RoutingTable route(String eventType, String workerName) {
        explicitRoutes.put(Objects.requireNonNull(eventType, "Event type cannot be null"),
                Objects.requireNonNull(workerName, "Worker name cannot be null"));
        return this;
    }

    public RoutingTable prefix(String prefix, String workerName) {
        prefixRoutes.put(Objects.requireNonNull(prefix, "Prefix cannot be null"),
                Objects.requireNonNull(workerName, "Worker name cannot be null"));
        return this;
    }

    public RoutingTable fallbackChain(String workerName, String... fallbacks) {
        return fallbackChain(workerName, Arrays.asList(fallbacks));
    }

    public RoutingTable fallbackChain(String workerName, List<String> fallbacks) {
        fallbackChains.put(Objects.requireNonNull(workerName, "Worker name cannot be null"), List.copyOf(fallbacks));
        return this;
    }

    public Optional<String> explicitWorker(String eventType) {
        return Optional.ofNullable(explicitRoutes.get(eventType));
    }

    /**
     * Looks up the part of the event type before its first underscore (the whole type when it
     * has none) in the prefix table.
     */
    public Optional<String> prefixWorker(String eventType) {
        int separator = eventType.indexOf('_');
        String prefix = separator >= 0 ? eventType.substring(0, separator) : eventType;
        return Optional.ofNullable(prefixRoutes.get(prefix));
    }

    public List<String> getFallbackChain(String workerName) {
        return fallbackChains.getOrDefault(workerName, List.of());
    }

    /**
     * Records a learned route unless one already exists.
     *
     * @return true if the route was added
     */
    boolean memoize(String eventType, String workerName) {
        boolean added = explicitRoutes.putIfAbsent(eventType, workerName) == null;
        if (added) {
            logger.fine("Memoized route " + eventType + " -> " + workerName);
        }
        return added;
    }

    public Map<String, String> getExplicitRoutes() {
        return Map.copyOf(explicitRoutes);
    }

    public Map<String, String> getPrefixRoutes() {
        return Map.copyOf(prefixRoutes);
    }

    public Map<String, List<String>> getFallbackChains() {
        return Map.copyOf(fallbackChains);
    }
}
