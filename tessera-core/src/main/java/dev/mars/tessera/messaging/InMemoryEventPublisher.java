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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Keeps every published event in memory. Useful for tests and local inspection.
 */
public class InMemoryEventPublisher implements EventPublisher {

    private final List<RoutingEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(RoutingEvent event) {
        events.add(event);
    }

    public List<RoutingEvent> getEvents() {
        return List.copyOf(events);
    }

    public List<RoutingEvent> getEvents(String eventType) {
        return events.stream()
                .filter(event -> event.eventType().equals(eventType))
                .collect(Collectors.toList());
    }

    public void clear() {
        events.clear();
    }
}
