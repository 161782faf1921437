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

/**
 * Sink for routing and transition events, typically backed by a message bus.
 *
 * <p>Publishing is best-effort: callers log a failing publisher and carry on, so an
 * unavailable bus never fails a routed call or a committed transition.</p>
 */
@FunctionalInterface
public interface EventPublisher {

    void publish(RoutingEvent event);

    static EventPublisher noop() {
        return event -> { };
    }
}
