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

package dev.mars.tessera.core.exceptions;

/**
 * Thrown when no routing strategy can resolve a worker for an event type.
 * The caller decides whether to drop, queue or alert.
 */
public class UnroutableEventException extends TesseraException {

    private final String eventType;

    public UnroutableEventException(String eventType) {
        super("No worker available for event type: " + eventType);
        this.eventType = eventType;
    }

    public String getEventType() {
        return eventType;
    }
}
