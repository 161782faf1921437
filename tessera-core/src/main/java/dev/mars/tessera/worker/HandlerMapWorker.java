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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class for workers that dispatch on event type through a table of handlers.
 *
 * <p>Subclasses register one {@link EventHandler} per event type in their constructor.
 * {@link #canHandle(String)} is a key lookup, so routing never needs to inspect the worker.</p>
 *
 * <pre>{@code
 * public class LeadWorker extends HandlerMapWorker {
 *     public LeadWorker() {
 *         super("Nyra");
 *         on("lead_capture", this::capture);
 *     }
 * }
 * }</pre>
 */
public abstract class HandlerMapWorker implements Worker {

    private static final Logger logger = Logger.getLogger(HandlerMapWorker.class.getName());

    private final String name;
    private final Map<String, EventHandler> handlers = new LinkedHashMap<>();

    protected HandlerMapWorker(String name) {
        this.name = Objects.requireNonNull(name, "Worker name cannot be null");
    }

    protected final void on(String eventType, EventHandler handler) {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Objects.requireNonNull(handler, "Handler cannot be null");
        if (handlers.putIfAbsent(eventType, handler) != null) {
            throw new IllegalArgumentException("Handler already registered for " + eventType + " on " + name);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean canHandle(String eventType) {
        return eventType != null && handlers.containsKey(eventType);
    }

    public Set<String> getHandledEventTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    @Override
    public Map<String, Object> processEvent(String eventType, Map<String, Object> payload) throws WorkerException {
        EventHandler handler = handlers.get(eventType);
        if (handler == null) {
            throw new WorkerException(name, "Unsupported event type: " + eventType);
        }
        try {
            Map<String, Object> result = handler.handle(payload != null ? payload : Map.of());
            return result != null ? result : Map.of();
        } catch (WorkerException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.log(Level.FINE, "Handler for " + eventType + " on " + name + " threw", e);
            throw new WorkerException(name, "Handler for " + eventType + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name + "', handles=" + handlers.keySet() + '}';
    }
}
