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

import dev.mars.tessera.core.exceptions.WorkerException;
import dev.mars.tessera.worker.EventHandler;
import dev.mars.tessera.worker.HandlerMapWorker;
import dev.mars.tessera.worker.WorkerHealth;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Worker whose handlers and health probe are set up by each test. Records every payload it
 * receives.
 */
class ScriptedWorker extends HandlerMapWorker {

    private final List<String> receivedTypes = new CopyOnWriteArrayList<>();
    private final List<Map<String, Object>> receivedPayloads = new CopyOnWriteArrayList<>();
    private volatile Callable<WorkerHealth> healthProbe = WorkerHealth::healthy;

    ScriptedWorker(String name) {
        super(name);
    }

    ScriptedWorker handles(String eventType, EventHandler handler) {
        on(eventType, payload -> {
            receivedTypes.add(eventType);
            receivedPayloads.add(payload);
            return handler.handle(payload);
        });
        return this;
    }

    ScriptedWorker handles(String eventType) {
        return handles(eventType, payload -> Map.of("handledBy", getName()));
    }

    ScriptedWorker failing(String eventType, String message) {
        return handles(eventType, payload -> {
            throw new WorkerException(getName(), message);
        });
    }

    ScriptedWorker health(Callable<WorkerHealth> probe) {
        this.healthProbe = probe;
        return this;
    }

    @Override
    public WorkerHealth checkHealth() throws Exception {
        return healthProbe.call();
    }

    List<String> receivedTypes() {
        return receivedTypes;
    }

    List<Map<String, Object>> receivedPayloads() {
        return receivedPayloads;
    }
}
