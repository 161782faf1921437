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

import dev.mars.tessera.worker.Worker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Registered workers in registration order, indexed by capability and business entity.
 *
 * <p>The registry is populated before the orchestrator is built and then frozen; after
 * {@link #freeze()} it is read-only and safe for unsynchronized concurrent reads.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkerRegistry {

    private static final Logger logger = Logger.getLogger(WorkerRegistry.class.getName());

    private final Map<String, WorkerRegistration> registrations = new LinkedHashMap<>();
    private final Map<String, List<String>> capabilityIndex = new LinkedHashMap<>();
    private volatile boolean frozen;

    /**
     * @throws IllegalArgumentException if a worker with the same name is already registered
     * @throws IllegalStateException    if the registry has been frozen
     */
    public synchronized WorkerRegistry register(WorkerRegistration registration) {
        Objects.requireNonNull(registration, "Registration cannot be null");
        if (frozen) {
            throw new IllegalStateException("Worker registry is frozen; cannot register " + registration.getName());
        }
        if (registrations.containsKey(registration.getName())) {
            throw new IllegalArgumentException("Worker already registered: " + registration.getName());
        }
        registrations.put(registration.getName(), registration);
        for (String capability : registration.getCapabilities()) {
            capabilityIndex.computeIfAbsent(capability, c -> new ArrayList<>()).add(registration.getName());
        }
        logger.info("Registered worker " + registration.getName() + " with capabilities " +
                registration.getCapabilities());
        return this;
    }

    public WorkerRegistry register(Worker worker) {
        return register(WorkerRegistration.of(worker));
    }

    public synchronized void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public Optional<Worker> getWorker(String name) {
        return getRegistration(name).map(WorkerRegistration::getWorker);
    }

    public Optional<WorkerRegistration> getRegistration(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(registrations.get(name));
    }

    public boolean contains(String name) {
        return name != null && registrations.containsKey(name);
    }

    public List<WorkerRegistration> getRegistrations() {
        return List.copyOf(registrations.values());
    }

    /**
     * Names of workers advertising the capability, in registration order.
     */
    public List<String> findByCapability(String capability) {
        List<String> names = capabilityIndex.get(capability);
        return names != null ? Collections.unmodifiableList(names) : List.of();
    }

    /**
     * Workers associated with the business entity, in registration order.
     */
    public List<WorkerRegistration> findByBusinessEntity(String businessEntityId) {
        List<WorkerRegistration> matches = new ArrayList<>();
        for (WorkerRegistration registration : registrations.values()) {
            if (registration.isAssociatedWith(businessEntityId)) {
                matches.add(registration);
            }
        }
        return matches;
    }

    public int size() {
        return registrations.size();
    }
}
