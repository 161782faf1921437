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

package dev.mars.tessera.storage;

import dev.mars.tessera.core.WorkflowInstance;
import dev.mars.tessera.core.exceptions.NotFoundException;
import dev.mars.tessera.core.exceptions.VersionConflictException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Thread-safe in-memory store. Not durable; intended for tests and embedded use.
 */
public class InMemoryWorkflowInstanceStore implements WorkflowInstanceStore {

    private static final Logger logger = Logger.getLogger(InMemoryWorkflowInstanceStore.class.getName());

    private final Map<String, WorkflowInstance> instances = new ConcurrentHashMap<>();

    @Override
    public void create(WorkflowInstance instance) throws VersionConflictException {
        WorkflowInstance existing = instances.putIfAbsent(instance.getInstanceId(), instance.copy());
        if (existing != null) {
            throw new VersionConflictException(instance.getInstanceId(), -1, existing.getVersion());
        }
        logger.fine("Created instance " + instance.getInstanceId());
    }

    @Override
    public WorkflowInstance get(String instanceId) throws NotFoundException {
        WorkflowInstance stored = instances.get(instanceId);
        if (stored == null) {
            throw NotFoundException.instance(instanceId);
        }
        return stored.copy();
    }

    @Override
    public void save(WorkflowInstance instance, long expectedVersion)
            throws VersionConflictException, NotFoundException {
        String id = instance.getInstanceId();
        WorkflowInstance replacement = instance.copy();
        // compute() holds the bin lock, so the version check and the write are one step
        long[] actual = {Long.MIN_VALUE};
        boolean[] missing = {false};
        instances.compute(id, (key, current) -> {
            if (current == null) {
                missing[0] = true;
                return null;
            }
            if (current.getVersion() != expectedVersion) {
                actual[0] = current.getVersion();
                return current;
            }
            return replacement;
        });
        if (missing[0]) {
            throw NotFoundException.instance(id);
        }
        if (actual[0] != Long.MIN_VALUE) {
            throw new VersionConflictException(id, expectedVersion, actual[0]);
        }
    }

    public List<WorkflowInstance> findByWorkflowId(String workflowId) {
        return instances.values().stream()
                .filter(instance -> instance.getWorkflowId().equals(workflowId))
                .map(WorkflowInstance::copy)
                .collect(Collectors.toList());
    }

    public Collection<String> getInstanceIds() {
        return List.copyOf(instances.keySet());
    }

    public int size() {
        return instances.size();
    }
}
