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

import java.util.Optional;

/**
 * The single mutation point for workflow instances.
 *
 * <p>Implementations must make {@link #save} an atomic compare-and-swap keyed by
 * {@code (instanceId, expectedVersion)}. Callers receive copies, so mutating a returned
 * instance never changes the stored one until it is saved.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface WorkflowInstanceStore {

    /**
     * Stores a new instance.
     *
     * @throws VersionConflictException if an instance with the same id already exists
     */
    void create(WorkflowInstance instance) throws VersionConflictException;

    /**
     * Loads a copy of the instance.
     *
     * @throws NotFoundException if no instance has this id
     */
    WorkflowInstance get(String instanceId) throws NotFoundException;

    /**
     * Replaces the stored instance if its version still equals {@code expectedVersion}.
     *
     * @throws VersionConflictException if another writer has saved since the caller loaded
     * @throws NotFoundException if the instance vanished
     */
    void save(WorkflowInstance instance, long expectedVersion) throws VersionConflictException, NotFoundException;

    default Optional<WorkflowInstance> find(String instanceId) {
        try {
            return Optional.of(get(instanceId));
        } catch (NotFoundException e) {
            return Optional.empty();
        }
    }
}
