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

import java.util.Objects;

/**
 * Thrown when a workflow instance, workflow definition, coordination pattern or worker
 * cannot be found.
 */
public class NotFoundException extends TesseraException {

    private final String entityType;
    private final String entityId;

    public NotFoundException(String entityType, String entityId) {
        super(entityType + " not found: " + entityId);
        this.entityType = Objects.requireNonNull(entityType, "Entity type cannot be null");
        this.entityId = entityId;
    }

    public static NotFoundException instance(String instanceId) {
        return new NotFoundException("Workflow instance", instanceId);
    }

    public static NotFoundException definition(String workflowId) {
        return new NotFoundException("Workflow definition", workflowId);
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }
}
