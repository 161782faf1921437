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

package dev.mars.tessera.workflow;

import dev.mars.tessera.core.exceptions.TesseraException;

/**
 * Exception thrown when a workflow or coordination pattern document cannot be read or fails
 * validation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowParseException extends TesseraException {

    private final String fieldPath;

    public WorkflowParseException(String message) {
        super(message);
        this.fieldPath = null;
    }

    public WorkflowParseException(String message, Throwable cause) {
        super(message, cause);
        this.fieldPath = null;
    }

    public WorkflowParseException(String fieldPath, String message, Throwable cause) {
        super(fieldPath != null ? fieldPath + ": " + message : message, cause);
        this.fieldPath = fieldPath;
    }

    /**
     * Path of the offending field, e.g. {@code transitions[2].retryDelay}, or null.
     */
    public String getFieldPath() {
        return fieldPath;
    }
}
