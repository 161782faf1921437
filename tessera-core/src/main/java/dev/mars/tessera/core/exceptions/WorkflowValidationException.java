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

import dev.mars.tessera.core.ValidationResult;

import java.util.Objects;

/**
 * Thrown at construction time when a workflow graph or coordination pattern is malformed.
 * Never raised while executing transitions.
 */
public class WorkflowValidationException extends TesseraException {

    private final String subject;
    private final ValidationResult validationResult;

    public WorkflowValidationException(String subject, ValidationResult validationResult) {
        super("Invalid definition '" + subject + "': " + validationResult.describeErrors());
        this.subject = subject;
        this.validationResult = Objects.requireNonNull(validationResult, "Validation result cannot be null");
    }

    public static WorkflowValidationException single(String subject, String fieldPath, String message) {
        ValidationResult result = new ValidationResult();
        result.addError(fieldPath, message);
        return new WorkflowValidationException(subject, result);
    }

    public String getSubject() {
        return subject;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
