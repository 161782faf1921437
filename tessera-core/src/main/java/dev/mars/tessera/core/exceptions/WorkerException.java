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

import java.util.List;

/**
 * Failure reported by (or while invoking) a worker.
 *
 * <p>When the router has walked a fallback chain before giving up, the original failure is
 * returned annotated with the fallback workers that were attempted.</p>
 */
public class WorkerException extends TesseraException {

    private final String workerName;
    private final List<String> attemptedFallbacks;

    public WorkerException(String workerName, String message) {
        this(workerName, message, null, List.of());
    }

    public WorkerException(String workerName, String message, Throwable cause) {
        this(workerName, message, cause, List.of());
    }

    private WorkerException(String workerName, String message, Throwable cause, List<String> attemptedFallbacks) {
        super(message, cause);
        this.workerName = workerName;
        this.attemptedFallbacks = List.copyOf(attemptedFallbacks);
    }

    /**
     * Returns a copy of this failure that records which fallback workers were tried.
     */
    public WorkerException withAttemptedFallbacks(List<String> fallbacks) {
        WorkerException annotated = new WorkerException(workerName, super.getMessage(), getCause(), fallbacks);
        annotated.setStackTrace(getStackTrace());
        return annotated;
    }

    public String getWorkerName() {
        return workerName;
    }

    public List<String> getAttemptedFallbacks() {
        return attemptedFallbacks;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        if (workerName != null) {
            sb.append("Worker '").append(workerName).append("': ");
        }
        sb.append(super.getMessage());
        if (!attemptedFallbacks.isEmpty()) {
            sb.append(" (fallbacks attempted: ").append(attemptedFallbacks).append(")");
        }
        return sb.toString();
    }
}
