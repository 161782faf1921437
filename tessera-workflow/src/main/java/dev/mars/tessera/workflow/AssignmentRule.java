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

import java.util.List;
import java.util.Objects;

/**
 * Declares which worker should own an instance while it sits in a state.
 *
 * <p>A rule names either a specific worker or a capability (role) that any registered worker
 * may advertise. Fallback workers are used when neither resolves. Lower priority values are
 * tried first.</p>
 */
public final class AssignmentRule {

    private final String workerName;
    private final String capability;
    private final List<String> fallbackWorkers;
    private final int priority;

    private AssignmentRule(Builder builder) {
        this.workerName = builder.workerName;
        this.capability = builder.capability;
        this.fallbackWorkers = List.copyOf(builder.fallbackWorkers);
        this.priority = builder.priority;
    }

    public static Builder worker(String workerName) {
        return new Builder().workerName(Objects.requireNonNull(workerName, "Worker name cannot be null"));
    }

    public static Builder capability(String capability) {
        return new Builder().capability(Objects.requireNonNull(capability, "Capability cannot be null"));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getWorkerName() {
        return workerName;
    }

    public String getCapability() {
        return capability;
    }

    public List<String> getFallbackWorkers() {
        return fallbackWorkers;
    }

    public int getPriority() {
        return priority;
    }

    @Override
    public String toString() {
        return "AssignmentRule{" +
                (workerName != null ? "worker='" + workerName + "'" : "capability='" + capability + "'") +
                ", fallbacks=" + fallbackWorkers +
                ", priority=" + priority + '}';
    }

    public static class Builder {
        private String workerName;
        private String capability;
        private List<String> fallbackWorkers = List.of();
        private int priority = 1;

        public Builder workerName(String workerName) {
            this.workerName = workerName;
            return this;
        }

        public Builder capability(String capability) {
            this.capability = capability;
            return this;
        }

        public Builder fallbackWorkers(String... fallbackWorkers) {
            this.fallbackWorkers = List.of(fallbackWorkers);
            return this;
        }

        public Builder fallbackWorkers(List<String> fallbackWorkers) {
            this.fallbackWorkers = fallbackWorkers != null ? List.copyOf(fallbackWorkers) : List.of();
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public AssignmentRule build() {
            if (workerName == null && capability == null && fallbackWorkers.isEmpty()) {
                throw new IllegalArgumentException("Assignment rule needs a worker, a capability or a fallback");
            }
            return new AssignmentRule(this);
        }
    }
}
