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

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A worker together with the routing metadata it is registered under.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkerRegistration {

    private final Worker worker;
    private final Set<String> capabilities;
    private final Set<String> businessEntities;
    private final boolean required;

    private WorkerRegistration(Builder builder) {
        this.worker = builder.worker;
        this.capabilities = Collections.unmodifiableSet(new LinkedHashSet<>(builder.capabilities));
        this.businessEntities = Collections.unmodifiableSet(new LinkedHashSet<>(builder.businessEntities));
        this.required = builder.required;
    }

    public static Builder builder(Worker worker) {
        return new Builder(worker);
    }

    public static WorkerRegistration of(Worker worker) {
        return builder(worker).build();
    }

    public Worker getWorker() {
        return worker;
    }

    public String getName() {
        return worker.getName();
    }

    public Set<String> getCapabilities() {
        return capabilities;
    }

    public Set<String> getBusinessEntities() {
        return businessEntities;
    }

    /**
     * Whether an unhealthy probe of this worker makes the whole orchestrator unhealthy rather
     * than degraded.
     */
    public boolean isRequired() {
        return required;
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }

    public boolean isAssociatedWith(String businessEntityId) {
        return businessEntities.contains(businessEntityId);
    }

    @Override
    public String toString() {
        return "WorkerRegistration{name='" + getName() + "', capabilities=" + capabilities +
                ", businessEntities=" + businessEntities + ", required=" + required + '}';
    }

    public static class Builder {
        private final Worker worker;
        private final Set<String> capabilities = new LinkedHashSet<>();
        private final Set<String> businessEntities = new LinkedHashSet<>();
        private boolean required = true;

        private Builder(Worker worker) {
            this.worker = Objects.requireNonNull(worker, "Worker cannot be null");
            Objects.requireNonNull(worker.getName(), "Worker name cannot be null");
        }

        public Builder capabilities(String... capabilities) {
            return capabilities(Arrays.asList(capabilities));
        }

        public Builder capabilities(Collection<String> capabilities) {
            this.capabilities.addAll(capabilities);
            return this;
        }

        public Builder businessEntities(String... businessEntities) {
            return businessEntities(Arrays.asList(businessEntities));
        }

        public Builder businessEntities(Collection<String> businessEntities) {
            this.businessEntities.addAll(businessEntities);
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public WorkerRegistration build() {
            return new WorkerRegistration(this);
        }
    }
}
