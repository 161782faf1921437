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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A request to move one instance along one named transition.
 */
public final class TransitionRequest {

    private final String instanceId;
    private final String transitionName;
    private final String actorId;
    private final String description;
    private final Map<String, Object> data;
    private final int attempt;

    private TransitionRequest(Builder builder) {
        this.instanceId = Objects.requireNonNull(builder.instanceId, "Instance ID cannot be null");
        this.transitionName = Objects.requireNonNull(builder.transitionName, "Transition name cannot be null");
        this.actorId = builder.actorId != null ? builder.actorId : "system";
        this.description = builder.description;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(builder.data));
        this.attempt = builder.attempt;
    }

    public static Builder builder(String instanceId, String transitionName) {
        return new Builder(instanceId, transitionName);
    }

    public static TransitionRequest of(String instanceId, String transitionName, String actorId) {
        return builder(instanceId, transitionName).actorId(actorId).build();
    }

    /**
     * The same request for the following attempt.
     */
    public TransitionRequest nextAttempt() {
        return builder(instanceId, transitionName)
                .actorId(actorId)
                .description(description)
                .data(data)
                .attempt(attempt + 1)
                .build();
    }

    public String getInstanceId() {
        return instanceId;
    }

    public String getTransitionName() {
        return transitionName;
    }

    public String getActorId() {
        return actorId;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public int getAttempt() {
        return attempt;
    }

    @Override
    public String toString() {
        return "TransitionRequest{instance='" + instanceId + "', transition='" + transitionName +
                "', actor='" + actorId + "', attempt=" + attempt + '}';
    }

    public static class Builder {
        private final String instanceId;
        private final String transitionName;
        private String actorId;
        private String description;
        private Map<String, Object> data = Map.of();
        private int attempt;

        private Builder(String instanceId, String transitionName) {
            this.instanceId = instanceId;
            this.transitionName = transitionName;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data != null ? data : Map.of();
            return this;
        }

        public Builder attempt(int attempt) {
            if (attempt < 0) {
                throw new IllegalArgumentException("Attempt cannot be negative");
            }
            this.attempt = attempt;
            return this;
        }

        public TransitionRequest build() {
            return new TransitionRequest(this);
        }
    }
}
