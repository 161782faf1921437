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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A named state in a workflow graph.
 */
public final class WorkflowState {

    private final String name;
    private final String description;
    private final boolean terminal;
    private final List<String> availableTransitions;
    private final List<AssignmentRule> assignmentRules;
    private final List<String> requiredDataPoints;

    private WorkflowState(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.terminal = builder.terminal;
        this.availableTransitions = List.copyOf(builder.availableTransitions);
        this.assignmentRules = List.copyOf(builder.assignmentRules);
        this.requiredDataPoints = List.copyOf(builder.requiredDataPoints);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static WorkflowState terminal(String name) {
        return builder(name).terminal(true).build();
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public List<String> getAvailableTransitions() {
        return availableTransitions;
    }

    public List<AssignmentRule> getAssignmentRules() {
        return assignmentRules;
    }

    public List<String> getRequiredDataPoints() {
        return requiredDataPoints;
    }

    @Override
    public String toString() {
        return "WorkflowState{name='" + name + "'" + (terminal ? ", terminal" : "") +
                ", transitions=" + availableTransitions + '}';
    }

    public static class Builder {
        private final String name;
        private String description;
        private boolean terminal;
        private final List<String> availableTransitions = new ArrayList<>();
        private final List<AssignmentRule> assignmentRules = new ArrayList<>();
        private final List<String> requiredDataPoints = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "State name cannot be null");
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder terminal(boolean terminal) {
            this.terminal = terminal;
            return this;
        }

        public Builder transitions(String... transitionNames) {
            this.availableTransitions.addAll(Arrays.asList(transitionNames));
            return this;
        }

        public Builder transitions(List<String> transitionNames) {
            this.availableTransitions.addAll(transitionNames);
            return this;
        }

        public Builder assignment(AssignmentRule rule) {
            this.assignmentRules.add(Objects.requireNonNull(rule, "Assignment rule cannot be null"));
            return this;
        }

        public Builder requiredData(String... dataPoints) {
            this.requiredDataPoints.addAll(Arrays.asList(dataPoints));
            return this;
        }

        public Builder requiredData(List<String> dataPoints) {
            this.requiredDataPoints.addAll(dataPoints);
            return this;
        }

        public WorkflowState build() {
            return new WorkflowState(this);
        }
    }
}
