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

import dev.mars.tessera.core.ValidationResult;
import dev.mars.tessera.core.exceptions.WorkflowValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Immutable graph of states and transitions.
 *
 * <p>The graph is validated once by {@link Builder#build()}; every dangling reference is
 * reported together. Cycles are allowed. A built definition is safe to share between
 * threads without synchronization.</p>
 *
 * <pre>{@code
 * WorkflowDefinition orders = WorkflowDefinition.builder("orders")
 *         .initialState("start")
 *         .state(WorkflowState.builder("start").transitions("to_processing").build())
 *         .state(WorkflowState.builder("processing").transitions("approve").build())
 *         .state(WorkflowState.terminal("approved"))
 *         .transition(Transition.builder("to_processing").from("start").to("processing").build())
 *         .transition(Transition.builder("approve").from("processing").to("approved")
 *                 .when(Condition.of("orderValue", ConditionOperator.GREATER_THAN, 1000)).build())
 *         .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowDefinition {

    private static final Logger logger = Logger.getLogger(WorkflowDefinition.class.getName());

    private final String id;
    private final String description;
    private final String version;
    private final String initialState;
    private final Map<String, WorkflowState> states;
    private final List<Transition> transitions;

    private WorkflowDefinition(Builder builder) {
        this.id = builder.id;
        this.description = builder.description;
        this.version = builder.version;
        this.initialState = builder.initialState;
        this.states = Collections.unmodifiableMap(new LinkedHashMap<>(builder.states));
        this.transitions = List.copyOf(builder.transitions);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public String getVersion() {
        return version;
    }

    public String getInitialState() {
        return initialState;
    }

    public Map<String, WorkflowState> getStates() {
        return states;
    }

    public Optional<WorkflowState> getState(String name) {
        return Optional.ofNullable(states.get(name));
    }

    public List<Transition> getTransitions() {
        return transitions;
    }

    /**
     * Transitions leaving {@code stateName} that the state lists as available, lowest priority first.
     */
    public List<Transition> getTransitionsFrom(String stateName) {
        WorkflowState state = states.get(stateName);
        if (state == null) {
            return List.of();
        }
        return transitions.stream()
                .filter(t -> t.getFrom().equals(stateName))
                .filter(t -> state.getAvailableTransitions().contains(t.getName()))
                .sorted(Comparator.comparingInt(Transition::getPriority))
                .collect(Collectors.toList());
    }

    /**
     * Finds the transition with this name leaving {@code fromState}. When several share the name
     * the lowest priority wins.
     */
    public Optional<Transition> findTransition(String fromState, String transitionName) {
        return transitions.stream()
                .filter(t -> t.getFrom().equals(fromState) && t.getName().equals(transitionName))
                .min(Comparator.comparingInt(Transition::getPriority));
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{id='" + id + "', states=" + states.keySet() +
                ", transitions=" + transitions.size() + '}';
    }

    public static class Builder {
        private final String id;
        private String description;
        private String version = "1.0.0";
        private String initialState;
        private final Map<String, WorkflowState> states = new LinkedHashMap<>();
        private final List<String> duplicateStates = new ArrayList<>();
        private final List<Transition> transitions = new ArrayList<>();

        private Builder(String id) {
            this.id = Objects.requireNonNull(id, "Workflow id cannot be null");
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder initialState(String initialState) {
            this.initialState = initialState;
            return this;
        }

        public Builder state(WorkflowState state) {
            Objects.requireNonNull(state, "State cannot be null");
            if (states.putIfAbsent(state.getName(), state) != null) {
                duplicateStates.add(state.getName());
            }
            return this;
        }

        public Builder transition(Transition transition) {
            transitions.add(Objects.requireNonNull(transition, "Transition cannot be null"));
            return this;
        }

        /**
         * Validates the graph and builds the definition.
         *
         * @throws WorkflowValidationException listing every dangling reference found
         */
        public WorkflowDefinition build() throws WorkflowValidationException {
            ValidationResult result = validate();
            if (!result.isValid()) {
                throw new WorkflowValidationException(id, result);
            }
            for (ValidationResult.ValidationIssue warning : result.getWarnings()) {
                logger.warning("Workflow '" + id + "': " + warning);
            }
            return new WorkflowDefinition(this);
        }

        private ValidationResult validate() {
            ValidationResult result = new ValidationResult();
            if (id.isBlank()) {
                result.addError("id", "Workflow id cannot be blank");
            }
            if (states.isEmpty()) {
                result.addError("states", "Workflow must declare at least one state");
            }
            for (String duplicate : duplicateStates) {
                result.addError("states[" + duplicate + "]", "Duplicate state: " + duplicate);
            }
            if (initialState == null) {
                result.addError("initialState", "Initial state is required");
            } else if (!states.containsKey(initialState)) {
                result.addError("initialState", "Unknown initial state: " + initialState);
            }

            for (Transition transition : transitions) {
                String path = "transitions[" + transition.getName() + "]";
                if (!states.containsKey(transition.getFrom())) {
                    result.addError(path + ".from", "Unknown state: " + transition.getFrom());
                }
                if (!states.containsKey(transition.getTo())) {
                    result.addError(path + ".to", "Unknown state: " + transition.getTo());
                }
                for (Transition.Route route : transition.getRoutes()) {
                    if (!states.containsKey(route.target())) {
                        result.addError(path + ".conditionalRouting[" + route.predicate() + "]",
                                "Unknown state: " + route.target());
                    }
                }
                for (String invalid : transition.getUnparseableRoutes()) {
                    result.addError(path + ".conditionalRouting[" + invalid + "]",
                            "Unparseable routing predicate: " + invalid);
                }
            }

            for (WorkflowState state : states.values()) {
                String path = "states[" + state.getName() + "]";
                for (String name : state.getAvailableTransitions()) {
                    boolean named = false;
                    boolean leavesState = false;
                    for (Transition transition : transitions) {
                        if (transition.getName().equals(name)) {
                            named = true;
                            leavesState |= transition.getFrom().equals(state.getName());
                        }
                    }
                    if (!named) {
                        result.addError(path + ".availableTransitions", "Unknown transition: " + name);
                    } else if (!leavesState) {
                        result.addError(path + ".availableTransitions",
                                "Transition '" + name + "' does not leave state '" + state.getName() + "'");
                    }
                }
                if (!state.isTerminal() && state.getAvailableTransitions().isEmpty()) {
                    result.addWarning(path, "Non-terminal state has no available transitions");
                }
            }
            return result;
        }
    }
}
