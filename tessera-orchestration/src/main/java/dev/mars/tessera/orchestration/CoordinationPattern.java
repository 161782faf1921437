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

import dev.mars.tessera.core.ValidationResult;
import dev.mars.tessera.core.exceptions.WorkflowValidationException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A predefined sequence of worker calls run as one tracked instance.
 *
 * <pre>
 * CoordinationPattern onboarding = CoordinationPattern.builder("lead_to_booking")
 *         .step("Nyra", "capture")
 *         .step("Solari", "book")
 *         .expectedDuration(Duration.ofMinutes(5))
 *         .build();
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class CoordinationPattern {

    /**
     * Prefix of the workflow id given to pattern instances.
     */
    public static final String WORKFLOW_ID_PREFIX = "pattern:";

    private final String name;
    private final List<PatternStep> steps;
    private final Map<String, Integer> indexByName;
    private final Duration expectedDuration;
    private final List<String> successCriteria;
    private final List<String> fallbackActions;

    private CoordinationPattern(String name, List<PatternStep> steps, Duration expectedDuration,
                                List<String> successCriteria, List<String> fallbackActions) {
        this.name = name;
        this.steps = List.copyOf(steps);
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            index.put(steps.get(i).getName(), i);
        }
        this.indexByName = Map.copyOf(index);
        this.expectedDuration = expectedDuration;
        this.successCriteria = List.copyOf(successCriteria);
        this.fallbackActions = List.copyOf(fallbackActions);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getWorkflowId() {
        return WORKFLOW_ID_PREFIX + name;
    }

    public List<PatternStep> getSteps() {
        return steps;
    }

    public PatternStep getFirstStep() {
        return steps.get(0);
    }

    public Optional<PatternStep> getStep(String stepName) {
        Integer index = indexByName.get(stepName);
        return index != null ? Optional.of(steps.get(index)) : Optional.empty();
    }

    public int indexOf(PatternStep step) {
        Integer index = indexByName.get(step.getName());
        return index != null ? index : -1;
    }

    /**
     * The step that runs after {@code step} succeeds, if any.
     */
    public Optional<PatternStep> next(PatternStep step) {
        return step.getNextOnSuccess() != null ? getStep(step.getNextOnSuccess()) : Optional.empty();
    }

    /**
     * Context key under which the outcome of {@code step} is recorded.
     */
    public String recordKey(PatternStep step) {
        return "step" + indexOf(step) + "_" + step.getWorker() + "_" + step.getEventType();
    }

    public Duration getExpectedDuration() {
        return expectedDuration;
    }

    public List<String> getSuccessCriteria() {
        return successCriteria;
    }

    public List<String> getFallbackActions() {
        return fallbackActions;
    }

    @Override
    public String toString() {
        return "CoordinationPattern{name='" + name + "', steps=" + steps.size() + '}';
    }

    public static class Builder {
        private final String name;
        private final List<PatternStep> steps = new ArrayList<>();
        private Duration expectedDuration;
        private final List<String> successCriteria = new ArrayList<>();
        private final List<String> fallbackActions = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder step(String worker, String eventType) {
            return step(PatternStep.builder(worker, eventType).build());
        }

        public Builder step(PatternStep step) {
            steps.add(Objects.requireNonNull(step, "Step cannot be null"));
            return this;
        }

        public Builder expectedDuration(Duration expectedDuration) {
            this.expectedDuration = expectedDuration;
            return this;
        }

        public Builder successCriteria(String... criteria) {
            return successCriteria(Arrays.asList(criteria));
        }

        public Builder successCriteria(List<String> criteria) {
            successCriteria.addAll(criteria);
            return this;
        }

        public Builder fallbackActions(String... actions) {
            return fallbackActions(Arrays.asList(actions));
        }

        public Builder fallbackActions(List<String> actions) {
            fallbackActions.addAll(actions);
            return this;
        }

        public CoordinationPattern build() throws WorkflowValidationException {
            String subject = name != null ? name : "<unnamed pattern>";
            ValidationResult result = new ValidationResult();
            if (name == null || name.trim().isEmpty()) {
                result.addError("name", "Pattern name is required");
            }
            if (steps.isEmpty()) {
                result.addError("steps", "Pattern must have at least one step");
                throw new WorkflowValidationException(subject, result);
            }

            List<String> names = new ArrayList<>();
            for (int i = 0; i < steps.size(); i++) {
                PatternStep step = steps.get(i);
                names.add(step.hasName() ? step.getName() : "step" + i);
            }
            Set<String> seen = new HashSet<>();
            for (String stepName : names) {
                if (!seen.add(stepName)) {
                    result.addError("steps[" + stepName + "]", "Duplicate step name: " + stepName);
                }
            }

            List<PatternStep> resolved = new ArrayList<>();
            for (int i = 0; i < steps.size(); i++) {
                PatternStep step = steps.get(i);
                String next = step.isNextExplicit()
                        ? step.getNextOnSuccess()
                        : (i + 1 < steps.size() ? names.get(i + 1) : null);
                if (next != null && !names.contains(next)) {
                    result.addError("steps[" + names.get(i) + "].nextOnSuccess", "Unknown step: " + next);
                }
                resolved.add(step.resolve(names.get(i), next));
            }

            if (result.isValid()) {
                checkTerminates(resolved, names, result);
            }
            if (!result.isValid()) {
                throw new WorkflowValidationException(subject, result);
            }
            return new CoordinationPattern(name, resolved, expectedDuration, successCriteria, fallbackActions);
        }

        // Step records are keyed by index, so a step may run at most once per run.
        private static void checkTerminates(List<PatternStep> resolved, List<String> names, ValidationResult result) {
            Set<String> visited = new HashSet<>();
            PatternStep current = resolved.get(0);
            while (current != null) {
                if (!visited.add(current.getName())) {
                    result.addError("steps[" + current.getName() + "]", "Step sequence loops back to " +
                            current.getName());
                    return;
                }
                String next = current.getNextOnSuccess();
                current = next != null ? resolved.get(names.indexOf(next)) : null;
            }
        }
    }
}
