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

import dev.mars.tessera.core.WorkflowInstance;
import dev.mars.tessera.workflow.AssignmentRule;
import dev.mars.tessera.workflow.WorkflowDefinition;
import dev.mars.tessera.workflow.WorkflowState;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Picks the worker responsible for an instance in its current state from the state's assignment
 * rules.
 *
 * <p>Rules are considered by ascending priority: first a named worker that is registered, then a
 * registered worker with the rule's capability, then the first registered fallback worker of any
 * rule.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class AssignmentResolver {

    private static final Logger logger = Logger.getLogger(AssignmentResolver.class.getName());

    private final WorkerRegistry registry;

    public AssignmentResolver(WorkerRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
    }

    public Optional<String> assign(WorkflowInstance instance, WorkflowDefinition definition) {
        Optional<WorkflowState> state = definition.getState(instance.getCurrentState());
        if (state.isEmpty() || state.get().getAssignmentRules().isEmpty()) {
            return Optional.empty();
        }
        List<AssignmentRule> rules = state.get().getAssignmentRules().stream()
                .sorted(Comparator.comparingInt(AssignmentRule::getPriority))
                .collect(Collectors.toList());

        for (AssignmentRule rule : rules) {
            if (rule.getWorkerName() != null && registry.contains(rule.getWorkerName())) {
                return assigned(instance, rule.getWorkerName(), "worker rule");
            }
        }
        for (AssignmentRule rule : rules) {
            if (rule.getCapability() != null) {
                List<String> capable = registry.findByCapability(rule.getCapability());
                if (!capable.isEmpty()) {
                    return assigned(instance, capable.get(0), "capability " + rule.getCapability());
                }
            }
        }
        for (AssignmentRule rule : rules) {
            for (String fallback : rule.getFallbackWorkers()) {
                if (registry.contains(fallback)) {
                    return assigned(instance, fallback, "fallback");
                }
            }
        }
        logger.warning("No registered worker matches the assignment rules of state " +
                instance.getCurrentState() + " for instance " + instance.getInstanceId());
        return Optional.empty();
    }

    private Optional<String> assigned(WorkflowInstance instance, String workerName, String reason) {
        logger.fine("Assigned " + workerName + " to instance " + instance.getInstanceId() + " by " + reason);
        return Optional.of(workerName);
    }
}
