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

import dev.mars.tessera.core.exceptions.WorkflowValidationException;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static dev.mars.tessera.workflow.DefinitionMaps.getBoolean;
import static dev.mars.tessera.workflow.DefinitionMaps.getDuration;
import static dev.mars.tessera.workflow.DefinitionMaps.getInt;
import static dev.mars.tessera.workflow.DefinitionMaps.getMap;
import static dev.mars.tessera.workflow.DefinitionMaps.getMapList;
import static dev.mars.tessera.workflow.DefinitionMaps.getString;
import static dev.mars.tessera.workflow.DefinitionMaps.getStringList;
import static dev.mars.tessera.workflow.DefinitionMaps.requireString;

/**
 * Turns a loaded document tree into a validated {@link WorkflowDefinition}. Shared by the YAML
 * and JSON parsers.
 */
class WorkflowDefinitionMapper {

    WorkflowDefinition toDefinition(Map<String, Object> data) throws WorkflowParseException {
        String id = requireString(data, "id", "workflow");
        WorkflowDefinition.Builder builder = WorkflowDefinition.builder(id)
                .description(getString(data, "description"))
                .version(getString(data, "version", "1.0.0"))
                .initialState(getString(data, "initialState"));

        List<Map<String, Object>> states = getMapList(data, "states", "workflow");
        for (int i = 0; i < states.size(); i++) {
            builder.state(parseState(states.get(i), "states[" + i + "]"));
        }
        List<Map<String, Object>> transitions = getMapList(data, "transitions", "workflow");
        for (int i = 0; i < transitions.size(); i++) {
            builder.transition(parseTransition(transitions.get(i), "transitions[" + i + "]"));
        }

        try {
            return builder.build();
        } catch (WorkflowValidationException e) {
            throw new WorkflowParseException("Workflow '" + id + "' is invalid: " +
                    e.getValidationResult().describeErrors(), e);
        }
    }

    private WorkflowState parseState(Map<String, Object> data, String path) throws WorkflowParseException {
        WorkflowState.Builder builder = WorkflowState.builder(requireString(data, "name", path))
                .description(getString(data, "description"))
                .terminal(getBoolean(data, "terminal", false))
                .transitions(getStringList(data, "transitions"))
                .requiredData(getStringList(data, "requiredData"));
        List<Map<String, Object>> assignments = getMapList(data, "assignments", path);
        for (int i = 0; i < assignments.size(); i++) {
            builder.assignment(parseAssignment(assignments.get(i), path + ".assignments[" + i + "]"));
        }
        return builder.build();
    }

    private AssignmentRule parseAssignment(Map<String, Object> data, String path) throws WorkflowParseException {
        try {
            return AssignmentRule.builder()
                    .workerName(getString(data, "worker"))
                    .capability(getString(data, "capability"))
                    .fallbackWorkers(getStringList(data, "fallbackWorkers"))
                    .priority(getInt(data, "priority", 1, path))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path, e.getMessage(), e);
        }
    }

    private Transition parseTransition(Map<String, Object> data, String path) throws WorkflowParseException {
        Transition.Builder builder = Transition.builder(requireString(data, "name", path))
                .description(getString(data, "description"))
                .from(requireString(data, "from", path))
                .to(requireString(data, "to", path))
                .priority(getInt(data, "priority", 1, path))
                .exponentialBackoff(getBoolean(data, "exponentialBackoff", false))
                .retryDelay(getDuration(data, "retryDelay", Duration.ofSeconds(1), path))
                .timeout(getDuration(data, "timeout", null, path));
        int retryCount = getInt(data, "retryCount", 0, path);
        if (retryCount < 0) {
            throw new WorkflowParseException(path + ".retryCount", "Retry count cannot be negative", null);
        }
        builder.retryCount(retryCount);

        List<Map<String, Object>> groups = getMapList(data, "conditions", path);
        for (int i = 0; i < groups.size(); i++) {
            builder.when(parseGroup(groups.get(i), path + ".conditions[" + i + "]"));
        }
        Map<String, Object> routing = getMap(data, "routing");
        if (routing != null) {
            for (Map.Entry<String, Object> entry : routing.entrySet()) {
                builder.routeIf(entry.getKey(), String.valueOf(entry.getValue()));
            }
        }
        for (String action : getStringList(data, "preActions")) {
            builder.preAction(action);
        }
        for (String action : getStringList(data, "postActions")) {
            builder.postAction(action);
        }
        List<Map<String, Object>> triggers = getMapList(data, "triggers", path);
        for (int i = 0; i < triggers.size(); i++) {
            builder.trigger(parseTrigger(triggers.get(i), path + ".triggers[" + i + "]"));
        }
        return builder.build();
    }

    private ConditionGroup parseGroup(Map<String, Object> data, String path) throws WorkflowParseException {
        LogicalOperator operator;
        try {
            operator = LogicalOperator.valueOf(getString(data, "operator", "AND").toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path + ".operator", "Unknown logical operator", e);
        }
        List<Map<String, Object>> conditions = getMapList(data, "conditions", path);
        Condition[] parsed = new Condition[conditions.size()];
        for (int i = 0; i < conditions.size(); i++) {
            parsed[i] = parseCondition(conditions.get(i), path + ".conditions[" + i + "]");
        }
        return operator == LogicalOperator.AND ? ConditionGroup.allOf(parsed) : ConditionGroup.anyOf(parsed);
    }

    private Condition parseCondition(Map<String, Object> data, String path) throws WorkflowParseException {
        ConditionOperator operator;
        try {
            operator = ConditionOperator.fromName(getString(data, "operator"));
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path + ".operator", "Unknown condition operator: " +
                    getString(data, "operator"), e);
        }
        return new Condition(requireString(data, "field", path), operator, data.get("value"),
                getBoolean(data, "caseSensitive", false));
    }

    private TransitionTrigger parseTrigger(Map<String, Object> data, String path) throws WorkflowParseException {
        try {
            TriggerType type = TriggerType.valueOf(
                    requireString(data, "type", path).toUpperCase(Locale.ROOT).replace('-', '_'));
            TransitionTrigger.Builder builder = TransitionTrigger.builder(requireString(data, "name", path), type)
                    .description(getString(data, "description"))
                    .eventTypes(getStringList(data, "eventTypes"))
                    .allowedRoles(getStringList(data, "allowedRoles"));
            Object scheduledTime = data.get("scheduledTime");
            if (scheduledTime instanceof Date) {
                // unquoted YAML timestamps arrive already resolved
                builder.scheduledTime(((Date) scheduledTime).toInstant());
            } else if (scheduledTime != null) {
                builder.scheduledTime(Instant.parse(scheduledTime.toString()));
            }
            String dailyAt = getString(data, "dailyAt");
            if (dailyAt != null) {
                builder.dailyAt(LocalTime.parse(dailyAt));
            }
            return builder.build();
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new WorkflowParseException(path, e.getMessage(), e);
        }
    }
}
