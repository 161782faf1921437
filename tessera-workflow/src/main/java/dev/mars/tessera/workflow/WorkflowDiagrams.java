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

import dev.mars.tessera.core.HistoryEntry;
import dev.mars.tessera.core.WorkflowInstance;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders workflow definitions and instance histories as Mermaid diagram source.
 *
 * <p>{@link #stateDiagram(WorkflowDefinition, String)} produces a {@code stateDiagram-v2} with one
 * edge per transition (plus one per conditional routing target) and start/end markers.
 * {@link #historyTimeline(WorkflowInstance, Instant, ZoneId)} produces a {@code gantt} chart
 * with one section per visited state.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowDiagrams {

    static final String HIGHLIGHT_CLASS = "current";

    private static final DateTimeFormatter GANTT_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private WorkflowDiagrams() {
    }

    public static String stateDiagram(WorkflowDefinition definition) {
        return stateDiagram(definition, null);
    }

    /**
     * @param highlightState state to mark as current, or null for none
     */
    public static String stateDiagram(WorkflowDefinition definition, String highlightState) {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        StringBuilder sb = new StringBuilder("stateDiagram-v2\n");
        for (WorkflowState state : definition.getStates().values()) {
            sb.append("    state \"").append(state.getName()).append("\" as ").append(nodeId(state.getName()))
                    .append('\n');
        }
        for (Transition transition : definition.getTransitions()) {
            edge(sb, transition.getFrom(), transition.getTo(), transition.getName());
            for (Map.Entry<String, String> route : transition.getConditionalRouting().entrySet()) {
                if (!route.getValue().equals(transition.getTo())) {
                    edge(sb, transition.getFrom(), route.getValue(),
                            transition.getName() + " [" + route.getKey() + "]");
                }
            }
        }
        sb.append("    [*] --> ").append(nodeId(definition.getInitialState())).append('\n');
        for (WorkflowState state : definition.getStates().values()) {
            if (state.isTerminal()) {
                sb.append("    ").append(nodeId(state.getName())).append(" --> [*]\n");
            }
        }
        if (highlightState != null && definition.getStates().containsKey(highlightState)) {
            sb.append("    classDef ").append(HIGHLIGHT_CLASS).append(" fill:#f9d71c,stroke:#333,stroke-width:2px\n");
            sb.append("    class ").append(nodeId(highlightState)).append(' ').append(HIGHLIGHT_CLASS).append('\n');
        }
        return sb.toString();
    }

    /**
     * Gantt chart of the time the instance spent in each state. The last segment of an instance
     * that is still running ends at {@code now}; a finished instance's last segment ends where it
     * started.
     */
    public static String historyTimeline(WorkflowInstance instance, Instant now, ZoneId zone) {
        Objects.requireNonNull(instance, "Workflow instance cannot be null");
        Objects.requireNonNull(now, "Now cannot be null");
        Objects.requireNonNull(zone, "Zone cannot be null");
        DateTimeFormatter format = GANTT_TIME.withZone(zone);

        List<HistoryEntry> history = instance.getHistoryLog();
        Map<String, List<String>> sections = new LinkedHashMap<>();
        for (int i = 0; i < history.size(); i++) {
            HistoryEntry entry = history.get(i);
            Instant end;
            if (i + 1 < history.size()) {
                end = history.get(i + 1).timestamp();
            } else {
                end = instance.getStatus().isTerminal() ? entry.timestamp() : now;
            }
            String task = entry.isCreation()
                    ? "Initial state"
                    : "Transition from " + entry.fromState() + " via " + entry.transition();
            sections.computeIfAbsent(entry.toState(), k -> new ArrayList<>())
                    .add("    " + taskLabel(task) + ": " + format.format(entry.timestamp()) + ", " +
                            format.format(end));
        }

        StringBuilder sb = new StringBuilder("gantt\n");
        sb.append("    title Workflow History Timeline - ").append(instance.getWorkflowId())
                .append(" (").append(instance.getInstanceId()).append(")\n");
        sb.append("    dateFormat YYYY-MM-DD HH:mm\n");
        sb.append("    axisFormat %m-%d %H:%M\n");
        sections.forEach((state, tasks) -> {
            sb.append("    section ").append(state).append('\n');
            tasks.forEach(task -> sb.append(task).append('\n'));
        });
        return sb.toString();
    }

    static String nodeId(String stateName) {
        return stateName.trim().replaceAll("\\s+", "_");
    }

    private static void edge(StringBuilder sb, String from, String to, String label) {
        sb.append("    ").append(nodeId(from)).append(" --> ").append(nodeId(to)).append(": ")
                .append(label.replace(':', ' ')).append('\n');
    }

    // gantt task names end at the first colon
    private static String taskLabel(String task) {
        return task.replace(':', ' ');
    }
}
