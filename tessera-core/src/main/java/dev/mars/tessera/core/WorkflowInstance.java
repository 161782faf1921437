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

package dev.mars.tessera.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One running execution of a workflow definition or coordination pattern.
 *
 * <p>Instances are mutable working copies: the store hands out copies and accepts them back
 * through a version-checked save. The history log only grows.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowInstance {

    private final String instanceId;
    private final String workflowId;
    private final Instant createdAt;
    private final Map<String, Object> contextData;
    private final List<HistoryEntry> historyLog;
    private String currentState;
    private InstanceStatus status;
    private long version;
    private Instant lastTransitionAt;

    public WorkflowInstance(String instanceId, String workflowId, String initialState,
                            Map<String, Object> contextData, Instant createdAt) {
        this.instanceId = Objects.requireNonNull(instanceId, "Instance ID cannot be null");
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.currentState = Objects.requireNonNull(initialState, "Initial state cannot be null");
        this.createdAt = Objects.requireNonNull(createdAt, "Created timestamp cannot be null");
        this.contextData = deepCopy(contextData != null ? contextData : Map.of());
        this.historyLog = new ArrayList<>();
        this.status = InstanceStatus.ACTIVE;
        this.version = 0;
        this.lastTransitionAt = createdAt;
    }

    private WorkflowInstance(WorkflowInstance source) {
        this.instanceId = source.instanceId;
        this.workflowId = source.workflowId;
        this.createdAt = source.createdAt;
        this.contextData = deepCopy(source.contextData);
        this.historyLog = new ArrayList<>(source.historyLog);
        this.currentState = source.currentState;
        this.status = source.status;
        this.version = source.version;
        this.lastTransitionAt = source.lastTransitionAt;
    }

    /**
     * Returns an independent copy; nested maps and lists in the context are copied too.
     */
    public WorkflowInstance copy() {
        return new WorkflowInstance(this);
    }

    public String getInstanceId() {
        return instanceId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getCurrentState() {
        return currentState;
    }

    public void setCurrentState(String currentState) {
        this.currentState = Objects.requireNonNull(currentState, "Current state cannot be null");
    }

    public InstanceStatus getStatus() {
        return status;
    }

    public void setStatus(InstanceStatus status) {
        this.status = Objects.requireNonNull(status, "Status cannot be null");
    }

    public Map<String, Object> getContextData() {
        return Collections.unmodifiableMap(contextData);
    }

    public Object getContextValue(String key) {
        return contextData.get(key);
    }

    public void putContextValue(String key, Object value) {
        contextData.put(Objects.requireNonNull(key, "Context key cannot be null"), copyValue(value));
    }

    public void mergeContext(Map<String, ?> data) {
        if (data != null) {
            data.forEach(this::putContextValue);
        }
    }

    public List<HistoryEntry> getHistoryLog() {
        return Collections.unmodifiableList(historyLog);
    }

    public void appendHistory(HistoryEntry entry) {
        historyLog.add(Objects.requireNonNull(entry, "History entry cannot be null"));
    }

    public long getVersion() {
        return version;
    }

    /**
     * Advances the version by one. Called exactly once per committed change.
     */
    public void incrementVersion() {
        version++;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastTransitionAt() {
        return lastTransitionAt;
    }

    public void setLastTransitionAt(Instant lastTransitionAt) {
        this.lastTransitionAt = lastTransitionAt;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map) {
            return deepCopy((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object element : (List<Object>) value) {
                copy.add(copyValue(element));
            }
            return copy;
        }
        return value;
    }

    private static Map<String, Object> deepCopy(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(String.valueOf(k), copyValue(v)));
        return copy;
    }

    @Override
    public String toString() {
        return "WorkflowInstance{" +
                "instanceId='" + instanceId + '\'' +
                ", workflowId='" + workflowId + '\'' +
                ", currentState='" + currentState + '\'' +
                ", status=" + status +
                ", version=" + version +
                ", history=" + historyLog.size() +
                '}';
    }
}
