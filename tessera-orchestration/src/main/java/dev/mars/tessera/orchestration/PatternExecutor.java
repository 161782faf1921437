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

import dev.mars.tessera.core.HistoryEntry;
import dev.mars.tessera.core.InstanceStatus;
import dev.mars.tessera.core.WorkflowInstance;
import dev.mars.tessera.core.exceptions.NotFoundException;
import dev.mars.tessera.core.exceptions.TesseraException;
import dev.mars.tessera.core.exceptions.VersionConflictException;
import dev.mars.tessera.core.exceptions.WorkerException;
import dev.mars.tessera.orchestration.observability.OrchestrationMetrics;
import dev.mars.tessera.storage.WorkflowInstanceStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs coordination patterns as tracked instances.
 *
 * <p>The first step runs on the caller's thread so the caller learns immediately whether the
 * pattern started. Each following step is queued on a {@link KeyedSerialExecutor} keyed by the
 * instance id, so at most one step per instance is in flight and steps are applied in order.</p>
 *
 * <p>Every step outcome is written to the instance context under
 * {@link CoordinationPattern#recordKey(PatternStep)} together with the overall
 * {@value #PATTERN_STATUS}. A failed step is also kept in the failure log and can be re-run with
 * {@link #resume(String)}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class PatternExecutor {

    private static final Logger logger = Logger.getLogger(PatternExecutor.class.getName());

    public static final String PATTERN_STATUS = "patternStatus";

    private static final int MAX_SAVE_ATTEMPTS = 3;

    private final EventRouter router;
    private final WorkflowInstanceStore store;
    private final KeyedSerialExecutor serialExecutor;
    private final OrchestrationMetrics metrics;
    private final Clock clock;
    private final Map<String, CoordinationPattern> patterns = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<PatternStatus>> completions = new ConcurrentHashMap<>();
    private final List<StepFailure> failures = new CopyOnWriteArrayList<>();

    public PatternExecutor(EventRouter router, WorkflowInstanceStore store, KeyedSerialExecutor serialExecutor,
                           Collection<CoordinationPattern> patterns, OrchestrationMetrics metrics, Clock clock) {
        this.router = Objects.requireNonNull(router, "Router cannot be null");
        this.store = Objects.requireNonNull(store, "Store cannot be null");
        this.serialExecutor = Objects.requireNonNull(serialExecutor, "Serial executor cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        for (CoordinationPattern pattern : patterns) {
            if (this.patterns.putIfAbsent(pattern.getName(), pattern) != null) {
                throw new IllegalArgumentException("Duplicate coordination pattern: " + pattern.getName());
            }
        }
    }

    public Optional<CoordinationPattern> getPattern(String name) {
        return Optional.ofNullable(patterns.get(name));
    }

    /**
     * Creates a pattern instance and runs its first step synchronously.
     *
     * @throws NotFoundException if no pattern has that name
     */
    public PatternStartResult start(String patternName, Map<String, Object> payload) throws TesseraException {
        CoordinationPattern pattern = patterns.get(patternName);
        if (pattern == null) {
            throw new NotFoundException("Coordination pattern", patternName);
        }
        Instant now = clock.instant();
        PatternStep first = pattern.getFirstStep();
        Map<String, Object> context = new LinkedHashMap<>(payload != null ? payload : Map.of());
        context.put(PATTERN_STATUS, PatternStatus.STARTED.name());

        WorkflowInstance instance = new WorkflowInstance(UUID.randomUUID().toString(), pattern.getWorkflowId(),
                first.getName(), context, now);
        instance.appendHistory(HistoryEntry.created("orchestrator", first.getName(), now));
        store.create(instance);
        String instanceId = instance.getInstanceId();
        completions.put(instanceId, new CompletableFuture<>());
        metrics.recordPatternStarted();
        logger.info("Started pattern " + patternName + " instance " + instanceId);

        PatternStatus status;
        try {
            status = runStep(pattern, instanceId, first);
        } catch (TesseraException e) {
            abandon(instanceId, e);
            throw e;
        }
        String reported = status == PatternStatus.COMPLETED ? PatternStartResult.COMPLETED
                : status == PatternStatus.FAILED ? PatternStartResult.FAILED
                : PatternStartResult.STARTED;
        return new PatternStartResult(instanceId, pattern.getWorkflowId(), reported);
    }

    /**
     * Re-queues the first step of the instance's pattern that has no success record.
     *
     * @return a future completed with the final status once the pattern finishes
     * @throws NotFoundException if the instance or its pattern is unknown
     */
    public CompletableFuture<PatternStatus> resume(String instanceId) throws TesseraException {
        WorkflowInstance instance = store.get(instanceId);
        CoordinationPattern pattern = patternFor(instance);
        Optional<PatternStep> pending = firstIncompleteStep(pattern, instance);
        if (pending.isEmpty()) {
            logger.info("Pattern instance " + instanceId + " has no incomplete steps");
            return CompletableFuture.completedFuture(PatternStatus.COMPLETED);
        }
        CompletableFuture<PatternStatus> completion = completions.get(instanceId);
        if (completion == null) {
            completion = new CompletableFuture<>();
            completions.put(instanceId, completion);
            metrics.recordPatternStarted();
        }
        logger.info("Resuming pattern instance " + instanceId + " at step " + pending.get().getName());
        schedule(pattern, instanceId, pending.get());
        return completion;
    }

    /**
     * A future completed with the final status of the pattern run; already complete when the run
     * has finished.
     */
    public CompletableFuture<PatternStatus> completion(String instanceId) throws NotFoundException {
        CompletableFuture<PatternStatus> pending = completions.get(instanceId);
        if (pending != null) {
            return pending;
        }
        return CompletableFuture.completedFuture(statusOf(store.get(instanceId)));
    }

    public List<StepFailure> getFailedSteps() {
        return List.copyOf(failures);
    }

    private PatternStatus runStep(CoordinationPattern pattern, String instanceId, PatternStep step)
            throws TesseraException {
        WorkflowInstance instance = store.get(instanceId);
        String recordKey = pattern.recordKey(step);
        if (hasSucceeded(instance, recordKey)) {
            logger.fine("Step " + step.getName() + " of " + instanceId + " already succeeded, skipping");
            return statusOf(instance);
        }

        Map<String, Object> payload = stepPayload(pattern, instance);
        RoutingOutcome outcome = null;
        WorkerException failure = null;
        int attempts = 0;
        while (attempts <= step.getRetryCount()) {
            attempts++;
            try {
                outcome = router.dispatch(step.getWorker(), step.getEventType(), payload);
                failure = null;
                break;
            } catch (WorkerException e) {
                failure = e;
                logger.fine("Step " + step.getName() + " attempt " + attempts + " failed: " + e.getMessage());
            }
        }

        Instant now = clock.instant();
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("success", failure == null);
        record.put("worker", step.getWorker());
        record.put("eventType", step.getEventType());
        if (failure == null) {
            record.put("result", outcome.result());
            if (!outcome.handledBy().equals(step.getWorker())) {
                record.put("handledBy", outcome.handledBy());
            }
        } else {
            record.put("error", failure.getMessage());
        }
        record.put("attempts", attempts);
        record.put("timestamp", now.toString());

        Optional<PatternStep> next = failure == null ? pattern.next(step) : Optional.empty();
        PatternStatus status = failure != null ? PatternStatus.FAILED
                : next.isPresent() ? PatternStatus.RUNNING
                : PatternStatus.COMPLETED;
        commitStep(instance, step, recordKey, record, status, now);
        metrics.recordStep(pattern.getName(), step.getWorker(), failure == null);

        if (failure != null) {
            failures.add(new StepFailure(instanceId, pattern.getName(), step.getName(), step.getWorker(),
                    step.getEventType(), failure.getMessage(), now));
            logger.warning("Pattern " + pattern.getName() + " instance " + instanceId + " failed at step " +
                    step.getName() + ": " + failure.getMessage());
        }
        if (status.isFinished()) {
            finish(instanceId, status);
        } else {
            schedule(pattern, instanceId, next.get());
        }
        return status;
    }

    private void commitStep(WorkflowInstance loaded, PatternStep step, String recordKey, Map<String, Object> record,
                            PatternStatus status, Instant now) throws TesseraException {
        WorkflowInstance instance = loaded;
        for (int attempt = 1; ; attempt++) {
            long expectedVersion = instance.getVersion();
            String fromState = instance.getCurrentState();
            instance.putContextValue(recordKey, record);
            instance.putContextValue(PATTERN_STATUS, status.name());
            instance.setCurrentState(step.getName());
            instance.setLastTransitionAt(now);
            instance.appendHistory(new HistoryEntry(step.getWorker(),
                    (Boolean.TRUE.equals(record.get("success")) ? "Completed " : "Failed ") + step.getEventType() +
                            " on " + step.getWorker(),
                    record, fromState, step.getName(), step.getEventType(), now));
            instance.setStatus(status == PatternStatus.COMPLETED ? InstanceStatus.COMPLETED
                    : status == PatternStatus.FAILED ? InstanceStatus.ERROR
                    : InstanceStatus.ACTIVE);
            instance.incrementVersion();
            try {
                store.save(instance, expectedVersion);
                return;
            } catch (VersionConflictException e) {
                if (attempt >= MAX_SAVE_ATTEMPTS) {
                    throw e;
                }
                logger.fine("Version conflict recording " + recordKey + ", reloading");
                instance = store.get(instance.getInstanceId());
            }
        }
    }

    private void schedule(CoordinationPattern pattern, String instanceId, PatternStep step) {
        try {
            serialExecutor.submit(instanceId, () -> runInBackground(pattern, instanceId, step));
        } catch (RejectedExecutionException e) {
            failures.add(new StepFailure(instanceId, pattern.getName(), step.getName(), step.getWorker(),
                    step.getEventType(), "Step could not be queued: " + e.getMessage(), clock.instant()));
            logger.warning("Could not queue step " + step.getName() + " of " + instanceId + ": " + e.getMessage());
            abandon(instanceId, e);
        }
    }

    private void runInBackground(CoordinationPattern pattern, String instanceId, PatternStep step) {
        try {
            runStep(pattern, instanceId, step);
        } catch (TesseraException | RuntimeException e) {
            failures.add(new StepFailure(instanceId, pattern.getName(), step.getName(), step.getWorker(),
                    step.getEventType(), e.getMessage(), clock.instant()));
            logger.log(Level.SEVERE, "Step " + step.getName() + " of pattern instance " + instanceId +
                    " could not be recorded: " + e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Step failure details for " + instanceId, e);
            }
            abandon(instanceId, e);
        }
    }

    private void finish(String instanceId, PatternStatus status) {
        metrics.recordPatternFinished();
        logger.info("Pattern instance " + instanceId + " finished with status " + status);
        CompletableFuture<PatternStatus> completion = completions.remove(instanceId);
        if (completion != null) {
            completion.complete(status);
        }
    }

    private void abandon(String instanceId, Throwable cause) {
        CompletableFuture<PatternStatus> completion = completions.remove(instanceId);
        if (completion != null) {
            metrics.recordPatternFinished();
            completion.completeExceptionally(cause);
        }
    }

    private CoordinationPattern patternFor(WorkflowInstance instance) throws NotFoundException {
        String workflowId = instance.getWorkflowId();
        CoordinationPattern pattern = workflowId.startsWith(CoordinationPattern.WORKFLOW_ID_PREFIX)
                ? patterns.get(workflowId.substring(CoordinationPattern.WORKFLOW_ID_PREFIX.length()))
                : null;
        if (pattern == null) {
            throw new NotFoundException("Coordination pattern", workflowId);
        }
        return pattern;
    }

    private Optional<PatternStep> firstIncompleteStep(CoordinationPattern pattern, WorkflowInstance instance) {
        PatternStep current = pattern.getFirstStep();
        while (current != null) {
            if (!hasSucceeded(instance, pattern.recordKey(current))) {
                return Optional.of(current);
            }
            current = pattern.next(current).orElse(null);
        }
        return Optional.empty();
    }

    // Caller payload plus the results of every step that has already succeeded, in step order.
    private Map<String, Object> stepPayload(CoordinationPattern pattern, WorkflowInstance instance) {
        Map<String, Object> payload = new LinkedHashMap<>(instance.getContextData());
        for (PatternStep step : pattern.getSteps()) {
            Object record = instance.getContextValue(pattern.recordKey(step));
            if (record instanceof Map && Boolean.TRUE.equals(((Map<?, ?>) record).get("success"))) {
                Object result = ((Map<?, ?>) record).get("result");
                if (result instanceof Map) {
                    for (Map.Entry<?, ?> entry : ((Map<?, ?>) result).entrySet()) {
                        payload.put(String.valueOf(entry.getKey()), entry.getValue());
                    }
                }
            }
        }
        payload.put(EventRouter.INSTANCE_ID, instance.getInstanceId());
        return payload;
    }

    private static boolean hasSucceeded(WorkflowInstance instance, String recordKey) {
        Object record = instance.getContextValue(recordKey);
        return record instanceof Map && Boolean.TRUE.equals(((Map<?, ?>) record).get("success"));
    }

    private static PatternStatus statusOf(WorkflowInstance instance) {
        Object value = instance.getContextValue(PATTERN_STATUS);
        try {
            return value != null ? PatternStatus.valueOf(value.toString()) : PatternStatus.STARTED;
        } catch (IllegalArgumentException e) {
            logger.warning("Unknown pattern status '" + value + "' on " + instance.getInstanceId());
            return PatternStatus.STARTED;
        }
    }
}
