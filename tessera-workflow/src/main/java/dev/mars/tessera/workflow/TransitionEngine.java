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
import dev.mars.tessera.core.InstanceStatus;
import dev.mars.tessera.core.TransitionResult;
import dev.mars.tessera.core.WorkflowInstance;
import dev.mars.tessera.core.exceptions.ActionException;
import dev.mars.tessera.core.exceptions.ConditionNotMetException;
import dev.mars.tessera.core.exceptions.InvalidTransitionException;
import dev.mars.tessera.core.exceptions.NotFoundException;
import dev.mars.tessera.core.exceptions.TesseraException;
import dev.mars.tessera.core.exceptions.TransitionTimeoutException;
import dev.mars.tessera.core.exceptions.VersionConflictException;
import dev.mars.tessera.core.exceptions.WorkflowValidationException;
import dev.mars.tessera.messaging.EventPublisher;
import dev.mars.tessera.messaging.RoutingEvent;
import dev.mars.tessera.storage.WorkflowInstanceStore;
import dev.mars.tessera.workflow.observability.WorkflowMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes single transition attempts against stored workflow instances.
 *
 * <p>An attempt loads the instance, checks the transition is available from the current state,
 * evaluates its conditions, resolves the target (conditional routing first, then the default),
 * runs pre-actions, then saves the advanced instance with a version check. Post-actions run
 * after the save and cannot undo it.</p>
 *
 * <p>The engine never sleeps or loops. A transient failure (timeout, version conflict or a
 * retryable pre-action failure) with attempts left produces a result with
 * {@link TransitionResult#isRetryRecommended()} set and the delay to wait; the caller schedules
 * the next attempt.</p>
 *
 * <p>Conditions and routing predicates are evaluated against the instance context overlaid with
 * the request data, so a caller can supply the values a guard depends on in the same request
 * that commits them.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TransitionEngine {

    private static final Logger logger = Logger.getLogger(TransitionEngine.class.getName());

    private final WorkflowInstanceStore store;
    private final Map<String, WorkflowDefinition> definitions;
    private final ActionRegistry actionRegistry;
    private final EventPublisher publisher;
    private final WorkflowMetrics metrics;
    private final Clock clock;
    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    public TransitionEngine(WorkflowInstanceStore store, Collection<WorkflowDefinition> definitions) {
        this(store, definitions, ActionRegistry.empty(), EventPublisher.noop(), WorkflowMetrics.noop(),
                Clock.systemUTC());
    }

    public TransitionEngine(WorkflowInstanceStore store,
                            Collection<WorkflowDefinition> definitions,
                            ActionRegistry actionRegistry,
                            EventPublisher publisher,
                            WorkflowMetrics metrics,
                            Clock clock) {
        this.store = Objects.requireNonNull(store, "Store cannot be null");
        this.actionRegistry = Objects.requireNonNull(actionRegistry, "Action registry cannot be null");
        this.publisher = Objects.requireNonNull(publisher, "Publisher cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        Map<String, WorkflowDefinition> byId = new LinkedHashMap<>();
        for (WorkflowDefinition definition : Objects.requireNonNull(definitions, "Definitions cannot be null")) {
            if (byId.putIfAbsent(definition.getId(), definition) != null) {
                throw new IllegalArgumentException("Duplicate workflow definition: " + definition.getId());
            }
        }
        this.definitions = Map.copyOf(byId);
    }

    /**
     * Creates an instance in the definition's initial state with a single creation history entry.
     *
     * @throws NotFoundException if the workflow id is unknown
     */
    public WorkflowInstance start(String workflowId, Map<String, Object> initialContext, String actorId)
            throws TesseraException {
        WorkflowDefinition definition = definitions.get(workflowId);
        if (definition == null) {
            throw NotFoundException.definition(workflowId);
        }
        Instant now = clock.instant();
        String initialState = definition.getInitialState();
        WorkflowInstance instance = new WorkflowInstance(UUID.randomUUID().toString(), workflowId,
                initialState, initialContext, now);
        instance.appendHistory(HistoryEntry.created(actorId != null ? actorId : "system", initialState, now));
        if (definition.getStates().get(initialState).isTerminal()) {
            instance.setStatus(InstanceStatus.COMPLETED);
        }
        store.create(instance);
        metrics.recordWorkflowStarted(workflowId);
        logger.info("Started workflow " + workflowId + " instance " + instance.getInstanceId() +
                " in state " + initialState);
        return instance.copy();
    }

    /**
     * Runs one attempt of a transition. Business failures are reported in the result, never thrown.
     */
    public TransitionResult execute(TransitionRequest request) {
        Objects.requireNonNull(request, "Transition request cannot be null");
        Instant started = clock.instant();
        String name = request.getTransitionName();
        int attempt = request.getAttempt();

        WorkflowInstance instance;
        try {
            instance = store.get(request.getInstanceId());
        } catch (NotFoundException e) {
            return fail(null, name, null, e, attempt);
        }
        String workflowId = instance.getWorkflowId();
        String fromState = instance.getCurrentState();

        WorkflowDefinition definition = definitions.get(workflowId);
        if (definition == null) {
            return fail(workflowId, name, fromState, NotFoundException.definition(workflowId), attempt);
        }
        WorkflowState current = definition.getStates().get(fromState);
        List<String> available = current != null ? current.getAvailableTransitions() : List.of();
        Optional<Transition> found = available.contains(name)
                ? definition.findTransition(fromState, name)
                : Optional.empty();
        if (found.isEmpty()) {
            return fail(workflowId, name, fromState,
                    new InvalidTransitionException(instance.getInstanceId(), fromState, name, available), attempt);
        }
        Transition transition = found.get();

        Map<String, Object> evaluationContext = evaluationContext(instance, request.getData());
        if (!evaluator.satisfiesAny(transition.getConditionGroups(), evaluationContext)) {
            return fail(workflowId, name, fromState,
                    new ConditionNotMetException(instance.getInstanceId(), name), attempt);
        }

        String target = resolveTarget(transition, evaluationContext);
        WorkflowState targetState = definition.getStates().get(target);
        if (targetState == null) {
            return fail(workflowId, name, fromState, WorkflowValidationException.single(workflowId,
                    "transitions[" + name + "]", "Resolved target state does not exist: " + target), attempt);
        }

        TransitionTimeoutException timeout = checkTimeout(transition, started);
        if (timeout != null) {
            return retryOrFail(workflowId, transition, fromState, timeout, attempt);
        }

        for (String action : transition.getPreActions()) {
            try {
                actionRegistry.run(action, instance.copy());
            } catch (ActionException e) {
                return retryOrFail(workflowId, transition, fromState, e, attempt);
            } catch (RuntimeException e) {
                return fail(workflowId, name, fromState,
                        new ActionException(action, String.valueOf(e.getMessage()), false, e), attempt);
            }
        }

        timeout = checkTimeout(transition, started);
        if (timeout != null) {
            return retryOrFail(workflowId, transition, fromState, timeout, attempt);
        }

        long expectedVersion = instance.getVersion();
        Instant committedAt = clock.instant();
        instance.mergeContext(request.getData());
        instance.setCurrentState(target);
        instance.setLastTransitionAt(committedAt);
        instance.appendHistory(new HistoryEntry(
                request.getActorId(),
                request.getDescription() != null ? request.getDescription()
                        : "Transitioned from " + fromState + " to " + target + " via " + name,
                request.getData(),
                fromState,
                target,
                name,
                committedAt));
        if (targetState.isTerminal()) {
            instance.setStatus(InstanceStatus.COMPLETED);
        }
        instance.incrementVersion();

        try {
            store.save(instance, expectedVersion);
        } catch (VersionConflictException e) {
            return retryOrFail(workflowId, transition, fromState, e, attempt);
        } catch (NotFoundException e) {
            return fail(workflowId, name, fromState, e, attempt);
        }

        logger.info("Instance " + instance.getInstanceId() + " moved " + fromState + " -> " + target +
                " via " + name + " (version " + instance.getVersion() + ")");

        List<String> missing = missingDataPoints(instance);
        if (!missing.isEmpty()) {
            logger.warning("Instance " + instance.getInstanceId() + " entered state " + target +
                    " without required data: " + missing);
        }

        WorkflowInstance committed = instance.copy();
        for (String action : transition.getPostActions()) {
            try {
                actionRegistry.run(action, committed.copy());
            } catch (ActionException | RuntimeException e) {
                logger.warning("Post-action " + action + " failed after committing " + name + " on " +
                        instance.getInstanceId() + ": " + e.getMessage());
            }
        }

        publishCommitted(committed, name, fromState, target, committedAt);
        metrics.recordTransitionCommitted(workflowId, name, secondsSince(started), targetState.isTerminal());
        return TransitionResult.committed(name, fromState, target, attempt, committedAt, committed);
    }

    /**
     * Names of transitions available from the instance's current state whose triggers fire in the
     * given circumstances and whose conditions hold, lowest priority first.
     */
    public List<String> findTriggeredTransitions(String instanceId, TriggerContext context) throws TesseraException {
        WorkflowInstance instance = store.get(instanceId);
        WorkflowDefinition definition = definitions.get(instance.getWorkflowId());
        if (definition == null) {
            throw NotFoundException.definition(instance.getWorkflowId());
        }
        Map<String, Object> data = instance.getContextData();
        List<String> names = new ArrayList<>();
        for (Transition transition : definition.getTransitionsFrom(instance.getCurrentState())) {
            if (!names.contains(transition.getName())
                    && transition.isTriggered(context, data)
                    && evaluator.satisfiesAny(transition.getConditionGroups(), data)) {
                names.add(transition.getName());
            }
        }
        return names;
    }

    /**
     * Required data points of the instance's current state that are absent from its context.
     */
    public List<String> missingDataPoints(WorkflowInstance instance) {
        WorkflowDefinition definition = definitions.get(instance.getWorkflowId());
        if (definition == null) {
            return List.of();
        }
        WorkflowState state = definition.getStates().get(instance.getCurrentState());
        if (state == null) {
            return List.of();
        }
        List<String> missing = new ArrayList<>();
        for (String dataPoint : state.getRequiredDataPoints()) {
            if (evaluator.resolveField(dataPoint, instance.getContextData()) == null) {
                missing.add(dataPoint);
            }
        }
        return missing;
    }

    public Optional<WorkflowDefinition> getDefinition(String workflowId) {
        return Optional.ofNullable(definitions.get(workflowId));
    }

    public Collection<WorkflowDefinition> getDefinitions() {
        return definitions.values();
    }

    public ConditionEvaluator getEvaluator() {
        return evaluator;
    }

    private String resolveTarget(Transition transition, Map<String, Object> context) {
        for (Transition.Route route : transition.getRoutes()) {
            if (evaluator.evaluate(route.predicate().getCondition(), context)) {
                logger.fine("Routing predicate '" + route.predicate() + "' redirects " + transition.getName() +
                        " to " + route.target());
                return route.target();
            }
        }
        return transition.getTo();
    }

    private TransitionTimeoutException checkTimeout(Transition transition, Instant started) {
        Duration limit = transition.getTimeout();
        if (limit == null) {
            return null;
        }
        Duration elapsed = Duration.between(started, clock.instant());
        return elapsed.compareTo(limit) > 0
                ? new TransitionTimeoutException(transition.getName(), limit, elapsed)
                : null;
    }

    private TransitionResult retryOrFail(String workflowId, Transition transition, String fromState,
                                         TesseraException error, int attempt) {
        if (error.isRetryable() && attempt < transition.getRetryCount()) {
            Duration delay = transition.retryDelayFor(attempt);
            logger.warning("Transition " + transition.getName() + " attempt " + attempt + " failed, retry in " +
                    delay.toMillis() + "ms: " + error.getMessage());
            metrics.recordTransitionFailed(workflowId, transition.getName(), error.getClass().getSimpleName(), true);
            return TransitionResult.retry(transition.getName(), fromState, error, delay, attempt, clock.instant());
        }
        return fail(workflowId, transition.getName(), fromState, error, attempt);
    }

    private TransitionResult fail(String workflowId, String transitionName, String fromState,
                                  TesseraException error, int attempt) {
        Level level = error instanceof ConditionNotMetException ? Level.INFO : Level.WARNING;
        logger.log(level, "Transition " + transitionName + " failed: " + error.getMessage());
        metrics.recordTransitionFailed(workflowId, transitionName, error.getClass().getSimpleName(), false);
        return TransitionResult.failed(transitionName, fromState, error, attempt, clock.instant());
    }

    private Map<String, Object> evaluationContext(WorkflowInstance instance, Map<String, Object> data) {
        if (data.isEmpty()) {
            return instance.getContextData();
        }
        Map<String, Object> merged = new LinkedHashMap<>(instance.getContextData());
        merged.putAll(data);
        return merged;
    }

    private void publishCommitted(WorkflowInstance instance, String transition, String fromState, String toState,
                                  Instant timestamp) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("workflowId", instance.getWorkflowId());
        details.put("transition", transition);
        details.put("fromState", fromState);
        details.put("toState", toState);
        details.put("status", instance.getStatus().name());
        details.put("version", instance.getVersion());
        try {
            publisher.publish(RoutingEvent.success(RoutingEvent.TRANSITION_COMMITTED, instance.getInstanceId(),
                    null, details, timestamp));
        } catch (RuntimeException e) {
            logger.warning("Failed to publish committed transition for " + instance.getInstanceId() + ": " +
                    e.getMessage());
        }
    }

    private double secondsSince(Instant started) {
        return Duration.between(started, clock.instant()).toMillis() / 1000.0;
    }
}
