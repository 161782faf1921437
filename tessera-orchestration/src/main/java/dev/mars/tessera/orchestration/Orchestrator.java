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

import dev.mars.tessera.config.TesseraConfiguration;
import dev.mars.tessera.core.TransitionResult;
import dev.mars.tessera.core.ValidationResult;
import dev.mars.tessera.core.WorkflowInstance;
import dev.mars.tessera.core.exceptions.NotFoundException;
import dev.mars.tessera.core.exceptions.RetriesExhaustedException;
import dev.mars.tessera.core.exceptions.TesseraException;
import dev.mars.tessera.core.exceptions.WorkflowValidationException;
import dev.mars.tessera.messaging.EventPublisher;
import dev.mars.tessera.orchestration.observability.OrchestrationMetrics;
import dev.mars.tessera.storage.InMemoryWorkflowInstanceStore;
import dev.mars.tessera.storage.WorkflowInstanceStore;
import dev.mars.tessera.worker.HealthStatus;
import dev.mars.tessera.worker.Worker;
import dev.mars.tessera.worker.WorkerHealth;
import dev.mars.tessera.workflow.ActionRegistry;
import dev.mars.tessera.workflow.Transition;
import dev.mars.tessera.workflow.TransitionEngine;
import dev.mars.tessera.workflow.TransitionRequest;
import dev.mars.tessera.workflow.TransitionTrigger;
import dev.mars.tessera.workflow.TriggerContext;
import dev.mars.tessera.workflow.WorkflowDefinition;
import dev.mars.tessera.workflow.WorkflowDiagrams;
import dev.mars.tessera.workflow.observability.WorkflowMetrics;
import io.opentelemetry.api.OpenTelemetry;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point tying the transition engine, event router and pattern executor together.
 *
 * <pre>
 * try (Orchestrator orchestrator = Orchestrator.builder()
 *         .worker(WorkerRegistration.builder(nyra).capabilities("lead_qualification").build())
 *         .worker(solari)
 *         .workflow(ordersDefinition)
 *         .pattern(leadToBooking)
 *         .build()) {
 *     orchestrator.handleEvent("lead_capture", payload);
 * }
 * </pre>
 *
 * <p>Transitions run their first attempt on the caller's thread; retries recommended by the
 * engine are scheduled on a dedicated scheduler after the delay the engine computed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class Orchestrator implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(Orchestrator.class.getName());

    private final TesseraConfiguration configuration;
    private final WorkflowInstanceStore store;
    private final WorkerRegistry registry;
    private final TransitionEngine engine;
    private final EventRouter router;
    private final KeyedSerialExecutor serialExecutor;
    private final PatternExecutor patternExecutor;
    private final AssignmentResolver assignmentResolver;
    private final ScheduledExecutorService retryScheduler;
    private final ExecutorService healthExecutor;
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private Orchestrator(Builder builder, WorkflowMetrics workflowMetrics, OrchestrationMetrics orchestrationMetrics) {
        this.configuration = builder.configuration;
        this.store = builder.store;
        this.registry = builder.registry;
        this.clock = builder.clock;
        this.engine = new TransitionEngine(store, builder.workflows, builder.actionRegistry, builder.publisher,
                workflowMetrics, clock);
        this.router = new EventRouter(registry, builder.routingTable, builder.publisher, orchestrationMetrics, clock,
                configuration.getWorkerCallTimeout(), configuration.isRoutingMemoizeEnabled());
        this.serialExecutor = new KeyedSerialExecutor(configuration.getPatternThreads(),
                configuration.getPatternQueueMaxPending());
        this.patternExecutor = new PatternExecutor(router, store, serialExecutor, builder.patterns,
                orchestrationMetrics, clock);
        this.assignmentResolver = new AssignmentResolver(registry);
        this.retryScheduler = Executors.newScheduledThreadPool(configuration.getRetrySchedulerThreads(),
                daemonThreads("tessera-retry-"));
        this.healthExecutor = Executors.newCachedThreadPool(daemonThreads("tessera-health-"));
        logger.info("Orchestrator started with " + registry.size() + " workers, " + builder.workflows.size() +
                " workflows and " + builder.patterns.size() + " patterns");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Routes an event to a worker. When the payload names an {@code instanceId} whose current
     * state has a transition triggered by this event type, that transition is fired as well,
     * whether or not a worker accepts the event.
     *
     * @throws dev.mars.tessera.core.exceptions.UnroutableEventException if no worker accepts the event
     * @throws dev.mars.tessera.core.exceptions.WorkerException          if the worker and its fallbacks failed
     */
    public RoutingOutcome handleEvent(String eventType, Map<String, Object> payload) throws TesseraException {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Map<String, Object> data = payload != null ? payload : Map.of();
        Object instanceId = data.get(EventRouter.INSTANCE_ID);
        if (instanceId != null) {
            fireEventTriggers(instanceId.toString(), eventType).ifPresent(future -> future.whenComplete((result, error) -> {
                if (error != null) {
                    logger.warning("Event-triggered transition on " + instanceId + " failed: " + error.getMessage());
                } else if (!result.isSuccess()) {
                    logger.info("Event-triggered transition " + result.getTransitionName() + " on " + instanceId +
                            " did not commit: " + result.getError().getMessage());
                }
            }));
        }
        return router.route(eventType, data);
    }

    /**
     * Fires the highest-priority transition of the instance's current state triggered by the
     * event type.
     *
     * @return the transition's future, or empty when the instance is unknown, is a pattern run or
     *         has no transition triggered by the event
     */
    public Optional<CompletableFuture<TransitionResult>> fireEventTriggers(String instanceId, String eventType)
            throws TesseraException {
        Optional<WorkflowInstance> instance = store.find(instanceId);
        if (instance.isEmpty() || engine.getDefinition(instance.get().getWorkflowId()).isEmpty()) {
            return Optional.empty();
        }
        List<String> triggered = engine.findTriggeredTransitions(instanceId,
                TriggerContext.event(eventType, clock.instant()));
        if (triggered.isEmpty()) {
            return Optional.empty();
        }
        logger.info("Event " + eventType + " triggers " + triggered.get(0) + " on instance " + instanceId);
        return Optional.of(transition(TransitionRequest.builder(instanceId, triggered.get(0))
                .actorId("event:" + eventType)
                .description("Triggered by event " + eventType)
                .build()));
    }

    /**
     * Fires the highest-priority scheduled transition that is due for the instance. Daily
     * triggers that fired record today's date under their {@code last_trigger_<name>} key so they
     * fire at most once per day.
     */
    public Optional<CompletableFuture<TransitionResult>> fireScheduledTriggers(String instanceId)
            throws TesseraException {
        WorkflowInstance instance = store.get(instanceId);
        WorkflowDefinition definition = engine.getDefinition(instance.getWorkflowId())
                .orElseThrow(() -> NotFoundException.definition(instance.getWorkflowId()));
        TriggerContext context = TriggerContext.scheduled(clock.instant());
        List<String> due = engine.findTriggeredTransitions(instanceId, context);
        if (due.isEmpty()) {
            return Optional.empty();
        }
        Transition transition = definition.findTransition(instance.getCurrentState(), due.get(0)).orElseThrow();
        Map<String, Object> data = new LinkedHashMap<>();
        for (TransitionTrigger trigger : transition.getTriggers()) {
            if (trigger.isDaily() && trigger.isTriggered(context, instance.getContextData())) {
                data.put(trigger.lastTriggerKey(), LocalDate.ofInstant(context.getNow(), context.getZone()).toString());
            }
        }
        return Optional.of(transition(TransitionRequest.builder(instanceId, transition.getName())
                .actorId("scheduler")
                .description("Scheduled trigger")
                .data(data)
                .build()));
    }

    public WorkflowInstance startWorkflow(String workflowId, Map<String, Object> initialContext, String actorId)
            throws TesseraException {
        return engine.start(workflowId, initialContext, actorId);
    }

    /**
     * Executes a transition, scheduling the retries the engine recommends.
     *
     * @return a future completed with the committed result, or with the failed result when the
     *         first attempt failed without recommending a retry. When a retried transition still
     *         fails, the future completes exceptionally with a {@link RetriesExhaustedException}
     *         carrying every attempt.
     */
    public CompletableFuture<TransitionResult> transition(TransitionRequest request) {
        Objects.requireNonNull(request, "Transition request cannot be null");
        CompletableFuture<TransitionResult> future = new CompletableFuture<>();
        attempt(request, new ArrayList<>(), future);
        return future;
    }

    public CompletableFuture<TransitionResult> transition(String instanceId, String transitionName, String actorId,
                                                          Map<String, Object> data) {
        return transition(TransitionRequest.builder(instanceId, transitionName).actorId(actorId).data(data).build());
    }

    private void attempt(TransitionRequest request, List<TransitionResult> attempts,
                         CompletableFuture<TransitionResult> future) {
        TransitionResult result;
        try {
            result = engine.execute(request);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Transition " + request.getTransitionName() + " on " +
                    request.getInstanceId() + " failed unexpectedly: " + e.getMessage());
            future.completeExceptionally(e);
            return;
        }
        attempts.add(result);

        if (result.isSuccess()) {
            future.complete(result);
        } else if (result.isRetryRecommended()) {
            Duration delay = result.getRetryAfter();
            try {
                retryScheduler.schedule(() -> attempt(request.nextAttempt(), attempts, future),
                        delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                logger.warning("Could not schedule retry of " + request.getTransitionName() + ": " + e.getMessage());
                future.completeExceptionally(new RetriesExhaustedException(request.getTransitionName(), attempts));
            }
        } else if (attempts.size() > 1) {
            future.completeExceptionally(new RetriesExhaustedException(request.getTransitionName(), attempts));
        } else {
            future.complete(result);
        }
    }

    public PatternStartResult startPattern(String patternName, Map<String, Object> payload) throws TesseraException {
        return patternExecutor.start(patternName, payload);
    }

    /**
     * Resumes a pattern run from its first step without a success record.
     */
    public CompletableFuture<PatternStatus> continueWorkflow(String instanceId) throws TesseraException {
        return patternExecutor.resume(instanceId);
    }

    public CompletableFuture<PatternStatus> awaitPattern(String instanceId) throws NotFoundException {
        return patternExecutor.completion(instanceId);
    }

    public List<StepFailure> getFailedSteps() {
        return patternExecutor.getFailedSteps();
    }

    /**
     * Probes every registered worker concurrently, each bounded by the health probe timeout.
     */
    public OrchestratorHealth checkHealth() {
        Duration timeout = configuration.getHealthProbeTimeout();
        List<WorkerRegistration> registrations = registry.getRegistrations();
        List<CompletableFuture<WorkerHealth>> probes = new ArrayList<>();
        for (WorkerRegistration registration : registrations) {
            probes.add(probe(registration, timeout));
        }

        OrchestratorHealth.Builder health = OrchestratorHealth.builder().timestamp(clock.instant());
        HealthStatus overall = HealthStatus.HEALTHY;
        int healthy = 0;
        for (int i = 0; i < registrations.size(); i++) {
            WorkerRegistration registration = registrations.get(i);
            WorkerHealth workerHealth = probes.get(i).join();
            health.worker(workerHealth);
            switch (workerHealth.getStatus()) {
                case HEALTHY:
                    healthy++;
                    break;
                case DEGRADED:
                    overall = overall.worst(HealthStatus.DEGRADED);
                    break;
                default:
                    overall = overall.worst(registration.isRequired() ? HealthStatus.UNHEALTHY : HealthStatus.DEGRADED);
                    logger.warning("Worker " + registration.getName() + " is unhealthy: " + workerHealth.getMessage());
                    break;
            }
        }
        return health.status(overall)
                .message(healthy + " of " + registrations.size() + " workers healthy")
                .build();
    }

    private CompletableFuture<WorkerHealth> probe(WorkerRegistration registration, Duration timeout) {
        String name = registration.getName();
        return CompletableFuture.supplyAsync(() -> {
            long started = System.nanoTime();
            try {
                WorkerHealth reported = registration.getWorker().checkHealth();
                Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
                if (reported == null) {
                    return WorkerHealth.unhealthy("Health probe returned no status").forWorker(name, elapsed);
                }
                return reported.forWorker(name, elapsed);
            } catch (Exception e) {
                return WorkerHealth.unhealthy("Health probe failed: " + e.getMessage())
                        .forWorker(name, Duration.ofNanos(System.nanoTime() - started));
            }
        }, healthExecutor).completeOnTimeout(
                WorkerHealth.unhealthy("Health probe timed out after " + timeout.toMillis() + "ms")
                        .forWorker(name, timeout),
                timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * The worker responsible for the instance in its current state.
     */
    public Optional<String> assignWorker(String instanceId) throws TesseraException {
        WorkflowInstance instance = store.get(instanceId);
        WorkflowDefinition definition = engine.getDefinition(instance.getWorkflowId())
                .orElseThrow(() -> NotFoundException.definition(instance.getWorkflowId()));
        return assignmentResolver.assign(instance, definition);
    }

    public WorkflowInstance getInstance(String instanceId) throws NotFoundException {
        return store.get(instanceId);
    }

    /**
     * Mermaid state diagram of the instance's workflow with its current state highlighted.
     */
    public String stateDiagram(String instanceId) throws NotFoundException {
        WorkflowInstance instance = store.get(instanceId);
        WorkflowDefinition definition = engine.getDefinition(instance.getWorkflowId())
                .orElseThrow(() -> NotFoundException.definition(instance.getWorkflowId()));
        return WorkflowDiagrams.stateDiagram(definition, instance.getCurrentState());
    }

    public String historyTimeline(String instanceId) throws NotFoundException {
        return WorkflowDiagrams.historyTimeline(store.get(instanceId), clock.instant(), clock.getZone());
    }

    public TransitionEngine getEngine() {
        return engine;
    }

    public EventRouter getRouter() {
        return router;
    }

    public WorkerRegistry getRegistry() {
        return registry;
    }

    public TesseraConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        int abandoned = retryScheduler.shutdownNow().size();
        if (abandoned > 0) {
            logger.warning("Dropped " + abandoned + " scheduled transition retries on shutdown");
        }
        serialExecutor.close();
        router.close();
        healthExecutor.shutdownNow();
        logger.info("Orchestrator stopped");
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger count = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public static class Builder {
        private TesseraConfiguration configuration;
        private WorkflowInstanceStore store;
        private WorkerRegistry registry = new WorkerRegistry();
        private RoutingTable routingTable;
        private EventPublisher publisher = EventPublisher.noop();
        private ActionRegistry actionRegistry = ActionRegistry.empty();
        private Clock clock = Clock.systemUTC();
        private OpenTelemetry openTelemetry;
        private final List<WorkflowDefinition> workflows = new ArrayList<>();
        private final List<CoordinationPattern> patterns = new ArrayList<>();

        private Builder() {
        }

        public Builder configuration(TesseraConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder store(WorkflowInstanceStore store) {
            this.store = store;
            return this;
        }

        public Builder registry(WorkerRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
            return this;
        }

        public Builder worker(WorkerRegistration registration) {
            registry.register(registration);
            return this;
        }

        public Builder worker(Worker worker) {
            registry.register(worker);
            return this;
        }

        public Builder routingTable(RoutingTable routingTable) {
            this.routingTable = routingTable;
            return this;
        }

        public Builder publisher(EventPublisher publisher) {
            this.publisher = Objects.requireNonNull(publisher, "Publisher cannot be null");
            return this;
        }

        public Builder actionRegistry(ActionRegistry actionRegistry) {
            this.actionRegistry = Objects.requireNonNull(actionRegistry, "Action registry cannot be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
            return this;
        }

        public Builder openTelemetry(OpenTelemetry openTelemetry) {
            this.openTelemetry = openTelemetry;
            return this;
        }

        public Builder workflow(WorkflowDefinition definition) {
            workflows.add(Objects.requireNonNull(definition, "Workflow definition cannot be null"));
            return this;
        }

        public Builder workflows(List<WorkflowDefinition> definitions) {
            definitions.forEach(this::workflow);
            return this;
        }

        public Builder pattern(CoordinationPattern pattern) {
            patterns.add(Objects.requireNonNull(pattern, "Pattern cannot be null"));
            return this;
        }

        public Builder patterns(List<CoordinationPattern> patterns) {
            patterns.forEach(this::pattern);
            return this;
        }

        /**
         * @throws WorkflowValidationException if a pattern step names a worker that is not registered
         */
        public Orchestrator build() throws WorkflowValidationException {
            if (configuration == null) {
                configuration = new TesseraConfiguration();
            }
            if (store == null) {
                store = new InMemoryWorkflowInstanceStore();
            }
            if (routingTable == null) {
                routingTable = RoutingTable.withDefaultPrefixes();
            }
            for (CoordinationPattern pattern : patterns) {
                ValidationResult result = new ValidationResult();
                for (PatternStep step : pattern.getSteps()) {
                    if (!registry.contains(step.getWorker())) {
                        result.addError("steps[" + step.getName() + "].worker", "Unregistered worker: " + step.getWorker());
                    }
                }
                if (!result.isValid()) {
                    throw new WorkflowValidationException(pattern.getName(), result);
                }
            }
            registry.freeze();

            WorkflowMetrics workflowMetrics;
            OrchestrationMetrics orchestrationMetrics;
            if (!configuration.isMetricsEnabled()) {
                workflowMetrics = WorkflowMetrics.noop();
                orchestrationMetrics = OrchestrationMetrics.noop();
            } else if (openTelemetry != null) {
                workflowMetrics = new WorkflowMetrics(openTelemetry);
                orchestrationMetrics = new OrchestrationMetrics(openTelemetry);
            } else {
                workflowMetrics = WorkflowMetrics.getInstance();
                orchestrationMetrics = OrchestrationMetrics.getInstance();
            }
            return new Orchestrator(this, workflowMetrics, orchestrationMetrics);
        }
    }
}
