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

import dev.mars.tessera.core.exceptions.UnroutableEventException;
import dev.mars.tessera.core.exceptions.WorkerException;
import dev.mars.tessera.messaging.EventPublisher;
import dev.mars.tessera.messaging.RoutingEvent;
import dev.mars.tessera.orchestration.observability.OrchestrationMetrics;
import dev.mars.tessera.worker.Worker;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves an event type to a worker and invokes it.
 *
 * <p>Resolution tries, in order: the explicit route table, a worker associated with the payload's
 * {@code businessEntityId} that accepts the event, the first worker advertising the payload's
 * {@code requiredCapability}, the event-type prefix table, and finally a probe of every
 * registered worker's {@link Worker#canHandle(String)} in registration order. Prefix and probe
 * matches are memoized into the explicit table when memoization is enabled.</p>
 *
 * <p>Every call is bounded by the worker call timeout. A failed call walks the worker's fallback
 * chain; each attempt, successful or not, is published as a {@link RoutingEvent}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class EventRouter implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(EventRouter.class.getName());

    public static final String BUSINESS_ENTITY_ID = "businessEntityId";
    public static final String REQUIRED_CAPABILITY = "requiredCapability";
    public static final String INSTANCE_ID = "instanceId";

    private final WorkerRegistry registry;
    private final RoutingTable routingTable;
    private final EventPublisher publisher;
    private final OrchestrationMetrics metrics;
    private final Clock clock;
    private final Duration callTimeout;
    private final boolean memoize;
    private final ExecutorService callExecutor;

    public EventRouter(WorkerRegistry registry, RoutingTable routingTable, EventPublisher publisher,
                       OrchestrationMetrics metrics, Clock clock, Duration callTimeout, boolean memoize) {
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        this.routingTable = Objects.requireNonNull(routingTable, "Routing table cannot be null");
        this.publisher = Objects.requireNonNull(publisher, "Publisher cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.callTimeout = Objects.requireNonNull(callTimeout, "Call timeout cannot be null");
        this.memoize = memoize;
        AtomicInteger threadCount = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tessera-worker-call-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Selects a worker without invoking it.
     *
     * @throws UnroutableEventException if no stage yields a registered worker
     */
    public RoutingDecision resolve(String eventType, Map<String, Object> payload) throws UnroutableEventException {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Map<String, Object> data = payload != null ? payload : Map.of();

        Optional<String> explicit = routingTable.explicitWorker(eventType);
        if (explicit.isPresent()) {
            if (registry.contains(explicit.get())) {
                return decided(eventType, explicit.get(), RoutingStrategy.EXPLICIT);
            }
            logger.warning("Explicit route for " + eventType + " names unregistered worker " + explicit.get());
        }

        Object entityId = data.get(BUSINESS_ENTITY_ID);
        if (entityId != null) {
            for (WorkerRegistration registration : registry.findByBusinessEntity(entityId.toString())) {
                if (accepts(registration.getWorker(), eventType)) {
                    return decided(eventType, registration.getName(), RoutingStrategy.ENTITY);
                }
            }
        }

        Object capability = data.get(REQUIRED_CAPABILITY);
        if (capability != null) {
            List<String> capable = registry.findByCapability(capability.toString());
            if (!capable.isEmpty()) {
                return decided(eventType, capable.get(0), RoutingStrategy.CAPABILITY);
            }
        }

        Optional<String> byPrefix = routingTable.prefixWorker(eventType);
        if (byPrefix.isPresent() && registry.contains(byPrefix.get())) {
            remember(eventType, byPrefix.get());
            return decided(eventType, byPrefix.get(), RoutingStrategy.PREFIX);
        }

        for (WorkerRegistration registration : registry.getRegistrations()) {
            if (accepts(registration.getWorker(), eventType)) {
                remember(eventType, registration.getName());
                return decided(eventType, registration.getName(), RoutingStrategy.PROBE);
            }
        }

        metrics.recordUnroutable();
        throw new UnroutableEventException(eventType);
    }

    /**
     * Resolves a worker for the event and invokes it, walking its fallback chain on failure.
     *
     * @throws UnroutableEventException if no worker can be selected
     * @throws WorkerException          if the worker and every fallback failed; annotated with
     *                                  the fallbacks attempted
     */
    public RoutingOutcome route(String eventType, Map<String, Object> payload)
            throws UnroutableEventException, WorkerException {
        RoutingDecision decision = resolve(eventType, payload);
        return invoke(decision, decision.workerName(), eventType, payload);
    }

    /**
     * Invokes a named worker through the same timeout and fallback path as {@link #route}.
     */
    public RoutingOutcome dispatch(String workerName, String eventType, Map<String, Object> payload)
            throws WorkerException {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        if (!registry.contains(workerName)) {
            throw new WorkerException(workerName, "Worker is not registered");
        }
        return invoke(null, workerName, eventType, payload);
    }

    private RoutingOutcome invoke(RoutingDecision decision, String workerName, String eventType,
                                  Map<String, Object> payload) throws WorkerException {
        Map<String, Object> data = payload != null ? payload : Map.of();
        try {
            Map<String, Object> result = call(workerName, eventType, data);
            return new RoutingOutcome(decision, workerName, result, List.of());
        } catch (WorkerException primaryFailure) {
            List<String> attempted = new ArrayList<>();
            for (String fallback : routingTable.getFallbackChain(workerName)) {
                if (!registry.contains(fallback)) {
                    logger.warning("Skipping unregistered fallback " + fallback + " for " + workerName);
                    continue;
                }
                attempted.add(fallback);
                metrics.recordFallbackUsed(fallback);
                logger.warning("Worker " + workerName + " failed on " + eventType + ", trying fallback " +
                        fallback + ": " + primaryFailure.getMessage());
                try {
                    Map<String, Object> result = call(fallback, eventType, data);
                    return new RoutingOutcome(decision, fallback, result, attempted);
                } catch (WorkerException fallbackFailure) {
                    logger.fine("Fallback " + fallback + " failed: " + fallbackFailure.getMessage());
                }
            }
            throw attempted.isEmpty() ? primaryFailure : primaryFailure.withAttemptedFallbacks(attempted);
        }
    }

    private Map<String, Object> call(String workerName, String eventType, Map<String, Object> payload)
            throws WorkerException {
        Worker worker = registry.getWorker(workerName)
                .orElseThrow(() -> new WorkerException(workerName, "Worker is not registered"));
        Object instanceId = payload.get(INSTANCE_ID);
        String instance = instanceId != null ? instanceId.toString() : null;
        Map<String, Object> view = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        try {
            Map<String, Object> result = invokeWithTimeout(worker, eventType, view);
            publish(RoutingEvent.success(eventType, instance, workerName, result, clock.instant()));
            return result;
        } catch (WorkerException e) {
            metrics.recordWorkerFailure(workerName);
            publish(RoutingEvent.failure(eventType, instance, workerName, e.getMessage(), clock.instant()));
            throw e;
        }
    }

    private Map<String, Object> invokeWithTimeout(Worker worker, String eventType, Map<String, Object> payload)
            throws WorkerException {
        Future<Map<String, Object>> future = callExecutor.submit(() -> worker.processEvent(eventType, payload));
        try {
            Map<String, Object> result = future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : Map.of();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new WorkerException(worker.getName(), "Timed out after " + callTimeout.toMillis() +
                    "ms processing " + eventType, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof WorkerException) {
                throw (WorkerException) cause;
            }
            throw new WorkerException(worker.getName(), "Failed processing " + eventType + ": " +
                    cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new WorkerException(worker.getName(), "Interrupted while processing " + eventType, e);
        }
    }

    private boolean accepts(Worker worker, String eventType) {
        try {
            return worker.canHandle(eventType);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "canHandle failed for worker " + worker.getName() + ": " + e.getMessage());
            return false;
        }
    }

    private void remember(String eventType, String workerName) {
        if (memoize) {
            routingTable.memoize(eventType, workerName);
        }
    }

    private RoutingDecision decided(String eventType, String workerName, RoutingStrategy strategy) {
        metrics.recordRouted(strategy);
        logger.fine("Routed " + eventType + " to " + workerName + " via " + strategy);
        return new RoutingDecision(eventType, workerName, strategy);
    }

    private void publish(RoutingEvent event) {
        try {
            publisher.publish(event);
        } catch (RuntimeException e) {
            logger.warning("Failed to publish routing event " + event.eventType() + ": " + e.getMessage());
        }
    }

    public RoutingTable getRoutingTable() {
        return routingTable;
    }

    @Override
    public void close() {
        callExecutor.shutdownNow();
    }
}
