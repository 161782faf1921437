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

package dev.mars.tessera.orchestration.observability;

import dev.mars.tessera.orchestration.RoutingStrategy;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for routing and coordination patterns.
 *
 * Provides:
 * - tessera.events.routed (counter) - Routing decisions, by strategy
 * - tessera.events.unroutable (counter) - Events no worker accepted
 * - tessera.worker.failures (counter) - Failed worker calls, by worker
 * - tessera.routing.fallbacks (counter) - Fallback worker invocations
 * - tessera.pattern.steps.executed (counter) - Pattern steps that succeeded
 * - tessera.pattern.steps.failed (counter) - Pattern steps that failed
 * - tessera.pattern.active (gauge) - Pattern runs started and not yet finished
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class OrchestrationMetrics {

    private static final Logger logger = Logger.getLogger(OrchestrationMetrics.class.getName());
    private static final String METER_NAME = "tessera-orchestration";

    private static OrchestrationMetrics instance;

    private final LongCounter eventsRouted;
    private final LongCounter eventsUnroutable;
    private final LongCounter workerFailures;
    private final LongCounter fallbacksUsed;
    private final LongCounter stepsExecuted;
    private final LongCounter stepsFailed;
    private final AtomicLong activePatterns = new AtomicLong(0);

    private static final AttributeKey<String> STRATEGY_KEY = AttributeKey.stringKey("routing.strategy");
    private static final AttributeKey<String> WORKER_KEY = AttributeKey.stringKey("worker.name");
    private static final AttributeKey<String> PATTERN_KEY = AttributeKey.stringKey("pattern.name");

    public OrchestrationMetrics(OpenTelemetry openTelemetry) {
        Meter meter = openTelemetry.getMeter(METER_NAME);

        eventsRouted = meter.counterBuilder("tessera.events.routed")
                .setDescription("Number of routing decisions made")
                .setUnit("1")
                .build();

        eventsUnroutable = meter.counterBuilder("tessera.events.unroutable")
                .setDescription("Number of events no worker accepted")
                .setUnit("1")
                .build();

        workerFailures = meter.counterBuilder("tessera.worker.failures")
                .setDescription("Number of failed worker calls")
                .setUnit("1")
                .build();

        fallbacksUsed = meter.counterBuilder("tessera.routing.fallbacks")
                .setDescription("Number of fallback worker invocations")
                .setUnit("1")
                .build();

        stepsExecuted = meter.counterBuilder("tessera.pattern.steps.executed")
                .setDescription("Number of coordination pattern steps that succeeded")
                .setUnit("1")
                .build();

        stepsFailed = meter.counterBuilder("tessera.pattern.steps.failed")
                .setDescription("Number of coordination pattern steps that failed")
                .setUnit("1")
                .build();

        meter.gaugeBuilder("tessera.pattern.active")
                .setDescription("Number of coordination pattern runs in progress")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activePatterns.get()));

        logger.fine("OrchestrationMetrics initialized");
    }

    public static synchronized OrchestrationMetrics getInstance() {
        if (instance == null) {
            instance = new OrchestrationMetrics(GlobalOpenTelemetry.get());
        }
        return instance;
    }

    public static OrchestrationMetrics noop() {
        return new OrchestrationMetrics(OpenTelemetry.noop());
    }

    public void recordRouted(RoutingStrategy strategy) {
        eventsRouted.add(1, Attributes.of(STRATEGY_KEY, strategy.name()));
    }

    public void recordUnroutable() {
        eventsUnroutable.add(1);
    }

    public void recordWorkerFailure(String workerName) {
        workerFailures.add(1, Attributes.of(WORKER_KEY, workerName));
    }

    public void recordFallbackUsed(String fallbackWorker) {
        fallbacksUsed.add(1, Attributes.of(WORKER_KEY, fallbackWorker));
    }

    public void recordPatternStarted() {
        activePatterns.incrementAndGet();
    }

    public void recordPatternFinished() {
        activePatterns.decrementAndGet();
    }

    public void recordStep(String patternName, String workerName, boolean success) {
        Attributes attrs = Attributes.builder()
                .put(PATTERN_KEY, patternName)
                .put(WORKER_KEY, workerName)
                .build();
        if (success) {
            stepsExecuted.add(1, attrs);
        } else {
            stepsFailed.add(1, attrs);
        }
    }

    public long getActivePatterns() {
        return activePatterns.get();
    }
}
