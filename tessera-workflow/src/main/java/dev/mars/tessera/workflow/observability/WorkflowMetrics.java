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

package dev.mars.tessera.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the transition engine.
 *
 * Provides:
 * - tessera.workflow.started (counter) - Instances started
 * - tessera.workflow.active (gauge) - Instances started and not yet in a terminal state
 * - tessera.transition.committed (counter) - Committed transitions
 * - tessera.transition.failed (counter) - Failed attempts, by failure reason
 * - tessera.transition.retried (counter) - Attempts that recommended a retry
 * - tessera.transition.duration.seconds (histogram) - Attempt duration
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = Logger.getLogger(WorkflowMetrics.class.getName());
    private static final String METER_NAME = "tessera-workflow";

    private static WorkflowMetrics instance;

    private final LongCounter workflowsStarted;
    private final LongCounter transitionsCommitted;
    private final LongCounter transitionsFailed;
    private final LongCounter transitionsRetried;
    private final DoubleHistogram transitionDuration;
    private final AtomicLong activeWorkflows = new AtomicLong(0);

    private static final AttributeKey<String> WORKFLOW_ID_KEY = AttributeKey.stringKey("workflow.id");
    private static final AttributeKey<String> TRANSITION_KEY = AttributeKey.stringKey("transition.name");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");

    public WorkflowMetrics(OpenTelemetry openTelemetry) {
        Meter meter = openTelemetry.getMeter(METER_NAME);

        workflowsStarted = meter.counterBuilder("tessera.workflow.started")
                .setDescription("Number of workflow instances started")
                .setUnit("1")
                .build();

        transitionsCommitted = meter.counterBuilder("tessera.transition.committed")
                .setDescription("Number of committed transitions")
                .setUnit("1")
                .build();

        transitionsFailed = meter.counterBuilder("tessera.transition.failed")
                .setDescription("Number of failed transition attempts")
                .setUnit("1")
                .build();

        transitionsRetried = meter.counterBuilder("tessera.transition.retried")
                .setDescription("Number of transition attempts that recommended a retry")
                .setUnit("1")
                .build();

        transitionDuration = meter.histogramBuilder("tessera.transition.duration.seconds")
                .setDescription("Transition attempt duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("tessera.workflow.active")
                .setDescription("Number of workflow instances not yet in a terminal state")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeWorkflows.get()));

        logger.fine("WorkflowMetrics initialized");
    }

    /**
     * Shared instance bound to {@link GlobalOpenTelemetry}.
     */
    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics(GlobalOpenTelemetry.get());
        }
        return instance;
    }

    /**
     * Metrics that record nothing, for when monitoring is disabled.
     */
    public static WorkflowMetrics noop() {
        return new WorkflowMetrics(OpenTelemetry.noop());
    }

    public void recordWorkflowStarted(String workflowId) {
        workflowsStarted.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId));
        activeWorkflows.incrementAndGet();
    }

    public void recordTransitionCommitted(String workflowId, String transition, double durationSeconds,
                                          boolean reachedTerminal) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(TRANSITION_KEY, transition)
                .build();
        transitionsCommitted.add(1, attrs);
        transitionDuration.record(durationSeconds, attrs);
        if (reachedTerminal) {
            activeWorkflows.decrementAndGet();
        }
    }

    public void recordTransitionFailed(String workflowId, String transition, String failureReason,
                                       boolean retryRecommended) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId != null ? workflowId : "unknown")
                .put(TRANSITION_KEY, transition)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();
        if (retryRecommended) {
            transitionsRetried.add(1, attrs);
        } else {
            transitionsFailed.add(1, attrs);
        }
    }

    public long getActiveWorkflows() {
        return activeWorkflows.get();
    }
}
