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
import dev.mars.tessera.core.HistoryEntry;
import dev.mars.tessera.core.TransitionResult;
import dev.mars.tessera.core.WorkflowInstance;
import dev.mars.tessera.core.exceptions.ConditionNotMetException;
import dev.mars.tessera.core.exceptions.NotFoundException;
import dev.mars.tessera.core.exceptions.RetriesExhaustedException;
import dev.mars.tessera.core.exceptions.UnroutableEventException;
import dev.mars.tessera.core.exceptions.VersionConflictException;
import dev.mars.tessera.core.exceptions.WorkerException;
import dev.mars.tessera.core.exceptions.WorkflowValidationException;
import dev.mars.tessera.storage.WorkflowInstanceStore;
import dev.mars.tessera.worker.HealthStatus;
import dev.mars.tessera.worker.WorkerHealth;
import dev.mars.tessera.workflow.AssignmentRule;
import dev.mars.tessera.workflow.Condition;
import dev.mars.tessera.workflow.ConditionOperator;
import dev.mars.tessera.workflow.Transition;
import dev.mars.tessera.workflow.TransitionTrigger;
import dev.mars.tessera.workflow.WorkflowDefinition;
import dev.mars.tessera.workflow.WorkflowState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class OrchestratorTest {

    private static final Instant MORNING = Instant.parse("2025-06-02T10:00:00Z");

    private final CountDownLatch release = new CountDownLatch(1);
    private Properties properties;
    private ScriptedWorker nyra;
    private ScriptedWorker solari;
    private Orchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new Properties();
        properties.setProperty(TesseraConfiguration.METRICS_ENABLED, "false");
        properties.setProperty(TesseraConfiguration.HEALTH_PROBE_TIMEOUT_MS, "200");
        nyra = new ScriptedWorker("Nyra")
                .handles("lead_capture", payload -> Map.of("leadScore", 80));
        solari = new ScriptedWorker("Solari")
                .failing("book_appointment", "calendar unavailable")
                .handles("payment_received", payload -> Map.of("receipt", "r-" + payload.get("amount")));
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        if (orchestrator != null) {
            orchestrator.close();
        }
    }

    private Orchestrator.Builder builder(Clock clock) {
        return Orchestrator.builder()
                .configuration(new TesseraConfiguration(properties))
                .clock(clock)
                .worker(nyra)
                .worker(WorkerRegistration.builder(solari).capabilities("booking").build());
    }

    private Orchestrator.Builder builder() {
        return builder(Clock.fixed(MORNING, ZoneOffset.UTC));
    }

    private static WorkflowDefinition orders() throws WorkflowValidationException {
        return WorkflowDefinition.builder("orders")
                .initialState("start")
                .state(WorkflowState.builder("start").transitions("to_processing").build())
                .state(WorkflowState.builder("processing").transitions("approve").build())
                .state(WorkflowState.terminal("approved"))
                .transition(Transition.builder("to_processing").from("start").to("processing").build())
                .transition(Transition.builder("approve").from("processing").to("approved")
                        .when(Condition.of("orderValue", ConditionOperator.GREATER_THAN, 1000))
                        .build())
                .build();
    }

    private static WorkflowDefinition invoices() throws WorkflowValidationException {
        return WorkflowDefinition.builder("invoice")
                .initialState("sent")
                .state(WorkflowState.builder("sent").transitions("mark_paid", "settle").build())
                .state(WorkflowState.terminal("paid"))
                .state(WorkflowState.terminal("settled"))
                .transition(Transition.builder("mark_paid").from("sent").to("paid")
                        .trigger(TransitionTrigger.onEvent("payment", "payment_received")).build())
                .transition(Transition.builder("settle").from("sent").to("settled")
                        .trigger(TransitionTrigger.onEvent("ledger", "ledger_settled")).build())
                .build();
    }

    private static WorkflowDefinition reminders() throws WorkflowValidationException {
        return WorkflowDefinition.builder("reminders")
                .initialState("waiting")
                .state(WorkflowState.builder("waiting").transitions("remind", "close")
                        .assignment(AssignmentRule.worker("Ghost").build())
                        .assignment(AssignmentRule.capability("booking").priority(2).build())
                        .build())
                .state(WorkflowState.terminal("closed"))
                .transition(Transition.builder("remind").from("waiting").to("waiting")
                        .trigger(TransitionTrigger.daily("morning", LocalTime.of(9, 0))).build())
                .transition(Transition.builder("close").from("waiting").to("closed").build())
                .build();
    }

    private static CoordinationPattern leadToBooking() throws WorkflowValidationException {
        return CoordinationPattern.builder("lead_to_booking")
                .step("Nyra", "lead_capture")
                .step("Solari", "book_appointment")
                .build();
    }

    @Test
    @DisplayName("approve commits once the order value condition holds")
    void testApproveScenario() throws Exception {
        orchestrator = builder().workflow(orders()).build();
        String id = orchestrator.startWorkflow("orders", Map.of("orderValue", 500), "alice").getInstanceId();
        assertTrue(orchestrator.transition(id, "to_processing", "alice", Map.of()).get(1, TimeUnit.SECONDS).isSuccess());

        TransitionResult blocked = orchestrator.transition(id, "approve", "bob", Map.of()).get(1, TimeUnit.SECONDS);
        assertFalse(blocked.isSuccess());
        assertInstanceOf(ConditionNotMetException.class, blocked.getError());

        TransitionResult approved = orchestrator.transition(id, "approve", "bob", Map.of("orderValue", 1500))
                .get(1, TimeUnit.SECONDS);
        assertTrue(approved.isSuccess());
        assertEquals("approved", orchestrator.getInstance(id).getCurrentState());
    }

    @Test
    @DisplayName("a transition that keeps conflicting is retried and then reported as exhausted")
    void testRetriesExhausted() throws Exception {
        WorkflowInstanceStore conflicting = mock(WorkflowInstanceStore.class);
        when(conflicting.get("i-1")).thenAnswer(inv ->
                new WorkflowInstance("i-1", "contended", "a", Map.of(), MORNING));
        doThrow(new VersionConflictException("i-1", 0, 1))
                .when(conflicting).save(any(WorkflowInstance.class), anyLong());
        WorkflowDefinition contended = WorkflowDefinition.builder("contended")
                .initialState("a")
                .state(WorkflowState.builder("a").transitions("go").build())
                .state(WorkflowState.terminal("b"))
                .transition(Transition.builder("go").from("a").to("b")
                        .retryCount(2).retryDelay(Duration.ofMillis(10)).build())
                .build();
        orchestrator = builder().store(conflicting).workflow(contended).build();

        CompletableFuture<TransitionResult> future = orchestrator.transition("i-1", "go", "ops", Map.of());

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        RetriesExhaustedException exhausted = assertInstanceOf(RetriesExhaustedException.class, e.getCause());
        assertEquals(3, exhausted.getAttemptCount());
        assertEquals("go", exhausted.getTransitionName());
        verify(conflicting, times(3)).save(any(WorkflowInstance.class), eq(0L));
    }

    @Nested
    @DisplayName("triggers")
    class Triggers {

        @Test
        void testEventFiresMatchingTransitionAndIsRouted() throws Exception {
            orchestrator = builder().workflow(invoices()).build();
            String id = orchestrator.startWorkflow("invoice", Map.of(), "billing").getInstanceId();

            RoutingOutcome outcome = orchestrator.handleEvent("payment_received",
                    Map.of(EventRouter.INSTANCE_ID, id, "amount", 120));

            assertEquals("Solari", outcome.handledBy());
            assertEquals("r-120", outcome.result().get("receipt"));
            WorkflowInstance instance = orchestrator.getInstance(id);
            assertEquals("paid", instance.getCurrentState());
            List<HistoryEntry> history = instance.getHistoryLog();
            assertEquals("event:payment_received", history.get(history.size() - 1).actor());
            assertNull(instance.getContextValue("amount"));
        }

        @Test
        void testTriggerFiresEvenWhenNoWorkerAcceptsTheEvent() throws Exception {
            orchestrator = builder().workflow(invoices()).build();
            String id = orchestrator.startWorkflow("invoice", Map.of(), "billing").getInstanceId();

            assertThrows(UnroutableEventException.class,
                    () -> orchestrator.handleEvent("ledger_settled", Map.of(EventRouter.INSTANCE_ID, id)));

            assertEquals("settled", orchestrator.getInstance(id).getCurrentState());
        }

        @Test
        void testEventsForUnknownInstancesOnlyRoute() throws Exception {
            orchestrator = builder().workflow(invoices()).build();

            assertTrue(orchestrator.fireEventTriggers("missing", "payment_received").isEmpty());
            RoutingOutcome outcome = orchestrator.handleEvent("lead_capture",
                    Map.of(EventRouter.INSTANCE_ID, "missing"));
            assertEquals("Nyra", outcome.handledBy());
        }

        @Test
        void testDailyTriggerFiresOncePerDay() throws Exception {
            orchestrator = builder().workflow(reminders()).build();
            String id = orchestrator.startWorkflow("reminders", Map.of(), "ops").getInstanceId();

            Optional<CompletableFuture<TransitionResult>> fired = orchestrator.fireScheduledTriggers(id);

            assertTrue(fired.isPresent());
            TransitionResult result = fired.get().get(1, TimeUnit.SECONDS);
            assertTrue(result.isSuccess());
            WorkflowInstance instance = orchestrator.getInstance(id);
            assertEquals("2025-06-02", instance.getContextValue("last_trigger_morning"));
            assertEquals("scheduler", instance.getHistoryLog().get(1).actor());
            assertTrue(orchestrator.fireScheduledTriggers(id).isEmpty());
        }

        @Test
        void testDailyTriggerWaitsForItsTime() throws Exception {
            orchestrator = builder(Clock.fixed(Instant.parse("2025-06-02T08:30:00Z"), ZoneOffset.UTC))
                    .workflow(reminders())
                    .build();
            String id = orchestrator.startWorkflow("reminders", Map.of(), "ops").getInstanceId();

            assertTrue(orchestrator.fireScheduledTriggers(id).isEmpty());
        }
    }

    @Nested
    @DisplayName("health")
    class Health {

        private WorkerHealth hang() throws InterruptedException {
            release.await(5, TimeUnit.SECONDS);
            return WorkerHealth.healthy();
        }

        @Test
        void testAllHealthy() throws Exception {
            orchestrator = builder().build();

            OrchestratorHealth health = orchestrator.checkHealth();

            assertTrue(health.isHealthy());
            assertEquals("2 of 2 workers healthy", health.getMessage());
            assertEquals("Nyra", health.getWorkers().get(0).getWorkerName());
        }

        @Test
        void testHangingOptionalWorkerDegradesWithinTimeout() throws Exception {
            ScriptedWorker sleepy = new ScriptedWorker("Sleepy").health(this::hang);
            orchestrator = builder()
                    .worker(WorkerRegistration.builder(sleepy).required(false).build())
                    .build();

            long started = System.nanoTime();
            OrchestratorHealth health = orchestrator.checkHealth();
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            assertEquals(HealthStatus.DEGRADED, health.getStatus());
            assertTrue(elapsedMs < 2000, "health check took " + elapsedMs + "ms");
            WorkerHealth sleepyHealth = health.getWorkers().get(2);
            assertEquals(HealthStatus.UNHEALTHY, sleepyHealth.getStatus());
            assertTrue(sleepyHealth.getMessage().contains("timed out after 200ms"));

            @SuppressWarnings("unchecked")
            Map<String, Object> summary = (Map<String, Object>) health.toMap().get("summary");
            assertEquals(3, summary.get("totalWorkers"));
            assertEquals(2L, summary.get("healthyWorkers"));
            assertEquals(1L, summary.get("unhealthyWorkers"));
        }

        @Test
        void testHangingRequiredWorkerMakesOrchestratorUnhealthy() throws Exception {
            orchestrator = builder()
                    .worker(new ScriptedWorker("Sleepy").health(this::hang))
                    .build();

            assertEquals(HealthStatus.UNHEALTHY, orchestrator.checkHealth().getStatus());
        }

        @Test
        void testThrowingAndDegradedProbes() throws Exception {
            orchestrator = builder()
                    .worker(WorkerRegistration.builder(new ScriptedWorker("Broken").health(() -> {
                        throw new IllegalStateException("disk full");
                    })).required(false).build())
                    .worker(new ScriptedWorker("Slow").health(() -> WorkerHealth.degraded("queue backlog")))
                    .build();

            OrchestratorHealth health = orchestrator.checkHealth();

            assertEquals(HealthStatus.DEGRADED, health.getStatus());
            assertEquals("2 of 4 workers healthy", health.getMessage());
            assertEquals("Health probe failed: disk full", health.getWorkers().get(2).getMessage());
            assertEquals("queue backlog", health.getWorkers().get(3).getMessage());
        }
    }

    @Nested
    @DisplayName("coordination patterns")
    class Patterns {

        @Test
        void testFailingStepIsReportedThroughTheOrchestrator() throws Exception {
            orchestrator = builder().pattern(leadToBooking()).build();

            PatternStartResult started = orchestrator.startPattern("lead_to_booking", Map.of());

            assertEquals(PatternStatus.FAILED, orchestrator.awaitPattern(started.instanceId()).get(5, TimeUnit.SECONDS));
            assertEquals(1, orchestrator.getFailedSteps().size());
            assertEquals("Solari", orchestrator.getFailedSteps().get(0).workerName());
        }

        @Test
        void testContinueWorkflowRetriesTheFailedStep() throws Exception {
            orchestrator = builder().pattern(leadToBooking()).build();
            PatternStartResult started = orchestrator.startPattern("lead_to_booking", Map.of());
            orchestrator.awaitPattern(started.instanceId()).get(5, TimeUnit.SECONDS);

            CompletableFuture<PatternStatus> resumed = orchestrator.continueWorkflow(started.instanceId());

            assertEquals(PatternStatus.FAILED, resumed.get(5, TimeUnit.SECONDS));
            assertEquals(List.of("lead_capture"), nyra.receivedTypes());
            assertEquals(List.of("book_appointment", "book_appointment"), solari.receivedTypes());
        }

        @Test
        void testPatternNamingUnregisteredWorkerIsRejected() throws Exception {
            CoordinationPattern pattern = CoordinationPattern.builder("ghostly")
                    .step("Ghost", "haunt")
                    .build();

            WorkflowValidationException e = assertThrows(WorkflowValidationException.class,
                    () -> builder().pattern(pattern).build());

            assertEquals("steps[step0].worker", e.getValidationResult().getErrors().get(0).getFieldPath());
        }
    }

    @Test
    void testAssignWorkerFallsBackToCapability() throws Exception {
        orchestrator = builder().workflow(reminders()).workflow(orders()).build();
        String reminder = orchestrator.startWorkflow("reminders", Map.of(), "ops").getInstanceId();
        String order = orchestrator.startWorkflow("orders", Map.of(), "ops").getInstanceId();

        assertEquals(Optional.of("Solari"), orchestrator.assignWorker(reminder));
        assertTrue(orchestrator.assignWorker(order).isEmpty());
    }

    @Test
    void testDiagramsReflectInstanceProgress() throws Exception {
        orchestrator = builder().workflow(orders()).build();
        String id = orchestrator.startWorkflow("orders", Map.of(), "alice").getInstanceId();
        assertTrue(orchestrator.transition(id, "to_processing", "alice", Map.of()).get(1, TimeUnit.SECONDS).isSuccess());

        assertThat(orchestrator.stateDiagram(id))
                .startsWith("stateDiagram-v2\n")
                .contains("    processing --> approved: approve\n")
                .endsWith("    class processing current\n");
        assertThat(orchestrator.historyTimeline(id))
                .contains("    section start\n")
                .contains("    section processing\n    Transition from start via to_processing: ");
        assertThrows(NotFoundException.class, () -> orchestrator.stateDiagram("missing"));
    }

    @Test
    void testRegistryIsFrozenOnceBuilt() throws Exception {
        orchestrator = builder().build();

        assertThrows(IllegalStateException.class,
                () -> orchestrator.getRegistry().register(new ScriptedWorker("Late")));
        orchestrator.close();
        orchestrator.close();
    }

    @Test
    void testWorkerFailureSurfacesFromHandleEvent() throws Exception {
        orchestrator = builder().build();

        WorkerException e = assertThrows(WorkerException.class,
                () -> orchestrator.handleEvent("book_appointment", Map.of()));
        assertEquals("Solari", e.getWorkerName());
    }
}
