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
import dev.mars.tessera.core.exceptions.WorkerException;
import dev.mars.tessera.messaging.EventPublisher;
import dev.mars.tessera.orchestration.observability.OrchestrationMetrics;
import dev.mars.tessera.storage.InMemoryWorkflowInstanceStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PatternExecutorTest {

    private InMemoryWorkflowInstanceStore store;
    private WorkerRegistry registry;
    private EventRouter router;
    private KeyedSerialExecutor serialExecutor;
    private ScriptedWorker nyra;
    private ScriptedWorker solari;
    private final AtomicBoolean calendarUp = new AtomicBoolean(false);

    @BeforeEach
    void setUp() {
        store = new InMemoryWorkflowInstanceStore();
        nyra = new ScriptedWorker("Nyra")
                .handles("lead_capture", payload -> Map.of("leadScore", 80, "qualified", true));
        solari = new ScriptedWorker("Solari").handles("book_appointment", payload -> {
            if (!calendarUp.get()) {
                throw new WorkerException("Solari", "calendar unavailable");
            }
            return Map.of("slot", "2025-06-03T09:00");
        });
        registry = new WorkerRegistry().register(nyra).register(solari);
        router = new EventRouter(registry, new RoutingTable(), EventPublisher.noop(), OrchestrationMetrics.noop(),
                Clock.systemUTC(), Duration.ofSeconds(2), false);
        serialExecutor = new KeyedSerialExecutor(2, 10);
    }

    @AfterEach
    void tearDown() {
        serialExecutor.close();
        router.close();
    }

    private PatternExecutor executor(CoordinationPattern... patterns) {
        return new PatternExecutor(router, store, serialExecutor, List.of(patterns), OrchestrationMetrics.noop(),
                Clock.systemUTC());
    }

    private static CoordinationPattern leadToBooking() throws Exception {
        return CoordinationPattern.builder("lead_to_booking")
                .step("Nyra", "lead_capture")
                .step("Solari", "book_appointment")
                .build();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> record(WorkflowInstance instance, String key) {
        return (Map<String, Object>) instance.getContextValue(key);
    }

    @Test
    @DisplayName("a failing second step fails the run and leaves the first step's record intact")
    void testFailedStepScenario() throws Exception {
        PatternExecutor executor = executor(leadToBooking());

        PatternStartResult started = executor.start("lead_to_booking", Map.of("email", "ana@example.com"));
        assertEquals(PatternStartResult.STARTED, started.status());
        assertEquals("pattern:lead_to_booking", started.workflowId());

        assertEquals(PatternStatus.FAILED, executor.completion(started.instanceId()).get(5, TimeUnit.SECONDS));

        WorkflowInstance instance = store.get(started.instanceId());
        Map<String, Object> first = record(instance, "step0_Nyra_lead_capture");
        assertEquals(true, first.get("success"));
        assertEquals(Map.of("leadScore", 80, "qualified", true), first.get("result"));
        assertEquals(1, first.get("attempts"));

        Map<String, Object> second = record(instance, "step1_Solari_book_appointment");
        assertEquals(false, second.get("success"));
        assertTrue(second.get("error").toString().contains("calendar unavailable"));

        assertEquals("FAILED", instance.getContextValue(PatternExecutor.PATTERN_STATUS));
        assertEquals(InstanceStatus.ERROR, instance.getStatus());
        assertEquals("step1", instance.getCurrentState());

        List<StepFailure> failures = executor.getFailedSteps();
        assertEquals(1, failures.size());
        assertEquals("step1", failures.get(0).stepName());
        assertEquals("Solari", failures.get(0).workerName());
        assertEquals(started.instanceId(), failures.get(0).instanceId());
    }

    @Test
    void testLaterStepsSeeEarlierResults() throws Exception {
        calendarUp.set(true);
        PatternExecutor executor = executor(leadToBooking());

        PatternStartResult started = executor.start("lead_to_booking", Map.of("email", "ana@example.com"));
        assertEquals(PatternStatus.COMPLETED, executor.completion(started.instanceId()).get(5, TimeUnit.SECONDS));

        Map<String, Object> seenBySolari = solari.receivedPayloads().get(0);
        assertEquals("ana@example.com", seenBySolari.get("email"));
        assertEquals(80, seenBySolari.get("leadScore"));
        assertEquals(started.instanceId(), seenBySolari.get(EventRouter.INSTANCE_ID));

        WorkflowInstance instance = store.get(started.instanceId());
        assertEquals(InstanceStatus.COMPLETED, instance.getStatus());
        List<HistoryEntry> history = instance.getHistoryLog();
        assertEquals(3, history.size());
        assertTrue(history.get(0).isCreation());
        assertEquals("Nyra", history.get(1).actor());
        assertEquals("Solari", history.get(2).actor());
        assertEquals("book_appointment", history.get(2).transition());
    }

    @Test
    void testResumeRunsOnlyIncompleteSteps() throws Exception {
        PatternExecutor executor = executor(leadToBooking());
        PatternStartResult started = executor.start("lead_to_booking", Map.of());
        assertEquals(PatternStatus.FAILED, executor.completion(started.instanceId()).get(5, TimeUnit.SECONDS));
        String firstTimestamp = record(store.get(started.instanceId()), "step0_Nyra_lead_capture")
                .get("timestamp").toString();

        calendarUp.set(true);
        assertEquals(PatternStatus.COMPLETED, executor.resume(started.instanceId()).get(5, TimeUnit.SECONDS));

        assertEquals(List.of("lead_capture"), nyra.receivedTypes());
        assertEquals(2, solari.receivedTypes().size());
        WorkflowInstance instance = store.get(started.instanceId());
        assertEquals(firstTimestamp, record(instance, "step0_Nyra_lead_capture").get("timestamp"));
        assertEquals(true, record(instance, "step1_Solari_book_appointment").get("success"));
        assertEquals("COMPLETED", instance.getContextValue(PatternExecutor.PATTERN_STATUS));

        assertEquals(PatternStatus.COMPLETED, executor.resume(started.instanceId()).get(1, TimeUnit.SECONDS));
        assertEquals(PatternStatus.COMPLETED, executor.completion(started.instanceId()).get(1, TimeUnit.SECONDS));
    }

    @Test
    void testStepRetriesBeforeFailing() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        registry.register(new ScriptedWorker("Ruvo").handles("task_assigned", payload -> {
            if (calls.incrementAndGet() < 3) {
                throw new WorkerException("Ruvo", "queue busy");
            }
            return Map.of("taskId", "t-1");
        }));
        CoordinationPattern pattern = CoordinationPattern.builder("assign")
                .step(PatternStep.builder("Ruvo", "task_assigned").retryCount(2).build())
                .build();
        PatternExecutor executor = executor(pattern);

        PatternStartResult started = executor.start("assign", Map.of());

        assertEquals(PatternStartResult.COMPLETED, started.status());
        Map<String, Object> step = record(store.get(started.instanceId()), "step0_Ruvo_task_assigned");
        assertEquals(true, step.get("success"));
        assertEquals(3, step.get("attempts"));
        assertTrue(executor.getFailedSteps().isEmpty());
    }

    @Test
    void testFailingFirstStepReportsFailedImmediately() throws Exception {
        CoordinationPattern pattern = CoordinationPattern.builder("book_only")
                .step("Solari", "book_appointment")
                .build();
        PatternExecutor executor = executor(pattern);

        PatternStartResult started = executor.start("book_only", Map.of());

        assertEquals(PatternStartResult.FAILED, started.status());
        assertEquals(PatternStatus.FAILED, executor.completion(started.instanceId()).get(1, TimeUnit.SECONDS));
        assertEquals("failed", started.toMap().get("status"));
    }

    @Test
    void testUnknownPatternAndInstance() throws Exception {
        PatternExecutor executor = executor(leadToBooking());

        NotFoundException e = assertThrows(NotFoundException.class, () -> executor.start("nope", Map.of()));
        assertEquals("nope", e.getEntityId());
        assertThrows(NotFoundException.class, () -> executor.resume("missing"));
    }

    @Test
    void testDuplicatePatternNamesRejected() throws Exception {
        CoordinationPattern pattern = leadToBooking();

        assertThrows(IllegalArgumentException.class, () -> executor(pattern, pattern));
    }
}
