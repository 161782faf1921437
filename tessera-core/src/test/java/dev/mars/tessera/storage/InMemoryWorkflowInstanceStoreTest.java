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

package dev.mars.tessera.storage;

import dev.mars.tessera.core.WorkflowInstance;
import dev.mars.tessera.core.exceptions.NotFoundException;
import dev.mars.tessera.core.exceptions.VersionConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryWorkflowInstanceStoreTest {

    private InMemoryWorkflowInstanceStore store;

    @BeforeEach
    void setUp() throws Exception {
        store = new InMemoryWorkflowInstanceStore();
        store.create(new WorkflowInstance("i-1", "orders", "start", Map.of("orderValue", 500), Instant.now()));
    }

    @Test
    void testGetReturnsCopy() throws Exception {
        WorkflowInstance loaded = store.get("i-1");
        loaded.setCurrentState("processing");

        assertEquals("start", store.get("i-1").getCurrentState());
    }

    @Test
    void testGetMissingInstance() {
        NotFoundException e = assertThrows(NotFoundException.class, () -> store.get("missing"));
        assertEquals("missing", e.getEntityId());
        assertTrue(store.find("missing").isEmpty());
    }

    @Test
    void testCreateDuplicateRejected() {
        WorkflowInstance duplicate = new WorkflowInstance("i-1", "orders", "start", null, Instant.now());
        assertThrows(VersionConflictException.class, () -> store.create(duplicate));
    }

    @Test
    void testSaveWithCurrentVersion() throws Exception {
        WorkflowInstance loaded = store.get("i-1");
        loaded.setCurrentState("processing");
        loaded.incrementVersion();

        store.save(loaded, 0);

        WorkflowInstance reloaded = store.get("i-1");
        assertEquals("processing", reloaded.getCurrentState());
        assertEquals(1, reloaded.getVersion());
    }

    @Test
    void testStaleSaveRejected() throws Exception {
        WorkflowInstance first = store.get("i-1");
        WorkflowInstance second = store.get("i-1");

        first.setCurrentState("processing");
        first.incrementVersion();
        store.save(first, 0);

        second.setCurrentState("cancelled");
        second.incrementVersion();
        VersionConflictException e = assertThrows(VersionConflictException.class, () -> store.save(second, 0));

        assertEquals(0, e.getExpectedVersion());
        assertEquals(1, e.getActualVersion());
        assertEquals("processing", store.get("i-1").getCurrentState());
    }

    @Test
    void testSaveVanishedInstance() {
        WorkflowInstance ghost = new WorkflowInstance("ghost", "orders", "start", null, Instant.now());
        assertThrows(NotFoundException.class, () -> store.save(ghost, 0));
    }

    @Test
    void testConcurrentSavesOnlyOneWins() throws Exception {
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch ready = new CountDownLatch(writers);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger wins = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();
        try {
            Future<?>[] futures = new Future<?>[writers];
            for (int i = 0; i < writers; i++) {
                final String state = "s" + i;
                futures[i] = pool.submit(() -> {
                    WorkflowInstance copy = store.get("i-1");
                    copy.setCurrentState(state);
                    copy.incrementVersion();
                    ready.countDown();
                    go.await();
                    try {
                        store.save(copy, 0);
                        wins.incrementAndGet();
                    } catch (VersionConflictException e) {
                        conflicts.incrementAndGet();
                    }
                    return null;
                });
            }
            assertTrue(ready.await(5, TimeUnit.SECONDS));
            go.countDown();
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, wins.get());
        assertEquals(writers - 1, conflicts.get());
        assertEquals(1, store.get("i-1").getVersion());
    }

    @Test
    void testFindByWorkflowId() throws Exception {
        store.create(new WorkflowInstance("i-2", "orders", "start", null, Instant.now()));
        store.create(new WorkflowInstance("i-3", "refunds", "start", null, Instant.now()));

        assertEquals(2, store.findByWorkflowId("orders").size());
        assertEquals(3, store.size());
    }
}
