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

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowInstanceTest {

    private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");

    @Test
    void testNewInstanceDefaults() {
        WorkflowInstance instance = new WorkflowInstance("i-1", "orders", "start", Map.of("a", 1), NOW);

        assertEquals("start", instance.getCurrentState());
        assertEquals(InstanceStatus.ACTIVE, instance.getStatus());
        assertEquals(0, instance.getVersion());
        assertEquals(NOW, instance.getCreatedAt());
        assertEquals(NOW, instance.getLastTransitionAt());
        assertEquals(1, instance.getContextValue("a"));
        assertTrue(instance.getHistoryLog().isEmpty());
    }

    @Test
    void testCopyIsDeep() {
        Map<String, Object> nested = new HashMap<>();
        nested.put("city", "Leeds");
        Map<String, Object> context = new HashMap<>();
        context.put("address", nested);
        context.put("tags", new ArrayList<>(List.of("vip")));

        WorkflowInstance original = new WorkflowInstance("i-1", "orders", "start", context, NOW);
        nested.put("city", "York");
        WorkflowInstance copy = original.copy();
        copy.putContextValue("extra", true);
        copy.appendHistory(HistoryEntry.created("bob", "start", NOW));
        copy.incrementVersion();

        @SuppressWarnings("unchecked")
        Map<String, Object> address = (Map<String, Object>) original.getContextValue("address");
        assertEquals("Leeds", address.get("city"));
        assertNull(original.getContextValue("extra"));
        assertTrue(original.getHistoryLog().isEmpty());
        assertEquals(0, original.getVersion());
        assertEquals(1, copy.getVersion());
    }

    @Test
    void testContextAndHistoryViewsAreReadOnly() {
        WorkflowInstance instance = new WorkflowInstance("i-1", "orders", "start", null, NOW);

        assertThrows(UnsupportedOperationException.class, () -> instance.getContextData().put("x", 1));
        assertThrows(UnsupportedOperationException.class,
                () -> instance.getHistoryLog().add(HistoryEntry.created("a", "start", NOW)));
    }

    @Test
    void testMergeContext() {
        WorkflowInstance instance = new WorkflowInstance("i-1", "orders", "start", Map.of("a", 1, "b", 2), NOW);
        instance.mergeContext(Map.of("b", 3, "c", 4));

        assertEquals(Map.of("a", 1, "b", 3, "c", 4), instance.getContextData());
    }

    @Test
    void testCreationHistoryEntry() {
        HistoryEntry entry = HistoryEntry.created("system", "start", NOW);

        assertTrue(entry.isCreation());
        assertEquals("start", entry.toState());
        assertTrue(entry.data().isEmpty());
    }

    @Test
    void testHistoryEntryDataIsDetachedFromCaller() {
        List<Object> items = new ArrayList<>(List.of("sku-1"));
        Map<String, Object> shipping = new HashMap<>();
        shipping.put("city", "Leeds");
        shipping.put("items", items);
        Map<String, Object> data = new HashMap<>();
        data.put("shipping", shipping);

        HistoryEntry entry = new HistoryEntry("alice", "shipped", data, "packed", "shipped", "ship", NOW);
        shipping.put("city", "York");
        items.add("sku-2");

        @SuppressWarnings("unchecked")
        Map<String, Object> recorded = (Map<String, Object>) entry.data().get("shipping");
        assertEquals("Leeds", recorded.get("city"));
        assertEquals(List.of("sku-1"), recorded.get("items"));
        assertThrows(UnsupportedOperationException.class, () -> recorded.put("city", "Hull"));
    }

    @Test
    void testValidationResultCollectsAllErrors() {
        ValidationResult result = new ValidationResult();
        result.addError("initialState", "Unknown state: nowhere");
        result.addError("transitions[go].to", "Unknown state: gone");
        result.addWarning("states[x]", "Unreachable");

        assertFalse(result.isValid());
        assertEquals(2, result.getErrorCount());
        assertTrue(result.hasWarnings());
        assertEquals("[initialState] Unknown state: nowhere; [transitions[go].to] Unknown state: gone",
                result.describeErrors());
    }

    @Test
    void testTerminalStatuses() {
        assertTrue(InstanceStatus.COMPLETED.isTerminal());
        assertTrue(InstanceStatus.ERROR.isTerminal());
        assertFalse(InstanceStatus.ACTIVE.isTerminal());
        assertFalse(InstanceStatus.ON_HOLD.isTerminal());
    }
}
