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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class WorkerRegistryTest {

    private WorkerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new WorkerRegistry()
                .register(WorkerRegistration.builder(new ScriptedWorker("Nyra").handles("lead_capture"))
                        .capabilities("lead_scoring", "enrichment")
                        .businessEntities("acme")
                        .build())
                .register(WorkerRegistration.builder(new ScriptedWorker("Solari").handles("book_appointment"))
                        .capabilities("booking", "enrichment")
                        .required(false)
                        .build())
                .register(new ScriptedWorker("Ruvo"));
    }

    @Test
    void testLookups() {
        assertEquals(3, registry.size());
        assertTrue(registry.contains("Nyra"));
        assertFalse(registry.contains("Ghost"));
        assertFalse(registry.contains(null));
        assertTrue(registry.getWorker("Solari").isPresent());
        assertTrue(registry.getWorker("Ghost").isEmpty());
        assertTrue(registry.getRegistration("Ruvo").orElseThrow().getCapabilities().isEmpty());
    }

    @Test
    void testRegistrationOrderIsPreserved() {
        List<String> names = registry.getRegistrations().stream()
                .map(WorkerRegistration::getName)
                .collect(Collectors.toList());
        assertEquals(List.of("Nyra", "Solari", "Ruvo"), names);
        assertEquals(List.of("Nyra", "Solari"), registry.findByCapability("enrichment"));
        assertEquals(List.of("Solari"), registry.findByCapability("booking"));
        assertTrue(registry.findByCapability("translation").isEmpty());
    }

    @Test
    void testBusinessEntityAssociation() {
        List<WorkerRegistration> matches = registry.findByBusinessEntity("acme");
        assertEquals(1, matches.size());
        assertEquals("Nyra", matches.get(0).getName());
        assertTrue(registry.findByBusinessEntity("globex").isEmpty());
    }

    @Test
    void testRequiredDefaultsToTrue() {
        assertTrue(registry.getRegistration("Nyra").orElseThrow().isRequired());
        assertTrue(registry.getRegistration("Ruvo").orElseThrow().isRequired());
        assertFalse(registry.getRegistration("Solari").orElseThrow().isRequired());
    }

    @Test
    void testDuplicateNameRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> registry.register(new ScriptedWorker("Nyra")));
        assertTrue(e.getMessage().contains("Nyra"));
        assertEquals(3, registry.size());
    }

    @Test
    void testFrozenRegistryRejectsRegistration() {
        registry.freeze();

        assertTrue(registry.isFrozen());
        assertThrows(IllegalStateException.class, () -> registry.register(new ScriptedWorker("Elan")));
        assertTrue(registry.contains("Nyra"));
    }
}
