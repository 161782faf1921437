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

package dev.mars.tessera.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for TesseraConfiguration.
 * Validates defaults, overrides and fallback on malformed values.
 */
class TesseraConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(TesseraConfiguration.PATTERN_THREADS);
        System.clearProperty(TesseraConfiguration.ROUTING_MEMOIZE_ENABLED);
    }

    // ========== Default Configuration Tests ==========

    @Test
    void testDefaults() {
        TesseraConfiguration config = TesseraConfiguration.defaults();

        assertEquals(Duration.ofSeconds(30), config.getWorkerCallTimeout());
        assertEquals(Duration.ofSeconds(5), config.getHealthProbeTimeout());
        assertEquals(4, config.getPatternThreads());
        assertEquals(64, config.getPatternQueueMaxPending());
        assertEquals(2, config.getRetrySchedulerThreads());
        assertTrue(config.isRoutingMemoizeEnabled());
        assertTrue(config.isMetricsEnabled());
    }

    // ========== Override Tests ==========

    @Test
    void testPropertiesOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty(TesseraConfiguration.HEALTH_PROBE_TIMEOUT_MS, "250");
        props.setProperty(TesseraConfiguration.ROUTING_MEMOIZE_ENABLED, "false");

        TesseraConfiguration config = new TesseraConfiguration(props);

        assertEquals(Duration.ofMillis(250), config.getHealthProbeTimeout());
        assertFalse(config.isRoutingMemoizeEnabled());
        assertEquals(4, config.getPatternThreads());
    }

    @Test
    void testSystemPropertiesOverrideDefaults() {
        System.setProperty(TesseraConfiguration.PATTERN_THREADS, "9");
        System.setProperty(TesseraConfiguration.ROUTING_MEMOIZE_ENABLED, "false");

        TesseraConfiguration config = new TesseraConfiguration();

        assertEquals(9, config.getPatternThreads());
        assertFalse(config.isRoutingMemoizeEnabled());
    }

    @Test
    void testSetProperty() {
        TesseraConfiguration config = TesseraConfiguration.defaults();
        config.setProperty(TesseraConfiguration.PATTERN_QUEUE_MAX_PENDING, "3");

        assertEquals(3, config.getPatternQueueMaxPending());
        assertEquals("3", config.getProperty(TesseraConfiguration.PATTERN_QUEUE_MAX_PENDING));
    }

    // ========== Invalid Value Tests ==========

    @Test
    void testInvalidIntegerFallsBackToDefault() {
        Properties props = new Properties();
        props.setProperty(TesseraConfiguration.PATTERN_THREADS, "lots");
        props.setProperty(TesseraConfiguration.WORKER_CALL_TIMEOUT_MS, "-1");

        TesseraConfiguration config = new TesseraConfiguration(props);

        assertEquals(4, config.getPatternThreads());
        assertEquals(Duration.ofSeconds(30), config.getWorkerCallTimeout());
    }

    @Test
    void testToString() {
        String text = TesseraConfiguration.defaults().toString();
        assertTrue(text.contains("patternThreads=4"));
        assertTrue(text.contains("healthProbeTimeout=5000ms"));
    }
}
