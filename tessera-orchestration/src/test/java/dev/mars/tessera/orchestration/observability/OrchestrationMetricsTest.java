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
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collection;

import static org.junit.jupiter.api.Assertions.*;

class OrchestrationMetricsTest {

    private InMemoryMetricReader reader;
    private SdkMeterProvider meterProvider;
    private OrchestrationMetrics metrics;

    @BeforeEach
    void setUp() {
        reader = InMemoryMetricReader.create();
        meterProvider = SdkMeterProvider.builder().registerMetricReader(reader).build();
        metrics = new OrchestrationMetrics(OpenTelemetrySdk.builder().setMeterProvider(meterProvider).build());
    }

    @AfterEach
    void tearDown() {
        meterProvider.close();
    }

    private long sum(Collection<MetricData> data, String name) {
        return data.stream()
                .filter(m -> m.getName().equals(name))
                .flatMap(m -> m.getLongSumData().getPoints().stream())
                .mapToLong(LongPointData::getValue)
                .sum();
    }

    @Test
    void testRoutingCounters() {
        metrics.recordRouted(RoutingStrategy.PREFIX);
        metrics.recordRouted(RoutingStrategy.PREFIX);
        metrics.recordRouted(RoutingStrategy.PROBE);
        metrics.recordUnroutable();
        metrics.recordWorkerFailure("Solari");
        metrics.recordFallbackUsed("Backup");

        Collection<MetricData> data = reader.collectAllMetrics();

        assertEquals(3, sum(data, "tessera.events.routed"));
        assertEquals(1, sum(data, "tessera.events.unroutable"));
        assertEquals(1, sum(data, "tessera.worker.failures"));
        assertEquals(1, sum(data, "tessera.routing.fallbacks"));
        long prefixCount = data.stream()
                .filter(m -> m.getName().equals("tessera.events.routed"))
                .flatMap(m -> m.getLongSumData().getPoints().stream())
                .filter(p -> "PREFIX".equals(p.getAttributes().get(AttributeKey.stringKey("routing.strategy"))))
                .mapToLong(LongPointData::getValue)
                .sum();
        assertEquals(2, prefixCount);
    }

    @Test
    void testPatternCountersAndActiveGauge() {
        metrics.recordPatternStarted();
        metrics.recordPatternStarted();
        metrics.recordStep("lead_to_booking", "Nyra", true);
        metrics.recordStep("lead_to_booking", "Solari", false);
        metrics.recordPatternFinished();

        Collection<MetricData> data = reader.collectAllMetrics();

        assertEquals(1, sum(data, "tessera.pattern.steps.executed"));
        assertEquals(1, sum(data, "tessera.pattern.steps.failed"));
        assertEquals(1, metrics.getActivePatterns());
        assertTrue(data.stream().anyMatch(m -> m.getName().equals("tessera.pattern.active")));
    }
}
