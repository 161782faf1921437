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

import dev.mars.tessera.workflow.WorkflowParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class YamlCoordinationPatternParserTest {

    private YamlCoordinationPatternParser parser;

    @BeforeEach
    void setUp() {
        parser = new YamlCoordinationPatternParser();
    }

    private String resource(String name) throws Exception {
        try (InputStream in = getClass().getResourceAsStream(name)) {
            assertNotNull(in, "missing test resource " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void testParsePatternList() throws Exception {
        List<CoordinationPattern> patterns = parser.parseFromString(resource("/patterns/lead-to-booking.yaml"));

        assertEquals(2, patterns.size());
        CoordinationPattern booking = patterns.get(0);
        assertEquals("lead_to_booking", booking.getName());
        assertEquals(Duration.ofMinutes(5), booking.getExpectedDuration());
        assertEquals(List.of("lead_qualified", "booking_confirmed"), booking.getSuccessCriteria());
        assertEquals(List.of("escalate_to_human"), booking.getFallbackActions());
        assertEquals("book", booking.getFirstStep().getNextOnSuccess());
        PatternStep book = booking.getStep("book").orElseThrow();
        assertEquals("Solari", book.getWorker());
        assertEquals(1, book.getRetryCount());
        assertTrue(booking.next(book).isEmpty());

        CoordinationPattern campaign = patterns.get(1);
        PatternStep segment = campaign.getFirstStep();
        assertEquals("launch", campaign.next(segment).orElseThrow().getName());
        assertEquals("launch", campaign.next(campaign.getStep("draft").orElseThrow()).orElseThrow().getName());
    }

    @Test
    void testParseSinglePatternDocumentFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("onboarding.yaml");
        Files.writeString(file, String.join("\n",
                "name: onboarding",
                "steps:",
                "  - worker: Sage",
                "    eventType: member_joined",
                "  - worker: Ruvo",
                "    eventType: task_created",
                "    nextOnSuccess: null"));

        List<CoordinationPattern> patterns = parser.parse(file);

        assertEquals(1, patterns.size());
        CoordinationPattern onboarding = patterns.get(0);
        assertNull(onboarding.getExpectedDuration());
        assertEquals(List.of("step0", "step1"), List.of(onboarding.getSteps().get(0).getName(),
                onboarding.getSteps().get(1).getName()));
        assertEquals("step1_Ruvo_task_created", onboarding.recordKey(onboarding.getSteps().get(1)));
    }

    @Test
    void testMissingWorkerReportsFieldPath() {
        WorkflowParseException e = assertThrows(WorkflowParseException.class, () -> parser.parseFromString(
                String.join("\n",
                        "patterns:",
                        "  - name: broken",
                        "    steps:",
                        "      - worker: Nyra",
                        "        eventType: lead_capture",
                        "      - eventType: book_appointment")));

        assertEquals("patterns[0].steps[1].worker", e.getFieldPath());
    }

    @Test
    void testNegativeRetryCountReportsFieldPath() {
        WorkflowParseException e = assertThrows(WorkflowParseException.class, () -> parser.parseFromString(
                String.join("\n",
                        "name: impatient",
                        "steps:",
                        "  - worker: Nyra",
                        "    eventType: lead_capture",
                        "    retryCount: -2")));

        assertEquals("pattern.steps[0].retryCount", e.getFieldPath());
    }

    @Test
    void testInvalidGraphIsReported() {
        WorkflowParseException e = assertThrows(WorkflowParseException.class, () -> parser.parseFromString(
                String.join("\n",
                        "name: dangling",
                        "steps:",
                        "  - worker: Nyra",
                        "    eventType: lead_capture",
                        "    nextOnSuccess: nowhere")));

        assertTrue(e.getMessage().contains("Unknown step: nowhere"), e.getMessage());
    }

    @Test
    void testMalformedYaml() {
        assertThrows(WorkflowParseException.class, () -> parser.parseFromString("patterns: [unclosed"));
        assertThrows(WorkflowParseException.class, () -> parser.parseFromString(""));
        assertThrows(WorkflowParseException.class, () -> parser.parseFromString("patterns: nope"));
    }
}
