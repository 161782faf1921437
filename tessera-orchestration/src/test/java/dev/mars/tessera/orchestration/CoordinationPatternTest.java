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

import dev.mars.tessera.core.ValidationResult;
import dev.mars.tessera.core.exceptions.WorkflowValidationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoordinationPatternTest {

    private static List<String> errorPaths(WorkflowValidationException e) {
        return e.getValidationResult().getErrors().stream()
                .map(ValidationResult.ValidationIssue::getFieldPath)
                .collect(Collectors.toList());
    }

    @Test
    void defaultsNameStepsAndChainsThemInOrder() throws Exception {
        CoordinationPattern pattern = CoordinationPattern.builder("lead_to_booking")
                .step("Nyra", "lead_capture")
                .step("Solari", "book_appointment")
                .expectedDuration(Duration.ofMinutes(5))
                .successCriteria("lead_qualified", "booking_confirmed")
                .fallbackActions("escalate_to_human")
                .build();

        assertThat(pattern.getWorkflowId()).isEqualTo("pattern:lead_to_booking");
        assertThat(pattern.getSteps()).extracting(PatternStep::getName).containsExactly("step0", "step1");
        assertThat(pattern.getFirstStep().getNextOnSuccess()).isEqualTo("step1");
        assertThat(pattern.next(pattern.getSteps().get(1))).isEmpty();
        assertThat(pattern.recordKey(pattern.getSteps().get(1))).isEqualTo("step1_Solari_book_appointment");
        assertThat(pattern.getSuccessCriteria()).containsExactly("lead_qualified", "booking_confirmed");
        assertThat(pattern.getExpectedDuration()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void explicitSuccessorCanSkipAndEndEarly() throws Exception {
        CoordinationPattern pattern = CoordinationPattern.builder("triage")
                .step(PatternStep.builder("Nyra", "lead_capture").name("capture").nextOnSuccess("notify").build())
                .step(PatternStep.builder("Solari", "book_appointment").name("book").build())
                .step(PatternStep.builder("Liora", "campaign_enroll").name("notify").nextOnSuccess(null).build())
                .build();

        assertThat(pattern.next(pattern.getFirstStep())).map(PatternStep::getName).contains("notify");
        assertThat(pattern.next(pattern.getStep("notify").orElseThrow())).isEmpty();
        assertThat(pattern.indexOf(pattern.getStep("book").orElseThrow())).isEqualTo(1);
    }

    @Test
    void rejectsEmptyPattern() {
        assertThatThrownBy(() -> CoordinationPattern.builder("empty").build())
                .isInstanceOf(WorkflowValidationException.class)
                .satisfies(e -> assertThat(errorPaths((WorkflowValidationException) e)).contains("steps"));
    }

    @Test
    void rejectsDuplicateAndDanglingStepNames() {
        assertThatThrownBy(() -> CoordinationPattern.builder("broken")
                .step(PatternStep.builder("Nyra", "lead_capture").name("capture").build())
                .step(PatternStep.builder("Nyra", "lead_qualify").name("capture").build())
                .step(PatternStep.builder("Solari", "book_appointment").name("book").nextOnSuccess("pay").build())
                .build())
                .isInstanceOf(WorkflowValidationException.class)
                .satisfies(e -> assertThat(errorPaths((WorkflowValidationException) e))
                        .contains("steps[capture]", "steps[book].nextOnSuccess"));
    }

    @Test
    void rejectsStepSequenceThatLoopsBack() {
        assertThatThrownBy(() -> CoordinationPattern.builder("loop")
                .step(PatternStep.builder("Nyra", "lead_capture").name("a").build())
                .step(PatternStep.builder("Solari", "book_appointment").name("b").nextOnSuccess("a").build())
                .build())
                .isInstanceOf(WorkflowValidationException.class)
                .hasMessageContaining("loops back to a");
    }

    @Test
    void rejectsNegativeRetryCount() {
        assertThatThrownBy(() -> PatternStep.builder("Nyra", "lead_capture").retryCount(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
