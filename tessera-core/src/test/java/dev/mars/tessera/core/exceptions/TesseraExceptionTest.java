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

package dev.mars.tessera.core.exceptions;

import dev.mars.tessera.core.TransitionResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TesseraExceptionTest {

    @Test
    void onlyTransientFailuresAreRetryable() {
        assertThat(new TransitionTimeoutException("t", Duration.ofSeconds(1), Duration.ofSeconds(2)).isRetryable()).isTrue();
        assertThat(new VersionConflictException("i", 1, 2).isRetryable()).isTrue();
        assertThat(new ActionException("notify", "smtp down", true).isRetryable()).isTrue();

        assertThat(new ActionException("notify", "bad template").isRetryable()).isFalse();
        assertThat(NotFoundException.instance("i").isRetryable()).isFalse();
        assertThat(new ConditionNotMetException("i", "approve").isRetryable()).isFalse();
        assertThat(new InvalidTransitionException("i", "start", "approve", List.of("submit")).isRetryable()).isFalse();
        assertThat(new UnroutableEventException("xyz_123").isRetryable()).isFalse();
        assertThat(new WorkerException("Nyra", "boom").isRetryable()).isFalse();
    }

    @Test
    void workerExceptionRecordsAttemptedFallbacks() {
        WorkerException original = new WorkerException("Solari", "calendar unavailable");
        WorkerException annotated = original.withAttemptedFallbacks(List.of("Ruvo", "Nyra"));

        assertThat(annotated.getWorkerName()).isEqualTo("Solari");
        assertThat(annotated.getAttemptedFallbacks()).containsExactly("Ruvo", "Nyra");
        assertThat(annotated.getMessage())
                .isEqualTo("Worker 'Solari': calendar unavailable (fallbacks attempted: [Ruvo, Nyra])");
        assertThat(original.getAttemptedFallbacks()).isEmpty();
    }

    @Test
    void notFoundNamesEntity() {
        NotFoundException e = NotFoundException.definition("orders");

        assertThat(e.getEntityType()).isEqualTo("Workflow definition");
        assertThat(e.getEntityId()).isEqualTo("orders");
        assertThat(e.getMessage()).isEqualTo("Workflow definition not found: orders");
    }

    @Test
    void retriesExhaustedCarriesAttemptChain() {
        Instant now = Instant.now();
        VersionConflictException last = new VersionConflictException("i", 3, 4);
        List<TransitionResult> attempts = List.of(
                TransitionResult.retry("approve", "review", new VersionConflictException("i", 1, 2), Duration.ofMillis(10), 0, now),
                TransitionResult.failed("approve", "review", last, 1, now));

        RetriesExhaustedException e = new RetriesExhaustedException("approve", attempts);

        assertThat(e.getAttemptCount()).isEqualTo(2);
        assertThat(e.getCause()).isSameAs(last);
        assertThat(e.getMessage()).contains("after 2 attempt(s)");
    }
}
