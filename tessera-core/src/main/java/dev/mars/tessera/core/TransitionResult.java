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

import dev.mars.tessera.core.exceptions.TesseraException;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of a single transition attempt.
 *
 * <p>The engine reports business failures through this value instead of throwing. When
 * {@link #isRetryRecommended()} is true the caller should try again after {@link #getRetryAfter()}.</p>
 */
public final class TransitionResult {

    private final boolean success;
    private final String transitionName;
    private final String fromState;
    private final String toState;
    private final TesseraException error;
    private final boolean retryRecommended;
    private final Duration retryAfter;
    private final int attempt;
    private final Instant timestamp;
    private final WorkflowInstance instance;

    private TransitionResult(boolean success, String transitionName, String fromState, String toState,
                             TesseraException error, boolean retryRecommended, Duration retryAfter,
                             int attempt, Instant timestamp, WorkflowInstance instance) {
        this.success = success;
        this.transitionName = transitionName;
        this.fromState = fromState;
        this.toState = toState;
        this.error = error;
        this.retryRecommended = retryRecommended;
        this.retryAfter = retryAfter != null ? retryAfter : Duration.ZERO;
        this.attempt = attempt;
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        this.instance = instance;
    }

    public static TransitionResult committed(String transitionName, String fromState, String toState,
                                             int attempt, Instant timestamp, WorkflowInstance instance) {
        return new TransitionResult(true, transitionName, fromState, toState, null, false, Duration.ZERO,
                attempt, timestamp, instance);
    }

    public static TransitionResult failed(String transitionName, String fromState, TesseraException error,
                                          int attempt, Instant timestamp) {
        return new TransitionResult(false, transitionName, fromState, null,
                Objects.requireNonNull(error, "Error cannot be null"), false, Duration.ZERO, attempt, timestamp, null);
    }

    public static TransitionResult retry(String transitionName, String fromState, TesseraException error,
                                         Duration retryAfter, int attempt, Instant timestamp) {
        return new TransitionResult(false, transitionName, fromState, null,
                Objects.requireNonNull(error, "Error cannot be null"), true, retryAfter, attempt, timestamp, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getTransitionName() {
        return transitionName;
    }

    public String getFromState() {
        return fromState;
    }

    public String getToState() {
        return toState;
    }

    public TesseraException getError() {
        return error;
    }

    public boolean isRetryRecommended() {
        return retryRecommended;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    public int getAttempt() {
        return attempt;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * The committed instance snapshot, or null when the attempt failed.
     */
    public WorkflowInstance getInstance() {
        return instance;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("TransitionResult{");
        sb.append("transition='").append(transitionName).append('\'');
        sb.append(", attempt=").append(attempt);
        if (success) {
            sb.append(", ").append(fromState).append(" -> ").append(toState);
        } else {
            sb.append(", error=").append(error.getMessage());
            if (retryRecommended) {
                sb.append(", retryAfter=").append(retryAfter.toMillis()).append("ms");
            }
        }
        return sb.append('}').toString();
    }
}
