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

import java.util.List;

/**
 * Thrown once a retryable transition has failed on every permitted attempt.
 * Carries the full chain of attempts, oldest first.
 */
public class RetriesExhaustedException extends TesseraException {

    private final String transitionName;
    private final List<TransitionResult> attempts;

    public RetriesExhaustedException(String transitionName, List<TransitionResult> attempts) {
        super("Transition '" + transitionName + "' failed after " + attempts.size() + " attempt(s)",
                attempts.isEmpty() ? null : attempts.get(attempts.size() - 1).getError());
        this.transitionName = transitionName;
        this.attempts = List.copyOf(attempts);
    }

    public String getTransitionName() {
        return transitionName;
    }

    public List<TransitionResult> getAttempts() {
        return attempts;
    }

    public int getAttemptCount() {
        return attempts.size();
    }
}
