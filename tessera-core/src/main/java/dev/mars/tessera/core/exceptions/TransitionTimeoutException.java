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

import java.time.Duration;

/**
 * Thrown when a transition attempt runs past its configured timeout.
 */
public class TransitionTimeoutException extends TesseraException {

    private final String transitionName;
    private final Duration timeout;
    private final Duration elapsed;

    public TransitionTimeoutException(String transitionName, Duration timeout, Duration elapsed) {
        super("Transition '" + transitionName + "' timed out after " + elapsed.toMillis()
                + "ms (limit " + timeout.toMillis() + "ms)");
        this.transitionName = transitionName;
        this.timeout = timeout;
        this.elapsed = elapsed;
    }

    public String getTransitionName() {
        return transitionName;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
