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

import java.util.Objects;

/**
 * One step of a coordination pattern: deliver an event type to a named worker.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class PatternStep {

    private final String name;
    private final String worker;
    private final String eventType;
    private final String nextOnSuccess;
    private final boolean nextExplicit;
    private final int retryCount;

    private PatternStep(String name, String worker, String eventType, String nextOnSuccess, boolean nextExplicit,
                        int retryCount) {
        this.name = name;
        this.worker = worker;
        this.eventType = eventType;
        this.nextOnSuccess = nextOnSuccess;
        this.nextExplicit = nextExplicit;
        this.retryCount = retryCount;
    }

    public static Builder builder(String worker, String eventType) {
        return new Builder(worker, eventType);
    }

    /**
     * Step name; {@code stepN} unless set explicitly.
     */
    public String getName() {
        return name;
    }

    public String getWorker() {
        return worker;
    }

    public String getEventType() {
        return eventType;
    }

    /**
     * Name of the step to run after this one succeeds, or null when the pattern ends here.
     */
    public String getNextOnSuccess() {
        return nextOnSuccess;
    }

    /**
     * Additional attempts made against the worker before the step is recorded as failed.
     */
    public int getRetryCount() {
        return retryCount;
    }

    boolean isNextExplicit() {
        return nextExplicit;
    }

    boolean hasName() {
        return name != null;
    }

    PatternStep resolve(String resolvedName, String resolvedNext) {
        return new PatternStep(resolvedName, worker, eventType, resolvedNext, nextExplicit, retryCount);
    }

    @Override
    public String toString() {
        return "PatternStep{name='" + name + "', worker='" + worker + "', eventType='" + eventType +
                "', nextOnSuccess=" + nextOnSuccess + '}';
    }

    public static class Builder {
        private final String worker;
        private final String eventType;
        private String name;
        private String nextOnSuccess;
        private boolean nextExplicit;
        private int retryCount;

        private Builder(String worker, String eventType) {
            this.worker = Objects.requireNonNull(worker, "Worker cannot be null");
            this.eventType = Objects.requireNonNull(eventType, "Event type cannot be null");
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Overrides the default successor (the following step). Null ends the pattern here.
         */
        public Builder nextOnSuccess(String nextOnSuccess) {
            this.nextOnSuccess = nextOnSuccess;
            this.nextExplicit = true;
            return this;
        }

        public Builder retryCount(int retryCount) {
            if (retryCount < 0) {
                throw new IllegalArgumentException("Retry count cannot be negative");
            }
            this.retryCount = retryCount;
            return this;
        }

        public PatternStep build() {
            return new PatternStep(name, worker, eventType, nextOnSuccess, nextExplicit, retryCount);
        }
    }
}
