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

package dev.mars.tessera.worker;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of probing one worker's health.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkerHealth {

    private final String workerName;
    private final HealthStatus status;
    private final String message;
    private final Instant checkedAt;
    private final Duration responseTime;
    private final Map<String, Object> details;

    private WorkerHealth(Builder builder) {
        this.workerName = builder.workerName;
        this.status = Objects.requireNonNull(builder.status, "Status cannot be null");
        this.message = builder.message;
        this.checkedAt = builder.checkedAt != null ? builder.checkedAt : Instant.now();
        this.responseTime = builder.responseTime;
        this.details = new HashMap<>(builder.details);
    }

    public static WorkerHealth healthy() {
        return builder().status(HealthStatus.HEALTHY).build();
    }

    public static WorkerHealth degraded(String message) {
        return builder().status(HealthStatus.DEGRADED).message(message).build();
    }

    public static WorkerHealth unhealthy(String message) {
        return builder().status(HealthStatus.UNHEALTHY).message(message).build();
    }

    public String getWorkerName() {
        return workerName;
    }

    public HealthStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public Instant getCheckedAt() {
        return checkedAt;
    }

    public Duration getResponseTime() {
        return responseTime;
    }

    public Map<String, Object> getDetails() {
        return new HashMap<>(details);
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }

    /**
     * Returns a copy stamped with the probed worker's name and the measured response time.
     */
    public WorkerHealth forWorker(String name, Duration measured) {
        return builder()
                .workerName(name)
                .status(status)
                .message(message)
                .checkedAt(checkedAt)
                .responseTime(measured)
                .details(details)
                .build();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("worker", workerName);
        map.put("status", status.name());
        map.put("checkedAt", checkedAt.toString());
        if (message != null) {
            map.put("message", message);
        }
        if (responseTime != null) {
            map.put("responseTimeMs", responseTime.toMillis());
        }
        if (!details.isEmpty()) {
            map.put("details", new HashMap<>(details));
        }
        return map;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String workerName;
        private HealthStatus status = HealthStatus.HEALTHY;
        private String message;
        private Instant checkedAt;
        private Duration responseTime;
        private final Map<String, Object> details = new HashMap<>();

        public Builder workerName(String workerName) {
            this.workerName = workerName;
            return this;
        }

        public Builder status(HealthStatus status) {
            this.status = status;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder checkedAt(Instant checkedAt) {
            this.checkedAt = checkedAt;
            return this;
        }

        public Builder responseTime(Duration responseTime) {
            this.responseTime = responseTime;
            return this;
        }

        public Builder detail(String key, Object value) {
            this.details.put(key, value);
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details.putAll(details);
            return this;
        }

        public WorkerHealth build() {
            return new WorkerHealth(this);
        }
    }

    @Override
    public String toString() {
        return "WorkerHealth{worker='" + workerName + "', status=" + status +
                (message != null ? ", message='" + message + "'" : "") + '}';
    }
}
