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

import dev.mars.tessera.worker.HealthStatus;
import dev.mars.tessera.worker.WorkerHealth;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated health of every registered worker.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class OrchestratorHealth {

    private final HealthStatus status;
    private final Instant timestamp;
    private final List<WorkerHealth> workers;
    private final String message;

    private OrchestratorHealth(Builder builder) {
        this.status = builder.status;
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.workers = List.copyOf(builder.workers);
        this.message = builder.message;
    }

    public HealthStatus getStatus() {
        return status;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public List<WorkerHealth> getWorkers() {
        return workers;
    }

    public String getMessage() {
        return message;
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("status", status.name());
        map.put("timestamp", timestamp.toString());
        if (message != null) {
            map.put("message", message);
        }

        List<Map<String, Object>> workerMaps = new ArrayList<>();
        for (WorkerHealth worker : workers) {
            workerMaps.add(worker.toMap());
        }
        map.put("workers", workerMaps);

        long healthy = workers.stream().filter(WorkerHealth::isHealthy).count();
        Map<String, Object> summary = new HashMap<>();
        summary.put("totalWorkers", workers.size());
        summary.put("healthyWorkers", healthy);
        summary.put("unhealthyWorkers", workers.size() - healthy);
        map.put("summary", summary);
        return map;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private HealthStatus status = HealthStatus.HEALTHY;
        private Instant timestamp;
        private final List<WorkerHealth> workers = new ArrayList<>();
        private String message;

        public Builder status(HealthStatus status) {
            this.status = status;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder worker(WorkerHealth worker) {
            this.workers.add(worker);
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public OrchestratorHealth build() {
            return new OrchestratorHealth(this);
        }
    }
}
