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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the caller of {@code startPattern} gets back once the first step has run.
 *
 * @param instanceId the pattern instance
 * @param workflowId {@code pattern:<name>}
 * @param status     {@code started} while later steps run in the background, otherwise
 *                   {@code completed} or {@code failed}
 */
public record PatternStartResult(String instanceId, String workflowId, String status) {

    public static final String STARTED = "started";
    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("instanceId", instanceId);
        map.put("workflowId", workflowId);
        map.put("status", status);
        return map;
    }
}
