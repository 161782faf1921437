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

/**
 * Thrown when none of a transition's condition groups holds for the instance context.
 * This is a business gate, not a fault: the caller decides what to do next.
 */
public class ConditionNotMetException extends TesseraException {

    private final String instanceId;
    private final String transitionName;

    public ConditionNotMetException(String instanceId, String transitionName) {
        super("Transition conditions not met for '" + transitionName + "' on instance " + instanceId);
        this.instanceId = instanceId;
        this.transitionName = transitionName;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public String getTransitionName() {
        return transitionName;
    }
}
