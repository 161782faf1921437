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

import java.util.List;

/**
 * Thrown when a transition is requested that is not available from the instance's
 * current state.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class InvalidTransitionException extends TesseraException {

    private final String instanceId;
    private final String currentState;
    private final String requestedTransition;
    private final List<String> validTransitions;

    /**
     * Constructs an InvalidTransitionException with full context.
     *
     * @param instanceId          the workflow instance whose transition was rejected
     * @param currentState        the state the instance is in
     * @param requestedTransition the transition that was requested
     * @param validTransitions    the transitions available from the current state
     */
    public InvalidTransitionException(String instanceId, String currentState,
                                      String requestedTransition, List<String> validTransitions) {
        super(String.format("Invalid transition for '%s': '%s' is not available from state '%s'. Valid transitions: %s",
                instanceId, requestedTransition, currentState, validTransitions));
        this.instanceId = instanceId;
        this.currentState = currentState;
        this.requestedTransition = requestedTransition;
        this.validTransitions = validTransitions != null ? List.copyOf(validTransitions) : List.of();
    }

    public String getInstanceId() {
        return instanceId;
    }

    public String getCurrentState() {
        return currentState;
    }

    public String getRequestedTransition() {
        return requestedTransition;
    }

    public List<String> getValidTransitions() {
        return validTransitions;
    }
}
