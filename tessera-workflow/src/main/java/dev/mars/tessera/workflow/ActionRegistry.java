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

package dev.mars.tessera.workflow;

import dev.mars.tessera.core.WorkflowInstance;
import dev.mars.tessera.core.exceptions.ActionException;

/**
 * Resolves the named pre- and post-transition hooks declared on transitions.
 * What a named action means is entirely up to the registry.
 */
public interface ActionRegistry {

    /**
     * Runs an action against a copy of the instance.
     *
     * @throws ActionException if the action is unknown or fails; a retryable failure lets the
     *                         caller try the transition again
     */
    void run(String actionName, WorkflowInstance instance) throws ActionException;

    static ActionRegistry empty() {
        return new MapActionRegistry();
    }
}
