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

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Action registry backed by a name-to-action map.
 *
 * <p>Exceptions other than {@link ActionException} raised by an action are wrapped as
 * non-retryable failures.</p>
 */
public class MapActionRegistry implements ActionRegistry {

    private static final Logger logger = Logger.getLogger(MapActionRegistry.class.getName());

    private final Map<String, WorkflowAction> actions = new ConcurrentHashMap<>();

    public MapActionRegistry register(String name, WorkflowAction action) {
        Objects.requireNonNull(name, "Action name cannot be null");
        Objects.requireNonNull(action, "Action cannot be null");
        if (actions.putIfAbsent(name, action) != null) {
            throw new IllegalArgumentException("Action already registered: " + name);
        }
        return this;
    }

    public Set<String> getActionNames() {
        return Set.copyOf(actions.keySet());
    }

    @Override
    public void run(String actionName, WorkflowInstance instance) throws ActionException {
        WorkflowAction action = actions.get(actionName);
        if (action == null) {
            throw new ActionException(actionName, "No such action registered");
        }
        logger.fine("Running action " + actionName + " for instance " + instance.getInstanceId());
        try {
            action.execute(instance);
        } catch (ActionException e) {
            throw e;
        } catch (Exception e) {
            throw new ActionException(actionName, e.getMessage(), false, e);
        }
    }
}
