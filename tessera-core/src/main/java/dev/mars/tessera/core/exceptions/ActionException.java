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
 * Failure of a named pre- or post-transition hook.
 */
public class ActionException extends TesseraException {

    private final String actionName;
    private final boolean retryable;

    public ActionException(String actionName, String message) {
        this(actionName, message, false, null);
    }

    public ActionException(String actionName, String message, boolean retryable) {
        this(actionName, message, retryable, null);
    }

    public ActionException(String actionName, String message, boolean retryable, Throwable cause) {
        super("Action '" + actionName + "' failed: " + message, cause);
        this.actionName = actionName;
        this.retryable = retryable;
    }

    public String getActionName() {
        return actionName;
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }
}
