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
 * Base checked exception for all Tessera failures.
 *
 * <p>Subclasses declare whether the failure is transient through {@link #isRetryable()}.
 * Only timeouts, store version conflicts and hook failures flagged as retryable are
 * retried by the orchestrator.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TesseraException extends Exception {

    public TesseraException(String message) {
        super(message);
    }

    public TesseraException(String message, Throwable cause) {
        super(message, cause);
    }

    public TesseraException(Throwable cause) {
        super(cause);
    }

    /**
     * Whether the operation that produced this exception may succeed if attempted again.
     *
     * @return true for transient failures
     */
    public boolean isRetryable() {
        return false;
    }
}
