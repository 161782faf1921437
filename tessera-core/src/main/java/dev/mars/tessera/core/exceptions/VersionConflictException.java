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
 * Thrown by a store when a save carries a stale expected version.
 * The losing writer retries; it never overwrites.
 */
public class VersionConflictException extends TesseraException {

    private final String instanceId;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String instanceId, long expectedVersion, long actualVersion) {
        super(String.format("Version conflict for instance '%s': expected %d but store holds %d",
                instanceId, expectedVersion, actualVersion));
        this.instanceId = instanceId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
