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

/**
 * What causes a transition to fire.
 */
public enum TriggerType {
    /** Fires whenever the transition's conditions hold. */
    AUTOMATIC,
    /** Fires on request from an actor holding an allowed role. */
    MANUAL,
    /** Fires at or after a point in time, or daily at a fixed time. */
    SCHEDULED,
    /** Fires when one of the listed event types arrives. */
    EVENT_DRIVEN
}
