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

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * The circumstances under which triggers are being checked.
 */
public final class TriggerContext {

    private final Instant now;
    private final ZoneId zone;
    private final String eventType;
    private final String actorRole;

    private TriggerContext(Instant now, ZoneId zone, String eventType, String actorRole) {
        this.now = Objects.requireNonNull(now, "Current time cannot be null");
        this.zone = Objects.requireNonNull(zone, "Zone cannot be null");
        this.eventType = eventType;
        this.actorRole = actorRole;
    }

    public static TriggerContext event(String eventType, Instant now) {
        return new TriggerContext(now, ZoneOffset.UTC, Objects.requireNonNull(eventType, "Event type cannot be null"), null);
    }

    public static TriggerContext manual(String actorRole, Instant now) {
        return new TriggerContext(now, ZoneOffset.UTC, null, Objects.requireNonNull(actorRole, "Actor role cannot be null"));
    }

    public static TriggerContext scheduled(Instant now) {
        return new TriggerContext(now, ZoneOffset.UTC, null, null);
    }

    /**
     * Returns a copy that evaluates daily triggers in the given zone.
     */
    public TriggerContext inZone(ZoneId zone) {
        return new TriggerContext(now, zone, eventType, actorRole);
    }

    public Instant getNow() {
        return now;
    }

    public ZoneId getZone() {
        return zone;
    }

    public String getEventType() {
        return eventType;
    }

    public String getActorRole() {
        return actorRole;
    }

    @Override
    public String toString() {
        return "TriggerContext{now=" + now +
                (eventType != null ? ", event='" + eventType + "'" : "") +
                (actorRole != null ? ", role='" + actorRole + "'" : "") + '}';
    }
}
