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
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Declares what may cause a transition to fire.
 *
 * <p>A daily scheduled trigger fires at most once per calendar day. The day it last fired is
 * kept in the instance context under {@link #lastTriggerKey()} as an ISO date.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class TransitionTrigger {

    private static final Logger logger = Logger.getLogger(TransitionTrigger.class.getName());

    private final String name;
    private final String description;
    private final TriggerType type;
    private final Set<String> eventTypes;
    private final Instant scheduledTime;
    private final LocalTime dailyAt;
    private final Set<String> allowedRoles;

    private TransitionTrigger(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.type = builder.type;
        this.eventTypes = Set.copyOf(builder.eventTypes);
        this.scheduledTime = builder.scheduledTime;
        this.dailyAt = builder.dailyAt;
        this.allowedRoles = Set.copyOf(builder.allowedRoles);
    }

    public static Builder builder(String name, TriggerType type) {
        return new Builder(name, type);
    }

    public static TransitionTrigger automatic(String name) {
        return builder(name, TriggerType.AUTOMATIC).build();
    }

    public static TransitionTrigger onEvent(String name, String... eventTypes) {
        return builder(name, TriggerType.EVENT_DRIVEN).eventTypes(List.of(eventTypes)).build();
    }

    public static TransitionTrigger daily(String name, LocalTime at) {
        return builder(name, TriggerType.SCHEDULED).dailyAt(at).build();
    }

    /**
     * Whether this trigger fires in the given circumstances.
     *
     * @param context         the event, actor role or clock being checked
     * @param instanceContext the instance's context data, used for daily bookkeeping
     */
    public boolean isTriggered(TriggerContext context, Map<String, Object> instanceContext) {
        switch (type) {
            case AUTOMATIC:
                return true;
            case EVENT_DRIVEN:
                return context.getEventType() != null && eventTypes.contains(context.getEventType());
            case MANUAL:
                return context.getActorRole() != null && allowedRoles.contains(context.getActorRole());
            case SCHEDULED:
                return isScheduleDue(context, instanceContext);
            default:
                return false;
        }
    }

    private boolean isScheduleDue(TriggerContext context, Map<String, Object> instanceContext) {
        Instant now = context.getNow();
        if (scheduledTime != null && !now.isBefore(scheduledTime)) {
            return true;
        }
        if (dailyAt == null) {
            return false;
        }
        ZonedDateTime localNow = now.atZone(context.getZone());
        LocalDate today = localNow.toLocalDate();
        Object last = instanceContext != null ? instanceContext.get(lastTriggerKey()) : null;
        if (last != null && today.equals(parseDay(last.toString()))) {
            return false;
        }
        return !localNow.toLocalTime().isBefore(dailyAt);
    }

    private LocalDate parseDay(String value) {
        try {
            return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
        } catch (DateTimeParseException e) {
            logger.fine("Ignoring unreadable " + lastTriggerKey() + " value: " + value);
            return null;
        }
    }

    /**
     * Context key recording the last day a daily trigger fired.
     */
    public String lastTriggerKey() {
        return "last_trigger_" + name;
    }

    public boolean isDaily() {
        return type == TriggerType.SCHEDULED && dailyAt != null;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public TriggerType getType() {
        return type;
    }

    public Set<String> getEventTypes() {
        return eventTypes;
    }

    public Instant getScheduledTime() {
        return scheduledTime;
    }

    public LocalTime getDailyAt() {
        return dailyAt;
    }

    public Set<String> getAllowedRoles() {
        return allowedRoles;
    }

    @Override
    public String toString() {
        return "TransitionTrigger{name='" + name + "', type=" + type + '}';
    }

    public static class Builder {
        private final String name;
        private final TriggerType type;
        private String description;
        private List<String> eventTypes = List.of();
        private Instant scheduledTime;
        private LocalTime dailyAt;
        private List<String> allowedRoles = List.of();

        private Builder(String name, TriggerType type) {
            this.name = Objects.requireNonNull(name, "Trigger name cannot be null");
            this.type = Objects.requireNonNull(type, "Trigger type cannot be null");
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder eventTypes(List<String> eventTypes) {
            this.eventTypes = eventTypes != null ? eventTypes : List.of();
            return this;
        }

        public Builder scheduledTime(Instant scheduledTime) {
            this.scheduledTime = scheduledTime;
            return this;
        }

        public Builder dailyAt(LocalTime dailyAt) {
            this.dailyAt = dailyAt;
            return this;
        }

        public Builder allowedRoles(List<String> allowedRoles) {
            this.allowedRoles = allowedRoles != null ? allowedRoles : List.of();
            return this;
        }

        public TransitionTrigger build() {
            if (type == TriggerType.EVENT_DRIVEN && eventTypes.isEmpty()) {
                throw new IllegalArgumentException("Event-driven trigger '" + name + "' needs at least one event type");
            }
            if (type == TriggerType.SCHEDULED && scheduledTime == null && dailyAt == null) {
                throw new IllegalArgumentException("Scheduled trigger '" + name + "' needs a time or a daily schedule");
            }
            return new TransitionTrigger(this);
        }
    }
}
