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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named edge between two states, guarded by conditions and carrying its own retry, timeout
 * and hook policy.
 *
 * <p>Condition groups are OR'd: the transition is allowed when any group holds, or when there
 * are no groups at all. Conditional routing keys are evaluated in declaration order and the
 * first that holds overrides {@link #getTo()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class Transition {

    private final String name;
    private final String description;
    private final String from;
    private final String to;
    private final List<ConditionGroup> conditionGroups;
    private final Map<String, String> conditionalRouting;
    private final List<Route> routes;
    private final List<String> unparseableRoutes;
    private final int retryCount;
    private final Duration retryDelay;
    private final boolean exponentialBackoff;
    private final Duration timeout;
    private final List<String> preActions;
    private final List<String> postActions;
    private final int priority;
    private final List<TransitionTrigger> triggers;

    /**
     * A parsed conditional-routing entry.
     */
    public record Route(RoutingPredicate predicate, String target) {
    }

    private Transition(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.from = Objects.requireNonNull(builder.from, "Transition '" + builder.name + "' needs a from state");
        this.to = Objects.requireNonNull(builder.to, "Transition '" + builder.name + "' needs a to state");
        this.conditionGroups = List.copyOf(builder.conditionGroups);
        this.conditionalRouting = Collections.unmodifiableMap(new LinkedHashMap<>(builder.conditionalRouting));
        this.retryCount = builder.retryCount;
        this.retryDelay = builder.retryDelay;
        this.exponentialBackoff = builder.exponentialBackoff;
        this.timeout = builder.timeout;
        this.preActions = List.copyOf(builder.preActions);
        this.postActions = List.copyOf(builder.postActions);
        this.priority = builder.priority;
        this.triggers = List.copyOf(builder.triggers);

        List<Route> parsed = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        conditionalRouting.forEach((key, target) -> {
            Optional<RoutingPredicate> predicate = RoutingPredicate.tryParse(key);
            if (predicate.isPresent()) {
                parsed.add(new Route(predicate.get(), target));
            } else {
                invalid.add(key);
            }
        });
        this.routes = List.copyOf(parsed);
        this.unparseableRoutes = List.copyOf(invalid);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Delay to wait before the attempt that follows {@code attempt} (0-based).
     * Exponential backoff doubles the base delay for every attempt already made.
     */
    public Duration retryDelayFor(int attempt) {
        if (!exponentialBackoff) {
            return retryDelay;
        }
        int shift = Math.min(Math.max(attempt, 0), 30);
        return retryDelay.multipliedBy(1L << shift);
    }

    /**
     * Whether this transition fires in the given circumstances. A transition without
     * triggers can be requested manually by any actor.
     */
    public boolean isTriggered(TriggerContext context, Map<String, Object> instanceContext) {
        if (triggers.isEmpty()) {
            return context.getActorRole() != null;
        }
        for (TransitionTrigger trigger : triggers) {
            if (trigger.isTriggered(context, instanceContext)) {
                return true;
            }
        }
        return false;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    public List<ConditionGroup> getConditionGroups() {
        return conditionGroups;
    }

    public Map<String, String> getConditionalRouting() {
        return conditionalRouting;
    }

    public List<Route> getRoutes() {
        return routes;
    }

    List<String> getUnparseableRoutes() {
        return unparseableRoutes;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public boolean isExponentialBackoff() {
        return exponentialBackoff;
    }

    /**
     * The attempt timeout, or null when the transition is unbounded.
     */
    public Duration getTimeout() {
        return timeout;
    }

    public List<String> getPreActions() {
        return preActions;
    }

    public List<String> getPostActions() {
        return postActions;
    }

    public int getPriority() {
        return priority;
    }

    public List<TransitionTrigger> getTriggers() {
        return triggers;
    }

    @Override
    public String toString() {
        return "Transition{name='" + name + "', " + from + " -> " + to + ", priority=" + priority + '}';
    }

    public static class Builder {
        private final String name;
        private String description;
        private String from;
        private String to;
        private final List<ConditionGroup> conditionGroups = new ArrayList<>();
        private final Map<String, String> conditionalRouting = new LinkedHashMap<>();
        private int retryCount;
        private Duration retryDelay = Duration.ofSeconds(1);
        private boolean exponentialBackoff;
        private Duration timeout;
        private final List<String> preActions = new ArrayList<>();
        private final List<String> postActions = new ArrayList<>();
        private int priority = 1;
        private final List<TransitionTrigger> triggers = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Transition name cannot be null");
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder from(String from) {
            this.from = from;
            return this;
        }

        public Builder to(String to) {
            this.to = to;
            return this;
        }

        public Builder when(ConditionGroup group) {
            this.conditionGroups.add(Objects.requireNonNull(group, "Condition group cannot be null"));
            return this;
        }

        public Builder when(Condition condition) {
            return when(ConditionGroup.allOf(condition));
        }

        public Builder routeIf(String predicate, String target) {
            this.conditionalRouting.put(Objects.requireNonNull(predicate, "Routing predicate cannot be null"),
                    Objects.requireNonNull(target, "Routing target cannot be null"));
            return this;
        }

        public Builder retryCount(int retryCount) {
            if (retryCount < 0) {
                throw new IllegalArgumentException("Retry count cannot be negative");
            }
            this.retryCount = retryCount;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = Objects.requireNonNull(retryDelay, "Retry delay cannot be null");
            return this;
        }

        public Builder exponentialBackoff(boolean exponentialBackoff) {
            this.exponentialBackoff = exponentialBackoff;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder preAction(String action) {
            this.preActions.add(Objects.requireNonNull(action, "Action name cannot be null"));
            return this;
        }

        public Builder postAction(String action) {
            this.postActions.add(Objects.requireNonNull(action, "Action name cannot be null"));
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder trigger(TransitionTrigger trigger) {
            this.triggers.add(Objects.requireNonNull(trigger, "Trigger cannot be null"));
            return this;
        }

        public Transition build() {
            return new Transition(this);
        }
    }
}
