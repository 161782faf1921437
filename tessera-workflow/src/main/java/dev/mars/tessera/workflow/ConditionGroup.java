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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A set of conditions combined with AND or OR. An empty group always holds.
 */
public final class ConditionGroup {

    private final List<Condition> conditions;
    private final LogicalOperator operator;

    public ConditionGroup(List<Condition> conditions, LogicalOperator operator) {
        this.conditions = conditions != null ? List.copyOf(conditions) : List.of();
        this.operator = Objects.requireNonNull(operator, "Logical operator cannot be null");
    }

    public static ConditionGroup allOf(Condition... conditions) {
        return new ConditionGroup(Arrays.asList(conditions), LogicalOperator.AND);
    }

    public static ConditionGroup anyOf(Condition... conditions) {
        return new ConditionGroup(Arrays.asList(conditions), LogicalOperator.OR);
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public LogicalOperator getOperator() {
        return operator;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConditionGroup that = (ConditionGroup) o;
        return conditions.equals(that.conditions) && operator == that.operator;
    }

    @Override
    public int hashCode() {
        return Objects.hash(conditions, operator);
    }

    @Override
    public String toString() {
        return operator + conditions.toString();
    }
}
