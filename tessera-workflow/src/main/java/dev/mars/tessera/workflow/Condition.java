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

import java.util.Objects;

/**
 * A single predicate over a dot-separated path into an instance's context data.
 * String comparisons ignore case unless {@code caseSensitive} is set.
 */
public final class Condition {

    private final String fieldPath;
    private final ConditionOperator operator;
    private final Object expected;
    private final boolean caseSensitive;

    public Condition(String fieldPath, ConditionOperator operator, Object expected, boolean caseSensitive) {
        this.fieldPath = Objects.requireNonNull(fieldPath, "Field path cannot be null");
        this.operator = Objects.requireNonNull(operator, "Operator cannot be null");
        this.expected = expected;
        this.caseSensitive = caseSensitive;
        if (fieldPath.isBlank()) {
            throw new IllegalArgumentException("Field path cannot be blank");
        }
    }

    public static Condition of(String fieldPath, ConditionOperator operator, Object expected) {
        return new Condition(fieldPath, operator, expected, false);
    }

    public static Condition exists(String fieldPath) {
        return new Condition(fieldPath, ConditionOperator.EXISTS, null, false);
    }

    public String getFieldPath() {
        return fieldPath;
    }

    public ConditionOperator getOperator() {
        return operator;
    }

    public Object getExpected() {
        return expected;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Condition that = (Condition) o;
        return caseSensitive == that.caseSensitive &&
                fieldPath.equals(that.fieldPath) &&
                operator == that.operator &&
                Objects.equals(expected, that.expected);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fieldPath, operator, expected, caseSensitive);
    }

    @Override
    public String toString() {
        return fieldPath + " " + operator + (operator.isPresenceCheck() ? "" : " " + expected);
    }
}
