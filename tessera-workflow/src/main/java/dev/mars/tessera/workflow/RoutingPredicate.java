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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A conditional-routing key such as {@code "priority == high"} or {@code "amount >= 1000"},
 * parsed into a case-sensitive {@link Condition}.
 *
 * <p>Grammar: {@code field op [value]}. Operators are {@code == != > < >= <= in not_in contains
 * not_contains exists not_exists matches}. Literals {@code true}/{@code false}, integers and
 * decimals are typed; anything else is a string, with surrounding quotes removed. An {@code in}
 * value is a comma-separated list, optionally wrapped in brackets.</p>
 */
public final class RoutingPredicate {

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private static final Map<String, ConditionOperator> OPERATORS = Map.ofEntries(
            Map.entry("==", ConditionOperator.EQUALS),
            Map.entry("!=", ConditionOperator.NOT_EQUALS),
            Map.entry(">", ConditionOperator.GREATER_THAN),
            Map.entry("<", ConditionOperator.LESS_THAN),
            Map.entry(">=", ConditionOperator.GREATER_THAN_OR_EQUAL),
            Map.entry("<=", ConditionOperator.LESS_THAN_OR_EQUAL),
            Map.entry("in", ConditionOperator.IN),
            Map.entry("not_in", ConditionOperator.NOT_IN),
            Map.entry("contains", ConditionOperator.CONTAINS),
            Map.entry("not_contains", ConditionOperator.NOT_CONTAINS),
            Map.entry("exists", ConditionOperator.EXISTS),
            Map.entry("not_exists", ConditionOperator.NOT_EXISTS),
            Map.entry("matches", ConditionOperator.REGEX));

    private final String expression;
    private final Condition condition;

    private RoutingPredicate(String expression, Condition condition) {
        this.expression = expression;
        this.condition = condition;
    }

    /**
     * Parses a routing key.
     *
     * @throws IllegalArgumentException if the key is not of the form {@code field op [value]}
     */
    public static RoutingPredicate parse(String expression) {
        Objects.requireNonNull(expression, "Routing expression cannot be null");
        String[] parts = expression.trim().split("\\s+", 3);
        if (parts.length < 2 || parts[0].isEmpty()) {
            throw new IllegalArgumentException("Routing predicate must be 'field op value': " + expression);
        }
        ConditionOperator operator = OPERATORS.get(parts[1]);
        if (operator == null) {
            throw new IllegalArgumentException("Unknown operator '" + parts[1] + "' in routing predicate: " + expression);
        }
        Object expected = null;
        if (!operator.isPresenceCheck()) {
            if (parts.length < 3) {
                throw new IllegalArgumentException("Missing value in routing predicate: " + expression);
            }
            expected = (operator == ConditionOperator.IN || operator == ConditionOperator.NOT_IN)
                    ? parseList(parts[2])
                    : parseLiteral(parts[2]);
        } else if (parts.length == 3) {
            throw new IllegalArgumentException("Operator '" + parts[1] + "' takes no value: " + expression);
        }
        return new RoutingPredicate(expression, new Condition(parts[0], operator, expected, true));
    }

    public static Optional<RoutingPredicate> tryParse(String expression) {
        try {
            return Optional.of(parse(expression));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    static Object parseLiteral(String raw) {
        String value = raw.trim();
        if ("true".equals(value)) {
            return Boolean.TRUE;
        }
        if ("false".equals(value)) {
            return Boolean.FALSE;
        }
        if (INTEGER.matcher(value).matches()) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                return new java.math.BigDecimal(value);
            }
        }
        if (DECIMAL.matcher(value).matches()) {
            return Double.parseDouble(value);
        }
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private static List<Object> parseList(String raw) {
        String value = raw.trim();
        if (value.startsWith("[") && value.endsWith("]")) {
            value = value.substring(1, value.length() - 1);
        }
        List<Object> items = new ArrayList<>();
        for (String item : value.split(",")) {
            if (!item.isBlank()) {
                items.add(parseLiteral(item));
            }
        }
        return items;
    }

    public String getExpression() {
        return expression;
    }

    public Condition getCondition() {
        return condition;
    }

    @Override
    public String toString() {
        return expression;
    }
}
