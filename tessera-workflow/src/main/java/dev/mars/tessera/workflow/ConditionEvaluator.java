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

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.logging.Logger;

/**
 * Evaluates conditions against an instance's context data.
 *
 * <p>Field paths are dot-separated and walk nested maps. A missing or non-map intermediate yields
 * {@code null}, which satisfies only {@link ConditionOperator#NOT_EXISTS} and fails every other
 * operator. Numbers compare numerically whatever their boxed type. Operands that cannot be
 * compared make the condition false rather than raising an error.</p>
 *
 * <p>The evaluator is stateless and thread-safe. Regular expressions are compiled per call.</p>
 */
public class ConditionEvaluator {

    private static final Logger logger = Logger.getLogger(ConditionEvaluator.class.getName());

    /**
     * True if any group holds. An empty list means the transition is unconditional.
     */
    public boolean satisfiesAny(List<ConditionGroup> groups, Map<String, Object> context) {
        if (groups == null || groups.isEmpty()) {
            return true;
        }
        for (ConditionGroup group : groups) {
            if (evaluate(group, context)) {
                return true;
            }
        }
        return false;
    }

    public boolean evaluate(ConditionGroup group, Map<String, Object> context) {
        if (group.isEmpty()) {
            return true;
        }
        if (group.getOperator() == LogicalOperator.AND) {
            for (Condition condition : group.getConditions()) {
                if (!evaluate(condition, context)) {
                    return false;
                }
            }
            return true;
        }
        for (Condition condition : group.getConditions()) {
            if (evaluate(condition, context)) {
                return true;
            }
        }
        return false;
    }

    public boolean evaluate(Condition condition, Map<String, Object> context) {
        Object actual = resolveField(condition.getFieldPath(), context);
        ConditionOperator operator = condition.getOperator();
        if (operator == ConditionOperator.EXISTS) {
            return actual != null;
        }
        if (operator == ConditionOperator.NOT_EXISTS) {
            return actual == null;
        }
        if (actual == null) {
            return false;
        }

        Object expected = condition.getExpected();
        boolean caseSensitive = condition.isCaseSensitive();
        Integer comparison;
        switch (operator) {
            case EQUALS:
                return valuesEqual(actual, expected, caseSensitive);
            case NOT_EQUALS:
                return !valuesEqual(actual, expected, caseSensitive);
            case GREATER_THAN:
                comparison = compare(actual, expected, caseSensitive);
                return comparison != null && comparison > 0;
            case LESS_THAN:
                comparison = compare(actual, expected, caseSensitive);
                return comparison != null && comparison < 0;
            case GREATER_THAN_OR_EQUAL:
                comparison = compare(actual, expected, caseSensitive);
                return comparison != null && comparison >= 0;
            case LESS_THAN_OR_EQUAL:
                comparison = compare(actual, expected, caseSensitive);
                return comparison != null && comparison <= 0;
            case CONTAINS:
                return Boolean.TRUE.equals(contains(actual, expected, caseSensitive));
            case NOT_CONTAINS:
                return Boolean.FALSE.equals(contains(actual, expected, caseSensitive));
            case IN:
                return Boolean.TRUE.equals(memberOf(actual, expected, caseSensitive));
            case NOT_IN:
                return Boolean.FALSE.equals(memberOf(actual, expected, caseSensitive));
            case REGEX:
                return matchesRegex(actual, expected, caseSensitive);
            default:
                return false;
        }
    }

    /**
     * Walks a dot-separated path through nested maps.
     *
     * @return the value found, or null when any segment is missing or not a map
     */
    public Object resolveField(String path, Map<String, Object> context) {
        if (path == null || context == null) {
            return null;
        }
        Object current = context;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private boolean valuesEqual(Object actual, Object expected, boolean caseSensitive) {
        if (actual == null || expected == null) {
            return actual == expected;
        }
        if (actual instanceof Number && expected instanceof Number) {
            BigDecimal a = toDecimal((Number) actual);
            BigDecimal b = toDecimal((Number) expected);
            return a != null && b != null ? a.compareTo(b) == 0 : actual.equals(expected);
        }
        if (actual instanceof CharSequence && expected instanceof CharSequence) {
            return normalize(actual, caseSensitive).equals(normalize(expected, caseSensitive));
        }
        return actual.equals(expected);
    }

    private Integer compare(Object actual, Object expected, boolean caseSensitive) {
        if (actual instanceof Number && expected instanceof Number) {
            BigDecimal a = toDecimal((Number) actual);
            BigDecimal b = toDecimal((Number) expected);
            return a != null && b != null ? a.compareTo(b) : null;
        }
        if (actual instanceof CharSequence && expected instanceof CharSequence) {
            return normalize(actual, caseSensitive).compareTo(normalize(expected, caseSensitive));
        }
        return null;
    }

    /**
     * @return null when the container type does not support membership
     */
    private Boolean contains(Object container, Object item, boolean caseSensitive) {
        if (container instanceof CharSequence) {
            if (item == null) {
                return null;
            }
            return normalize(container, caseSensitive).contains(normalize(item, caseSensitive));
        }
        if (container instanceof Collection) {
            for (Object element : (Collection<?>) container) {
                if (valuesEqual(element, item, caseSensitive)) {
                    return true;
                }
            }
            return false;
        }
        if (container instanceof Map) {
            for (Object key : ((Map<?, ?>) container).keySet()) {
                if (valuesEqual(key, item, caseSensitive)) {
                    return true;
                }
            }
            return false;
        }
        return null;
    }

    private Boolean memberOf(Object actual, Object candidates, boolean caseSensitive) {
        if (candidates instanceof Collection) {
            return contains(candidates, actual, caseSensitive);
        }
        if (candidates == null) {
            return null;
        }
        return valuesEqual(actual, candidates, caseSensitive);
    }

    private boolean matchesRegex(Object actual, Object expected, boolean caseSensitive) {
        if (expected == null) {
            return false;
        }
        try {
            Pattern pattern = caseSensitive
                    ? Pattern.compile(expected.toString())
                    : Pattern.compile(expected.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            return pattern.matcher(actual.toString()).lookingAt();
        } catch (PatternSyntaxException e) {
            logger.fine("Malformed regex treated as no match: " + e.getMessage());
            return false;
        }
    }

    private static String normalize(Object value, boolean caseSensitive) {
        String text = value.toString();
        return caseSensitive ? text : text.toLowerCase(Locale.ROOT);
    }

    private static BigDecimal toDecimal(Number number) {
        try {
            if (number instanceof BigDecimal) {
                return (BigDecimal) number;
            }
            if (number instanceof Double || number instanceof Float) {
                double value = number.doubleValue();
                return Double.isFinite(value) ? BigDecimal.valueOf(value) : null;
            }
            return new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
