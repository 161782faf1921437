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

import java.util.Locale;

/**
 * Comparison applied by a {@link Condition} to the value found at its field path.
 */
public enum ConditionOperator {
    EQUALS,
    NOT_EQUALS,
    GREATER_THAN,
    LESS_THAN,
    GREATER_THAN_OR_EQUAL,
    LESS_THAN_OR_EQUAL,
    CONTAINS,
    NOT_CONTAINS,
    IN,
    NOT_IN,
    EXISTS,
    NOT_EXISTS,
    REGEX;

    /**
     * Parses an operator name as written in definition files. Accepts the enum name in any
     * case, plus the aliases {@code regex_match} and {@code matches}.
     *
     * @throws IllegalArgumentException for an unknown operator
     */
    public static ConditionOperator fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Condition operator is required");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("REGEX_MATCH".equals(normalized) || "MATCHES".equals(normalized)) {
            return REGEX;
        }
        return valueOf(normalized);
    }

    /**
     * Whether this operator only tests for presence and so ignores the expected value.
     */
    public boolean isPresenceCheck() {
        return this == EXISTS || this == NOT_EXISTS;
    }
}
