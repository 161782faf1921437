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
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Safe accessors over the loosely typed maps produced by YAML and JSON loaders.
 */
public final class DefinitionMaps {

    private DefinitionMaps() {
    }

    public static String getString(Map<String, Object> data, String key) {
        return getString(data, key, null);
    }

    public static String getString(Map<String, Object> data, String key, String defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    public static String requireString(Map<String, Object> data, String key, String path) throws WorkflowParseException {
        String value = getString(data, key);
        if (value == null || value.trim().isEmpty()) {
            throw new WorkflowParseException(path + "." + key, "Required field is missing", null);
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> getMap(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> getMapList(Map<String, Object> data, String key, String path)
            throws WorkflowParseException {
        if (data == null) return List.of();
        Object value = data.get(key);
        if (value == null) return List.of();
        if (!(value instanceof List)) {
            throw new WorkflowParseException(path + "." + key, "Expected a list", null);
        }
        List<Map<String, Object>> result = new ArrayList<>();
        List<Object> items = (List<Object>) value;
        for (int i = 0; i < items.size(); i++) {
            if (!(items.get(i) instanceof Map)) {
                throw new WorkflowParseException(path + "." + key + "[" + i + "]", "Expected a mapping", null);
            }
            result.add((Map<String, Object>) items.get(i));
        }
        return result;
    }

    public static List<String> getStringList(Map<String, Object> data, String key) {
        if (data == null) return List.of();
        Object value = data.get(key);
        if (value instanceof List) {
            List<String> result = new ArrayList<>();
            for (Object item : (List<?>) value) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return result;
        }
        if (value != null) {
            return List.of(value.toString());
        }
        return List.of();
    }

    public static boolean getBoolean(Map<String, Object> data, String key, boolean defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    public static int getInt(Map<String, Object> data, String key, int defaultValue, String path)
            throws WorkflowParseException {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new WorkflowParseException(path + "." + key, "Not an integer: " + value, e);
        }
    }

    /**
     * Reads a duration written as {@code 500ms}, {@code 30s}, {@code 5m}, {@code 2h} or a bare
     * number of seconds.
     *
     * @return the duration, or {@code defaultValue} when the key is absent
     */
    public static Duration getDuration(Map<String, Object> data, String key, Duration defaultValue, String path)
            throws WorkflowParseException {
        if (data == null || data.get(key) == null) {
            return defaultValue;
        }
        try {
            return parseDuration(data.get(key).toString());
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path + "." + key, e.getMessage(), e);
        }
    }

    public static Duration parseDuration(String text) {
        String trimmed = text.trim().toLowerCase(Locale.ROOT);
        try {
            if (trimmed.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(trimmed.substring(0, trimmed.length() - 2).trim()));
            } else if (trimmed.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()));
            } else if (trimmed.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()));
            } else if (trimmed.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()));
            }
            return Duration.ofSeconds(Long.parseLong(trimmed));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid duration: " + text, e);
        }
    }
}
