package com.relayflow.relayflow_engine.executor;

import com.relayflow.relayflow_engine.exception.ConfigValidationException;

import java.util.List;
import java.util.Map;

/**
 * Typed reads from a rendered config map. Templated fields arrive as strings after
 * rendering and are converted here explicitly; a failed conversion is a config violation.
 */
public final class ConfigReader {

    private ConfigReader() {
    }

    public static String string(Map<String, Object> config, String key, String defaultValue) {
        Object value = config.get(key);
        return value == null ? defaultValue : String.valueOf(value);
    }

    public static String requireString(Map<String, Object> config, String key) {
        String value = string(config, key, null);
        if (value == null || value.isBlank()) {
            throw new ConfigValidationException("field '" + key + "' is required");
        }
        return value;
    }

    public static Integer integer(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) return null;
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.valueOf(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ConfigValidationException("field '" + key + "' must be an integer but was '" + value + "'");
        }
    }

    public static int requireInteger(Map<String, Object> config, String key) {
        Integer value = integer(config, key);
        if (value == null) {
            throw new ConfigValidationException("field '" + key + "' is required");
        }
        return value;
    }

    public static boolean bool(Map<String, Object> config, String key, boolean defaultValue) {
        Object value = config.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean b) return b;
        String s = String.valueOf(value).trim();
        if ("true".equalsIgnoreCase(s)) return true;
        if ("false".equalsIgnoreCase(s)) return false;
        throw new ConfigValidationException("field '" + key + "' must be a boolean but was '" + value + "'");
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> map(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) return Map.of();
        if (value instanceof Map<?, ?> m) return (Map<String, Object>) m;
        throw new ConfigValidationException("field '" + key + "' must be a map");
    }

    public static List<String> stringList(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) return List.of();
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        if (value instanceof String s) {
            return List.of(s.split("\\s*,\\s*"));
        }
        throw new ConfigValidationException("field '" + key + "' must be a list");
    }
}
