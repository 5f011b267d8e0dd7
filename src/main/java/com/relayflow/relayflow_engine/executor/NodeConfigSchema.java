package com.relayflow.relayflow_engine.executor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declared shape of a node's static config. Validation reports every violation and never
 * coerces: {@code "5"} is not an INTEGER. A field marked {@code templated} also accepts a
 * string holding a {@code {{...}}} placeholder, which is converted after rendering.
 */
public final class NodeConfigSchema {

    public enum FieldType { STRING, INTEGER, NUMBER, BOOLEAN, MAP, LIST, ANY }

    public record ConfigField(String name, FieldType type, boolean required, boolean templated, Set<String> allowed) {
    }

    private static final NodeConfigSchema EMPTY = new NodeConfigSchema(Map.of());

    private final Map<String, ConfigField> fields;

    private NodeConfigSchema(Map<String, ConfigField> fields) {
        this.fields = fields;
    }

    public static NodeConfigSchema empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Collection<ConfigField> fields() {
        return fields.values();
    }

    public boolean isTemplated(String name) {
        ConfigField field = fields.get(name);
        return field != null && field.templated();
    }

    public List<String> validate(Map<String, Object> config) {
        List<String> violations = new ArrayList<>();
        Map<String, Object> values = config != null ? config : Map.of();

        for (String key : values.keySet()) {
            if (!fields.containsKey(key)) {
                violations.add("unknown field '" + key + "'");
            }
        }
        for (ConfigField field : fields.values()) {
            Object value = values.get(field.name());
            if (value == null) {
                if (field.required()) violations.add("missing required field '" + field.name() + "'");
                continue;
            }
            if (field.templated() && value instanceof String s && s.contains("{{")) {
                continue;
            }
            if (!matches(field.type(), value)) {
                violations.add("field '" + field.name() + "' must be " + field.type()
                        + " but was " + value.getClass().getSimpleName());
                continue;
            }
            if (!field.allowed().isEmpty() && !field.allowed().contains(String.valueOf(value))) {
                violations.add("field '" + field.name() + "' must be one of " + field.allowed()
                        + " but was '" + value + "'");
            }
        }
        return violations;
    }

    private static boolean matches(FieldType type, Object value) {
        return switch (type) {
            case STRING -> value instanceof String;
            case INTEGER -> value instanceof Integer || value instanceof Long || value instanceof Short;
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case MAP -> value instanceof Map;
            case LIST -> value instanceof List;
            case ANY -> true;
        };
    }

    public static final class Builder {
        private final Map<String, ConfigField> fields = new LinkedHashMap<>();

        public Builder required(String name, FieldType type) {
            return add(new ConfigField(name, type, true, false, Set.of()));
        }

        public Builder optional(String name, FieldType type) {
            return add(new ConfigField(name, type, false, false, Set.of()));
        }

        public Builder requiredTemplate(String name, FieldType type) {
            return add(new ConfigField(name, type, true, true, Set.of()));
        }

        public Builder optionalTemplate(String name, FieldType type) {
            return add(new ConfigField(name, type, false, true, Set.of()));
        }

        public Builder oneOf(String name, boolean required, String... allowed) {
            return add(new ConfigField(name, FieldType.STRING, required, false, Set.of(allowed)));
        }

        private Builder add(ConfigField field) {
            fields.put(field.name(), field);
            return this;
        }

        public NodeConfigSchema build() {
            return new NodeConfigSchema(Map.copyOf(fields));
        }
    }
}
