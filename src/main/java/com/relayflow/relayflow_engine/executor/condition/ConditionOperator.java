package com.relayflow.relayflow_engine.executor.condition;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntPredicate;

/**
 * Comparisons a condition case can make. Ordering operators compare numerically and are false
 * when either side is not a number; nothing here throws.
 */
public enum ConditionOperator {
    EQUALS("equals", true),
    NOT_EQUALS("not_equals", true),
    CONTAINS("contains", true),
    NOT_CONTAINS("not_contains", true),
    STARTS_WITH("starts_with", true),
    ENDS_WITH("ends_with", true),
    IS_EMPTY("is_empty", false),
    IS_NOT_EMPTY("is_not_empty", false),
    GREATER_THAN("greater_than", true),
    LESS_THAN("less_than", true),
    GREATER_THAN_OR_EQUALS("greater_than_or_equals", true),
    LESS_THAN_OR_EQUALS("less_than_or_equals", true);

    private final String id;
    private final boolean needsValue;

    ConditionOperator(String id, boolean needsValue) {
        this.id = id;
        this.needsValue = needsValue;
    }

    public String id() {
        return id;
    }

    public boolean needsValue() {
        return needsValue;
    }

    public static Optional<ConditionOperator> fromId(String id) {
        return Arrays.stream(values()).filter(o -> o.id.equals(id)).findFirst();
    }

    public boolean test(Object actual, Object expected) {
        return switch (this) {
            case EQUALS -> same(actual, expected);
            case NOT_EQUALS -> !same(actual, expected);
            case CONTAINS -> actual != null && contains(actual, expected);
            case NOT_CONTAINS -> actual == null || !contains(actual, expected);
            case STARTS_WITH -> actual != null && String.valueOf(actual).startsWith(String.valueOf(expected));
            case ENDS_WITH -> actual != null && String.valueOf(actual).endsWith(String.valueOf(expected));
            case IS_EMPTY -> isEmpty(actual);
            case IS_NOT_EMPTY -> !isEmpty(actual);
            case GREATER_THAN -> ordered(actual, expected, c -> c > 0);
            case LESS_THAN -> ordered(actual, expected, c -> c < 0);
            case GREATER_THAN_OR_EQUALS -> ordered(actual, expected, c -> c >= 0);
            case LESS_THAN_OR_EQUALS -> ordered(actual, expected, c -> c <= 0);
        };
    }

    private static boolean same(Object actual, Object expected) {
        BigDecimal a = number(actual);
        BigDecimal e = number(expected);
        if (a != null && e != null && actual instanceof Number && expected instanceof Number) {
            return a.compareTo(e) == 0;
        }
        return Objects.equals(actual, expected);
    }

    private static boolean contains(Object actual, Object expected) {
        if (actual instanceof Collection<?> collection) {
            return collection.stream().anyMatch(item -> same(item, expected));
        }
        return String.valueOf(actual).contains(String.valueOf(expected));
    }

    private static boolean isEmpty(Object value) {
        if (value == null) return true;
        if (value instanceof CharSequence s) return s.length() == 0;
        if (value instanceof Collection<?> c) return c.isEmpty();
        if (value instanceof Map<?, ?> m) return m.isEmpty();
        return false;
    }

    private static boolean ordered(Object actual, Object expected, IntPredicate test) {
        BigDecimal a = number(actual);
        BigDecimal e = number(expected);
        return a != null && e != null && test.test(a.compareTo(e));
    }

    // Numbers and numeric strings; null for anything else
    private static BigDecimal number(Object value) {
        if (value instanceof BigDecimal d) return d;
        if (value instanceof Number n) {
            try {
                return new BigDecimal(n.toString());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return new BigDecimal(s.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }
}
