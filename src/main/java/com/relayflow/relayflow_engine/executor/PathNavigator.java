package com.relayflow.relayflow_engine.executor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Walks a map/list tree by path. Supports {@code a.b.c}, {@code items[0].name} and
 * {@code items.0.name}. A numeric segment indexes lists and is a plain key for maps.
 */
public final class PathNavigator {

    /** Returned when a step of the path does not exist; distinct from a present null. */
    public static final Object MISSING = new Object() {
        @Override
        public String toString() {
            return "<missing>";
        }
    };

    private PathNavigator() {
    }

    public static Object navigate(Object root, String path) {
        if (path == null || path.isBlank()) return root;
        Object current = root;
        for (String segment : segments(path)) {
            if (current instanceof Map<?, ?> map) {
                if (!map.containsKey(segment)) return MISSING;
                current = map.get(segment);
            } else if (current instanceof List<?> list && isIndex(segment)) {
                int idx = Integer.parseInt(segment);
                if (idx >= list.size()) return MISSING;
                current = list.get(idx);
            } else {
                return MISSING;
            }
        }
        return current;
    }

    static List<String> segments(String path) {
        List<String> segments = new ArrayList<>();
        StringBuilder token = new StringBuilder();
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '.' || c == '[' || c == ']') {
                if (!token.isEmpty()) {
                    segments.add(token.toString().trim());
                    token.setLength(0);
                }
            } else {
                token.append(c);
            }
        }
        if (!token.isEmpty()) {
            segments.add(token.toString().trim());
        }
        return segments;
    }

    private static boolean isIndex(String segment) {
        return !segment.isEmpty() && segment.length() < 10 && segment.chars().allMatch(Character::isDigit);
    }
}
