package com.relayflow.relayflow_engine.executor;

import java.util.regex.Pattern;

/**
 * One {@code {{root.path}}} placeholder. {@code root} is a node id (or {@code trigger}),
 * {@code path} the remainder with the leading dot removed, possibly empty.
 */
public record Reference(String root, String path, String raw) {

    // Matches {{fetch.output.items[0].name}}, whitespace inside the braces is ignored
    public static final Pattern PATTERN = Pattern.compile("\\{\\{\\s*([^{}]+?)\\s*}}");

    public static Reference parse(String raw) {
        String expr = raw.trim();
        int cut = expr.length();
        int dot = expr.indexOf('.');
        int bracket = expr.indexOf('[');
        if (dot >= 0) cut = dot;
        if (bracket >= 0 && bracket < cut) cut = bracket;
        String root = expr.substring(0, cut);
        String path = expr.substring(cut);
        if (path.startsWith(".")) {
            path = path.substring(1);
        }
        return new Reference(root, path, expr);
    }

    /** True when {@code value} is exactly one placeholder and nothing else. */
    public static boolean isWholeReference(String value) {
        return value != null && PATTERN.matcher(value.trim()).matches();
    }
}
