package com.relayflow.relayflow_engine.exception;

import lombok.Getter;

import java.util.List;

/**
 * Node config does not match the executor's declared schema. Values are never coerced.
 */
@Getter
public class ConfigValidationException extends ValidationException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public ConfigValidationException(List<String> violations) {
        super("INVALID_CONFIG", "Invalid node config: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ConfigValidationException(String violation) {
        this(List.of(violation));
    }
}
