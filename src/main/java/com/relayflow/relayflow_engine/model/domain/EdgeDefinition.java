package com.relayflow.relayflow_engine.model.domain;

import lombok.NonNull;
import lombok.Value;

/**
 * Dependency from {@code source} to {@code target}. An edge with a {@code sourceHandle} is a
 * branch: it is followed only when the source node selects that handle.
 */
@Value
public class EdgeDefinition {
    @NonNull String source;
    @NonNull String target;
    String sourceHandle;

    public static EdgeDefinition of(String source, String target) {
        return new EdgeDefinition(source, target, null);
    }

    public static EdgeDefinition branch(String source, String handle, String target) {
        return new EdgeDefinition(source, target, handle);
    }
}
