package com.relayflow.relayflow_engine.model.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * One node of a workflow.
 * <p>
 * {@code config} is static and checked against the executor's schema. {@code inputs} maps
 * an input name to an expression that may reference ancestor outputs, e.g.
 * {@code "title": "{{fetch.output.title}}"}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class NodeDefinition {

    @NonNull String id;

    @NonNull String type;

    @Builder.Default
    Map<String, Object> config = Map.of();

    @Builder.Default
    Map<String, Object> inputs = Map.of();

    /** Overrides the executor default when present. */
    RetryPolicy retryPolicy;

    /** Per-attempt wall clock limit; engine default applies when absent. */
    Duration timeout;
}
