package com.relayflow.relayflow_engine.executor;

import com.relayflow.relayflow_engine.model.domain.RetryPolicy;

import java.util.List;
import java.util.Map;

public interface NodeExecutor {

    /** Output key through which a node picks the branch edges to follow. */
    String SELECTED_HANDLE = "selectedHandle";

    /** Type identifier this executor handles, e.g. {@code "github"}. */
    String supportedType();

    /** Shape of the static config; checked during validation. */
    default NodeConfigSchema configSchema() {
        return NodeConfigSchema.empty();
    }

    /** Config violations; schema check by default, executors add semantic checks. */
    default List<String> validateConfig(Map<String, Object> config) {
        return configSchema().validate(config);
    }

    /** Used when the node definition does not carry its own retry policy. */
    default RetryPolicy defaultRetryPolicy() {
        return null;
    }

    /** Trigger nodes start a run and must not have incoming edges. */
    default boolean isEntryPoint() {
        return false;
    }

    // Runs one attempt. Failures are returned, not thrown; a thrown exception counts as NODE_FAULT.
    NodeResult execute(NodeExecutionRequest request);
}
