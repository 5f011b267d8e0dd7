package com.relayflow.relayflow_engine.model.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Immutable workflow graph. Node declaration order is significant: it breaks ties when
 * several nodes become ready together. Shared read-only between concurrent runs.
 */
@Value
@Builder(toBuilder = true)
public class WorkflowDefinition {

    @NonNull String id;

    String name;

    @Singular
    List<NodeDefinition> nodes;

    @Singular
    List<EdgeDefinition> edges;

    @Builder.Default
    FailurePolicy failurePolicy = FailurePolicy.FAIL_FAST;

    /** No default: every definition states how overlapping runs are handled. */
    @NonNull ConcurrencyPolicy concurrencyPolicy;

    Duration runTimeout;

    public Optional<NodeDefinition> findNode(String nodeId) {
        return nodes.stream().filter(n -> n.getId().equals(nodeId)).findFirst();
    }
}
