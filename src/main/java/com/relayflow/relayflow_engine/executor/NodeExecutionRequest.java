package com.relayflow.relayflow_engine.executor;

import com.relayflow.relayflow_engine.model.run.TriggerContext;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class NodeExecutionRequest {
    String runId;
    @NonNull String nodeId;
    int attempt;

    @Builder.Default
    Map<String, Object> config = Map.of();

    /** Node inputs with every reference already resolved. */
    @Builder.Default
    Map<String, Object> inputs = Map.of();

    TriggerContext trigger;

    @Builder.Default
    CancelSignal cancelSignal = new CancelSignal();
}
