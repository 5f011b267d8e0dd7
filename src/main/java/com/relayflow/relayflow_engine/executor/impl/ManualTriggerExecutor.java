package com.relayflow.relayflow_engine.executor.impl;

import com.relayflow.relayflow_engine.executor.NodeExecutionRequest;
import com.relayflow.relayflow_engine.executor.NodeExecutor;
import com.relayflow.relayflow_engine.executor.NodeResult;
import com.relayflow.relayflow_engine.model.domain.NodeType;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Entry node of manually started workflows. Passes the trigger context through:
 * {@code {{start.output.payload.x}}} reads the manual payload.
 */
@Component
public class ManualTriggerExecutor implements NodeExecutor {

    @Override
    public String supportedType() {
        return NodeType.MANUAL_TRIGGER.id();
    }

    @Override
    public boolean isEntryPoint() {
        return true;
    }

    @Override
    public NodeResult execute(NodeExecutionRequest request) {
        if (request.getTrigger() == null) {
            return NodeResult.success(Map.of("payload", Map.of()));
        }
        return NodeResult.success(request.getTrigger().toDocument());
    }
}
