package com.relayflow.relayflow_engine.executor.impl;

import com.relayflow.relayflow_engine.executor.NodeExecutionRequest;
import com.relayflow.relayflow_engine.executor.NodeExecutor;
import com.relayflow.relayflow_engine.executor.NodeResult;
import com.relayflow.relayflow_engine.model.domain.NodeType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;

/**
 * Collects the run's result. Each declared input becomes one field of the output, e.g.
 * {@code inputs: {"summary": "{{render.output.text}}"}} gives {@code {"summary": "..."}}.
 * The first answer node that succeeds supplies {@code WorkflowRun.result}.
 */
@Component
public class AnswerNodeExecutor implements NodeExecutor {

    @Override
    public String supportedType() {
        return NodeType.ANSWER.id();
    }

    @Override
    public NodeResult execute(NodeExecutionRequest request) {
        return NodeResult.success(new LinkedHashMap<>(request.getInputs()));
    }
}
