package com.relayflow.relayflow_engine.engine;

import com.relayflow.relayflow_engine.model.run.RunFailure;
import com.relayflow.relayflow_engine.model.run.RunState;

public record WorkflowRunEvent(String runId, String definitionId, RunState state, RunFailure failure) {
}
