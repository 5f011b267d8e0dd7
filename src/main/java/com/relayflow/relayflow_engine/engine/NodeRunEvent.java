package com.relayflow.relayflow_engine.engine;

import com.relayflow.relayflow_engine.model.run.NodeError;
import com.relayflow.relayflow_engine.model.run.NodeRunState;

public record NodeRunEvent(String runId, String nodeId, NodeRunState state, int attempt, NodeError error) {
}
