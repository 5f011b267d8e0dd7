package com.relayflow.relayflow_engine.engine;

import com.relayflow.relayflow_engine.executor.NodeExecutor;
import com.relayflow.relayflow_engine.model.domain.RetryPolicy;

import java.time.Duration;

/**
 * Validated definition plus everything resolved per node before a run starts, indexed by
 * declaration position.
 */
record RunPlan(WorkflowGraph graph,
               NodeExecutor[] executors,
               RetryPolicy[] retryPolicies,
               Duration[] nodeTimeouts,
               Duration runTimeout) {
}
