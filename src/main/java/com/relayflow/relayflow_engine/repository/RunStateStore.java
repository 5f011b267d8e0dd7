package com.relayflow.relayflow_engine.repository;

import com.relayflow.relayflow_engine.model.domain.WorkflowDefinition;
import com.relayflow.relayflow_engine.model.run.NodeError;
import com.relayflow.relayflow_engine.model.run.NodeRunState;
import com.relayflow.relayflow_engine.model.run.RunFailure;
import com.relayflow.relayflow_engine.model.run.RunState;
import com.relayflow.relayflow_engine.model.run.TriggerContext;

import java.util.Map;
import java.util.Optional;

/**
 * Durable home of definitions and run state. The engine calls it synchronously on every
 * state transition; implementations may throw any runtime exception on failure.
 */
public interface RunStateStore {

    /** Creates a run in PENDING and returns its id. */
    String createRun(String definitionId, TriggerContext trigger);

    void updateNodeRun(String runId, String nodeId, NodeRunState state, Map<String, Object> output, NodeError error);

    void updateRunState(String runId, RunState state);

    default void updateRunState(String runId, RunState state, RunFailure failure) {
        updateRunState(runId, state);
    }

    Optional<WorkflowDefinition> loadDefinition(String definitionId);

    void saveDefinition(WorkflowDefinition definition);

    /** Returns true when a definition was removed. */
    boolean deleteDefinition(String definitionId);
}
