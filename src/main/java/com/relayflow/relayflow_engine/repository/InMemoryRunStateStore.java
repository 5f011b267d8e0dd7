package com.relayflow.relayflow_engine.repository;

import com.relayflow.relayflow_engine.model.domain.WorkflowDefinition;
import com.relayflow.relayflow_engine.model.run.NodeError;
import com.relayflow.relayflow_engine.model.run.NodeRun;
import com.relayflow.relayflow_engine.model.run.NodeRunState;
import com.relayflow.relayflow_engine.model.run.RunFailure;
import com.relayflow.relayflow_engine.model.run.RunState;
import com.relayflow.relayflow_engine.model.run.TriggerContext;
import com.relayflow.relayflow_engine.model.run.WorkflowRun;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store for embedding and tests. Nothing survives a restart.
 */
public class InMemoryRunStateStore implements RunStateStore {

    private final Map<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();
    private final Map<String, WorkflowRun> runs = new ConcurrentHashMap<>();

    @Override
    public void saveDefinition(WorkflowDefinition definition) {
        definitions.put(definition.getId(), definition);
    }

    @Override
    public boolean deleteDefinition(String definitionId) {
        return definitions.remove(definitionId) != null;
    }

    public Collection<WorkflowDefinition> definitions() {
        return List.copyOf(definitions.values());
    }

    @Override
    public String createRun(String definitionId, TriggerContext trigger) {
        String runId = UUID.randomUUID().toString();
        runs.put(runId, WorkflowRun.builder()
                .runId(runId)
                .definitionId(definitionId)
                .trigger(trigger)
                .state(RunState.PENDING)
                .build());
        return runId;
    }

    @Override
    public void updateNodeRun(String runId, String nodeId, NodeRunState state, Map<String, Object> output, NodeError error) {
        WorkflowRun run = requireRun(runId);
        synchronized (run) {
            NodeRun nodeRun = run.getNodeRuns().computeIfAbsent(nodeId, id -> NodeRun.builder().nodeId(id).build());
            nodeRun.setState(state);
            if (output != null) nodeRun.setOutput(output);
            if (error != null) nodeRun.setError(error);
        }
    }

    @Override
    public void updateRunState(String runId, RunState state) {
        updateRunState(runId, state, null);
    }

    @Override
    public void updateRunState(String runId, RunState state, RunFailure failure) {
        WorkflowRun run = requireRun(runId);
        synchronized (run) {
            run.setState(state);
            if (failure != null) run.setFailure(failure);
        }
    }

    @Override
    public Optional<WorkflowDefinition> loadDefinition(String definitionId) {
        return Optional.ofNullable(definitions.get(definitionId));
    }

    public Optional<WorkflowRun> findRun(String runId) {
        WorkflowRun run = runs.get(runId);
        if (run == null) return Optional.empty();
        synchronized (run) {
            return Optional.of(run.snapshot());
        }
    }

    private WorkflowRun requireRun(String runId) {
        WorkflowRun run = runs.get(runId);
        if (run == null) {
            throw new IllegalArgumentException("Unknown run: " + runId);
        }
        return run;
    }
}
