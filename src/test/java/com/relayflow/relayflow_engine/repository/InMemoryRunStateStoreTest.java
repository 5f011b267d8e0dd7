package com.relayflow.relayflow_engine.repository;

import com.relayflow.relayflow_engine.model.domain.ConcurrencyPolicy;
import com.relayflow.relayflow_engine.model.domain.WorkflowDefinition;
import com.relayflow.relayflow_engine.model.run.NodeRunState;
import com.relayflow.relayflow_engine.model.run.RunState;
import com.relayflow.relayflow_engine.model.run.TriggerContext;
import com.relayflow.relayflow_engine.model.run.WorkflowRun;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

public class InMemoryRunStateStoreTest {

    private final InMemoryRunStateStore store = new InMemoryRunStateStore();

    @Test
    public void shouldSaveReplaceAndDeleteDefinitions() {
        store.saveDefinition(WorkflowDefinition.builder().id("wf").name("v1").concurrencyPolicy(ConcurrencyPolicy.QUEUE).build());
        store.saveDefinition(WorkflowDefinition.builder().id("wf").name("v2").concurrencyPolicy(ConcurrencyPolicy.QUEUE).build());

        Assertions.assertEquals(1, store.definitions().size());
        Assertions.assertEquals("v2", store.loadDefinition("wf").orElseThrow().getName());
        Assertions.assertTrue(store.deleteDefinition("wf"));
        Assertions.assertFalse(store.deleteDefinition("wf"));
        Assertions.assertTrue(store.loadDefinition("wf").isEmpty());
    }

    @Test
    public void shouldRecordNodeAndRunState() {
        String runId = store.createRun("wf", TriggerContext.manual("wf", Map.of(), Instant.parse("2024-01-01T00:00:00Z")));

        store.updateRunState(runId, RunState.RUNNING);
        store.updateNodeRun(runId, "A", NodeRunState.SUCCEEDED, Map.of("ok", true), null);
        WorkflowRun run = store.findRun(runId).orElseThrow();

        Assertions.assertEquals(RunState.RUNNING, run.getState());
        Assertions.assertEquals(NodeRunState.SUCCEEDED, run.nodeRun("A").getState());
        Assertions.assertEquals(Map.of("ok", true), run.nodeRun("A").getOutput());
    }

    @Test
    public void shouldReturnSnapshotsNotLiveState() {
        String runId = store.createRun("wf", TriggerContext.manual("wf", Map.of(), Instant.parse("2024-01-01T00:00:00Z")));
        WorkflowRun before = store.findRun(runId).orElseThrow();

        store.updateNodeRun(runId, "A", NodeRunState.RUNNING, null, null);

        Assertions.assertNull(before.nodeRun("A"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> store.updateRunState("missing", RunState.FAILED));
    }
}
