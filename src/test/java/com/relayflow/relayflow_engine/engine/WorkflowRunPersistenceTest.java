package com.relayflow.relayflow_engine.engine;

import com.relayflow.relayflow_engine.model.run.ErrorKind;
import com.relayflow.relayflow_engine.model.run.NodeRunState;
import com.relayflow.relayflow_engine.model.run.RunState;
import com.relayflow.relayflow_engine.model.run.WorkflowRun;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static com.relayflow.relayflow_engine.engine.EngineFixture.edge;
import static com.relayflow.relayflow_engine.engine.EngineFixture.node;
import static com.relayflow.relayflow_engine.engine.EngineFixture.workflow;

public class WorkflowRunPersistenceTest {

    @Test
    public void shouldFailRunWithInfrastructureMarkerWhenStoreStaysDown() throws Exception {
        FlakyRunStateStore store = new FlakyRunStateStore(NodeRunState.SUCCEEDED, Integer.MAX_VALUE);
        try (EngineFixture fixture = new EngineFixture(store)) {
            WorkflowRun run = fixture.run(workflow("infra")
                    .node(node("A")).node(node("B"))
                    .edge(edge("A", "B"))
                    .build());

            Assertions.assertEquals(RunState.FAILED, run.getState());
            Assertions.assertTrue(run.getFailure().isInfrastructure());
            Assertions.assertEquals(0, fixture.executor.calls("B"));
            Assertions.assertEquals(NodeRunState.SUCCEEDED, run.getNodeRuns().get("A").getState());
            Assertions.assertEquals(NodeRunState.SKIPPED, run.getNodeRuns().get("B").getState());
            Assertions.assertTrue(run.getNodeRuns().values().stream().allMatch(n -> n.getState().isTerminal()));
            Assertions.assertEquals(RunState.FAILED, store.findRun(run.getRunId()).orElseThrow().getState());
        }
    }

    @Test
    public void shouldSettleNodeCaughtMidDispatchWhenStoreGoesDown() throws Exception {
        FlakyRunStateStore store = new FlakyRunStateStore(NodeRunState.RUNNING, Integer.MAX_VALUE);
        try (EngineFixture fixture = new EngineFixture(store)) {
            WorkflowRun run = fixture.run(workflow("infra-dispatch")
                    .node(node("A")).node(node("B"))
                    .edge(edge("A", "B"))
                    .build());

            Assertions.assertEquals(RunState.FAILED, run.getState());
            Assertions.assertTrue(run.getFailure().isInfrastructure());
            Assertions.assertEquals(0, fixture.executor.totalCalls());
            Assertions.assertEquals(NodeRunState.FAILED, run.getNodeRuns().get("A").getState());
            Assertions.assertEquals(ErrorKind.NODE_FAULT, run.getNodeRuns().get("A").getError().kind());
            Assertions.assertEquals(NodeRunState.SKIPPED, run.getNodeRuns().get("B").getState());
        }
    }

    @Test
    public void shouldRideOutShortStoreOutage() throws Exception {
        FlakyRunStateStore store = new FlakyRunStateStore(NodeRunState.SUCCEEDED, 1);
        try (EngineFixture fixture = new EngineFixture(store)) {
            WorkflowRun run = fixture.run(workflow("blip").node(node("A")).build());

            Assertions.assertEquals(RunState.SUCCEEDED, run.getState());
            Assertions.assertEquals(1, store.failures());
        }
    }
}
