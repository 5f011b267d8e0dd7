package com.relayflow.relayflow_engine.engine;

import com.relayflow.relayflow_engine.executor.condition.ConditionNodeExecutor;
import com.relayflow.relayflow_engine.executor.impl.AnswerNodeExecutor;
import com.relayflow.relayflow_engine.model.domain.EdgeDefinition;
import com.relayflow.relayflow_engine.model.domain.NodeDefinition;
import com.relayflow.relayflow_engine.model.domain.NodeType;
import com.relayflow.relayflow_engine.model.domain.WorkflowDefinition;
import com.relayflow.relayflow_engine.model.run.NodeRunState;
import com.relayflow.relayflow_engine.model.run.RunState;
import com.relayflow.relayflow_engine.model.run.WorkflowRun;
import com.relayflow.relayflow_engine.repository.InMemoryRunStateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.relayflow.relayflow_engine.engine.EngineFixture.edge;
import static com.relayflow.relayflow_engine.engine.EngineFixture.node;
import static com.relayflow.relayflow_engine.engine.EngineFixture.workflow;

public class WorkflowBranchingTest {

    private EngineFixture fixture;

    @BeforeEach
    public void setUp() {
        fixture = new EngineFixture(new InMemoryRunStateStore(), new ConditionNodeExecutor(), new AnswerNodeExecutor());
    }

    @AfterEach
    public void tearDown() {
        fixture.close();
    }

    @Test
    public void shouldFollowSelectedBranchAndSkipTheOther() throws Exception {
        WorkflowRun run = fixture.run(greeting("ada"));

        Assertions.assertEquals(RunState.SUCCEEDED, run.getState());
        Assertions.assertEquals(NodeRunState.SUCCEEDED, run.nodeRun("greet").getState());
        Assertions.assertEquals(NodeRunState.SKIPPED, run.nodeRun("reject").getState());
        Assertions.assertEquals(NodeRunState.SKIPPED, run.nodeRun("audit").getState());
        Assertions.assertEquals(NodeRunState.SUCCEEDED, run.nodeRun("merge").getState());
        Assertions.assertEquals(0, fixture.executor.calls("reject"));
        Assertions.assertEquals(0, fixture.executor.calls("audit"));
        Assertions.assertEquals("known", run.nodeRun("check").getOutput().get("selectedHandle"));
        Assertions.assertNull(run.getFailure());
    }

    @Test
    public void shouldExposeAnswerOutputAsRunResult() throws Exception {
        WorkflowRun run = fixture.run(greeting("ada"));

        Map<String, Object> result = run.getResult();
        Assertions.assertNotNull(result);
        Assertions.assertEquals("greet", result.get("greeting"));
        Assertions.assertTrue(result.containsKey("rejected"));
        Assertions.assertNull(result.get("rejected"));
    }

    @Test
    public void shouldTakeDefaultBranchWhenNoCaseMatches() throws Exception {
        WorkflowRun run = fixture.run(greeting("grace"));

        Assertions.assertEquals(RunState.SUCCEEDED, run.getState());
        Assertions.assertEquals(NodeRunState.SKIPPED, run.nodeRun("greet").getState());
        Assertions.assertEquals(NodeRunState.SUCCEEDED, run.nodeRun("reject").getState());
        Assertions.assertEquals(NodeRunState.SUCCEEDED, run.nodeRun("audit").getState());
        Assertions.assertEquals("reject", run.getResult().get("rejected"));
        Assertions.assertNull(run.getResult().get("greeting"));
    }

    @Test
    public void shouldSkipEverythingBehindAnUnwiredHandle() throws Exception {
        WorkflowDefinition definition = workflow("unwired")
                .node(condition("check", "nobody"))
                .node(node("only")).node(node("after"))
                .node(answer("answer", Map.of("value", "{{after.output.node}}")))
                .edge(EdgeDefinition.branch("check", "known", "only"))
                .edge(edge("only", "after"))
                .edge(edge("after", "answer"))
                .build();

        WorkflowRun run = fixture.run(definition);

        Assertions.assertEquals(RunState.SUCCEEDED, run.getState());
        Assertions.assertEquals(0, fixture.executor.totalCalls());
        List.of("only", "after", "answer").forEach(id ->
                Assertions.assertEquals(NodeRunState.SKIPPED, run.nodeRun(id).getState(), id));
        Assertions.assertNull(run.getResult());
    }

    @Test
    public void shouldFollowEveryEdgeOfNodeThatSelectsNothing() throws Exception {
        WorkflowDefinition definition = workflow("plain")
                .node(node("source")).node(node("left")).node(node("right"))
                .edge(EdgeDefinition.branch("source", "ignored", "left"))
                .edge(edge("source", "right"))
                .build();

        WorkflowRun run = fixture.run(definition);

        Assertions.assertEquals(RunState.SUCCEEDED, run.getState());
        Assertions.assertEquals(1, fixture.executor.calls("left"));
        Assertions.assertEquals(1, fixture.executor.calls("right"));
    }

    // check -known-> greet -> merge -> answer
    //       -default-> reject -> merge, reject -> audit
    private static WorkflowDefinition greeting(String knownUser) {
        return workflow("greeting")
                .node(condition("check", knownUser))
                .node(node("greet")).node(node("reject")).node(node("audit")).node(node("merge"))
                .node(answer("answer", Map.of(
                        "greeting", "{{greet.output.node}}",
                        "rejected", "{{reject.output.node}}")))
                .edge(EdgeDefinition.branch("check", "known", "greet"))
                .edge(EdgeDefinition.branch("check", "default", "reject"))
                .edge(edge("greet", "merge"))
                .edge(edge("reject", "merge"))
                .edge(edge("reject", "audit"))
                .edge(edge("merge", "answer"))
                .build();
    }

    private static NodeDefinition condition(String id, String knownUser) {
        return NodeDefinition.builder()
                .id(id)
                .type(NodeType.CONDITION.id())
                .inputs(Map.of("user", "{{trigger.payload.user}}"))
                .config(Map.of("cases", List.of(Map.of(
                        "id", "known",
                        "conditions", List.of(Map.of("variable", "user", "operator", "equals", "value", knownUser))))))
                .build();
    }

    private static NodeDefinition answer(String id, Map<String, Object> inputs) {
        return NodeDefinition.builder().id(id).type(NodeType.ANSWER.id()).inputs(inputs).build();
    }
}
