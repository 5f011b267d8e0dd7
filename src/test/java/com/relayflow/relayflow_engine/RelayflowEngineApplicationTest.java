package com.relayflow.relayflow_engine;

import com.relayflow.relayflow_engine.executor.NodeExecutorRegistry;
import com.relayflow.relayflow_engine.model.domain.ConcurrencyPolicy;
import com.relayflow.relayflow_engine.model.domain.EdgeDefinition;
import com.relayflow.relayflow_engine.model.domain.NodeDefinition;
import com.relayflow.relayflow_engine.model.domain.NodeType;
import com.relayflow.relayflow_engine.model.domain.WorkflowDefinition;
import com.relayflow.relayflow_engine.model.run.RunState;
import com.relayflow.relayflow_engine.model.run.WorkflowRun;
import com.relayflow.relayflow_engine.service.DefinitionService;
import com.relayflow.relayflow_engine.service.WorkflowService;
import com.relayflow.relayflow_engine.trigger.TriggerService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Map;

@SpringBootTest
public class RelayflowEngineApplicationTest {

    @Autowired
    private NodeExecutorRegistry registry;

    @Autowired
    private DefinitionService definitionService;

    @Autowired
    private WorkflowService workflowService;

    @Autowired
    private TriggerService triggerService;

    @Test
    public void shouldRegisterEveryBuiltInNodeType() {
        Arrays.stream(NodeType.values())
                .forEach(type -> Assertions.assertTrue(registry.isSupported(type.id()), type.id()));
    }

    @Test
    public void shouldDeployAndRunWorkflowEndToEnd() throws Exception {
        definitionService.deploy(WorkflowDefinition.builder()
                .id("double-and-render")
                .concurrencyPolicy(ConcurrencyPolicy.QUEUE)
                .node(NodeDefinition.builder().id("manual").type(NodeType.MANUAL_TRIGGER.id()).build())
                .node(NodeDefinition.builder().id("double").type(NodeType.CODE.id())
                        .config(Map.of("code", "count * 2"))
                        .inputs(Map.of("count", "{{manual.output.payload.count}}"))
                        .build())
                .node(NodeDefinition.builder().id("render").type(NodeType.TEMPLATE.id())
                        .config(Map.of("template", "{{n}} items"))
                        .inputs(Map.of("n", "{{double.output.result}}"))
                        .build())
                .edge(EdgeDefinition.of("manual", "double"))
                .edge(EdgeDefinition.of("double", "render"))
                .build());

        WorkflowRun run = workflowService.runSync("double-and-render", Map.of("count", 21), Duration.ofSeconds(10))
                .orElseThrow();

        Assertions.assertEquals(RunState.SUCCEEDED, run.getState());
        Assertions.assertEquals(Map.of("text", "42 items"), run.nodeRun("render").getOutput());
    }

    @Test
    public void shouldStartRunFromWebhook() {
        definitionService.deploy(WorkflowDefinition.builder()
                .id("on-push")
                .concurrencyPolicy(ConcurrencyPolicy.PARALLEL)
                .node(NodeDefinition.builder().id("hook").type(NodeType.WEBHOOK_TRIGGER.id())
                        .config(Map.of("path", "/hooks/push", "variableMappings", Map.of("branch", "ref")))
                        .build())
                .node(NodeDefinition.builder().id("say").type(NodeType.TEMPLATE.id())
                        .config(Map.of("template", "pushed to {{branch}}"))
                        .inputs(Map.of("branch", "{{hook.output.variables.branch}}"))
                        .build())
                .edge(EdgeDefinition.of("hook", "say"))
                .build());

        String definitionId = triggerService.acceptWebhook("/hooks/push", null,
                "{\"ref\":\"main\"}".getBytes(StandardCharsets.UTF_8)).definitionId();

        Assertions.assertEquals("on-push", definitionId);
        Assertions.assertTrue(definitionService.undeploy("on-push"));
    }
}
