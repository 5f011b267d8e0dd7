package com.relayflow.relayflow_engine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayflow.relayflow_engine.engine.EngineFixture;
import com.relayflow.relayflow_engine.exception.CycleException;
import com.relayflow.relayflow_engine.executor.impl.ScheduleTriggerExecutor;
import com.relayflow.relayflow_engine.model.domain.NodeDefinition;
import com.relayflow.relayflow_engine.model.domain.NodeType;
import com.relayflow.relayflow_engine.model.domain.WorkflowDefinition;
import com.relayflow.relayflow_engine.model.run.RunRequest;
import com.relayflow.relayflow_engine.repository.InMemoryRunStateStore;
import com.relayflow.relayflow_engine.trigger.TriggerService;
import com.relayflow.relayflow_engine.trigger.WebhookSignatureVerifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.relayflow.relayflow_engine.engine.EngineFixture.edge;
import static com.relayflow.relayflow_engine.engine.EngineFixture.node;
import static com.relayflow.relayflow_engine.engine.EngineFixture.workflow;

public class DefinitionServiceTest {

    private EngineFixture fixture;
    private TriggerService triggers;
    private DefinitionService service;
    private final List<RunRequest> requests = new ArrayList<>();

    @BeforeEach
    public void setUp() {
        fixture = new EngineFixture(new InMemoryRunStateStore(), new ScheduleTriggerExecutor());
        triggers = new TriggerService(Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC),
                fixture.properties, new WebhookSignatureVerifier(), new ObjectMapper(), requests::add);
        service = new DefinitionService(fixture.validator, fixture.recorder, triggers);
    }

    @AfterEach
    public void tearDown() {
        fixture.close();
    }

    @Test
    public void shouldStoreDefinitionAndRegisterItsSchedule() {
        service.deploy(scheduled("nightly"));

        Assertions.assertTrue(fixture.store.loadDefinition("nightly").isPresent());
        Assertions.assertTrue(triggers.nextFireAt("nightly:cron").isPresent());
        Assertions.assertEquals(1, triggers.tick(Instant.parse("2024-01-01T02:00:00Z")).size());
        Assertions.assertEquals("nightly", requests.get(0).definitionId());
    }

    @Test
    public void shouldStoreNothingWhenDefinitionIsInvalid() {
        WorkflowDefinition cyclic = workflow("cyclic")
                .node(node("A"))
                .node(node("B"))
                .edge(edge("A", "B"))
                .edge(edge("B", "A"))
                .build();

        Assertions.assertThrows(CycleException.class, () -> service.deploy(cyclic));
        Assertions.assertTrue(fixture.store.loadDefinition("cyclic").isEmpty());
    }

    @Test
    public void shouldUnregisterTriggersOnUndeploy() {
        service.deploy(scheduled("nightly"));

        Assertions.assertTrue(service.undeploy("nightly"));
        Assertions.assertTrue(fixture.store.loadDefinition("nightly").isEmpty());
        Assertions.assertTrue(triggers.scheduledTriggers().isEmpty());
        Assertions.assertFalse(service.undeploy("nightly"));
    }

    private static WorkflowDefinition scheduled(String id) {
        return workflow(id)
                .node(NodeDefinition.builder().id("cron").type(NodeType.SCHEDULE_TRIGGER.id())
                        .config(Map.of("cron", "0 2 * * *")).build())
                .node(node("work"))
                .edge(edge("cron", "work"))
                .build();
    }
}
