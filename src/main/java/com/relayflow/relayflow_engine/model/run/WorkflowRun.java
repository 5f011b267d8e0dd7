package com.relayflow.relayflow_engine.model.run;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowRun {

    private String runId;
    private String definitionId;
    private TriggerContext trigger;

    @Builder.Default
    private RunState state = RunState.PENDING;

    private Instant startedAt;
    private Instant endedAt;

    // Keyed by node id in declaration order
    @Builder.Default
    private Map<String, NodeRun> nodeRuns = new LinkedHashMap<>();

    // One entry per dispatched attempt, in dispatch order
    @Builder.Default
    private List<String> dispatchOrder = new ArrayList<>();

    private RunFailure failure;

    // Output of the first answer node that succeeded
    private Map<String, Object> result;

    public NodeRun nodeRun(String nodeId) {
        return nodeRuns.get(nodeId);
    }

    /** Deep enough copy for readers on other threads. */
    public WorkflowRun snapshot() {
        Map<String, NodeRun> nodes = new LinkedHashMap<>();
        nodeRuns.forEach((id, nr) -> nodes.put(id, nr.copy()));
        return WorkflowRun.builder()
                .runId(runId)
                .definitionId(definitionId)
                .trigger(trigger)
                .state(state)
                .startedAt(startedAt)
                .endedAt(endedAt)
                .nodeRuns(nodes)
                .dispatchOrder(new ArrayList<>(dispatchOrder))
                .failure(failure)
                .result(result)
                .build();
    }
}
