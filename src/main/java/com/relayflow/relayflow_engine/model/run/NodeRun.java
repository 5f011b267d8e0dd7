package com.relayflow.relayflow_engine.model.run;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * State of a node within a run. Only the run's coordinator mutates it; readers get copies.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NodeRun {
    private String nodeId;

    @Builder.Default
    private NodeRunState state = NodeRunState.WAITING;

    private int attempts;
    private Map<String, Object> output;
    private NodeError error;
    private Instant startedAt;
    private Instant endedAt;

    /** Set while the node waits out a retry backoff. */
    private Instant nextAttemptAt;

    public NodeRun copy() {
        return toBuilder().build();
    }
}
