package com.relayflow.relayflow_engine.model.run;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * User visible reason a run failed. Never carries a stack trace.
 * {@code infrastructure} marks failures of the engine's own collaborators (the run-state
 * store) as opposed to failures of workflow nodes.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunFailure {
    String nodeId;
    ErrorKind kind;
    int attempts;
    String message;
    boolean infrastructure;
}
