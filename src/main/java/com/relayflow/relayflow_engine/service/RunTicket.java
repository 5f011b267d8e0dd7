package com.relayflow.relayflow_engine.service;

import com.relayflow.relayflow_engine.model.run.WorkflowRun;

import java.util.concurrent.CompletableFuture;

/**
 * Outcome of handing a run request to {@link WorkflowService}.
 * <p>
 * STARTED carries the run id. QUEUED has no run id yet; {@code completion} finishes once the
 * queued run has started and ended. SKIPPED has neither.
 * </p>
 */
public record RunTicket(Status status, String runId, CompletableFuture<WorkflowRun> completion) {

    public enum Status {
        STARTED,
        QUEUED,
        SKIPPED
    }

    static RunTicket skipped() {
        return new RunTicket(Status.SKIPPED, null, CompletableFuture.completedFuture(null));
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }
}
