package com.relayflow.relayflow_engine.engine;

import com.relayflow.relayflow_engine.model.run.WorkflowRun;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Started run. {@code completion} completes with the terminal snapshot of the run.
 */
public record RunHandle(String runId, CompletableFuture<WorkflowRun> completion) {

    public WorkflowRun await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run " + runId + " completed exceptionally", e.getCause());
        }
    }
}
