package com.relayflow.relayflow_engine.engine;

import com.relayflow.relayflow_engine.executor.VariableResolver;
import com.relayflow.relayflow_engine.repository.RunStateStore;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.function.Consumer;

/** Collaborators a run coordinator borrows from the engine. */
record EngineContext(Clock clock,
                     RunStateRecorder recorder,
                     RunStateStore store,
                     ExecutionEventPublisher events,
                     VariableResolver resolver,
                     ThreadPoolExecutor workers,
                     ScheduledExecutorService timer,
                     Duration cancelGracePeriod,
                     int maxParallelNodes,
                     Consumer<RunCoordinator> finishedCallback) {

    void onRunFinished(RunCoordinator coordinator) {
        finishedCallback.accept(coordinator);
    }
}
