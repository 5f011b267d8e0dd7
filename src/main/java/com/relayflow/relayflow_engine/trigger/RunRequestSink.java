package com.relayflow.relayflow_engine.trigger;

import com.relayflow.relayflow_engine.model.run.RunRequest;

/** Receives run requests emitted by triggers. */
@FunctionalInterface
public interface RunRequestSink {

    void accept(RunRequest request);
}
