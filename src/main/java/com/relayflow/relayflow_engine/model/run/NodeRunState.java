package com.relayflow.relayflow_engine.model.run;

/**
 * Lifecycle of one node inside a run. A node waiting out a retry backoff is {@code WAITING}
 * again until the backoff elapses.
 */
public enum NodeRunState {
    WAITING,
    READY,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }
}
