package com.relayflow.relayflow_engine.model.domain;

/**
 * What happens when a run request arrives while an earlier run of the same definition is
 * still active.
 */
public enum ConcurrencyPolicy {
    QUEUE,
    SKIP,
    PARALLEL
}
