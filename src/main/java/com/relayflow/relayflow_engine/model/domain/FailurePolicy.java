package com.relayflow.relayflow_engine.model.domain;

public enum FailurePolicy {
    /** First terminal node failure stops dispatching; every not-started node is skipped. */
    FAIL_FAST,
    /** Only descendants of a failed node are skipped; independent branches keep running. */
    CONTINUE_ON_ERROR
}
