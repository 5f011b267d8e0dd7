package com.relayflow.relayflow_engine.model.run;

public enum ErrorKind {
    /** The node's own logic failed (script error, unexpected exception). */
    NODE_FAULT(true),
    TIMEOUT(true),
    CANCELLED(false),
    /** Transient upstream condition: rate limit, 5xx, connection reset. */
    RETRYABLE(true),
    /** Permanent upstream rejection: bad credentials, missing resource. */
    FATAL(false),
    /** Bad input or config; retrying cannot help. */
    VALIDATION(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
