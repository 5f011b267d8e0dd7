package com.relayflow.relayflow_engine.exception;

/**
 * The run-state store kept failing after the configured number of attempts.
 */
public class PersistenceException extends WorkflowException {

    private static final long serialVersionUID = 1L;

    public PersistenceException(String message, Throwable cause) {
        super("PERSISTENCE", message, cause);
    }
}
