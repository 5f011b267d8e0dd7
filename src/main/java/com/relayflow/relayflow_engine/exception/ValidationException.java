package com.relayflow.relayflow_engine.exception;

/**
 * A definition, a node config or an inbound trigger request was rejected before any node ran.
 */
public class ValidationException extends WorkflowException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super("VALIDATION", message);
    }

    protected ValidationException(String code, String message) {
        super(code, message);
    }
}
