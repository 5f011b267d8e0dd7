package com.relayflow.relayflow_engine.exception;

public class TriggerNotFoundException extends ValidationException {

    private static final long serialVersionUID = 1L;

    public TriggerNotFoundException(String message) {
        super("TRIGGER_NOT_FOUND", message);
    }
}
