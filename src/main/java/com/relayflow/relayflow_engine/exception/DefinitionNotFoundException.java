package com.relayflow.relayflow_engine.exception;

public class DefinitionNotFoundException extends ValidationException {

    private static final long serialVersionUID = 1L;

    public DefinitionNotFoundException(String definitionId) {
        super("DEFINITION_NOT_FOUND", "Workflow definition not found: " + definitionId);
    }
}
