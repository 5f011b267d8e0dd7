package com.relayflow.relayflow_engine.exception;

import lombok.Getter;

@Getter
public class UnknownNodeTypeException extends ValidationException {

    private static final long serialVersionUID = 1L;

    private final String nodeType;

    public UnknownNodeTypeException(String nodeType) {
        super("UNKNOWN_NODE_TYPE", "No executor registered for node type: " + nodeType);
        this.nodeType = nodeType;
    }
}
