package com.relayflow.relayflow_engine.exception;

import lombok.Getter;

@Getter
public class UnresolvedReferenceException extends ValidationException {

    private static final long serialVersionUID = 1L;

    private final String reference;

    public UnresolvedReferenceException(String reference, String reason) {
        super("UNRESOLVED_REFERENCE", "Cannot resolve {{" + reference + "}}: " + reason);
        this.reference = reference;
    }
}
