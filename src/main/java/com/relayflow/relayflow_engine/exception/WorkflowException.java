package com.relayflow.relayflow_engine.exception;

import lombok.Getter;

/**
 * Base type for every engine error.
 * <p>
 * Carries a stable error code next to the human readable message so callers can branch
 * on the code without parsing text.
 * </p>
 */
@Getter
public class WorkflowException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String code;

    public WorkflowException(String code, String message) {
        super(message);
        this.code = code;
    }

    public WorkflowException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{code='" + code + "', message='" + getMessage() + "'}";
    }
}
