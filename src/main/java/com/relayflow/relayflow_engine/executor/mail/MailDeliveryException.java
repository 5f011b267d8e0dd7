package com.relayflow.relayflow_engine.executor.mail;

import com.relayflow.relayflow_engine.exception.WorkflowException;
import com.relayflow.relayflow_engine.model.run.ErrorKind;
import lombok.Getter;

import java.time.Duration;

/**
 * A provider could not deliver a message. {@code kind} tells the engine whether a retry
 * can help.
 */
@Getter
public class MailDeliveryException extends WorkflowException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final transient Duration retryAfter;

    public MailDeliveryException(ErrorKind kind, String message, Duration retryAfter) {
        super("MAIL_" + kind.name(), message);
        this.kind = kind;
        this.retryAfter = retryAfter;
    }

    public MailDeliveryException(ErrorKind kind, String message, Throwable cause) {
        super("MAIL_" + kind.name(), message, cause);
        this.kind = kind;
        this.retryAfter = null;
    }
}
