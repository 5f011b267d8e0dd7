package com.relayflow.relayflow_engine.exception;

public class WebhookVerificationException extends ValidationException {

    private static final long serialVersionUID = 1L;

    public WebhookVerificationException(String message) {
        super("WEBHOOK_SIGNATURE", message);
    }
}
