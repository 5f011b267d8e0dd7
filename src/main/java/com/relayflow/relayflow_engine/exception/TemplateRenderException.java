package com.relayflow.relayflow_engine.exception;

public class TemplateRenderException extends ValidationException {

    private static final long serialVersionUID = 1L;

    public TemplateRenderException(String message) {
        super("TEMPLATE_RENDER", message);
    }
}
