package com.relayflow.relayflow_engine.executor.mail;

import java.util.Map;

public interface MailProvider {

    /** Name used in node config, e.g. {@code smtp}. */
    String getName();

    /**
     * Delivers the message and returns a receipt (message id, provider name).
     *
     * @throws MailDeliveryException with RETRYABLE or FATAL kind
     */
    Map<String, Object> send(MailMessage message);
}
