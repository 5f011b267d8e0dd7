package com.relayflow.relayflow_engine.executor.mail;

import java.util.List;

public record MailMessage(String from, List<String> to, List<String> cc, String subject, String body, boolean html) {
}
