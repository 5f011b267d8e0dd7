package com.relayflow.relayflow_engine.executor.mail;

import com.relayflow.relayflow_engine.config.EngineProperties;
import com.relayflow.relayflow_engine.exception.ValidationException;
import com.relayflow.relayflow_engine.executor.ConfigReader;
import com.relayflow.relayflow_engine.executor.NodeConfigSchema;
import com.relayflow.relayflow_engine.executor.NodeConfigSchema.FieldType;
import com.relayflow.relayflow_engine.executor.NodeExecutionRequest;
import com.relayflow.relayflow_engine.executor.NodeExecutor;
import com.relayflow.relayflow_engine.executor.NodeResult;
import com.relayflow.relayflow_engine.executor.TemplateRenderer;
import com.relayflow.relayflow_engine.model.domain.NodeType;
import com.relayflow.relayflow_engine.model.domain.RetryPolicy;
import com.relayflow.relayflow_engine.model.run.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes mail nodes.
 *
 * Config shape:
 * {
 *   "provider": "smtp",                          // smtp or api, default relayflow.mail.default-provider
 *   "to":       ["ops@example.com"],             // list or comma separated string
 *   "cc":       "lead@example.com",              // optional
 *   "from":     "bot@example.com",               // optional, default relayflow.mail.from
 *   "subject":  "PR #{{pr.number}} merged",
 *   "body":     "{{pr.title}} by {{pr.author}}",
 *   "html":     false
 * }
 *
 * Render errors are VALIDATION; delivery errors carry the provider's RETRYABLE/FATAL kind.
 */
@Slf4j
@Component
public class MailNodeExecutor implements NodeExecutor {

    private static final NodeConfigSchema SCHEMA = NodeConfigSchema.builder()
            .oneOf("provider", false, "smtp", "api")
            .requiredTemplate("to", FieldType.ANY)
            .optionalTemplate("cc", FieldType.ANY)
            .optionalTemplate("from", FieldType.STRING)
            .requiredTemplate("subject", FieldType.STRING)
            .requiredTemplate("body", FieldType.STRING)
            .optional("html", FieldType.BOOLEAN)
            .build();

    private final TemplateRenderer renderer;
    private final MailProviderFactory providers;
    private final EngineProperties.Mail settings;
    private final RetryPolicy retryPolicy;

    public MailNodeExecutor(TemplateRenderer renderer, MailProviderFactory providers, EngineProperties properties) {
        this.renderer = renderer;
        this.providers = providers;
        this.settings = properties.getMail();
        this.retryPolicy = RetryPolicy.exponential(settings.getMaxAttempts(), settings.getBackoff(), 2.0d);
    }

    @Override
    public String supportedType() {
        return NodeType.MAIL.id();
    }

    @Override
    public NodeConfigSchema configSchema() {
        return SCHEMA;
    }

    @Override
    public RetryPolicy defaultRetryPolicy() {
        return retryPolicy;
    }

    @Override
    public NodeResult execute(NodeExecutionRequest request) {
        MailMessage message;
        MailProvider provider;
        try {
            Map<String, Object> config = renderer.renderConfig(request.getConfig(), request.getInputs());
            provider = providers.getProvider(ConfigReader.string(config, "provider", settings.getDefaultProvider()));
            List<String> to = ConfigReader.stringList(config, "to");
            if (to.isEmpty() || to.stream().anyMatch(String::isBlank)) {
                return NodeResult.failure(ErrorKind.VALIDATION, "Mail node needs at least one recipient");
            }
            message = new MailMessage(
                    ConfigReader.string(config, "from", settings.getFrom()),
                    to,
                    ConfigReader.stringList(config, "cc"),
                    ConfigReader.requireString(config, "subject"),
                    ConfigReader.string(config, "body", ""),
                    ConfigReader.bool(config, "html", false));
        } catch (ValidationException ex) {
            return NodeResult.failure(ErrorKind.VALIDATION, ex.getMessage());
        }

        if (request.getCancelSignal().isCancelled()) {
            return NodeResult.cancelled();
        }
        try {
            Map<String, Object> receipt = provider.send(message);
            Map<String, Object> output = new LinkedHashMap<>(receipt);
            output.put("to", message.to());
            output.put("subject", message.subject());
            log.info("Mail '{}' sent to {} via {} (run {}, node {})",
                    message.subject(), message.to(), provider.getName(), request.getRunId(), request.getNodeId());
            return NodeResult.success(output);
        } catch (MailDeliveryException ex) {
            if (ex.getKind() == ErrorKind.RETRYABLE) {
                return NodeResult.retryable(ex.getMessage(), ex.getRetryAfter());
            }
            return NodeResult.failure(ex.getKind(), ex.getMessage());
        }
    }
}
