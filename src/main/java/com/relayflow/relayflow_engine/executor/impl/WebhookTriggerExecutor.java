package com.relayflow.relayflow_engine.executor.impl;

import com.relayflow.relayflow_engine.executor.ConfigReader;
import com.relayflow.relayflow_engine.executor.NodeConfigSchema;
import com.relayflow.relayflow_engine.executor.NodeConfigSchema.FieldType;
import com.relayflow.relayflow_engine.executor.NodeExecutionRequest;
import com.relayflow.relayflow_engine.executor.NodeExecutor;
import com.relayflow.relayflow_engine.executor.NodeResult;
import com.relayflow.relayflow_engine.executor.PathNavigator;
import com.relayflow.relayflow_engine.model.domain.NodeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry node of webhook-started workflows.
 *
 * Config shape:
 * {
 *   "path":             "/hooks/jira",
 *   "secret":           "s3cr3t",                       // optional, enables signature check
 *   "variableMappings": { "summary": "issue.fields.summary", "first": "items[0].name" }
 * }
 *
 * Output: the trigger context plus "variables", one entry per mapping. A mapping whose
 * path is absent from the payload yields null.
 */
@Slf4j
@Component
public class WebhookTriggerExecutor implements NodeExecutor {

    private static final NodeConfigSchema SCHEMA = NodeConfigSchema.builder()
            .required("path", FieldType.STRING)
            .optional("secret", FieldType.STRING)
            .optional("variableMappings", FieldType.MAP)
            .build();

    @Override
    public String supportedType() {
        return NodeType.WEBHOOK_TRIGGER.id();
    }

    @Override
    public NodeConfigSchema configSchema() {
        return SCHEMA;
    }

    @Override
    public boolean isEntryPoint() {
        return true;
    }

    @Override
    public NodeResult execute(NodeExecutionRequest request) {
        Map<String, Object> payload = request.getTrigger() != null ? request.getTrigger().getPayload() : Map.of();
        Map<String, Object> variables = new LinkedHashMap<>();
        ConfigReader.map(request.getConfig(), "variableMappings").forEach((name, path) -> {
            Object value = PathNavigator.navigate(payload, String.valueOf(path));
            if (value == PathNavigator.MISSING) {
                log.warn("Webhook node {}: path '{}' not found in payload, '{}' set to null", request.getNodeId(), path, name);
                value = null;
            }
            variables.put(name, value);
        });

        Map<String, Object> output = new LinkedHashMap<>();
        if (request.getTrigger() != null) {
            output.putAll(request.getTrigger().toDocument());
        } else {
            output.put("payload", payload);
        }
        output.put("variables", variables);
        return NodeResult.success(output);
    }
}
