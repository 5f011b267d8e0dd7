package com.relayflow.relayflow_engine.executor.impl;

import com.relayflow.relayflow_engine.exception.ValidationException;
import com.relayflow.relayflow_engine.executor.NodeConfigSchema;
import com.relayflow.relayflow_engine.executor.NodeConfigSchema.FieldType;
import com.relayflow.relayflow_engine.executor.NodeExecutionRequest;
import com.relayflow.relayflow_engine.executor.NodeExecutor;
import com.relayflow.relayflow_engine.executor.NodeResult;
import com.relayflow.relayflow_engine.model.domain.NodeType;
import com.relayflow.relayflow_engine.trigger.CronSchedule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry node of scheduled workflows.
 *
 * Config shape:
 * {
 *   "cron":     "0 9 * * MON-FRI",
 *   "timezone": "Europe/Berlin"      // optional, UTC when absent
 * }
 *
 * Output: scheduledAt, firedAt, triggerId of the firing plus the expression itself.
 */
@Component
public class ScheduleTriggerExecutor implements NodeExecutor {

    private static final NodeConfigSchema SCHEMA = NodeConfigSchema.builder()
            .required("cron", FieldType.STRING)
            .optional("timezone", FieldType.STRING)
            .build();

    @Override
    public String supportedType() {
        return NodeType.SCHEDULE_TRIGGER.id();
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
    public List<String> validateConfig(Map<String, Object> config) {
        List<String> violations = new ArrayList<>(SCHEMA.validate(config));
        if (violations.isEmpty()) {
            try {
                CronSchedule.parse((String) config.get("cron"), (String) config.get("timezone"));
            } catch (ValidationException ex) {
                violations.add(ex.getMessage());
            }
        }
        return violations;
    }

    @Override
    public NodeResult execute(NodeExecutionRequest request) {
        Map<String, Object> output = new LinkedHashMap<>();
        if (request.getTrigger() != null) {
            output.putAll(request.getTrigger().toDocument());
        }
        output.put("cron", request.getConfig().get("cron"));
        output.put("timezone", request.getConfig().getOrDefault("timezone", "UTC"));
        return NodeResult.success(output);
    }
}
