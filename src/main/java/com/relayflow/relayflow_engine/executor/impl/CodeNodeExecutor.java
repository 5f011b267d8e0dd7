package com.relayflow.relayflow_engine.executor.impl;

import com.relayflow.relayflow_engine.config.EngineProperties;
import com.relayflow.relayflow_engine.engine.ScriptRunner;
import com.relayflow.relayflow_engine.executor.ConfigReader;
import com.relayflow.relayflow_engine.executor.NodeConfigSchema;
import com.relayflow.relayflow_engine.executor.NodeConfigSchema.FieldType;
import com.relayflow.relayflow_engine.executor.NodeExecutionRequest;
import com.relayflow.relayflow_engine.executor.NodeExecutor;
import com.relayflow.relayflow_engine.executor.NodeResult;
import com.relayflow.relayflow_engine.model.domain.NodeType;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes code nodes.
 *
 * Config shape:
 * {
 *   "language":  "spel",                       // spel (default), javascript or python
 *   "code":      "items.?[price > 10].size()",
 *   "timeoutMs": 5000                          // optional, defaults to the node timeout
 * }
 *
 * The snippet sees the node's resolved inputs: as the root object and #inputs in SpEL,
 * as `input` in JavaScript, as `input` in Python (assign the final value to `result`).
 * A map result becomes the node output; anything else is wrapped as {"result": value}.
 */
@Component
public class CodeNodeExecutor implements NodeExecutor {

    private static final NodeConfigSchema SCHEMA = NodeConfigSchema.builder()
            .oneOf("language", false, ScriptRunner.SPEL, ScriptRunner.JAVASCRIPT, ScriptRunner.PYTHON)
            .required("code", FieldType.STRING)
            .optional("timeoutMs", FieldType.INTEGER)
            .build();

    private final ScriptRunner scriptRunner;
    private final Duration defaultTimeout;

    public CodeNodeExecutor(ScriptRunner scriptRunner, EngineProperties properties) {
        this.scriptRunner = scriptRunner;
        this.defaultTimeout = properties.getExecution().getDefaultNodeTimeout();
    }

    @Override
    public String supportedType() {
        return NodeType.CODE.id();
    }

    @Override
    public NodeConfigSchema configSchema() {
        return SCHEMA;
    }

    @Override
    @SuppressWarnings("unchecked")
    public NodeResult execute(NodeExecutionRequest request) {
        Map<String, Object> config = request.getConfig();
        String language = ConfigReader.string(config, "language", ScriptRunner.SPEL);
        String code = ConfigReader.requireString(config, "code");
        Integer timeoutMs = ConfigReader.integer(config, "timeoutMs");
        Duration timeout = timeoutMs != null ? Duration.ofMillis(timeoutMs) : defaultTimeout;

        if (request.getCancelSignal().isCancelled()) {
            return NodeResult.cancelled();
        }
        ScriptRunner.ScriptResult result = scriptRunner.run(
                language, code, new LinkedHashMap<>(request.getInputs()), timeout, request.getCancelSignal());

        if (!result.success()) {
            return NodeResult.failure(result.errorKind(), result.error());
        }
        Object output = result.output();
        if (output instanceof Map<?, ?> map) {
            Map<String, Object> structured = new LinkedHashMap<>();
            map.forEach((k, v) -> structured.put(String.valueOf(k), v));
            return NodeResult.success(structured);
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("result", output);
        return NodeResult.success(wrapped);
    }
}
