package com.relayflow.relayflow_engine.executor.impl;

import com.relayflow.relayflow_engine.exception.TemplateRenderException;
import com.relayflow.relayflow_engine.executor.NodeConfigSchema;
import com.relayflow.relayflow_engine.executor.NodeConfigSchema.FieldType;
import com.relayflow.relayflow_engine.executor.NodeExecutionRequest;
import com.relayflow.relayflow_engine.executor.NodeExecutor;
import com.relayflow.relayflow_engine.executor.NodeResult;
import com.relayflow.relayflow_engine.executor.TemplateRenderer;
import com.relayflow.relayflow_engine.model.domain.NodeType;
import com.relayflow.relayflow_engine.model.run.ErrorKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Renders a text template against the node's inputs. Output: {@code {"text": "..."}}.
 */
@Component
@RequiredArgsConstructor
public class TemplateNodeExecutor implements NodeExecutor {

    private static final NodeConfigSchema SCHEMA = NodeConfigSchema.builder()
            .requiredTemplate("template", FieldType.STRING)
            .build();

    private final TemplateRenderer renderer;

    @Override
    public String supportedType() {
        return NodeType.TEMPLATE.id();
    }

    @Override
    public NodeConfigSchema configSchema() {
        return SCHEMA;
    }

    @Override
    public NodeResult execute(NodeExecutionRequest request) {
        Object template = request.getConfig().get("template");
        try {
            String text = renderer.render(String.valueOf(template), request.getInputs());
            return NodeResult.success(Map.of("text", text));
        } catch (TemplateRenderException ex) {
            return NodeResult.failure(ErrorKind.VALIDATION, ex.getMessage());
        }
    }
}
