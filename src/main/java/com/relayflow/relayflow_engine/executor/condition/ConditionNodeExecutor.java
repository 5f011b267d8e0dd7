package com.relayflow.relayflow_engine.executor.condition;

import com.relayflow.relayflow_engine.executor.NodeConfigSchema;
import com.relayflow.relayflow_engine.executor.NodeConfigSchema.FieldType;
import com.relayflow.relayflow_engine.executor.NodeExecutionRequest;
import com.relayflow.relayflow_engine.executor.NodeExecutor;
import com.relayflow.relayflow_engine.executor.NodeResult;
import com.relayflow.relayflow_engine.executor.PathNavigator;
import com.relayflow.relayflow_engine.model.domain.NodeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Picks one outgoing branch.
 *
 * Config shape:
 * {
 *   "cases": [
 *     {
 *       "id": "large",
 *       "logicalOperator": "and",                  // and (default) or or
 *       "conditions": [
 *         { "variable": "order.total", "operator": "greater_than", "value": 100 }
 *       ]
 *     }
 *   ]
 * }
 *
 * {@code variable} is a path into the node's resolved inputs. Cases are tried in order and the
 * first match selects the edges whose sourceHandle is the case id; a case without conditions
 * always matches. When nothing matches the handle is {@code "default"}.
 * Output: {"matchedCaseId": id or null, "selectedHandle": handle}.
 */
@Slf4j
@Component
public class ConditionNodeExecutor implements NodeExecutor {

    public static final String DEFAULT_HANDLE = "default";

    private static final NodeConfigSchema SCHEMA = NodeConfigSchema.builder()
            .required("cases", FieldType.LIST)
            .build();

    @Override
    public String supportedType() {
        return NodeType.CONDITION.id();
    }

    @Override
    public NodeConfigSchema configSchema() {
        return SCHEMA;
    }

    @Override
    public List<String> validateConfig(Map<String, Object> config) {
        List<String> violations = new ArrayList<>(SCHEMA.validate(config));
        if (!violations.isEmpty()) return violations;

        Set<String> ids = new HashSet<>();
        List<?> cases = (List<?>) config.get("cases");
        for (int i = 0; i < cases.size(); i++) {
            if (!(cases.get(i) instanceof Map<?, ?> c)) {
                violations.add("cases[" + i + "] must be a map");
                continue;
            }
            Object id = c.get("id");
            if (!(id instanceof String s) || s.isBlank()) {
                violations.add("cases[" + i + "].id is required");
            } else if (DEFAULT_HANDLE.equals(s)) {
                violations.add("cases[" + i + "].id '" + DEFAULT_HANDLE + "' is reserved");
            } else if (!ids.add(s)) {
                violations.add("cases[" + i + "].id '" + s + "' is not unique");
            }
            Object logical = c.get("logicalOperator");
            if (logical != null && !"and".equals(logical) && !"or".equals(logical)) {
                violations.add("cases[" + i + "].logicalOperator must be 'and' or 'or'");
            }
            Object conditions = c.get("conditions");
            if (conditions == null) continue;
            if (!(conditions instanceof List<?> list)) {
                violations.add("cases[" + i + "].conditions must be a list");
                continue;
            }
            for (int j = 0; j < list.size(); j++) {
                validateCondition(list.get(j), "cases[" + i + "].conditions[" + j + "]", violations);
            }
        }
        return violations;
    }

    private static void validateCondition(Object condition, String at, List<String> violations) {
        if (!(condition instanceof Map<?, ?> c)) {
            violations.add(at + " must be a map");
            return;
        }
        if (!(c.get("variable") instanceof String v) || v.isBlank()) {
            violations.add(at + ".variable is required");
        }
        Object operatorId = c.get("operator");
        ConditionOperator operator = ConditionOperator.fromId(String.valueOf(operatorId)).orElse(null);
        if (operator == null) {
            violations.add(at + ".operator '" + operatorId + "' is not supported");
        } else if (operator.needsValue() && !c.containsKey("value")) {
            violations.add(at + ".value is required for " + operator.id());
        }
    }

    @Override
    public NodeResult execute(NodeExecutionRequest request) {
        Map<String, Object> inputs = request.getInputs();
        for (Object entry : (List<?>) request.getConfig().get("cases")) {
            Map<?, ?> branch = (Map<?, ?>) entry;
            String caseId = String.valueOf(branch.get("id"));
            boolean matched = matches(branch, inputs);
            log.debug("Condition {} case '{}': {}", request.getNodeId(), caseId, matched);
            if (matched) {
                return selected(caseId, caseId);
            }
        }
        return selected(null, DEFAULT_HANDLE);
    }

    private static boolean matches(Map<?, ?> branch, Map<String, Object> inputs) {
        Object conditions = branch.get("conditions");
        if (!(conditions instanceof List<?> list) || list.isEmpty()) {
            return true;
        }
        boolean any = "or".equals(branch.get("logicalOperator"));
        for (Object item : list) {
            boolean result = evaluate((Map<?, ?>) item, inputs);
            if (any && result) return true;
            if (!any && !result) return false;
        }
        return !any;
    }

    private static boolean evaluate(Map<?, ?> condition, Map<String, Object> inputs) {
        Object actual = PathNavigator.navigate(inputs, String.valueOf(condition.get("variable")));
        if (actual == PathNavigator.MISSING) {
            actual = null;
        }
        ConditionOperator operator = ConditionOperator.fromId(String.valueOf(condition.get("operator")))
                .orElseThrow(() -> new IllegalStateException("Unsupported operator " + condition.get("operator")));
        return operator.test(actual, condition.get("value"));
    }

    private static NodeResult selected(String caseId, String handle) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("matchedCaseId", caseId);
        output.put(SELECTED_HANDLE, handle);
        return NodeResult.success(output);
    }
}
