package com.relayflow.relayflow_engine.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayflow.relayflow_engine.exception.UnresolvedReferenceException;
import com.relayflow.relayflow_engine.model.run.ExecutionContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Resolves {@code {{nodeId.path}}} references in node inputs against the outputs of nodes
 * that already succeeded in the run.
 * <p>
 * A node is addressed as {@code {output: <its output>, attempts: n}}, so
 * {@code {{fetch.output.items[0].id}}} reads into fetch's output and {@code {{fetch}}} is
 * shorthand for the whole output. {@code {{trigger.payload.x}}} reads the trigger context.
 * A value that is exactly one reference resolves to the raw object; references embedded in
 * a longer string are interpolated. Maps and lists are resolved element by element.
 * Resolution never falls back to an empty value: anything missing throws. The one exception
 * is a node on a branch that was not taken, whose references resolve to null.
 * </p>
 */
@Component
@RequiredArgsConstructor
public class VariableResolver {

    private final ObjectMapper objectMapper;

    public Object resolve(Object expression, ExecutionContext context) {
        if (expression instanceof String s) {
            return resolveString(s, context);
        }
        if (expression instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            map.forEach((k, v) -> resolved.put(String.valueOf(k), resolve(v, context)));
            return resolved;
        }
        if (expression instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            list.forEach(v -> resolved.add(resolve(v, context)));
            return resolved;
        }
        return expression;
    }

    public Map<String, Object> resolveInputs(Map<String, Object> inputs, ExecutionContext context) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        if (inputs == null) return resolved;
        inputs.forEach((name, expr) -> resolved.put(name, resolve(expr, context)));
        return resolved;
    }

    /** Every reference in {@code expression}, in order of appearance, without duplicates. */
    public Set<Reference> extractReferences(Object expression) {
        Set<Reference> refs = new LinkedHashSet<>();
        collect(expression, refs);
        return refs;
    }

    private void collect(Object expression, Set<Reference> refs) {
        if (expression instanceof String s) {
            Matcher matcher = Reference.PATTERN.matcher(s);
            while (matcher.find()) {
                refs.add(Reference.parse(matcher.group(1)));
            }
        } else if (expression instanceof Map<?, ?> map) {
            map.values().forEach(v -> collect(v, refs));
        } else if (expression instanceof List<?> list) {
            list.forEach(v -> collect(v, refs));
        }
    }

    private Object resolveString(String value, ExecutionContext context) {
        if (!value.contains("{{")) return value;

        if (Reference.isWholeReference(value)) {
            Matcher whole = Reference.PATTERN.matcher(value.trim());
            whole.matches();
            return lookup(Reference.parse(whole.group(1)), context);
        }

        Matcher matcher = Reference.PATTERN.matcher(value);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            Object resolved = lookup(Reference.parse(matcher.group(1)), context);
            matcher.appendReplacement(result, Matcher.quoteReplacement(stringify(resolved)));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private Object lookup(Reference ref, ExecutionContext context) {
        if (context.isBranchSkipped(ref.root())) {
            return null;
        }
        Map<String, Object> document = context.document(ref.root())
                .orElseThrow(() -> new UnresolvedReferenceException(ref.raw(),
                        "node '" + ref.root() + "' has no successful output in this run"));
        if (ref.path().isEmpty()) {
            return ExecutionContext.TRIGGER_NAMESPACE.equals(ref.root()) ? document : document.get("output");
        }
        Object value = PathNavigator.navigate(document, ref.path());
        if (value == PathNavigator.MISSING) {
            throw new UnresolvedReferenceException(ref.raw(), "path '" + ref.path() + "' does not exist");
        }
        return value;
    }

    String stringify(Object value) {
        if (value == null) return "null";
        if (value instanceof Map || value instanceof List) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return value.toString();
            }
        }
        return value.toString();
    }
}
