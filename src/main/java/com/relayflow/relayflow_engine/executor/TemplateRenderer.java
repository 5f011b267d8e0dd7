package com.relayflow.relayflow_engine.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayflow.relayflow_engine.exception.TemplateRenderException;
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
 * Renders {@code {{name}}} and {@code {{name.path}}} placeholders in node config against
 * the node's resolved inputs. Config stays static; only declared inputs can be referenced.
 */
@Component
@RequiredArgsConstructor
public class TemplateRenderer {

    private final ObjectMapper objectMapper;

    public String render(String template, Map<String, Object> inputs) {
        Object rendered = renderValue(template, inputs);
        return rendered == null ? null : stringify(rendered);
    }

    /**
     * Renders strings anywhere inside {@code value}. A string that is exactly one placeholder
     * becomes the raw input value, so {@code "{{labels}}"} can yield a list.
     */
    public Object renderValue(Object value, Map<String, Object> inputs) {
        if (value instanceof String s) {
            return renderString(s, inputs);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> rendered = new LinkedHashMap<>();
            map.forEach((k, v) -> rendered.put(String.valueOf(k), renderValue(v, inputs)));
            return rendered;
        }
        if (value instanceof List<?> list) {
            List<Object> rendered = new ArrayList<>(list.size());
            list.forEach(v -> rendered.add(renderValue(v, inputs)));
            return rendered;
        }
        return value;
    }

    public Map<String, Object> renderConfig(Map<String, Object> config, Map<String, Object> inputs) {
        Map<String, Object> rendered = new LinkedHashMap<>();
        if (config != null) {
            config.forEach((k, v) -> rendered.put(k, renderValue(v, inputs)));
        }
        return rendered;
    }

    /** Input names referenced anywhere inside {@code value}. */
    public Set<String> placeholderNames(Object value) {
        Set<String> names = new LinkedHashSet<>();
        collect(value, names);
        return names;
    }

    private void collect(Object value, Set<String> names) {
        if (value instanceof String s) {
            Matcher matcher = Reference.PATTERN.matcher(s);
            while (matcher.find()) {
                names.add(Reference.parse(matcher.group(1)).root());
            }
        } else if (value instanceof Map<?, ?> map) {
            map.values().forEach(v -> collect(v, names));
        } else if (value instanceof List<?> list) {
            list.forEach(v -> collect(v, names));
        }
    }

    private Object renderString(String template, Map<String, Object> inputs) {
        if (!template.contains("{{")) return template;

        if (Reference.isWholeReference(template)) {
            Matcher whole = Reference.PATTERN.matcher(template.trim());
            whole.matches();
            return lookup(Reference.parse(whole.group(1)), inputs);
        }

        Matcher matcher = Reference.PATTERN.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            Object value = lookup(Reference.parse(matcher.group(1)), inputs);
            matcher.appendReplacement(out, Matcher.quoteReplacement(value == null ? "" : stringify(value)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private Object lookup(Reference ref, Map<String, Object> inputs) {
        if (inputs == null || !inputs.containsKey(ref.root())) {
            throw new TemplateRenderException("Template references unknown input '" + ref.root() + "'");
        }
        Object value = PathNavigator.navigate(inputs.get(ref.root()), ref.path());
        if (value == PathNavigator.MISSING) {
            throw new TemplateRenderException("Input '" + ref.root() + "' has no field '" + ref.path() + "'");
        }
        return value;
    }

    private String stringify(Object value) {
        if (value instanceof Map || value instanceof List) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new TemplateRenderException("Cannot render value as JSON: " + e.getOriginalMessage());
            }
        }
        return String.valueOf(value);
    }
}
