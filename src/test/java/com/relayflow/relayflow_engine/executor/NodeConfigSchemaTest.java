package com.relayflow.relayflow_engine.executor;

import com.relayflow.relayflow_engine.executor.NodeConfigSchema.FieldType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

public class NodeConfigSchemaTest {

    private final NodeConfigSchema schema = NodeConfigSchema.builder()
            .required("owner", FieldType.STRING)
            .requiredTemplate("number", FieldType.INTEGER)
            .optional("labels", FieldType.LIST)
            .oneOf("method", false, "merge", "squash", "rebase")
            .build();

    @Test
    public void shouldAcceptWellFormedConfig() {
        List<String> violations = schema.validate(Map.of("owner", "acme", "number", 5, "method", "squash"));

        Assertions.assertTrue(violations.isEmpty(), violations.toString());
    }

    @Test
    public void shouldAcceptPlaceholderInTemplatedField() {
        Assertions.assertTrue(schema.validate(Map.of("owner", "acme", "number", "{{pr.number}}")).isEmpty());
    }

    @Test
    public void shouldNotCoerceStringsToNumbers() {
        List<String> violations = schema.validate(Map.of("owner", "acme", "number", "5"));

        Assertions.assertEquals(List.of("field 'number' must be INTEGER but was String"), violations);
    }

    @Test
    public void shouldReportMissingUnknownAndDisallowedValues() {
        List<String> violations = schema.validate(Map.of("number", 1, "method", "fast", "extra", true));

        Assertions.assertEquals(3, violations.size(), violations.toString());
        Assertions.assertTrue(violations.contains("unknown field 'extra'"));
        Assertions.assertTrue(violations.contains("missing required field 'owner'"));
        Assertions.assertTrue(violations.stream().anyMatch(v -> v.startsWith("field 'method' must be one of")));
    }

    @Test
    public void emptySchemaRejectsAnyField() {
        Assertions.assertEquals(List.of("unknown field 'x'"), NodeConfigSchema.empty().validate(Map.of("x", 1)));
        Assertions.assertTrue(NodeConfigSchema.empty().validate(null).isEmpty());
    }
}
