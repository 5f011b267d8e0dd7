package com.relayflow.relayflow_engine.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayflow.relayflow_engine.exception.TemplateRenderException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

public class TemplateRendererTest {

    private final TemplateRenderer renderer = new TemplateRenderer(new ObjectMapper());

    @Test
    public void shouldRenderPlaceholdersAgainstInputs() {
        Map<String, Object> inputs = Map.of("pr", Map.of("number", 42, "title", "Add cache"), "author", "lin");

        String text = renderer.render("#{{pr.number}} {{pr.title}} by {{ author }}", inputs);

        Assertions.assertEquals("#42 Add cache by lin", text);
    }

    @Test
    public void shouldKeepRawValueForWholePlaceholder() {
        Object labels = renderer.renderValue("{{labels}}", Map.of("labels", List.of("bug", "p1")));

        Assertions.assertEquals(List.of("bug", "p1"), labels);
    }

    @Test
    public void shouldRenderWholeConfigTree() {
        Map<String, Object> config = Map.of(
                "title", "Deploy {{version}}",
                "labels", List.of("release", "{{env}}"),
                "count", 3);

        Map<String, Object> rendered = renderer.renderConfig(config, Map.of("version", "1.2.0", "env", "prod"));

        Assertions.assertEquals("Deploy 1.2.0", rendered.get("title"));
        Assertions.assertEquals(List.of("release", "prod"), rendered.get("labels"));
        Assertions.assertEquals(3, rendered.get("count"));
    }

    @Test
    public void shouldRenderNullAsEmptyInsideText() {
        Map<String, Object> inputs = new java.util.HashMap<>();
        inputs.put("missing", null);

        Assertions.assertEquals("value=", renderer.render("value={{missing}}", inputs));
    }

    @Test
    public void shouldFailOnUnknownInputOrField() {
        Assertions.assertThrows(TemplateRenderException.class, () -> renderer.render("{{nope}}", Map.of()));
        Assertions.assertThrows(TemplateRenderException.class,
                () -> renderer.render("{{pr.body}}", Map.of("pr", Map.of("title", "x"))));
    }

    @Test
    public void shouldListPlaceholderNames() {
        Set<String> names = renderer.placeholderNames(Map.of(
                "subject", "{{pr.title}} ({{repo}})",
                "to", List.of("{{owner.email}}")));

        Assertions.assertEquals(Set.of("pr", "repo", "owner"), names);
    }
}
