package com.relayflow.relayflow_engine.executor.github;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayflow.relayflow_engine.config.EngineProperties;
import com.relayflow.relayflow_engine.executor.HttpFailureClassifier;
import com.relayflow.relayflow_engine.executor.NodeExecutionRequest;
import com.relayflow.relayflow_engine.executor.NodeResult;
import com.relayflow.relayflow_engine.executor.TemplateRenderer;
import com.relayflow.relayflow_engine.model.run.ErrorKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class GithubNodeExecutorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private MockRestServiceServer server;
    private GithubNodeExecutor executor;

    @BeforeEach
    public void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        EngineProperties properties = new EngineProperties();
        properties.getGithub().setToken("default-token");
        executor = new GithubNodeExecutor(
                new GithubClient(restTemplate, properties),
                new TemplateRenderer(new ObjectMapper()),
                new HttpFailureClassifier(Clock.fixed(NOW, ZoneOffset.UTC)),
                properties);
    }

    @Test
    public void shouldFetchAndSummarizePullRequest() {
        server.expect(requestTo("https://api.github.com/repos/acme/api/pulls/42"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer default-token"))
                .andExpect(header("X-GitHub-Api-Version", "2022-11-28"))
                .andRespond(withSuccess("""
                        {"number": 42, "title": "Add retries", "state": "open", "html_url": "https://github.com/acme/api/pull/42",
                         "user": {"login": "octocat"}, "head": {"ref": "feature", "sha": "abc123"}, "base": {"ref": "main"}}
                        """, MediaType.APPLICATION_JSON));

        NodeResult result = executor.execute(request(Map.of(
                "action", "get_pull_request", "owner", "acme", "repo", "api", "number", "{{pr}}"), Map.of("pr", 42)));

        server.verify();
        Assertions.assertTrue(result.isSuccess(), result.getErrorMessage());
        Assertions.assertEquals("Add retries", result.getOutput().get("title"));
        Assertions.assertEquals("octocat", result.getOutput().get("author"));
        Assertions.assertEquals("abc123", result.getOutput().get("headSha"));
        Assertions.assertEquals("main", result.getOutput().get("baseRef"));
    }

    @Test
    public void shouldPostRenderedComment() {
        server.expect(requestTo("https://api.github.com/repos/acme/api/issues/7/comments"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer node-token"))
                .andExpect(content().json("{\"body\":\"Build passed for abc123\"}"))
                .andRespond(withSuccess("{\"id\": 99, \"html_url\": \"https://github.com/acme/api/issues/7#c99\"}",
                        MediaType.APPLICATION_JSON));

        NodeResult result = executor.execute(request(Map.of(
                "action", "comment_issue", "owner", "acme", "repo", "api", "number", 7,
                "body", "Build {{status}} for {{sha}}", "token", "node-token"),
                Map.of("status", "passed", "sha", "abc123")));

        server.verify();
        Assertions.assertEquals(99, result.getOutput().get("id"));
    }

    @Test
    public void shouldReturnLabelNamesAfterAddingLabels() {
        server.expect(requestTo("https://api.github.com/repos/acme/api/issues/7/labels"))
                .andExpect(content().json("{\"labels\":[\"bug\",\"triage\"]}"))
                .andRespond(withSuccess("[{\"name\": \"bug\"}, {\"name\": \"triage\"}]", MediaType.APPLICATION_JSON));

        NodeResult result = executor.execute(request(Map.of(
                "action", "add_labels", "owner", "acme", "repo", "api", "number", 7,
                "labels", List.of("bug", "triage")), Map.of()));

        Assertions.assertEquals(List.of("bug", "triage"), result.getOutput().get("labels"));
    }

    @Test
    public void shouldTreatNotFoundAsFatal() {
        server.expect(requestTo("https://api.github.com/repos/acme/api/pulls/42"))
                .andRespond(withResourceNotFound());

        NodeResult result = executor.execute(request(Map.of(
                "action", "get_pull_request", "owner", "acme", "repo", "api", "number", 42), Map.of()));

        Assertions.assertEquals(ErrorKind.FATAL, result.getErrorKind());
    }

    @Test
    public void shouldRetryOnServerErrorAndRateLimit() {
        server.expect(requestTo("https://api.github.com/repos/acme/api/pulls/42"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        server.expect(requestTo("https://api.github.com/repos/acme/api/pulls/42"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).header(HttpHeaders.RETRY_AFTER, "30"));

        Map<String, Object> config = Map.of("action", "get_pull_request", "owner", "acme", "repo", "api", "number", 42);
        NodeResult unavailable = executor.execute(request(config, Map.of()));
        NodeResult limited = executor.execute(request(config, Map.of()));

        Assertions.assertEquals(ErrorKind.RETRYABLE, unavailable.getErrorKind());
        Assertions.assertEquals(ErrorKind.RETRYABLE, limited.getErrorKind());
        Assertions.assertEquals(Duration.ofSeconds(30), limited.getRetryAfter());
    }

    @Test
    public void shouldTreatExhaustedQuotaAsRetryableUntilReset() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("x-ratelimit-remaining", "0");
        headers.set("x-ratelimit-reset", String.valueOf(NOW.plusSeconds(90).getEpochSecond()));
        server.expect(requestTo("https://api.github.com/repos/acme/api/pulls/42"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN).headers(headers));

        NodeResult result = executor.execute(request(Map.of(
                "action", "get_pull_request", "owner", "acme", "repo", "api", "number", 42), Map.of()));

        Assertions.assertEquals(ErrorKind.RETRYABLE, result.getErrorKind());
        Assertions.assertEquals(Duration.ofSeconds(90), result.getRetryAfter());
    }

    @Test
    public void shouldRequireFieldsPerAction() {
        Assertions.assertTrue(executor.validateConfig(Map.of(
                "action", "get_pull_request", "owner", "acme", "repo", "api", "number", 1)).isEmpty());
        Assertions.assertEquals(List.of("action comment_issue requires field 'body'"), executor.validateConfig(Map.of(
                "action", "comment_issue", "owner", "acme", "repo", "api", "number", 1)));
        Assertions.assertFalse(executor.validateConfig(Map.of(
                "action", "create_issue", "owner", "acme", "repo", "api")).isEmpty());
        Assertions.assertFalse(executor.validateConfig(Map.of(
                "action", "delete_repo", "owner", "acme", "repo", "api")).isEmpty());
    }

    @Test
    public void shouldUseConfiguredRetryPolicyByDefault() {
        Assertions.assertEquals(3, executor.defaultRetryPolicy().getMaxAttempts());
    }

    private static NodeExecutionRequest request(Map<String, Object> config, Map<String, Object> inputs) {
        return NodeExecutionRequest.builder()
                .runId("run-1")
                .nodeId("github")
                .attempt(1)
                .config(config)
                .inputs(inputs)
                .build();
    }
}
