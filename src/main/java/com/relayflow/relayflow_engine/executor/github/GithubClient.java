package com.relayflow.relayflow_engine.executor.github;

import com.relayflow.relayflow_engine.config.EngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin REST v3 client. Errors surface as RestTemplate exceptions and are classified by
 * the caller.
 */
@Slf4j
@Component
public class GithubClient {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT = new ParameterizedTypeReference<>() {
    };
    private static final ParameterizedTypeReference<List<Map<String, Object>>> JSON_ARRAY = new ParameterizedTypeReference<>() {
    };

    private final RestTemplate restTemplate;
    private final EngineProperties.Github settings;

    public GithubClient(RestTemplate restTemplate, EngineProperties properties) {
        this.restTemplate = restTemplate;
        this.settings = properties.getGithub();
    }

    public Map<String, Object> getPullRequest(String token, String owner, String repo, int number) {
        return exchange(HttpMethod.GET, token, null, "/repos/{owner}/{repo}/pulls/{number}", owner, repo, number);
    }

    public Map<String, Object> createIssue(String token, String owner, String repo, String title, String body, List<String> labels) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", title);
        if (body != null) payload.put("body", body);
        if (labels != null && !labels.isEmpty()) payload.put("labels", labels);
        return exchange(HttpMethod.POST, token, payload, "/repos/{owner}/{repo}/issues", owner, repo);
    }

    /** Issue and pull request comments share the issues endpoint. */
    public Map<String, Object> commentIssue(String token, String owner, String repo, int number, String body) {
        return exchange(HttpMethod.POST, token, Map.of("body", body),
                "/repos/{owner}/{repo}/issues/{number}/comments", owner, repo, number);
    }

    public Map<String, Object> mergePullRequest(String token, String owner, String repo, int number,
                                                String mergeMethod, String commitTitle) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("merge_method", mergeMethod);
        if (commitTitle != null) payload.put("commit_title", commitTitle);
        return exchange(HttpMethod.PUT, token, payload, "/repos/{owner}/{repo}/pulls/{number}/merge", owner, repo, number);
    }

    public List<Map<String, Object>> addLabels(String token, String owner, String repo, int number, List<String> labels) {
        URI url = url("/repos/{owner}/{repo}/issues/{number}/labels", owner, repo, number);
        List<Map<String, Object>> body = restTemplate.exchange(url, HttpMethod.POST,
                new HttpEntity<>(Map.of("labels", labels), headers(token)), JSON_ARRAY).getBody();
        return body != null ? body : List.of();
    }

    private Map<String, Object> exchange(HttpMethod method, String token, Object payload, String path, Object... vars) {
        URI url = url(path, vars);
        log.debug("GitHub {} {}", method, url);
        Map<String, Object> body = restTemplate.exchange(url, method, new HttpEntity<>(payload, headers(token)), JSON_OBJECT).getBody();
        return body != null ? body : Map.of();
    }

    private URI url(String path, Object... vars) {
        return UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl())
                .path(path)
                .buildAndExpand(vars)
                .encode()
                .toUri();
    }

    private HttpHeaders headers(String token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.parseMediaType("application/vnd.github+json")));
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-GitHub-Api-Version", settings.getApiVersion());
        String effective = token != null && !token.isBlank() ? token : settings.getToken();
        if (effective != null && !effective.isBlank()) {
            headers.setBearerAuth(effective);
        }
        return headers;
    }
}
