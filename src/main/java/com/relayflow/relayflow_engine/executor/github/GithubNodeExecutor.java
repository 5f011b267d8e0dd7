package com.relayflow.relayflow_engine.executor.github;

import com.relayflow.relayflow_engine.config.EngineProperties;
import com.relayflow.relayflow_engine.exception.ValidationException;
import com.relayflow.relayflow_engine.executor.ConfigReader;
import com.relayflow.relayflow_engine.executor.HttpFailureClassifier;
import com.relayflow.relayflow_engine.executor.NodeConfigSchema;
import com.relayflow.relayflow_engine.executor.NodeConfigSchema.FieldType;
import com.relayflow.relayflow_engine.executor.NodeExecutionRequest;
import com.relayflow.relayflow_engine.executor.NodeExecutor;
import com.relayflow.relayflow_engine.executor.NodeResult;
import com.relayflow.relayflow_engine.executor.TemplateRenderer;
import com.relayflow.relayflow_engine.model.domain.NodeType;
import com.relayflow.relayflow_engine.model.domain.RetryPolicy;
import com.relayflow.relayflow_engine.model.run.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes GitHub nodes, one action per node.
 *
 * Config shape (string fields may use {{input}} placeholders):
 * {
 *   "action":      "comment_issue",
 *   "owner":       "acme",
 *   "repo":        "api",
 *   "number":      "{{pr.output.number}}",
 *   "body":        "Build {{status}} for {{sha}}",
 *   "title":       "...",                       // create_issue, merge_pull_request
 *   "labels":      ["bug"],                     // create_issue, add_labels
 *   "mergeMethod": "squash",                    // merge_pull_request
 *   "token":       "{{secrets.token}}"           // optional, falls back to relayflow.github.token
 * }
 */
@Slf4j
@Component
public class GithubNodeExecutor implements NodeExecutor {

    private static final NodeConfigSchema SCHEMA = NodeConfigSchema.builder()
            .oneOf("action", true, GithubAction.ids())
            .requiredTemplate("owner", FieldType.STRING)
            .requiredTemplate("repo", FieldType.STRING)
            .optionalTemplate("number", FieldType.INTEGER)
            .optionalTemplate("title", FieldType.STRING)
            .optionalTemplate("body", FieldType.STRING)
            .optionalTemplate("labels", FieldType.LIST)
            .oneOf("mergeMethod", false, "merge", "squash", "rebase")
            .optionalTemplate("token", FieldType.STRING)
            .build();

    private final GithubClient client;
    private final TemplateRenderer renderer;
    private final HttpFailureClassifier classifier;
    private final RetryPolicy retryPolicy;

    public GithubNodeExecutor(GithubClient client, TemplateRenderer renderer,
                              HttpFailureClassifier classifier, EngineProperties properties) {
        this.client = client;
        this.renderer = renderer;
        this.classifier = classifier;
        EngineProperties.Github github = properties.getGithub();
        this.retryPolicy = RetryPolicy.exponential(github.getMaxAttempts(), github.getBackoff(), 2.0d);
    }

    @Override
    public String supportedType() {
        return NodeType.GITHUB.id();
    }

    @Override
    public NodeConfigSchema configSchema() {
        return SCHEMA;
    }

    @Override
    public RetryPolicy defaultRetryPolicy() {
        return retryPolicy;
    }

    @Override
    public List<String> validateConfig(Map<String, Object> config) {
        List<String> violations = new ArrayList<>(SCHEMA.validate(config));
        if (!violations.isEmpty()) return violations;
        GithubAction action = GithubAction.fromId((String) config.get("action")).orElseThrow();
        switch (action) {
            case GET_PULL_REQUEST, MERGE_PULL_REQUEST -> requireField(config, violations, action, "number");
            case CREATE_ISSUE -> requireField(config, violations, action, "title");
            case COMMENT_ISSUE -> {
                requireField(config, violations, action, "number");
                requireField(config, violations, action, "body");
            }
            case ADD_LABELS -> {
                requireField(config, violations, action, "number");
                requireField(config, violations, action, "labels");
            }
        }
        return violations;
    }

    private static void requireField(Map<String, Object> config, List<String> violations, GithubAction action, String field) {
        if (config.get(field) == null) {
            violations.add("action " + action.id() + " requires field '" + field + "'");
        }
    }

    @Override
    public NodeResult execute(NodeExecutionRequest request) {
        Map<String, Object> config;
        GithubAction action;
        try {
            config = renderer.renderConfig(request.getConfig(), request.getInputs());
            String actionId = ConfigReader.requireString(config, "action");
            action = GithubAction.fromId(actionId)
                    .orElseThrow(() -> new ValidationException("Unknown GitHub action: " + actionId));
        } catch (ValidationException ex) {
            return NodeResult.failure(ErrorKind.VALIDATION, ex.getMessage());
        }
        if (request.getCancelSignal().isCancelled()) {
            return NodeResult.cancelled();
        }

        String owner = ConfigReader.requireString(config, "owner");
        String repo = ConfigReader.requireString(config, "repo");
        String token = ConfigReader.string(config, "token", null);
        String operation = "GitHub " + action.id() + " on " + owner + "/" + repo;

        try {
            Map<String, Object> output = switch (action) {
                case GET_PULL_REQUEST -> summarizePullRequest(
                        client.getPullRequest(token, owner, repo, ConfigReader.requireInteger(config, "number")));
                case CREATE_ISSUE -> summarizeIssue(client.createIssue(token, owner, repo,
                        ConfigReader.requireString(config, "title"),
                        ConfigReader.string(config, "body", null),
                        ConfigReader.stringList(config, "labels")));
                case COMMENT_ISSUE -> summarizeComment(client.commentIssue(token, owner, repo,
                        ConfigReader.requireInteger(config, "number"),
                        ConfigReader.requireString(config, "body")));
                case MERGE_PULL_REQUEST -> summarizeMerge(client.mergePullRequest(token, owner, repo,
                        ConfigReader.requireInteger(config, "number"),
                        ConfigReader.string(config, "mergeMethod", "merge"),
                        ConfigReader.string(config, "title", null)));
                case ADD_LABELS -> Map.of("labels", client.addLabels(token, owner, repo,
                        ConfigReader.requireInteger(config, "number"),
                        ConfigReader.stringList(config, "labels")).stream().map(l -> l.get("name")).toList());
            };
            log.info("{} succeeded (run {}, node {})", operation, request.getRunId(), request.getNodeId());
            return NodeResult.success(output);

        } catch (HttpStatusCodeException ex) {
            return classifier.classify(operation, ex);
        } catch (ResourceAccessException ex) {
            return classifier.classify(operation, ex);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> summarizePullRequest(Map<String, Object> pr) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("number", pr.get("number"));
        out.put("title", pr.get("title"));
        out.put("state", pr.get("state"));
        out.put("body", pr.get("body"));
        out.put("url", pr.get("html_url"));
        out.put("merged", pr.get("merged"));
        out.put("mergeable", pr.get("mergeable"));
        Object user = pr.get("user");
        out.put("author", user instanceof Map<?, ?> u ? ((Map<String, Object>) u).get("login") : null);
        Object head = pr.get("head");
        out.put("headRef", head instanceof Map<?, ?> h ? ((Map<String, Object>) h).get("ref") : null);
        out.put("headSha", head instanceof Map<?, ?> h ? ((Map<String, Object>) h).get("sha") : null);
        Object base = pr.get("base");
        out.put("baseRef", base instanceof Map<?, ?> b ? ((Map<String, Object>) b).get("ref") : null);
        return out;
    }

    private static Map<String, Object> summarizeIssue(Map<String, Object> issue) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", issue.get("id"));
        out.put("number", issue.get("number"));
        out.put("title", issue.get("title"));
        out.put("state", issue.get("state"));
        out.put("url", issue.get("html_url"));
        return out;
    }

    private static Map<String, Object> summarizeComment(Map<String, Object> comment) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", comment.get("id"));
        out.put("url", comment.get("html_url"));
        out.put("body", comment.get("body"));
        return out;
    }

    private static Map<String, Object> summarizeMerge(Map<String, Object> merge) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("merged", merge.get("merged"));
        out.put("sha", merge.get("sha"));
        out.put("message", merge.get("message"));
        return out;
    }
}
