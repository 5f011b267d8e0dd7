package com.relayflow.relayflow_engine.executor.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class HttpNodeExecutor implements NodeExecutor {

    private static final NodeConfigSchema SCHEMA = NodeConfigSchema.builder()
            .requiredTemplate("url", FieldType.STRING)
            .oneOf("method", false, "GET", "POST", "PUT", "PATCH", "DELETE", "HEAD")
            .optionalTemplate("headers", FieldType.MAP)
            .optionalTemplate("body", FieldType.ANY)
            .build();

    private final TemplateRenderer renderer;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final HttpFailureClassifier classifier;

    @Override
    public String supportedType() {
        return NodeType.HTTP.id();
    }

    @Override
    public NodeConfigSchema configSchema() {
        return SCHEMA;
    }

    @Override
    public RetryPolicy defaultRetryPolicy() {
        return RetryPolicy.exponential(3, Duration.ofSeconds(1), 2.0d);
    }

    /*
     * Config shape:
     * {
     *   "url":     "https://api.example.com/users/{{userId}}",
     *   "method":  "POST",
     *   "headers": { "Authorization": "Bearer {{token}}" },
     *   "body":    { "userId": "{{userId}}" }
     * }
     */
    @Override
    public NodeResult execute(NodeExecutionRequest request) {
        Map<String, Object> config;
        try {
            config = renderer.renderConfig(request.getConfig(), request.getInputs());
        } catch (ValidationException ex) {
            return NodeResult.failure(ErrorKind.VALIDATION, ex.getMessage());
        }

        String url = ConfigReader.requireString(config, "url");
        String method = ConfigReader.string(config, "method", "GET");
        Map<String, Object> headers = ConfigReader.map(config, "headers");
        Object body = config.get("body");

        if (request.getCancelSignal().isCancelled()) {
            return NodeResult.cancelled();
        }

        try {
            HttpHeaders httpHeaders = new HttpHeaders();
            httpHeaders.setContentType(MediaType.APPLICATION_JSON);
            httpHeaders.setAccept(List.of(MediaType.APPLICATION_JSON, MediaType.ALL));
            headers.forEach((k, v) -> httpHeaders.set(k, String.valueOf(v)));

            HttpEntity<Object> entity = new HttpEntity<>(body, httpHeaders);
            ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.valueOf(method), entity, String.class);

            Map<String, Object> output = new HashMap<>();
            output.put("statusCode", response.getStatusCode().value());
            output.put("body", parseBody(response.getBody()));
            output.put("headers", response.getHeaders().toSingleValueMap());
            return NodeResult.success(output);

        } catch (HttpStatusCodeException ex) {
            return classifier.classify(method + " " + url, ex);
        } catch (ResourceAccessException ex) {
            return classifier.classify(method + " " + url, ex);
        }
    }

    private Object parseBody(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            return objectMapper.readValue(body, Object.class);
        } catch (Exception e) {
            return body; // return raw string if not JSON
        }
    }
}
