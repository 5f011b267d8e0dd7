package com.relayflow.relayflow_engine.executor.mail;

import com.relayflow.relayflow_engine.config.EngineProperties;
import com.relayflow.relayflow_engine.executor.HttpFailureClassifier;
import com.relayflow.relayflow_engine.executor.NodeResult;
import com.relayflow.relayflow_engine.model.run.ErrorKind;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends through a transactional mail HTTP API: JSON POST to {@code relayflow.mail.api-url}
 * with a bearer key. Response codes are classified like every other outbound HTTP call.
 */
@Component
public class HttpApiMailProvider implements MailProvider {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT = new ParameterizedTypeReference<>() {
    };

    private final RestTemplate restTemplate;
    private final HttpFailureClassifier classifier;
    private final EngineProperties.Mail settings;

    public HttpApiMailProvider(RestTemplate restTemplate, HttpFailureClassifier classifier, EngineProperties properties) {
        this.restTemplate = restTemplate;
        this.classifier = classifier;
        this.settings = properties.getMail();
    }

    @Override
    public String getName() {
        return "api";
    }

    @Override
    public Map<String, Object> send(MailMessage message) {
        if (settings.getApiUrl() == null || settings.getApiUrl().isBlank()) {
            throw new MailDeliveryException(ErrorKind.FATAL, "Mail API is not configured; set relayflow.mail.api-url", (Throwable) null);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", message.from());
        payload.put("to", message.to());
        if (!message.cc().isEmpty()) payload.put("cc", message.cc());
        payload.put("subject", message.subject());
        payload.put(message.html() ? "html" : "text", message.body());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (settings.getApiKey() != null) {
            headers.setBearerAuth(settings.getApiKey());
        }

        try {
            Map<String, Object> response = restTemplate.exchange(settings.getApiUrl(), HttpMethod.POST,
                    new HttpEntity<>(payload, headers), JSON_OBJECT).getBody();
            Map<String, Object> receipt = new LinkedHashMap<>();
            receipt.put("provider", getName());
            receipt.put("messageId", response != null ? response.get("id") : null);
            return receipt;
        } catch (HttpStatusCodeException ex) {
            throw toDeliveryException(classifier.classify("Mail API send", ex));
        } catch (ResourceAccessException ex) {
            throw toDeliveryException(classifier.classify("Mail API send", ex));
        }
    }

    private static MailDeliveryException toDeliveryException(NodeResult result) {
        return new MailDeliveryException(result.getErrorKind(), result.getErrorMessage(), result.getRetryAfter());
    }
}
