package com.relayflow.relayflow_engine.executor;

import com.relayflow.relayflow_engine.model.run.ErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Maps HTTP failures of outbound calls to node error kinds.
 *
 * <pre>
 * 429, 5xx                                   RETRYABLE
 * 403 + x-ratelimit-remaining: 0 / Retry-After RETRYABLE (secondary rate limit)
 * other 4xx (401, 403, 404, 422 ...)          FATAL
 * connection / read failures                  RETRYABLE
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpFailureClassifier {

    private static final int MAX_BODY_IN_MESSAGE = 300;

    private final Clock clock;

    public NodeResult classify(String operation, HttpStatusCodeException ex) {
        int status = ex.getStatusCode().value();
        HttpHeaders headers = ex.getResponseHeaders() != null ? ex.getResponseHeaders() : new HttpHeaders();
        String message = operation + " failed with HTTP " + status + bodySuffix(ex.getResponseBodyAsString());

        boolean rateLimited = status == 429
                || (status == 403 && ("0".equals(headers.getFirst("x-ratelimit-remaining"))
                        || headers.getFirst(HttpHeaders.RETRY_AFTER) != null));

        if (rateLimited || ex.getStatusCode().is5xxServerError()) {
            Duration retryAfter = retryAfter(headers);
            log.warn("{} (retryable{})", message, retryAfter != null ? ", retry after " + retryAfter : "");
            return NodeResult.retryable(message, retryAfter);
        }
        log.warn("{} (fatal)", message);
        return NodeResult.failure(ErrorKind.FATAL, message);
    }

    public NodeResult classify(String operation, ResourceAccessException ex) {
        String message = operation + " failed: " + ex.getMessage();
        log.warn("{} (retryable)", message);
        return NodeResult.retryable(message, null);
    }

    Duration retryAfter(HttpHeaders headers) {
        String retryAfter = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (retryAfter != null) {
            try {
                return Duration.ofSeconds(Long.parseLong(retryAfter.trim()));
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric Retry-After '{}'", retryAfter);
            }
        }
        String reset = headers.getFirst("x-ratelimit-reset");
        if (reset != null && "0".equals(headers.getFirst("x-ratelimit-remaining"))) {
            try {
                Duration wait = Duration.between(clock.instant(), Instant.ofEpochSecond(Long.parseLong(reset.trim())));
                return wait.isNegative() ? Duration.ZERO : wait;
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric x-ratelimit-reset '{}'", reset);
            }
        }
        return null;
    }

    private static String bodySuffix(String body) {
        if (body == null || body.isBlank()) return "";
        String trimmed = body.strip();
        return ": " + (trimmed.length() > MAX_BODY_IN_MESSAGE ? trimmed.substring(0, MAX_BODY_IN_MESSAGE) + "..." : trimmed);
    }
}
