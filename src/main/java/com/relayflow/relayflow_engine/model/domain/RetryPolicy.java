package com.relayflow.relayflow_engine.model.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Retry settings for a node.
 *
 * <pre>
 * maxAttempts       total attempts including the first one (1 = no retry)
 * backoff           delay before the second attempt
 * backoffMultiplier growth factor applied per further attempt
 * maxBackoff        upper bound of any single delay
 * </pre>
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    @Builder.Default
    int maxAttempts = 1;

    @Builder.Default
    Duration backoff = Duration.ofSeconds(1);

    @Builder.Default
    double backoffMultiplier = 2.0d;

    @Builder.Default
    Duration maxBackoff = Duration.ofMinutes(1);

    public static RetryPolicy noRetry() {
        return RetryPolicy.builder().build();
    }

    public static RetryPolicy exponential(int maxAttempts, Duration backoff, double multiplier) {
        return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .backoff(backoff)
                .backoffMultiplier(multiplier)
                .build();
    }

    /**
     * Delay to wait after {@code failedAttempt} failed. A retry-after hint from the
     * executor raises the delay to at least the hint, still bounded by {@link #maxBackoff}.
     */
    public Duration delayAfter(int failedAttempt, Duration retryAfter) {
        int exponent = Math.max(0, failedAttempt - 1);
        double multiplier = backoffMultiplier < 1.0d ? 1.0d : backoffMultiplier;
        double millis = Math.max(0L, backoff.toMillis()) * Math.pow(multiplier, exponent);
        long capMillis = maxBackoff.toMillis();
        long delay = (long) Math.min(millis, (double) capMillis);
        if (retryAfter != null && retryAfter.toMillis() > delay) {
            delay = Math.min(retryAfter.toMillis(), capMillis);
        }
        return Duration.ofMillis(delay);
    }

    public int effectiveMaxAttempts() {
        return Math.max(1, maxAttempts);
    }
}
