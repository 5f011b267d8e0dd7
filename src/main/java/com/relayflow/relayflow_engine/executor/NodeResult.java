package com.relayflow.relayflow_engine.executor;

import com.relayflow.relayflow_engine.model.run.ErrorKind;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Outcome of one node attempt.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NodeResult {

    public enum Status { SUCCEEDED, FAILED }

    Status status;
    Map<String, Object> output;
    ErrorKind errorKind;
    String errorMessage;

    /** Minimum delay before the next attempt, typically from a Retry-After header. */
    Duration retryAfter;

    public static NodeResult success(Map<String, Object> output) {
        return new NodeResult(Status.SUCCEEDED, output != null ? output : Map.of(), null, null, null);
    }

    public static NodeResult failure(ErrorKind kind, String message) {
        return new NodeResult(Status.FAILED, null, kind, message, null);
    }

    public static NodeResult retryable(String message, Duration retryAfter) {
        return new NodeResult(Status.FAILED, null, ErrorKind.RETRYABLE, message, retryAfter);
    }

    public static NodeResult cancelled() {
        return failure(ErrorKind.CANCELLED, "Node was cancelled");
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }
}
