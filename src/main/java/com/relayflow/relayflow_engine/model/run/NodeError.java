package com.relayflow.relayflow_engine.model.run;

public record NodeError(ErrorKind kind, String message) {
}
