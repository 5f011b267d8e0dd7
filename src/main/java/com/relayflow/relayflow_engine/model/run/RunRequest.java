package com.relayflow.relayflow_engine.model.run;

import lombok.NonNull;

/**
 * Request to start a run. Holds the definition id, never a live graph.
 */
public record RunRequest(@NonNull String definitionId, @NonNull TriggerContext trigger) {
}
