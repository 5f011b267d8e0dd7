package com.relayflow.relayflow_engine.engine;

import com.relayflow.relayflow_engine.config.EngineProperties;
import com.relayflow.relayflow_engine.exception.PersistenceException;
import com.relayflow.relayflow_engine.model.domain.WorkflowDefinition;
import com.relayflow.relayflow_engine.model.run.NodeError;
import com.relayflow.relayflow_engine.model.run.NodeRunState;
import com.relayflow.relayflow_engine.model.run.RunFailure;
import com.relayflow.relayflow_engine.model.run.RunState;
import com.relayflow.relayflow_engine.model.run.TriggerContext;
import com.relayflow.relayflow_engine.repository.RunStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Every store call of the engine goes through here. Failed calls are retried with
 * exponential backoff; once attempts run out a {@link PersistenceException} is thrown and
 * the caller fails the run with the infrastructure marker.
 */
@Slf4j
@Component
public class RunStateRecorder {

    private final RunStateStore store;
    private final EngineProperties.Persistence settings;

    public RunStateRecorder(RunStateStore store, EngineProperties properties) {
        this.store = store;
        this.settings = properties.getPersistence();
    }

    public String createRun(String definitionId, TriggerContext trigger) {
        return call("createRun(" + definitionId + ")", () -> store.createRun(definitionId, trigger));
    }

    public void nodeState(String runId, String nodeId, NodeRunState state, Map<String, Object> output, NodeError error) {
        call("updateNodeRun(" + runId + ", " + nodeId + ", " + state + ")", () -> {
            store.updateNodeRun(runId, nodeId, state, output, error);
            return null;
        });
    }

    public void runState(String runId, RunState state, RunFailure failure) {
        call("updateRunState(" + runId + ", " + state + ")", () -> {
            if (failure == null) {
                store.updateRunState(runId, state);
            } else {
                store.updateRunState(runId, state, failure);
            }
            return null;
        });
    }

    public Optional<WorkflowDefinition> loadDefinition(String definitionId) {
        return call("loadDefinition(" + definitionId + ")", () -> store.loadDefinition(definitionId));
    }

    public void saveDefinition(WorkflowDefinition definition) {
        call("saveDefinition(" + definition.getId() + ")", () -> {
            store.saveDefinition(definition);
            return null;
        });
    }

    public boolean deleteDefinition(String definitionId) {
        return call("deleteDefinition(" + definitionId + ")", () -> store.deleteDefinition(definitionId));
    }

    private <T> T call(String operation, Supplier<T> action) {
        int maxAttempts = Math.max(1, settings.getMaxAttempts());
        long delayMs = Math.max(0L, settings.getBackoff().toMillis());
        double multiplier = settings.getBackoffMultiplier() > 0 ? settings.getBackoffMultiplier() : 1.0d;

        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return action.get();
            } catch (RuntimeException ex) {
                if (attempt >= maxAttempts) {
                    log.error("Store call {} failed after {} attempts: {}", operation, attempt, ex.getMessage());
                    throw new PersistenceException(
                            "Run-state store call " + operation + " failed after " + attempt + " attempts: " + ex.getMessage(), ex);
                }
                log.warn("Store call {} failed on attempt {}/{}. Retrying in {} ms: {}",
                        operation, attempt, maxAttempts, delayMs, ex.getMessage());
            }
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new PersistenceException("Interrupted while retrying store call " + operation, ie);
            }
            delayMs = (long) Math.max(0L, delayMs * multiplier);
        }
    }
}
