package com.relayflow.relayflow_engine.engine;

import com.relayflow.relayflow_engine.model.run.NodeError;
import com.relayflow.relayflow_engine.model.run.NodeRunState;
import com.relayflow.relayflow_engine.model.run.RunFailure;
import com.relayflow.relayflow_engine.model.run.RunState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes run and node transitions as Spring application events. Listeners run on the
 * coordinator thread, so they must not block.
 */
@Slf4j
@Component
public class ExecutionEventPublisher {

    private final ApplicationEventPublisher publisher;

    public ExecutionEventPublisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    public void runStateChanged(String runId, String definitionId, RunState state, RunFailure failure) {
        if (failure != null) {
            log.info("Run {} of {} -> {} (node={}, kind={}, attempts={}, infrastructure={}): {}",
                    runId, definitionId, state, failure.getNodeId(), failure.getKind(),
                    failure.getAttempts(), failure.isInfrastructure(), failure.getMessage());
        } else {
            log.info("Run {} of {} -> {}", runId, definitionId, state);
        }
        publish(new WorkflowRunEvent(runId, definitionId, state, failure));
    }

    public void nodeStarted(String runId, String nodeId, int attempt) {
        log.info("Run {} node {} started (attempt {})", runId, nodeId, attempt);
        publish(new NodeRunEvent(runId, nodeId, NodeRunState.RUNNING, attempt, null));
    }

    public void nodeCompleted(String runId, String nodeId, NodeRunState state, int attempt) {
        log.info("Run {} node {} -> {} after {} attempt(s)", runId, nodeId, state, attempt);
        publish(new NodeRunEvent(runId, nodeId, state, attempt, null));
    }

    public void nodeFailed(String runId, String nodeId, int attempt, NodeError error) {
        log.error("Run {} node {} failed on attempt {} [{}]: {}", runId, nodeId, attempt, error.kind(), error.message());
        publish(new NodeRunEvent(runId, nodeId, NodeRunState.FAILED, attempt, error));
    }

    public void nodeRetrying(String runId, String nodeId, int attempt, NodeError error, long delayMs) {
        log.warn("Run {} node {} failed on attempt {} [{}], retrying in {} ms: {}",
                runId, nodeId, attempt, error.kind(), delayMs, error.message());
        publish(new NodeRunEvent(runId, nodeId, NodeRunState.WAITING, attempt, error));
    }

    private void publish(Object event) {
        try {
            publisher.publishEvent(event);
        } catch (RuntimeException ex) {
            log.warn("Execution event listener failed for {}: {}", event, ex.getMessage());
        }
    }
}
