package com.relayflow.relayflow_engine.engine;

import com.relayflow.relayflow_engine.config.EngineProperties;
import com.relayflow.relayflow_engine.exception.DefinitionNotFoundException;
import com.relayflow.relayflow_engine.exception.PersistenceException;
import com.relayflow.relayflow_engine.exception.ValidationException;
import com.relayflow.relayflow_engine.executor.NodeExecutor;
import com.relayflow.relayflow_engine.executor.NodeExecutorRegistry;
import com.relayflow.relayflow_engine.executor.VariableResolver;
import com.relayflow.relayflow_engine.model.domain.NodeDefinition;
import com.relayflow.relayflow_engine.model.domain.RetryPolicy;
import com.relayflow.relayflow_engine.model.domain.WorkflowDefinition;
import com.relayflow.relayflow_engine.model.run.ErrorKind;
import com.relayflow.relayflow_engine.model.run.NodeRun;
import com.relayflow.relayflow_engine.model.run.RunFailure;
import com.relayflow.relayflow_engine.model.run.RunRequest;
import com.relayflow.relayflow_engine.model.run.RunState;
import com.relayflow.relayflow_engine.model.run.TriggerContext;
import com.relayflow.relayflow_engine.model.run.WorkflowRun;
import com.relayflow.relayflow_engine.repository.RunStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for running workflows.
 * <p>
 * {@link #start} validates the definition on the caller's thread. A definition that fails
 * validation produces a run that goes straight from PENDING to FAILED without executing
 * any node. Valid runs are handed to a {@link RunCoordinator} on the coordinator pool.
 * </p>
 */
@Slf4j
@Service
public class WorkflowExecutionEngine {

    private final WorkflowValidator validator;
    private final NodeExecutorRegistry registry;
    private final RunStateRecorder recorder;
    private final ExecutionEventPublisher events;
    private final ThreadPoolExecutor coordinators;
    private final Clock clock;
    private final EngineProperties.Execution settings;
    private final EngineContext context;

    private final Map<String, RunCoordinator> active = new ConcurrentHashMap<>();
    private final Map<String, WorkflowRun> history;

    public WorkflowExecutionEngine(WorkflowValidator validator,
                                   NodeExecutorRegistry registry,
                                   VariableResolver resolver,
                                   RunStateRecorder recorder,
                                   RunStateStore store,
                                   ExecutionEventPublisher events,
                                   @Qualifier("nodeWorkerPool") ThreadPoolExecutor workers,
                                   @Qualifier("runCoordinatorPool") ThreadPoolExecutor coordinators,
                                   @Qualifier("engineTimer") ScheduledExecutorService timer,
                                   Clock clock,
                                   EngineProperties properties) {
        this.validator = validator;
        this.registry = registry;
        this.recorder = recorder;
        this.events = events;
        this.coordinators = coordinators;
        this.clock = clock;
        this.settings = properties.getExecution();
        this.context = new EngineContext(clock, recorder, store, events, resolver, workers, timer,
                settings.getCancelGracePeriod(), Math.max(1, settings.getMaxParallelNodes()), this::finished);

        int historySize = Math.max(0, settings.getHistorySize());
        this.history = Collections.synchronizedMap(new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, WorkflowRun> eldest) {
                return size() > historySize;
            }
        });
    }

    public WorkflowDefinition loadDefinition(String definitionId) {
        return recorder.loadDefinition(definitionId)
                .orElseThrow(() -> new DefinitionNotFoundException(definitionId));
    }

    public RunHandle submit(RunRequest request) {
        return start(loadDefinition(request.definitionId()), request.trigger());
    }

    /** Starts a run and blocks until it is terminal or {@code timeout} elapses. */
    public WorkflowRun execute(RunRequest request, Duration timeout) throws InterruptedException, TimeoutException {
        return submit(request).await(timeout);
    }

    public RunHandle start(WorkflowDefinition definition, TriggerContext trigger) {
        String runId = recorder.createRun(definition.getId(), trigger);
        WorkflowRun run = WorkflowRun.builder()
                .runId(runId)
                .definitionId(definition.getId())
                .trigger(trigger)
                .state(RunState.PENDING)
                .build();
        for (NodeDefinition node : definition.getNodes()) {
            run.getNodeRuns().putIfAbsent(node.getId(), NodeRun.builder().nodeId(node.getId()).build());
        }
        CompletableFuture<WorkflowRun> completion = new CompletableFuture<>();

        RunPlan plan;
        try {
            plan = plan(definition);
        } catch (ValidationException ex) {
            rejectRun(run, ex);
            completion.complete(run.snapshot());
            return new RunHandle(runId, completion);
        }

        RunCoordinator coordinator = new RunCoordinator(plan, run, context, completion);
        active.put(runId, coordinator);
        coordinators.execute(coordinator);
        log.info("Run {} of {} accepted ({} nodes, trigger={})",
                runId, definition.getId(), plan.graph().size(), trigger.getType());
        return new RunHandle(runId, completion);
    }

    public boolean cancel(String runId) {
        RunCoordinator coordinator = active.get(runId);
        if (coordinator == null) {
            return false;
        }
        coordinator.requestCancel();
        return true;
    }

    public Optional<WorkflowRun> status(String runId) {
        RunCoordinator coordinator = active.get(runId);
        if (coordinator != null) {
            return Optional.of(coordinator.snapshot());
        }
        return Optional.ofNullable(history.get(runId));
    }

    public List<String> activeRunIds() {
        return List.copyOf(active.keySet());
    }

    private RunPlan plan(WorkflowDefinition definition) {
        WorkflowGraph graph = validator.validate(definition);
        int n = graph.size();
        NodeExecutor[] executors = new NodeExecutor[n];
        RetryPolicy[] policies = new RetryPolicy[n];
        Duration[] timeouts = new Duration[n];
        for (int i = 0; i < n; i++) {
            NodeDefinition node = graph.node(i);
            executors[i] = registry.resolve(node.getType());
            policies[i] = effectiveRetryPolicy(node, executors[i]);
            timeouts[i] = node.getTimeout() != null ? node.getTimeout() : settings.getDefaultNodeTimeout();
        }
        Duration runTimeout = definition.getRunTimeout() != null ? definition.getRunTimeout() : settings.getDefaultRunTimeout();
        return new RunPlan(graph, executors, policies, timeouts, runTimeout);
    }

    // node definition, then executor default, then engine default
    private RetryPolicy effectiveRetryPolicy(NodeDefinition node, NodeExecutor executor) {
        if (node.getRetryPolicy() != null) return node.getRetryPolicy();
        RetryPolicy executorDefault = executor.defaultRetryPolicy();
        return executorDefault != null ? executorDefault : settings.defaultRetryPolicy();
    }

    private void rejectRun(WorkflowRun run, ValidationException ex) {
        log.warn("Run {} of {} rejected by validation: {}", run.getRunId(), run.getDefinitionId(), ex.getMessage());
        RunFailure failure = RunFailure.builder()
                .kind(ErrorKind.VALIDATION)
                .message(ex.getMessage())
                .build();
        run.setState(RunState.FAILED);
        run.setEndedAt(clock.instant());
        try {
            recorder.runState(run.getRunId(), RunState.FAILED, failure);
        } catch (PersistenceException pe) {
            failure = failure.toBuilder().infrastructure(true).message(ex.getMessage() + "; " + pe.getMessage()).build();
        }
        run.setFailure(failure);
        events.runStateChanged(run.getRunId(), run.getDefinitionId(), RunState.FAILED, failure);
        history.put(run.getRunId(), run.snapshot());
    }

    private void finished(RunCoordinator coordinator) {
        history.put(coordinator.runId(), coordinator.snapshot());
        active.remove(coordinator.runId());
    }
}
