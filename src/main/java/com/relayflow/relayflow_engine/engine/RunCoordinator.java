package com.relayflow.relayflow_engine.engine;

import com.relayflow.relayflow_engine.exception.PersistenceException;
import com.relayflow.relayflow_engine.exception.ValidationException;
import com.relayflow.relayflow_engine.executor.CancelSignal;
import com.relayflow.relayflow_engine.executor.NodeExecutionRequest;
import com.relayflow.relayflow_engine.executor.NodeExecutor;
import com.relayflow.relayflow_engine.executor.NodeResult;
import com.relayflow.relayflow_engine.executor.VariableResolver;
import com.relayflow.relayflow_engine.model.domain.FailurePolicy;
import com.relayflow.relayflow_engine.model.domain.NodeDefinition;
import com.relayflow.relayflow_engine.model.domain.NodeType;
import com.relayflow.relayflow_engine.model.domain.RetryPolicy;
import com.relayflow.relayflow_engine.model.run.ErrorKind;
import com.relayflow.relayflow_engine.model.run.ExecutionContext;
import com.relayflow.relayflow_engine.model.run.NodeError;
import com.relayflow.relayflow_engine.model.run.NodeRun;
import com.relayflow.relayflow_engine.model.run.NodeRunState;
import com.relayflow.relayflow_engine.model.run.RunFailure;
import com.relayflow.relayflow_engine.model.run.RunState;
import com.relayflow.relayflow_engine.model.run.WorkflowRun;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scheduling loop of one run.
 * <p>
 * The coordinator thread is the only writer of the run's state. Node attempts execute on
 * the shared worker pool; their results, and every timer (attempt timeout, retry backoff,
 * cancel grace period, run timeout), come back as events on this run's queue. Ready nodes
 * are dispatched in declaration order, which makes the dispatch trace deterministic for a
 * given set of completion events.
 * </p>
 */
@Slf4j
class RunCoordinator implements Runnable {

    sealed interface Event permits AttemptCompleted, AttemptTimedOut, RetryDue, CancelRequested, GraceExpired, RunTimedOut {
    }

    record AttemptCompleted(int node, int attempt, NodeResult result) implements Event {
    }

    record AttemptTimedOut(int node, int attempt) implements Event {
    }

    record RetryDue(int node) implements Event {
    }

    record CancelRequested() implements Event {
    }

    record GraceExpired() implements Event {
    }

    record RunTimedOut() implements Event {
    }

    private record InFlight(int attempt, CancelSignal signal, Future<?> task, ScheduledFuture<?> timeout) {
    }

    private final RunPlan plan;
    private final WorkflowGraph graph;
    private final WorkflowRun run;
    private final String runId;
    private final EngineContext engine;
    private final CompletableFuture<WorkflowRun> completion;
    private final AtomicReference<WorkflowRun> snapshot;

    private final BlockingQueue<Event> events = new LinkedBlockingQueue<>();
    private final CancelSignal runSignal = new CancelSignal();
    private final ExecutionContext context;

    private final NodeRun[] nodeRuns;
    private final int[] pendingParents;
    private final int[] activeParents;
    private final NodeError[] lastErrors;
    private final NavigableSet<Integer> ready = new TreeSet<>();
    private final Map<Integer, InFlight> inFlight = new HashMap<>();
    private final Map<Integer, ScheduledFuture<?>> retryTimers = new HashMap<>();

    private ScheduledFuture<?> runTimeoutTimer;
    private ScheduledFuture<?> graceTimer;
    private boolean halting;
    private boolean cancelled;
    private boolean timedOut;
    private boolean anyFailed;
    private RunFailure failure;

    RunCoordinator(RunPlan plan, WorkflowRun run, EngineContext engine, CompletableFuture<WorkflowRun> completion) {
        this.plan = plan;
        this.graph = plan.graph();
        this.run = run;
        this.runId = run.getRunId();
        this.engine = engine;
        this.completion = completion;
        this.context = new ExecutionContext(run.getTrigger());
        this.snapshot = new AtomicReference<>(run.snapshot());

        int n = graph.size();
        this.nodeRuns = new NodeRun[n];
        this.pendingParents = new int[n];
        this.activeParents = new int[n];
        this.lastErrors = new NodeError[n];
        for (int i = 0; i < n; i++) {
            nodeRuns[i] = run.getNodeRuns().get(graph.node(i).getId());
            pendingParents[i] = graph.parents(i).length;
        }
    }

    String runId() {
        return runId;
    }

    WorkflowRun snapshot() {
        return snapshot.get();
    }

    void requestCancel() {
        events.add(new CancelRequested());
    }

    @Override
    public void run() {
        try {
            start();
            // A cancel issued while the run waited for a coordinator thread is already queued
            drainPending();
            dispatchReady();
            publishSnapshot();
            while (!isDrained()) {
                Event event = events.take();
                handle(event);
                dispatchReady();
                publishSnapshot();
            }
            finish();
        } catch (PersistenceException ex) {
            abort(ex.getMessage(), true);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            abort("Run coordinator interrupted", true);
        } catch (RuntimeException ex) {
            log.error("Run {} coordinator crashed: {}", runId, ex.getMessage(), ex);
            abort("Engine error: " + ex.getMessage(), true);
        }
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────────

    private void start() {
        run.setState(RunState.RUNNING);
        run.setStartedAt(engine.clock().instant());
        engine.recorder().runState(runId, RunState.RUNNING, null);
        engine.events().runStateChanged(runId, run.getDefinitionId(), RunState.RUNNING, null);

        for (int i = 0; i < graph.size(); i++) {
            if (pendingParents[i] == 0) {
                markReady(i);
            }
        }
        Duration runTimeout = plan.runTimeout();
        runTimeoutTimer = engine.timer().schedule(() -> events.add(new RunTimedOut()),
                runTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void drainPending() {
        Event pending;
        while ((pending = events.poll()) != null) {
            handle(pending);
        }
    }

    private boolean isDrained() {
        return inFlight.isEmpty() && ready.isEmpty() && retryTimers.isEmpty();
    }

    private void finish() {
        cancelTimers();
        for (int i = 0; i < graph.size(); i++) {
            if (!nodeRuns[i].getState().isTerminal()) {
                skip(i);
            }
        }

        RunState finalState;
        if (cancelled) {
            finalState = RunState.CANCELLED;
        } else if (timedOut || anyFailed) {
            finalState = RunState.FAILED;
        } else {
            finalState = RunState.SUCCEEDED;
        }
        RunFailure reported = finalState == RunState.FAILED ? failure : null;

        run.setResult(answerOutput());
        run.setState(finalState);
        run.setEndedAt(engine.clock().instant());
        run.setFailure(reported);
        engine.recorder().runState(runId, finalState, reported);
        complete(finalState, reported);
    }

    private Map<String, Object> answerOutput() {
        for (int i = 0; i < graph.size(); i++) {
            if (NodeType.ANSWER.id().equals(graph.node(i).getType())
                    && nodeRuns[i].getState() == NodeRunState.SUCCEEDED) {
                return nodeRuns[i].getOutput();
            }
        }
        return null;
    }

    /** Store or engine failure: stop everything and fail the run with the infrastructure marker. */
    private void abort(String message, boolean infrastructure) {
        runSignal.cancel();
        cancelTimers();
        inFlight.values().forEach(f -> f.task().cancel(true));
        settleAfterAbort();

        RunFailure infraFailure = RunFailure.builder()
                .kind(failure != null ? failure.getKind() : null)
                .nodeId(failure != null ? failure.getNodeId() : null)
                .attempts(failure != null ? failure.getAttempts() : 0)
                .message(message)
                .infrastructure(infrastructure)
                .build();
        run.setState(RunState.FAILED);
        run.setEndedAt(engine.clock().instant());
        run.setFailure(infraFailure);
        try {
            engine.store().updateRunState(runId, RunState.FAILED, infraFailure);
        } catch (RuntimeException storeError) {
            log.error("Run {} could not record infrastructure failure: {}", runId, storeError.getMessage());
        }
        complete(RunState.FAILED, infraFailure);
    }

    /**
     * Makes every node terminal in memory only, since the store is not trusted after an
     * abort. In-flight attempts fail (or are cancelled when the run was cancelled), nodes
     * that never started are skipped.
     */
    private void settleAfterAbort() {
        Instant now = engine.clock().instant();
        ErrorKind interruptedKind = cancelled ? ErrorKind.CANCELLED : ErrorKind.NODE_FAULT;
        for (int i = 0; i < graph.size(); i++) {
            NodeRun nodeRun = nodeRuns[i];
            if (nodeRun.getState().isTerminal()) continue;
            if (inFlight.containsKey(i) || nodeRun.getState() == NodeRunState.RUNNING) {
                nodeRun.setState(NodeRunState.FAILED);
                nodeRun.setError(new NodeError(interruptedKind, "Run aborted while the node was running"));
            } else {
                nodeRun.setState(NodeRunState.SKIPPED);
            }
            nodeRun.setNextAttemptAt(null);
            nodeRun.setEndedAt(now);
        }
        inFlight.clear();
        ready.clear();
    }

    private void complete(RunState finalState, RunFailure reported) {
        context.clear();
        publishSnapshot();
        engine.events().runStateChanged(runId, run.getDefinitionId(), finalState, reported);
        engine.onRunFinished(this);
        completion.complete(snapshot.get());
    }

    private void cancelTimers() {
        if (runTimeoutTimer != null) runTimeoutTimer.cancel(false);
        if (graceTimer != null) graceTimer.cancel(false);
        retryTimers.values().forEach(t -> t.cancel(false));
        retryTimers.clear();
        inFlight.values().forEach(f -> f.timeout().cancel(false));
    }

    private void publishSnapshot() {
        snapshot.set(run.snapshot());
    }

    // ── Events ────────────────────────────────────────────────────────────────

    private void handle(Event event) {
        if (event instanceof AttemptCompleted completed) {
            onAttemptCompleted(completed);
        } else if (event instanceof AttemptTimedOut timeout) {
            onAttemptTimedOut(timeout);
        } else if (event instanceof RetryDue due) {
            onRetryDue(due.node());
        } else if (event instanceof CancelRequested) {
            onCancel();
        } else if (event instanceof GraceExpired) {
            onGraceExpired();
        } else if (event instanceof RunTimedOut) {
            onRunTimedOut();
        }
    }

    private void onAttemptCompleted(AttemptCompleted event) {
        InFlight flight = currentFlight(event.node(), event.attempt());
        if (flight == null) return;
        inFlight.remove(event.node());
        flight.timeout().cancel(false);

        NodeResult result = event.result();
        if (result.isSuccess()) {
            succeed(event.node(), result.getOutput());
        } else {
            attemptFailed(event.node(), result.getErrorKind(), result.getErrorMessage(), result.getRetryAfter());
        }
    }

    private void onAttemptTimedOut(AttemptTimedOut event) {
        InFlight flight = currentFlight(event.node(), event.attempt());
        if (flight == null) return;
        inFlight.remove(event.node());
        flight.signal().cancel();
        flight.task().cancel(true);
        Duration limit = plan.nodeTimeouts()[event.node()];
        attemptFailed(event.node(), ErrorKind.TIMEOUT, "Node timed out after " + limit.toMillis() + " ms", null);
    }

    // Late completions of timed-out, cancelled or superseded attempts are ignored
    private InFlight currentFlight(int node, int attempt) {
        InFlight flight = inFlight.get(node);
        if (flight == null || flight.attempt() != attempt || nodeRuns[node].getState() != NodeRunState.RUNNING) {
            log.debug("Run {} ignoring stale event for node {} attempt {}", runId, graph.node(node).getId(), attempt);
            return null;
        }
        return flight;
    }

    private void onRetryDue(int node) {
        if (retryTimers.remove(node) == null || halting) return;
        NodeRun nodeRun = nodeRuns[node];
        nodeRun.setNextAttemptAt(null);
        markReady(node);
    }

    private void onCancel() {
        if (cancelled) return;
        log.info("Run {} cancellation requested", runId);
        cancelled = true;
        halt();
        startGracePeriod();
    }

    private void onRunTimedOut() {
        if (timedOut || cancelled) return;
        timedOut = true;
        Duration limit = plan.runTimeout();
        failure = RunFailure.builder()
                .kind(ErrorKind.TIMEOUT)
                .message("Run exceeded timeout of " + limit.toMillis() + " ms")
                .build();
        log.warn("Run {} timed out after {} ms", runId, limit.toMillis());
        halt();
        startGracePeriod();
    }

    private void startGracePeriod() {
        runSignal.cancel();
        if (!inFlight.isEmpty() && graceTimer == null) {
            long graceMs = engine.cancelGracePeriod().toMillis();
            graceTimer = engine.timer().schedule(() -> events.add(new GraceExpired()), graceMs, TimeUnit.MILLISECONDS);
        }
    }

    private void onGraceExpired() {
        for (Map.Entry<Integer, InFlight> entry : Map.copyOf(inFlight).entrySet()) {
            int node = entry.getKey();
            InFlight flight = entry.getValue();
            flight.timeout().cancel(false);
            flight.task().cancel(true);
            inFlight.remove(node);
            ErrorKind kind = timedOut ? ErrorKind.TIMEOUT : ErrorKind.CANCELLED;
            failNode(node, kind, "Node did not stop within the cancellation grace period");
        }
    }

    // ── Node transitions ──────────────────────────────────────────────────────

    private void markReady(int node) {
        nodeRuns[node].setState(NodeRunState.READY);
        engine.recorder().nodeState(runId, graph.node(node).getId(), NodeRunState.READY, null, null);
        ready.add(node);
    }

    private void dispatchReady() {
        if (halting) return;
        while (!ready.isEmpty() && inFlight.size() < engine.maxParallelNodes()) {
            dispatch(ready.pollFirst());
        }
    }

    private void dispatch(int node) {
        NodeDefinition definition = graph.node(node);
        NodeRun nodeRun = nodeRuns[node];
        int attempt = nodeRun.getAttempts() + 1;
        nodeRun.setAttempts(attempt);

        Map<String, Object> inputs;
        try {
            inputs = engine.resolver().resolveInputs(definition.getInputs(), context);
        } catch (ValidationException ex) {
            failNode(node, ErrorKind.VALIDATION, ex.getMessage());
            return;
        }

        nodeRun.setState(NodeRunState.RUNNING);
        if (nodeRun.getStartedAt() == null) {
            nodeRun.setStartedAt(engine.clock().instant());
        }
        run.getDispatchOrder().add(definition.getId());
        engine.recorder().nodeState(runId, definition.getId(), NodeRunState.RUNNING, null, null);
        engine.events().nodeStarted(runId, definition.getId(), attempt);

        CancelSignal signal = runSignal.child();
        NodeExecutionRequest request = NodeExecutionRequest.builder()
                .runId(runId)
                .nodeId(definition.getId())
                .attempt(attempt)
                .config(definition.getConfig())
                .inputs(inputs)
                .trigger(run.getTrigger())
                .cancelSignal(signal)
                .build();
        NodeExecutor executor = plan.executors()[node];

        Future<?> task;
        try {
            task = engine.workers().submit(() -> events.add(new AttemptCompleted(node, attempt, invoke(executor, request))));
        } catch (RejectedExecutionException ex) {
            attemptFailed(node, ErrorKind.RETRYABLE, "Worker pool saturated", null);
            return;
        }
        Duration limit = plan.nodeTimeouts()[node];
        ScheduledFuture<?> timeout = engine.timer().schedule(
                () -> events.add(new AttemptTimedOut(node, attempt)), limit.toMillis(), TimeUnit.MILLISECONDS);
        inFlight.put(node, new InFlight(attempt, signal, task, timeout));
    }

    // Runs on a worker thread; must not touch coordinator state
    private static NodeResult invoke(NodeExecutor executor, NodeExecutionRequest request) {
        try {
            NodeResult result = executor.execute(request);
            if (result == null) {
                return NodeResult.failure(ErrorKind.NODE_FAULT, "Executor returned no result");
            }
            return result;
        } catch (ValidationException ex) {
            return NodeResult.failure(ErrorKind.VALIDATION, ex.getMessage());
        } catch (RuntimeException ex) {
            String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("Node {} ({}) threw on attempt {}: {}", request.getNodeId(),
                    executor.supportedType(), request.getAttempt(), msg, ex);
            return NodeResult.failure(ErrorKind.NODE_FAULT, msg);
        }
    }

    private void succeed(int node, Map<String, Object> output) {
        NodeRun nodeRun = nodeRuns[node];
        String nodeId = graph.node(node).getId();
        nodeRun.setState(NodeRunState.SUCCEEDED);
        nodeRun.setOutput(output);
        nodeRun.setError(null);
        nodeRun.setEndedAt(engine.clock().instant());
        context.recordSuccess(nodeId, output, nodeRun.getAttempts());
        engine.recorder().nodeState(runId, nodeId, NodeRunState.SUCCEEDED, output, null);
        engine.events().nodeCompleted(runId, nodeId, NodeRunState.SUCCEEDED, nodeRun.getAttempts());

        String selected = selectedHandle(output);
        for (int child : graph.children(node)) {
            if (selected == null || selected.equals(graph.handle(node, child))) {
                activeParents[child]++;
            }
            parentSettled(child);
        }
    }

    private static String selectedHandle(Map<String, Object> output) {
        Object handle = output != null ? output.get(NodeExecutor.SELECTED_HANDLE) : null;
        return handle != null ? String.valueOf(handle) : null;
    }

    // A node runs once every parent settled and at least one incoming edge was followed
    private void parentSettled(int child) {
        pendingParents[child]--;
        if (pendingParents[child] > 0 || nodeRuns[child].getState() != NodeRunState.WAITING || halting) {
            return;
        }
        if (activeParents[child] > 0) {
            markReady(child);
        } else {
            skipBranch(child);
        }
    }

    private void skipBranch(int node) {
        String nodeId = graph.node(node).getId();
        log.debug("Run {} skipping {}: no selected branch leads to it", runId, nodeId);
        skip(node);
        context.recordBranchSkipped(nodeId);
        for (int child : graph.children(node)) {
            parentSettled(child);
        }
    }

    private void attemptFailed(int node, ErrorKind kind, String message, Duration retryAfter) {
        ErrorKind effectiveKind = kind != null ? kind : ErrorKind.NODE_FAULT;
        NodeRun nodeRun = nodeRuns[node];
        NodeError error = new NodeError(effectiveKind, message);
        lastErrors[node] = error;
        RetryPolicy policy = plan.retryPolicies()[node];

        if (effectiveKind.isRetryable() && nodeRun.getAttempts() < policy.effectiveMaxAttempts() && !halting) {
            Duration delay = policy.delayAfter(nodeRun.getAttempts(), retryAfter);
            String nodeId = graph.node(node).getId();
            nodeRun.setState(NodeRunState.WAITING);
            nodeRun.setError(error);
            nodeRun.setNextAttemptAt(engine.clock().instant().plus(delay));
            engine.recorder().nodeState(runId, nodeId, NodeRunState.WAITING, null, error);
            engine.events().nodeRetrying(runId, nodeId, nodeRun.getAttempts(), error, delay.toMillis());
            retryTimers.put(node, engine.timer().schedule(
                    () -> events.add(new RetryDue(node)), delay.toMillis(), TimeUnit.MILLISECONDS));
            return;
        }
        failNode(node, effectiveKind, message);
    }

    private void failNode(int node, ErrorKind kind, String message) {
        NodeRun nodeRun = nodeRuns[node];
        String nodeId = graph.node(node).getId();
        NodeError error = new NodeError(kind, message);
        nodeRun.setState(NodeRunState.FAILED);
        nodeRun.setError(error);
        nodeRun.setNextAttemptAt(null);
        nodeRun.setEndedAt(engine.clock().instant());
        engine.recorder().nodeState(runId, nodeId, NodeRunState.FAILED, null, error);
        engine.events().nodeFailed(runId, nodeId, nodeRun.getAttempts(), error);

        anyFailed = true;
        if (failure == null && !cancelled) {
            failure = RunFailure.builder()
                    .nodeId(nodeId)
                    .kind(kind)
                    .attempts(nodeRun.getAttempts())
                    .message(message)
                    .build();
        }

        BitSet descendants = graph.descendants(node);
        for (int d = descendants.nextSetBit(0); d >= 0; d = descendants.nextSetBit(d + 1)) {
            if (!nodeRuns[d].getState().isTerminal() && nodeRuns[d].getState() != NodeRunState.RUNNING) {
                skip(d);
            }
        }

        if (plan.graph().definition().getFailurePolicy() == FailurePolicy.FAIL_FAST) {
            halt();
        }
    }

    private void skip(int node) {
        NodeRun nodeRun = nodeRuns[node];
        ready.remove(node);
        ScheduledFuture<?> retry = retryTimers.remove(node);
        if (retry != null) retry.cancel(false);
        nodeRun.setState(NodeRunState.SKIPPED);
        nodeRun.setNextAttemptAt(null);
        nodeRun.setEndedAt(engine.clock().instant());
        engine.recorder().nodeState(runId, graph.node(node).getId(), NodeRunState.SKIPPED, null, null);
    }

    /**
     * Stops dispatching. Not-started nodes are skipped, nodes waiting out a retry backoff
     * fail with their last error, in-flight nodes drain.
     */
    private void halt() {
        if (halting) return;
        halting = true;
        for (int node : Map.copyOf(retryTimers).keySet()) {
            retryTimers.remove(node).cancel(false);
            NodeError last = lastErrors[node];
            failNodeQuietly(node, last != null ? last : new NodeError(ErrorKind.CANCELLED, "Run halted"));
        }
        for (int node : new TreeSet<>(ready)) {
            skip(node);
        }
        ready.clear();
        for (int i = 0; i < graph.size(); i++) {
            if (nodeRuns[i].getState() == NodeRunState.WAITING) {
                skip(i);
            }
        }
    }

    // Terminal failure without re-entering halt(); used while halting
    private void failNodeQuietly(int node, NodeError error) {
        NodeRun nodeRun = nodeRuns[node];
        String nodeId = graph.node(node).getId();
        nodeRun.setState(NodeRunState.FAILED);
        nodeRun.setError(error);
        nodeRun.setNextAttemptAt(null);
        nodeRun.setEndedAt(engine.clock().instant());
        anyFailed = true;
        engine.recorder().nodeState(runId, nodeId, NodeRunState.FAILED, null, error);
        engine.events().nodeFailed(runId, nodeId, nodeRun.getAttempts(), error);
    }
}
