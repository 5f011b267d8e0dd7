package com.relayflow.relayflow_engine.service;

import com.relayflow.relayflow_engine.engine.RunHandle;
import com.relayflow.relayflow_engine.engine.WorkflowExecutionEngine;
import com.relayflow.relayflow_engine.model.domain.ConcurrencyPolicy;
import com.relayflow.relayflow_engine.model.domain.WorkflowDefinition;
import com.relayflow.relayflow_engine.model.run.RunRequest;
import com.relayflow.relayflow_engine.model.run.TriggerContext;
import com.relayflow.relayflow_engine.model.run.WorkflowRun;
import com.relayflow.relayflow_engine.trigger.RunRequestSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Applies each definition's {@link ConcurrencyPolicy} before handing requests to the engine.
 * <p>
 * Every definition has a lane that counts its active runs. With QUEUE, requests arriving
 * while a run is active wait in FIFO order and start when the active run ends. With SKIP
 * they are dropped. PARALLEL starts everything.
 * </p>
 * Trigger requests, manual starts and synchronous runs all pass through {@link #submit}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowService implements RunRequestSink {

    private final WorkflowExecutionEngine engine;
    private final Clock clock;

    private final Map<String, Lane> lanes = new ConcurrentHashMap<>();

    @Override
    public void accept(RunRequest request) {
        RunTicket ticket = submit(request);
        log.debug("Run request for {} from {}: {}", request.definitionId(), request.trigger().getType(), ticket.status());
    }

    public RunTicket submit(RunRequest request) {
        WorkflowDefinition definition = engine.loadDefinition(request.definitionId());
        Lane lane = lanes.computeIfAbsent(definition.getId(), id -> new Lane());
        ConcurrencyPolicy policy = definition.getConcurrencyPolicy();

        synchronized (lane) {
            if (policy != ConcurrencyPolicy.PARALLEL && lane.active > 0) {
                if (policy == ConcurrencyPolicy.SKIP) {
                    log.info("Run request for {} skipped: a run is already active", definition.getId());
                    return RunTicket.skipped();
                }
                CompletableFuture<WorkflowRun> later = new CompletableFuture<>();
                lane.pending.addLast(new Pending(request, later));
                log.info("Run request for {} queued behind {} active run(s), {} waiting",
                        definition.getId(), lane.active, lane.pending.size());
                return new RunTicket(RunTicket.Status.QUEUED, null, later);
            }
            lane.active++;
        }
        RunHandle handle = startInLane(definition, request, lane);
        return new RunTicket(RunTicket.Status.STARTED, handle.runId(), handle.completion());
    }

    public RunTicket triggerManual(String definitionId, Map<String, Object> payload) {
        return submit(new RunRequest(definitionId, TriggerContext.manual(definitionId, payload, clock.instant())));
    }

    /**
     * Starts a manual run and waits for it. Empty when the request was skipped.
     */
    public Optional<WorkflowRun> runSync(String definitionId, Map<String, Object> payload, Duration timeout)
            throws InterruptedException, TimeoutException {
        RunTicket ticket = triggerManual(definitionId, payload);
        if (ticket.isSkipped()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(ticket.completion().get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run of " + definitionId + " completed exceptionally", e.getCause());
        }
    }

    public boolean cancel(String runId) {
        return engine.cancel(runId);
    }

    public Optional<WorkflowRun> status(String runId) {
        return engine.status(runId);
    }

    public int queuedRequests(String definitionId) {
        Lane lane = lanes.get(definitionId);
        if (lane == null) return 0;
        synchronized (lane) {
            return lane.pending.size();
        }
    }

    // ── Lanes ─────────────────────────────────────────────────────────────────

    private RunHandle startInLane(WorkflowDefinition definition, RunRequest request, Lane lane) {
        RunHandle handle;
        try {
            handle = engine.start(definition, request.trigger());
        } catch (RuntimeException ex) {
            release(definition.getId(), lane);
            throw ex;
        }
        // Callers observe completion only after the lane has been released
        CompletableFuture<WorkflowRun> released = handle.completion()
                .whenComplete((run, error) -> release(definition.getId(), lane));
        return new RunHandle(handle.runId(), released);
    }

    private void release(String definitionId, Lane lane) {
        Pending next;
        synchronized (lane) {
            lane.active--;
            next = lane.pending.pollFirst();
            if (next != null) {
                lane.active++;
            }
        }
        if (next == null) {
            return;
        }
        log.info("Starting queued run of {}", definitionId);
        WorkflowDefinition definition;
        try {
            definition = engine.loadDefinition(definitionId);
        } catch (RuntimeException ex) {
            log.error("Queued run of {} could not start: {}", definitionId, ex.getMessage());
            next.completion().completeExceptionally(ex);
            release(definitionId, lane);
            return;
        }
        RunHandle handle;
        try {
            handle = startInLane(definition, next.request(), lane);
        } catch (RuntimeException ex) {
            log.error("Queued run of {} could not start: {}", definitionId, ex.getMessage());
            next.completion().completeExceptionally(ex);
            return;
        }
        handle.completion().whenComplete((run, error) -> {
            if (error != null) {
                next.completion().completeExceptionally(error);
            } else {
                next.completion().complete(run);
            }
        });
    }

    private static final class Lane {
        private int active;
        private final Deque<Pending> pending = new ArrayDeque<>();
    }

    private record Pending(RunRequest request, CompletableFuture<WorkflowRun> completion) {
    }
}
