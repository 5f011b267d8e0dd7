package com.relayflow.relayflow_engine.trigger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayflow.relayflow_engine.config.EngineProperties;
import com.relayflow.relayflow_engine.config.EngineProperties.MisfirePolicy;
import com.relayflow.relayflow_engine.exception.TriggerNotFoundException;
import com.relayflow.relayflow_engine.exception.ValidationException;
import com.relayflow.relayflow_engine.executor.ConfigReader;
import com.relayflow.relayflow_engine.model.domain.NodeDefinition;
import com.relayflow.relayflow_engine.model.domain.NodeType;
import com.relayflow.relayflow_engine.model.domain.Trigger;
import com.relayflow.relayflow_engine.model.domain.TriggerType;
import com.relayflow.relayflow_engine.model.domain.WorkflowDefinition;
import com.relayflow.relayflow_engine.model.run.RunRequest;
import com.relayflow.relayflow_engine.model.run.TriggerContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns live schedule and webhook triggers and turns them into run requests.
 * <p>
 * Schedules: {@link #tick(Instant)} fires every trigger whose {@code nextFireAt} has passed.
 * Time is read through a monotonic view of the clock, so a clock stepping backwards never
 * re-fires a slot. The next fire time advances along the cron slots from the slot that
 * fired, so late ticks do not shift the schedule. Slots missed by more than one period are
 * handled by the configured {@link MisfirePolicy}.
 * </p>
 * <p>
 * Webhooks: {@link #acceptWebhook} verifies the signature when the trigger has a secret and
 * hands the request to the sink on the caller's thread.
 * </p>
 */
@Slf4j
@Service
public class TriggerService {

    private final Clock clock;
    private final EngineProperties.Trigger settings;
    private final WebhookSignatureVerifier verifier;
    private final ObjectMapper objectMapper;
    private final RunRequestSink sink;

    private final Map<String, ScheduledTriggerState> schedules = new ConcurrentHashMap<>();
    private final Map<String, Trigger.Webhook> webhooksByPath = new ConcurrentHashMap<>();
    private Instant lastObserved = Instant.MIN;

    public TriggerService(Clock clock, EngineProperties properties, WebhookSignatureVerifier verifier,
                          ObjectMapper objectMapper, RunRequestSink sink) {
        this.clock = clock;
        this.settings = properties.getTrigger();
        this.verifier = verifier;
        this.objectMapper = objectMapper;
        this.sink = sink;
    }

    // ── Registration ──────────────────────────────────────────────────────────

    public void register(Trigger trigger) {
        if (trigger instanceof Trigger.Schedule schedule) {
            registerSchedule(schedule);
        } else if (trigger instanceof Trigger.Webhook webhook) {
            registerWebhook(webhook);
        } else {
            throw new ValidationException("Manual triggers are started through WorkflowService, not registered");
        }
    }

    /** Replaces every trigger of the definition with the trigger nodes it declares now. */
    public void registerDefinition(WorkflowDefinition definition) {
        unregisterDefinition(definition.getId());
        for (NodeDefinition node : definition.getNodes()) {
            String triggerId = definition.getId() + ":" + node.getId();
            Map<String, Object> config = node.getConfig();
            if (NodeType.SCHEDULE_TRIGGER.id().equals(node.getType())) {
                String zone = ConfigReader.string(config, "timezone", settings.getDefaultTimezone());
                registerSchedule(new Trigger.Schedule(triggerId, definition.getId(),
                        ConfigReader.requireString(config, "cron"), CronSchedule.zone(zone)));
            } else if (NodeType.WEBHOOK_TRIGGER.id().equals(node.getType())) {
                registerWebhook(new Trigger.Webhook(triggerId, definition.getId(),
                        ConfigReader.requireString(config, "path"), ConfigReader.string(config, "secret", null)));
            }
        }
    }

    public void unregisterDefinition(String definitionId) {
        schedules.values().removeIf(s -> s.getTrigger().definitionId().equals(definitionId));
        webhooksByPath.values().removeIf(w -> w.definitionId().equals(definitionId));
    }

    public boolean unregister(String triggerId) {
        boolean removed = schedules.remove(triggerId) != null;
        removed |= webhooksByPath.values().removeIf(w -> w.triggerId().equals(triggerId));
        return removed;
    }

    private void registerSchedule(Trigger.Schedule trigger) {
        ZoneId zone = trigger.zone() != null ? trigger.zone() : CronSchedule.zone(settings.getDefaultTimezone());
        CronSchedule schedule = CronSchedule.parse(trigger.cronExpression(), zone);
        Instant next = schedule.next(observe(clock.instant()));
        schedules.put(trigger.triggerId(), new ScheduledTriggerState(trigger, schedule, next));
        log.info("Schedule trigger {} for {} registered: {} next fire at {}",
                trigger.triggerId(), trigger.definitionId(), schedule, next);
    }

    private void registerWebhook(Trigger.Webhook trigger) {
        String path = normalizePath(trigger.path());
        Trigger.Webhook existing = webhooksByPath.get(path);
        if (existing != null && !existing.triggerId().equals(trigger.triggerId())) {
            throw new ValidationException("Webhook path " + path + " is already used by trigger " + existing.triggerId());
        }
        webhooksByPath.put(path, new Trigger.Webhook(trigger.triggerId(), trigger.definitionId(), path, trigger.secret()));
        log.info("Webhook trigger {} for {} registered on {}{}", trigger.triggerId(), trigger.definitionId(),
                path, trigger.secret() != null ? " (signed)" : "");
    }

    // ── Schedules ─────────────────────────────────────────────────────────────

    public List<RunRequest> tick() {
        return tick(clock.instant());
    }

    public synchronized List<RunRequest> tick(Instant now) {
        Instant effective = observe(now);
        List<ScheduledTriggerState> states = new ArrayList<>(schedules.values());
        states.sort(Comparator.comparing(s -> s.getTrigger().triggerId()));

        List<RunRequest> emitted = new ArrayList<>();
        for (ScheduledTriggerState state : states) {
            emitted.addAll(fireDue(state, effective));
        }
        emitted.forEach(this::emit);
        return emitted;
    }

    private List<RunRequest> fireDue(ScheduledTriggerState state, Instant now) {
        Instant slot = state.getNextFireAt();
        if (slot == null || slot.isAfter(now)) {
            return List.of();
        }
        CronSchedule schedule = state.getSchedule();
        List<RunRequest> requests = new ArrayList<>();

        if (settings.getMisfirePolicy() == MisfirePolicy.CATCH_UP) {
            int limit = Math.max(1, settings.getMaxCatchUp());
            while (slot != null && !slot.isAfter(now) && requests.size() < limit) {
                requests.add(request(state, slot, now, false));
                slot = schedule.next(slot);
            }
            state.fired(now, slot);
        } else {
            Instant following = schedule.next(slot);
            boolean coalesced = following != null && !following.isAfter(now);
            if (coalesced) {
                log.warn("Schedule trigger {} missed slots between {} and {}; firing once",
                        state.getTrigger().triggerId(), slot, now);
            }
            requests.add(request(state, slot, now, coalesced));
            state.fired(now, coalesced ? schedule.next(now) : following);
        }
        return requests;
    }

    private RunRequest request(ScheduledTriggerState state, Instant scheduledAt, Instant firedAt, boolean coalesced) {
        Trigger.Schedule trigger = state.getTrigger();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("cron", trigger.cronExpression());
        payload.put("scheduledAt", scheduledAt.toString());
        payload.put("coalesced", coalesced);
        TriggerContext context = TriggerContext.builder()
                .type(TriggerType.SCHEDULE)
                .triggerId(trigger.triggerId())
                .payload(payload)
                .firedAt(firedAt)
                .scheduledAt(scheduledAt)
                .build();
        return new RunRequest(trigger.definitionId(), context);
    }

    private void emit(RunRequest request) {
        try {
            sink.accept(request);
        } catch (RuntimeException ex) {
            log.error("Run request from trigger {} for {} was not accepted: {}",
                    request.trigger().getTriggerId(), request.definitionId(), ex.getMessage());
        }
    }

    public Optional<Instant> nextFireAt(String triggerId) {
        ScheduledTriggerState state = schedules.get(triggerId);
        return state == null ? Optional.empty() : Optional.ofNullable(state.getNextFireAt());
    }

    public List<ScheduledTriggerState> scheduledTriggers() {
        return List.copyOf(schedules.values());
    }

    // ── Webhooks ──────────────────────────────────────────────────────────────

    /**
     * Converts an inbound webhook into a run request and hands it to the sink.
     *
     * @throws TriggerNotFoundException when no trigger listens on {@code path}
     * @throws com.relayflow.relayflow_engine.exception.WebhookVerificationException on a bad signature
     */
    public RunRequest acceptWebhook(String path, String signatureHeader, byte[] rawBody) {
        Trigger.Webhook webhook = webhooksByPath.get(normalizePath(path));
        if (webhook == null) {
            throw new TriggerNotFoundException("No webhook trigger registered on " + path);
        }
        if (webhook.secret() != null && !webhook.secret().isBlank()) {
            verifier.verify(webhook.secret(), signatureHeader, rawBody);
        }
        TriggerContext context = TriggerContext.builder()
                .type(TriggerType.WEBHOOK)
                .triggerId(webhook.triggerId())
                .payload(parsePayload(rawBody))
                .firedAt(observe(clock.instant()))
                .build();
        RunRequest request = new RunRequest(webhook.definitionId(), context);
        log.info("Webhook {} accepted for {}", webhook.path(), webhook.definitionId());
        sink.accept(request);
        return request;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> parsePayload(byte[] rawBody) {
        if (rawBody == null || rawBody.length == 0) {
            return Map.of();
        }
        try {
            Object parsed = objectMapper.readValue(rawBody, Object.class);
            if (parsed instanceof Map<?, ?> map) {
                return (Map<String, Object>) map;
            }
            Map<String, Object> wrapped = new LinkedHashMap<>();
            wrapped.put("body", parsed);
            return wrapped;
        } catch (IOException ex) {
            log.debug("Webhook body is not JSON, passing it through as text: {}", ex.getMessage());
            return Map.of("raw", new String(rawBody, StandardCharsets.UTF_8));
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    // Monotonic view of the clock
    private synchronized Instant observe(Instant now) {
        if (now.isAfter(lastObserved)) {
            lastObserved = now;
        }
        return lastObserved;
    }

    private static String normalizePath(String path) {
        if (path == null || path.isBlank()) {
            throw new ValidationException("Webhook path is empty");
        }
        String trimmed = path.trim();
        if (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
    }
}
