package com.relayflow.relayflow_engine.trigger;

import com.relayflow.relayflow_engine.model.domain.Trigger;
import lombok.Getter;

import java.time.Instant;

/**
 * Live schedule trigger. {@code nextFireAt} is the next slot that has not been fired yet;
 * it always advances along the cron slots, never from the tick time.
 */
@Getter
public class ScheduledTriggerState {

    private final Trigger.Schedule trigger;
    private final CronSchedule schedule;
    private Instant nextFireAt;
    private Instant lastFiredAt;

    ScheduledTriggerState(Trigger.Schedule trigger, CronSchedule schedule, Instant nextFireAt) {
        this.trigger = trigger;
        this.schedule = schedule;
        this.nextFireAt = nextFireAt;
    }

    void fired(Instant firedAt, Instant nextFireAt) {
        this.lastFiredAt = firedAt;
        this.nextFireAt = nextFireAt;
    }
}
