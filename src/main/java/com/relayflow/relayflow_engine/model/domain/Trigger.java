package com.relayflow.relayflow_engine.model.domain;

import java.time.ZoneId;

/**
 * Something that starts runs of a workflow definition.
 */
public sealed interface Trigger permits Trigger.Schedule, Trigger.Webhook, Trigger.Manual {

    String triggerId();

    String definitionId();

    TriggerType type();

    /**
     * Cron based trigger. {@code cronExpression} is a 5-field crontab or a 6-field
     * expression with seconds.
     */
    record Schedule(String triggerId, String definitionId, String cronExpression, ZoneId zone) implements Trigger {
        public TriggerType type() {
            return TriggerType.SCHEDULE;
        }
    }

    /** Inbound HTTP event; {@code secret} may be null for unsigned hooks. */
    record Webhook(String triggerId, String definitionId, String path, String secret) implements Trigger {
        public TriggerType type() {
            return TriggerType.WEBHOOK;
        }
    }

    record Manual(String definitionId) implements Trigger {
        public String triggerId() {
            return "manual:" + definitionId;
        }

        public TriggerType type() {
            return TriggerType.MANUAL;
        }
    }
}
