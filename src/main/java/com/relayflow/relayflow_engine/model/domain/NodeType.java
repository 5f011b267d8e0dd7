package com.relayflow.relayflow_engine.model.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Identifiers of the node types that ship with the engine. The registry itself is keyed by
 * the string id, so additional executors can register types outside this enum.
 */
public enum NodeType {
    MANUAL_TRIGGER("start", true),
    SCHEDULE_TRIGGER("scheduleTrigger", true),
    WEBHOOK_TRIGGER("webhookTrigger", true),
    CODE("code", false),
    GITHUB("github", false),
    MAIL("mail", false),
    HTTP("http", false),
    TEMPLATE("template", false),
    CONDITION("condition", false),
    ANSWER("answer", false);

    private final String id;
    private final boolean trigger;

    NodeType(String id, boolean trigger) {
        this.id = id;
        this.trigger = trigger;
    }

    public String id() {
        return id;
    }

    public boolean isTrigger() {
        return trigger;
    }

    public static Optional<NodeType> fromId(String id) {
        return Arrays.stream(values()).filter(t -> t.id.equals(id)).findFirst();
    }
}
