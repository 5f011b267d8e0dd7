package com.relayflow.relayflow_engine.model.domain;

public enum TriggerType {
    SCHEDULE,
    WEBHOOK,
    MANUAL
}
