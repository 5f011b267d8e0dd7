package com.relayflow.relayflow_engine.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class CycleException extends ValidationException {

    private static final long serialVersionUID = 1L;

    private final List<String> cycle;

    public CycleException(List<String> cycle) {
        super("CYCLE", "Workflow graph contains a cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }
}
