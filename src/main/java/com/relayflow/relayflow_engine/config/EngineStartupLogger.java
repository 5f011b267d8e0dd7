package com.relayflow.relayflow_engine.config;

import com.relayflow.relayflow_engine.executor.NodeExecutorRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Logs at startup which node types are registered, which script interpreters are enabled
 * and whether schedule triggers will be evaluated.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EngineStartupLogger implements ApplicationRunner {

    private final NodeExecutorRegistry registry;
    private final EngineProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        log.info("[ENGINE] Node types: {}", registry.registeredTypes());
        log.info("[ENGINE] Workers: core={} max={} queue={}; max parallel nodes per run={}",
                properties.getWorker().getCoreSize(), properties.getWorker().getMaxSize(),
                properties.getWorker().getQueueCapacity(), properties.getExecution().getMaxParallelNodes());
        if (properties.getSandbox().getInterpreters().isEmpty()) {
            log.info("[ENGINE] Code nodes: spel only (no subprocess interpreters enabled)");
        } else {
            log.info("[ENGINE] Code nodes: spel plus {} under {}", properties.getSandbox().getInterpreters(),
                    properties.getSandbox().getLauncher());
        }
        if (properties.getTrigger().isEnabled()) {
            log.info("[ENGINE] Schedule triggers evaluated every {} ms, misfire policy {}",
                    properties.getTrigger().getTickIntervalMs(), properties.getTrigger().getMisfirePolicy());
        } else {
            log.warn("[ENGINE] relayflow.trigger.enabled=false: schedule triggers will not fire");
        }
    }
}
