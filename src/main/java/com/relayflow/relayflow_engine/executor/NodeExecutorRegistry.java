package com.relayflow.relayflow_engine.executor;

import com.relayflow.relayflow_engine.exception.UnknownNodeTypeException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Maps node type ids to executors.
 * <p>
 * Built once at start-up from every {@link NodeExecutor} bean and then frozen: after
 * {@link #freeze()} the table is an immutable map, so lookups from many runs need no lock.
 * Factories are invoked once at registration; executors are stateless and shared.
 * </p>
 */
@Slf4j
@Component
public class NodeExecutorRegistry {

    private final List<NodeExecutor> executors;
    private final Map<String, NodeExecutor> pending = new LinkedHashMap<>();
    private volatile Map<String, NodeExecutor> registry;

    public NodeExecutorRegistry(List<NodeExecutor> executors) {
        this.executors = executors;
    }

    @PostConstruct
    public void init() {
        executors.forEach(executor -> register(executor.supportedType(), () -> executor));
        freeze();
    }

    public synchronized void register(String type, Supplier<? extends NodeExecutor> factory) {
        if (registry != null) {
            throw new IllegalStateException("Node registry is frozen; cannot register type: " + type);
        }
        NodeExecutor executor = factory.get();
        if (executor == null) {
            throw new IllegalArgumentException("Factory for node type " + type + " returned null");
        }
        NodeExecutor previous = pending.putIfAbsent(type, executor);
        if (previous != null) {
            throw new IllegalStateException("Node type '" + type + "' is already registered by "
                    + previous.getClass().getSimpleName() + "; " + executor.getClass().getSimpleName() + " cannot replace it");
        }
    }

    public synchronized void freeze() {
        if (registry == null) {
            registry = Map.copyOf(pending);
            pending.clear();
            log.info("Node registry frozen with types {}", registry.keySet());
        }
    }

    public NodeExecutor resolve(String type) {
        NodeExecutor executor = table().get(type);
        if (executor == null) {
            throw new UnknownNodeTypeException(type);
        }
        return executor;
    }

    public boolean isSupported(String type) {
        return type != null && table().containsKey(type);
    }

    public Set<String> registeredTypes() {
        return table().keySet();
    }

    private Map<String, NodeExecutor> table() {
        Map<String, NodeExecutor> current = registry;
        if (current == null) {
            throw new IllegalStateException("Node registry has not been frozen yet");
        }
        return current;
    }
}
