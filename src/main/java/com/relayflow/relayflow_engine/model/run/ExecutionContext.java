package com.relayflow.relayflow_engine.model.run;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Outputs of the nodes that succeeded so far in one run, plus the trigger context.
 * Owned by the run's coordinator thread and cleared when the run ends.
 */
public class ExecutionContext {

    public static final String TRIGGER_NAMESPACE = "trigger";

    private final TriggerContext trigger;
    private final Map<String, Map<String, Object>> outputs = new HashMap<>();
    private final Map<String, Integer> attempts = new HashMap<>();
    private final Set<String> skippedBranches = new HashSet<>();

    public ExecutionContext(TriggerContext trigger) {
        this.trigger = trigger;
    }

    public TriggerContext getTrigger() {
        return trigger;
    }

    public void recordSuccess(String nodeId, Map<String, Object> output, int attemptCount) {
        outputs.put(nodeId, output != null ? output : Map.of());
        attempts.put(nodeId, attemptCount);
    }

    /** Node left out because its branch was not selected; references to it read as null. */
    public void recordBranchSkipped(String nodeId) {
        skippedBranches.add(nodeId);
    }

    public boolean isBranchSkipped(String nodeId) {
        return skippedBranches.contains(nodeId);
    }

    public boolean hasOutput(String nodeId) {
        return outputs.containsKey(nodeId);
    }

    /**
     * Document addressed by {@code {{nodeId...}}}: {@code {output: ..., attempts: n}}, or the
     * trigger context for the reserved namespace.
     */
    public Optional<Map<String, Object>> document(String name) {
        if (TRIGGER_NAMESPACE.equals(name)) {
            return Optional.of(trigger.toDocument());
        }
        Map<String, Object> output = outputs.get(name);
        if (output == null) {
            return Optional.empty();
        }
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("output", output);
        doc.put("attempts", attempts.getOrDefault(name, 0));
        return Optional.of(doc);
    }

    public void clear() {
        outputs.clear();
        attempts.clear();
        skippedBranches.clear();
    }
}
