package com.relayflow.relayflow_engine.model.run;

import com.relayflow.relayflow_engine.model.domain.TriggerType;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What started a run. Exposed to node inputs under the reserved {@code trigger} namespace.
 */
@Value
@Builder
public class TriggerContext {

    @NonNull TriggerType type;

    String triggerId;

    @Builder.Default
    Map<String, Object> payload = Map.of();

    @NonNull Instant firedAt;

    /** Slot the schedule intended to fire at; null for non-schedule triggers. */
    Instant scheduledAt;

    public static TriggerContext manual(String definitionId, Map<String, Object> payload, Instant firedAt) {
        return TriggerContext.builder()
                .type(TriggerType.MANUAL)
                .triggerId("manual:" + definitionId)
                .payload(payload != null ? payload : Map.of())
                .firedAt(firedAt)
                .build();
    }

    /** Map view used by {@code {{trigger.*}}} references. */
    public Map<String, Object> toDocument() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("type", type.name());
        doc.put("triggerId", triggerId);
        doc.put("payload", payload);
        doc.put("firedAt", firedAt.toString());
        if (scheduledAt != null) {
            doc.put("scheduledAt", scheduledAt.toString());
        }
        return doc;
    }
}
