package com.relayflow.relayflow_engine.trigger;

import com.relayflow.relayflow_engine.model.run.RunRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Drives {@link TriggerService#tick} on the trigger scheduler.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "relayflow.trigger", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TriggerTickJob {

    private final TriggerService triggerService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${relayflow.trigger.tick-interval-ms:1000}")
    public void tick() {
        List<RunRequest> fired = triggerService.tick(clock.instant());
        if (!fired.isEmpty()) {
            log.debug("Trigger tick fired {} run request(s)", fired.size());
        }
    }
}
