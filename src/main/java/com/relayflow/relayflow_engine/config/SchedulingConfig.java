package com.relayflow.relayflow_engine.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler for the trigger tick job, isolated from node work so a slow run never delays
 * schedule evaluation.
 */
@Slf4j
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "relayflow.trigger", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {

    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler triggerScheduler(
            @Value("${relayflow.trigger.scheduler.pool-size:1}") int poolSize,
            @Value("${relayflow.trigger.scheduler.await-termination-seconds:10}") int awaitTerminationSeconds) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(poolSize, 1));
        scheduler.setThreadNamePrefix("relayflow-trigger-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(Math.max(awaitTerminationSeconds, 0));
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(throwable ->
                log.error("Trigger tick failed: {}", throwable.getMessage(), throwable));
        return scheduler;
    }
}
