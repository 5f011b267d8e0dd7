package com.relayflow.relayflow_engine.config;

import com.relayflow.relayflow_engine.repository.InMemoryRunStateStore;
import com.relayflow.relayflow_engine.repository.RunStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(60))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public RunStateStore runStateStore() {
        log.warn("No RunStateStore bean supplied; using the in-memory store. Run state is lost on restart.");
        return new InMemoryRunStateStore();
    }

    /**
     * Node attempt pool shared by all runs. Attempts block on I/O and subprocesses, so it is
     * kept apart from the coordinator threads. Rejections abort; the coordinator turns them
     * into a retryable attempt failure.
     */
    @Bean(name = "nodeWorkerPool", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "nodeWorkerPool")
    public ThreadPoolExecutor nodeWorkerPool(EngineProperties properties) {
        EngineProperties.Worker worker = properties.getWorker();
        int coreSize = Math.max(worker.getCoreSize(), 1);
        int maxSize = Math.max(worker.getMaxSize(), coreSize);
        int queueCapacity = Math.max(worker.getQueueCapacity(), 0);
        BlockingQueue<Runnable> queue = queueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(queueCapacity);
        return new ThreadPoolExecutor(
                coreSize,
                maxSize,
                Math.max(worker.getKeepAliveSeconds(), 0L),
                TimeUnit.SECONDS,
                queue,
                namedThreadFactory(worker.getThreadNamePrefix(), false),
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean(name = "runCoordinatorPool", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "runCoordinatorPool")
    public ThreadPoolExecutor runCoordinatorPool(EngineProperties properties) {
        int threads = Math.max(properties.getWorker().getCoordinatorThreads(), 1);
        return new ThreadPoolExecutor(
                threads,
                threads,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                namedThreadFactory("relayflow-run-", false));
    }

    /** SpEL evaluations of code nodes. Daemon threads, no queue: a full pool rejects at once. */
    @Bean(name = "scriptEvaluatorPool", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "scriptEvaluatorPool")
    public ThreadPoolExecutor scriptEvaluatorPool(EngineProperties properties) {
        int threads = Math.max(properties.getSandbox().getEvaluatorThreads(), 1);
        return new ThreadPoolExecutor(
                threads,
                threads,
                60L,
                TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                namedThreadFactory("relayflow-spel-", true),
                new ThreadPoolExecutor.AbortPolicy());
    }

    /** Fires retry, timeout and grace-period events into run queues. */
    @Bean(name = "engineTimer", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "engineTimer")
    public ScheduledExecutorService engineTimer(EngineProperties properties) {
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(
                Math.max(properties.getWorker().getTimerThreads(), 1),
                namedThreadFactory("relayflow-timer-", true));
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }

    static ThreadFactory namedThreadFactory(String prefix, boolean daemon) {
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory delegate = Executors.defaultThreadFactory();
        return runnable -> {
            Thread thread = delegate.newThread(runnable);
            thread.setName(prefix + threadIndex.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        };
    }
}
