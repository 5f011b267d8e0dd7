package com.relayflow.relayflow_engine.config;

import com.relayflow.relayflow_engine.model.domain.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Engine settings, bound from {@code relayflow.*} in application.properties.
 */
@Data
@ConfigurationProperties(prefix = "relayflow")
public class EngineProperties {

    private Worker worker = new Worker();
    private Execution execution = new Execution();
    private Persistence persistence = new Persistence();
    private Trigger trigger = new Trigger();
    private Sandbox sandbox = new Sandbox();
    private Github github = new Github();
    private Mail mail = new Mail();

    /** Thread pools shared by every run. */
    @Data
    public static class Worker {
        /** Node attempts of all runs share this pool. */
        private int coreSize = 8;
        private int maxSize = 16;
        private long keepAliveSeconds = 60L;
        private int queueCapacity = 1000;
        private String threadNamePrefix = "relayflow-worker-";
        /** One coordinator thread per active run; further runs wait in the queue as PENDING. */
        private int coordinatorThreads = 32;
        private int timerThreads = 2;
    }

    @Data
    public static class Execution {
        private Duration defaultNodeTimeout = Duration.ofSeconds(300);
        private Duration defaultRunTimeout = Duration.ofSeconds(600);
        private Duration cancelGracePeriod = Duration.ofSeconds(5);
        /** Upper bound on nodes of a single run in flight at once. */
        private int maxParallelNodes = 10;
        private int defaultMaxAttempts = 1;
        private Duration defaultBackoff = Duration.ofSeconds(1);
        private double defaultBackoffMultiplier = 2.0d;
        private Duration maxBackoff = Duration.ofMinutes(1);
        /** Finished runs kept for status lookups. */
        private int historySize = 1000;

        public RetryPolicy defaultRetryPolicy() {
            return RetryPolicy.builder()
                    .maxAttempts(defaultMaxAttempts)
                    .backoff(defaultBackoff)
                    .backoffMultiplier(defaultBackoffMultiplier)
                    .maxBackoff(maxBackoff)
                    .build();
        }
    }

    /** Retries around run-state store writes. */
    @Data
    public static class Persistence {
        private int maxAttempts = 3;
        private Duration backoff = Duration.ofMillis(200);
        private double backoffMultiplier = 2.0d;
    }

    @Data
    public static class Trigger {
        private boolean enabled = true;
        private long tickIntervalMs = 1000L;
        private MisfirePolicy misfirePolicy = MisfirePolicy.FIRE_ONCE;
        /** Upper bound of slots replayed per trigger per tick under CATCH_UP. */
        private int maxCatchUp = 10;
        private String defaultTimezone = "UTC";
    }

    public enum MisfirePolicy {
        /** Coalesce every missed slot into one run request. */
        FIRE_ONCE,
        /** One run request per missed slot, bounded by maxCatchUp. */
        CATCH_UP
    }

    @Data
    public static class Sandbox {
        /** Subprocess languages allowed for code nodes, e.g. javascript, python. Empty = in-process only. */
        private List<String> interpreters = new ArrayList<>();
        /** Environment variables passed through to script subprocesses. */
        private List<String> allowedEnv = new ArrayList<>(List.of("PATH"));
        private int maxOutputBytes = 1024 * 1024;
        /**
         * Command that confines script subprocesses, prepended to the interpreter call.
         * {workdir} is replaced by the script's working directory. Required once an
         * interpreter is enabled, e.g. bwrap or firejail with networking disabled.
         */
        private List<String> launcher = new ArrayList<>();
        /** Threads evaluating SpEL snippets; an evaluation that overruns its timeout is abandoned on one of them. */
        private int evaluatorThreads = 4;
        private int maxExpressionLength = 10_000;
    }

    @Data
    public static class Github {
        private String baseUrl = "https://api.github.com";
        private String token;
        private String apiVersion = "2022-11-28";
        private int maxAttempts = 3;
        private Duration backoff = Duration.ofSeconds(1);
    }

    @Data
    public static class Mail {
        /** smtp or api. */
        private String defaultProvider = "smtp";
        private String from;
        private String apiUrl;
        private String apiKey;
        private int maxAttempts = 3;
        private Duration backoff = Duration.ofSeconds(2);
    }
}
