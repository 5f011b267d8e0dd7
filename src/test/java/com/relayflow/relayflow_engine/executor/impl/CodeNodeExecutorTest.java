package com.relayflow.relayflow_engine.executor.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayflow.relayflow_engine.config.EngineProperties;
import com.relayflow.relayflow_engine.engine.ScriptRunner;
import com.relayflow.relayflow_engine.executor.CancelSignal;
import com.relayflow.relayflow_engine.executor.NodeExecutionRequest;
import com.relayflow.relayflow_engine.executor.NodeResult;
import com.relayflow.relayflow_engine.model.run.ErrorKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public class CodeNodeExecutorTest {

    private final ExecutorService evaluators = Executors.newFixedThreadPool(2, runnable -> {
        Thread thread = new Thread(runnable, "spel-test");
        thread.setDaemon(true);
        return thread;
    });
    private final CodeNodeExecutor executor = new CodeNodeExecutor(
            new ScriptRunner(new ObjectMapper(), new EngineProperties(), evaluators), new EngineProperties());

    @AfterEach
    public void tearDown() {
        evaluators.shutdownNow();
    }

    @Test
    public void shouldEvaluateSpelAgainstInputs() {
        NodeResult result = executor.execute(request(
                Map.of("code", "items.?[price > 10].size()"),
                Map.of("items", List.of(Map.of("price", 5), Map.of("price", 12), Map.of("price", 30)))));

        Assertions.assertTrue(result.isSuccess(), result.getErrorMessage());
        Assertions.assertEquals(Map.of("result", 2), result.getOutput());
    }

    @Test
    public void shouldUseMapResultAsOutput() {
        NodeResult result = executor.execute(request(
                Map.of("language", "spel", "code", "{'total': #inputs['count'] * 2, 'label': name.toUpperCase()}"),
                Map.of("count", 21, "name", "ok")));

        Assertions.assertTrue(result.isSuccess(), result.getErrorMessage());
        Assertions.assertEquals(42, result.getOutput().get("total"));
        Assertions.assertEquals("OK", result.getOutput().get("label"));
    }

    @Test
    public void shouldBlockTypeReferences() {
        NodeResult result = executor.execute(request(
                Map.of("code", "T(java.lang.Runtime).getRuntime().availableProcessors()"), Map.of()));

        Assertions.assertFalse(result.isSuccess());
        Assertions.assertEquals(ErrorKind.NODE_FAULT, result.getErrorKind());
    }

    @Test
    public void shouldReportParseErrorsAsNodeFault() {
        NodeResult result = executor.execute(request(Map.of("code", "items.?["), Map.of("items", List.of())));

        Assertions.assertEquals(ErrorKind.NODE_FAULT, result.getErrorKind());
        Assertions.assertTrue(result.getErrorMessage().startsWith("Expression does not parse"));
    }

    @Test
    public void shouldTimeOutSlowExpression() {
        long started = System.nanoTime();
        NodeResult result = executor.execute(request(
                Map.of("code", "slow.value", "timeoutMs", 100), Map.of("slow", new SlowValue(5_000))));
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        Assertions.assertEquals(ErrorKind.TIMEOUT, result.getErrorKind());
        Assertions.assertTrue(elapsedMs < 2_000, "returned after " + elapsedMs + " ms");
    }

    @Test
    public void shouldStopExpressionWhenCancelled() throws Exception {
        CancelSignal signal = new CancelSignal();
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
        try {
            timer.schedule(signal::cancel, 100, TimeUnit.MILLISECONDS);
            long started = System.nanoTime();
            NodeResult result = executor.execute(NodeExecutionRequest.builder()
                    .runId("run-1")
                    .nodeId("code")
                    .attempt(1)
                    .config(Map.of("code", "slow.value", "timeoutMs", 10_000))
                    .inputs(Map.of("slow", new SlowValue(5_000)))
                    .cancelSignal(signal)
                    .build());
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;

            Assertions.assertEquals(ErrorKind.CANCELLED, result.getErrorKind());
            Assertions.assertTrue(elapsedMs < 2_000, "returned after " + elapsedMs + " ms");
        } finally {
            timer.shutdownNow();
        }
    }

    @Test
    public void shouldNotExposeStringRepeat() {
        NodeResult result = executor.execute(request(Map.of("code", "'ab'.repeat(60000000).length()"), Map.of()));

        Assertions.assertEquals(ErrorKind.NODE_FAULT, result.getErrorKind());
    }

    @Test
    public void shouldRejectOverlongExpression() {
        String code = "1" + " + 1".repeat(5_000);

        NodeResult result = executor.execute(request(Map.of("code", code), Map.of()));

        Assertions.assertEquals(ErrorKind.NODE_FAULT, result.getErrorKind());
        Assertions.assertTrue(result.getErrorMessage().startsWith("Expression does not parse"));
    }

    @Test
    public void shouldRefuseInterpretersThatAreNotEnabled() {
        NodeResult result = executor.execute(request(Map.of("language", "python", "code", "result = 1"), Map.of()));

        Assertions.assertEquals(ErrorKind.VALIDATION, result.getErrorKind());
        Assertions.assertTrue(result.getErrorMessage().contains("relayflow.sandbox.interpreters"));
    }

    @Test
    public void shouldValidateLanguageInConfig() {
        Assertions.assertFalse(executor.validateConfig(Map.of("language", "ruby", "code", "1")).isEmpty());
        Assertions.assertFalse(executor.validateConfig(Map.of("language", "spel")).isEmpty());
        Assertions.assertTrue(executor.validateConfig(Map.of("code", "1 + 1", "timeoutMs", 500)).isEmpty());
    }

    /** Bean whose property read blocks, interruptibly, for a while. */
    public static class SlowValue {
        private final long millis;

        public SlowValue(long millis) {
            this.millis = millis;
        }

        public int getValue() throws InterruptedException {
            Thread.sleep(millis);
            return 1;
        }
    }

    private static NodeExecutionRequest request(Map<String, Object> config, Map<String, Object> inputs) {
        return NodeExecutionRequest.builder()
                .runId("run-1")
                .nodeId("code")
                .attempt(1)
                .config(config)
                .inputs(inputs)
                .build();
    }
}
