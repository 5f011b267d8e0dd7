package com.relayflow.relayflow_engine.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayflow.relayflow_engine.config.EngineProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class ScriptRunnerTest {

    private final ExecutorService evaluators = Executors.newSingleThreadExecutor();

    @AfterEach
    public void tearDown() {
        evaluators.shutdownNow();
    }

    @Test
    public void shouldRefuseInterpreterWithoutLauncher() {
        EngineProperties properties = new EngineProperties();
        properties.getSandbox().setInterpreters(List.of("python"));

        IllegalStateException error = Assertions.assertThrows(IllegalStateException.class,
                () -> new ScriptRunner(new ObjectMapper(), properties, evaluators));
        Assertions.assertTrue(error.getMessage().contains("relayflow.sandbox.launcher"));
    }

    @Test
    public void shouldPrefixInterpreterWithLauncher() {
        EngineProperties properties = new EngineProperties();
        properties.getSandbox().setInterpreters(List.of("python"));
        properties.getSandbox().setLauncher(List.of("bwrap", "--bind", "{workdir}", "{workdir}", "--unshare-net", "--"));
        ScriptRunner runner = new ScriptRunner(new ObjectMapper(), properties, evaluators);
        Path workDir = Path.of("/tmp/rf_script_1");

        List<String> command = runner.command(List.of("python3", "-I"),
                workDir.resolve("script.py"), workDir.resolve("input.json"), workDir);

        Assertions.assertEquals(List.of("bwrap", "--bind", "/tmp/rf_script_1", "/tmp/rf_script_1", "--unshare-net", "--",
                "python3", "-I", "/tmp/rf_script_1/script.py", "/tmp/rf_script_1/input.json"), command);
    }

    @Test
    public void shouldStartWithSpelOnlyByDefault() {
        ScriptRunner runner = new ScriptRunner(new ObjectMapper(), new EngineProperties(), evaluators);

        Assertions.assertTrue(runner.isSupported("spel"));
        Assertions.assertTrue(runner.isSupported(null));
        Assertions.assertFalse(runner.isSupported("ruby"));
    }
}
