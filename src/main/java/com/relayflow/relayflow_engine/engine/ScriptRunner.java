package com.relayflow.relayflow_engine.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayflow.relayflow_engine.config.EngineProperties;
import com.relayflow.relayflow_engine.executor.CancelSignal;
import com.relayflow.relayflow_engine.model.run.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.expression.MapAccessor;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.SpelParserConfiguration;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.DataBindingMethodResolver;
import org.springframework.expression.spel.support.DataBindingPropertyAccessor;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs code-node snippets.
 *
 * Languages:
 *   spel        Spring Expression Language, in-process, read-only (default)
 *   javascript  `node` subprocess, only when enabled in relayflow.sandbox.interpreters
 *   python      `python3` subprocess, same rule
 *
 * SpEL runs in a SimpleEvaluationContext: property reads on maps and beans plus instance
 * methods, no type references, constructors or bean lookups, so a snippet cannot reach the
 * filesystem, the network or the JVM. String#repeat is filtered out and expressions longer
 * than relayflow.sandbox.max-expression-length are rejected. Evaluation happens on the
 * scriptEvaluatorPool; the node returns TIMEOUT or CANCELLED as soon as either fires, and an
 * evaluation that ignores the interrupt keeps its evaluator thread until it ends.
 *
 * Subprocesses:
 *   1. Fresh temp directory as working dir, input JSON and wrapped script written into it
 *   2. Command is relayflow.sandbox.launcher + interpreter; enabling an interpreter without
 *      a launcher fails startup
 *   3. Environment reduced to relayflow.sandbox.allowed-env, python runs isolated (-I)
 *   4. stdout goes to a file, capped at relayflow.sandbox.max-output-bytes
 *   5. Killed on timeout or when the node is cancelled
 *   6. Temp directory removed
 */
@Slf4j
@Service
public class ScriptRunner {

    public static final String SPEL = "spel";
    public static final String JAVASCRIPT = "javascript";
    public static final String PYTHON = "python";

    static final String WORKDIR_PLACEHOLDER = "{workdir}";
    private static final Set<String> BLOCKED_STRING_METHODS = Set.of("repeat");

    private final ObjectMapper objectMapper;
    private final EngineProperties.Sandbox sandbox;
    private final ExecutorService evaluators;
    private final ExpressionParser parser;
    private final DataBindingMethodResolver methodResolver;

    public ScriptRunner(ObjectMapper objectMapper, EngineProperties properties,
                        @Qualifier("scriptEvaluatorPool") ExecutorService evaluators) {
        this.objectMapper = objectMapper;
        this.sandbox = properties.getSandbox();
        this.evaluators = evaluators;
        this.parser = new SpelExpressionParser(new SpelParserConfiguration(
                null, null, false, false, Integer.MAX_VALUE, sandbox.getMaxExpressionLength()));
        this.methodResolver = DataBindingMethodResolver.forInstanceMethodInvocation();
        this.methodResolver.registerMethodFilter(String.class, methods -> methods.stream()
                .filter(m -> !BLOCKED_STRING_METHODS.contains(m.getName()))
                .collect(Collectors.toCollection(ArrayList::new)));

        if (!sandbox.getInterpreters().isEmpty() && sandbox.getLauncher().isEmpty()) {
            throw new IllegalStateException("relayflow.sandbox.interpreters " + sandbox.getInterpreters()
                    + " requires relayflow.sandbox.launcher; script subprocesses never run unconfined");
        }
    }

    // ── Public API ────────────────────────────────────────────────────────────

    public ScriptResult run(String language, String code, Map<String, Object> inputs, Duration timeout, CancelSignal cancel) {
        String lang = language == null ? SPEL : language.toLowerCase(Locale.ROOT);
        return switch (lang) {
            case SPEL -> evaluateSpel(code, inputs, timeout, cancel);
            case JAVASCRIPT -> subprocessAllowed(lang)
                    ? runScript("js", buildJsWrapper(code), inputs, List.of("node"), timeout, cancel)
                    : disabled(lang);
            case PYTHON -> subprocessAllowed(lang)
                    ? runScript("py", buildPyWrapper(code), inputs, List.of("python3", "-I"), timeout, cancel)
                    : disabled(lang);
            default -> ScriptResult.error(ErrorKind.VALIDATION,
                    "Unsupported language: " + language + ". Use 'spel', 'javascript' or 'python'.");
        };
    }

    public boolean isSupported(String language) {
        String lang = language == null ? SPEL : language.toLowerCase(Locale.ROOT);
        return SPEL.equals(lang) || JAVASCRIPT.equals(lang) || PYTHON.equals(lang);
    }

    private boolean subprocessAllowed(String language) {
        return sandbox.getInterpreters().stream().anyMatch(language::equalsIgnoreCase);
    }

    private ScriptResult disabled(String language) {
        return ScriptResult.error(ErrorKind.VALIDATION,
                "Language '" + language + "' is not enabled; add it to relayflow.sandbox.interpreters");
    }

    // ── SpEL ──────────────────────────────────────────────────────────────────

    private ScriptResult evaluateSpel(String code, Map<String, Object> inputs, Duration timeout, CancelSignal cancel) {
        Expression expression;
        try {
            expression = parser.parseExpression(code);
        } catch (ParseException | EvaluationException e) {
            return ScriptResult.error(ErrorKind.NODE_FAULT, "Expression does not parse: " + e.getMessage());
        }
        SimpleEvaluationContext context = SimpleEvaluationContext
                .forPropertyAccessors(new MapAccessor(), DataBindingPropertyAccessor.forReadOnlyAccess())
                .withMethodResolvers(methodResolver)
                .withRootObject(inputs)
                .build();
        context.setVariable("inputs", inputs);

        Future<Object> evaluation;
        try {
            evaluation = evaluators.submit(() -> expression.getValue(context));
        } catch (RejectedExecutionException e) {
            return ScriptResult.error(ErrorKind.RETRYABLE, "All expression evaluator threads are busy.");
        }
        cancel.onCancel(() -> evaluation.cancel(true));
        try {
            return ScriptResult.ok(evaluation.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            evaluation.cancel(true);
            log.warn("SpEL evaluation abandoned after {} ms: {}", timeout.toMillis(), abbreviate(code));
            return ScriptResult.error(ErrorKind.TIMEOUT, "Expression timed out after " + timeout.toMillis() + " ms.");
        } catch (CancellationException e) {
            return ScriptResult.error(ErrorKind.CANCELLED, "Expression was cancelled.");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            return ScriptResult.error(ErrorKind.NODE_FAULT, "Expression failed: " + message);
        } catch (InterruptedException e) {
            evaluation.cancel(true);
            Thread.currentThread().interrupt();
            return ScriptResult.error(ErrorKind.CANCELLED, "Expression evaluation was interrupted.");
        }
    }

    private static String abbreviate(String code) {
        return code.length() <= 80 ? code : code.substring(0, 77) + "...";
    }

    // ── Script wrappers ───────────────────────────────────────────────────────

    private String buildJsWrapper(String userCode) {
        return """
                const fs    = require('fs');
                const input = JSON.parse(fs.readFileSync(process.argv[2], 'utf8'));

                try {
                    const result = (function(input) {
                        %s
                    })(input);

                    process.stdout.write(JSON.stringify({ success: true, output: result ?? null }));
                } catch (e) {
                    process.stdout.write(JSON.stringify({ success: false, error: e.message }));
                }
                """.formatted(userCode);
    }

    private String buildPyWrapper(String userCode) {
        return """
                import json, sys

                with open(sys.argv[1]) as f:
                    input = json.load(f)

                result = None
                try:
                %s
                    print(json.dumps({"success": True, "output": result}))
                except Exception as e:
                    print(json.dumps({"success": False, "error": str(e)}))
                """.formatted(indentPython(userCode));
    }

    // ── Core subprocess runner ────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    private ScriptResult runScript(String extension, String wrappedCode, Map<String, Object> inputs,
                                   List<String> interpreter, Duration timeout, CancelSignal cancel) {
        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("rf_script_");
            Path inputFile = workDir.resolve("input.json");
            Path scriptFile = workDir.resolve("script." + extension);
            Path stdoutFile = workDir.resolve("stdout.json");
            Path stderrFile = workDir.resolve("stderr.txt");
            Files.writeString(inputFile, objectMapper.writeValueAsString(inputs));
            Files.writeString(scriptFile, wrappedCode);

            ProcessBuilder builder = new ProcessBuilder(command(interpreter, scriptFile, inputFile, workDir))
                    .directory(workDir.toFile())
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());
            List<String> allowedEnv = sandbox.getAllowedEnv();
            builder.environment().keySet().removeIf(key -> !allowedEnv.contains(key));

            Process process = builder.start();
            cancel.onCancel(process::destroyForcibly);

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (cancel.isCancelled()) {
                process.destroyForcibly();
                return ScriptResult.error(ErrorKind.CANCELLED, "Script was cancelled.");
            }
            if (!finished) {
                process.destroyForcibly();
                return ScriptResult.error(ErrorKind.TIMEOUT,
                        "Script timed out after " + timeout.toMillis() + " ms. Check for infinite loops.");
            }

            String stdout = readCapped(stdoutFile);
            if (stdout == null) {
                return ScriptResult.error(ErrorKind.NODE_FAULT,
                        "Script output exceeds " + sandbox.getMaxOutputBytes() + " bytes.");
            }
            if (stdout.isEmpty()) {
                String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8).trim();
                return ScriptResult.error(ErrorKind.NODE_FAULT, stderr.isEmpty() ? "Script produced no output." : stderr);
            }

            Map<String, Object> parsed = objectMapper.readValue(stdout, Map.class);
            if (Boolean.TRUE.equals(parsed.get("success"))) {
                return ScriptResult.ok(parsed.get("output"));
            }
            return ScriptResult.error(ErrorKind.NODE_FAULT,
                    String.valueOf(parsed.getOrDefault("error", "Script returned failure.")));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ScriptResult.error(ErrorKind.CANCELLED, "Script execution was interrupted.");
        } catch (IOException e) {
            log.error("ScriptRunner IO error: {}", e.getMessage());
            return ScriptResult.error(ErrorKind.NODE_FAULT, "Failed to run script: " + e.getMessage());
        } finally {
            deleteQuietly(workDir);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    List<String> command(List<String> interpreter, Path scriptFile, Path inputFile, Path workDir) {
        List<String> command = new ArrayList<>();
        for (String part : sandbox.getLauncher()) {
            command.add(part.replace(WORKDIR_PLACEHOLDER, workDir.toString()));
        }
        command.addAll(interpreter);
        command.add(scriptFile.toString());
        command.add(inputFile.toString());
        return command;
    }

    /** Returns null when the output is larger than the configured cap. */
    private String readCapped(Path file) throws IOException {
        if (Files.size(file) > sandbox.getMaxOutputBytes()) {
            return null;
        }
        return Files.readString(file, StandardCharsets.UTF_8).trim();
    }

    /** Indent each line of user Python code by 4 spaces (goes inside try block) */
    private String indentPython(String code) {
        return code.lines()
                .map(line -> "    " + line)
                .reduce("", (a, b) -> a + "\n" + b);
    }

    private void deleteQuietly(Path dir) {
        if (dir == null) return;
        try {
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            log.warn("Could not remove script work dir {}: {}", dir, e.getMessage());
        }
    }

    // ── Result type ───────────────────────────────────────────────────────────

    public record ScriptResult(boolean success, Object output, ErrorKind errorKind, String error) {
        static ScriptResult ok(Object output) {
            return new ScriptResult(true, output, null, null);
        }

        static ScriptResult error(ErrorKind kind, String message) {
            return new ScriptResult(false, null, kind, message);
        }
    }
}
