package com.hartwig.varpipe.tool;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Queue;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.EvictingQueue;
import com.google.common.collect.Queues;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs external tools as child processes. Knows nothing about what the tools do: a zero exit code plus all declared outputs is
 * success, anything else is a {@link ToolFailure}.
 */
public class ExternalToolAdapter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExternalToolAdapter.class);
    public static final int DIAGNOSTIC_LINES = 50;
    private static final long DRAIN_GRACE_MILLIS = 5000;

    public ToolResult invoke(ToolInvocation invocation) {
        var toolName = invocation.toolName();
        var workDirectory = invocation.workDirectory();
        var arguments = invocation.command().render(invocation.values());

        var processBuilder = new ProcessBuilder(arguments).directory(workDirectory.toFile());
        invocation.stdoutOutput().ifPresentOrElse(output -> processBuilder.redirectOutput(workDirectory.resolve(output).toFile()),
                () -> processBuilder.redirectErrorStream(true));

        LOGGER.info("[{}] Running {}", toolName, String.join(" ", arguments));
        Queue<String> diagnostics = Queues.synchronizedQueue(EvictingQueue.create(DIAGNOSTIC_LINES));
        int exitCode;
        try {
            var process = processBuilder.start();
            var diagnosticStream = invocation.stdoutOutput().isPresent() ? process.getErrorStream() : process.getInputStream();
            var drainer = new Thread(() -> drain(toolName, diagnosticStream, diagnostics), toolName + "-output");
            drainer.setDaemon(true);
            drainer.start();
            if (!waitFor(invocation, process)) {
                process.destroyForcibly();
                drainer.join(DRAIN_GRACE_MILLIS);
                throw new ToolFailure(toolName,
                        ToolFailure.NOT_STARTED,
                        "timed out after " + describe(invocation.timeout().orElseThrow()),
                        new ArrayList<>(diagnostics));
            }
            drainer.join();
            exitCode = process.exitValue();
        } catch (IOException e) {
            throw new ToolFailure(toolName, ToolFailure.NOT_STARTED, "could not run process: " + e.getMessage(), new ArrayList<>(diagnostics));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolFailure(toolName, ToolFailure.NOT_STARTED, "interrupted while waiting for process", new ArrayList<>(diagnostics));
        }

        if (exitCode != 0) {
            throw new ToolFailure(toolName, exitCode, "non-zero exit code", new ArrayList<>(diagnostics));
        }

        var outputs = new LinkedHashMap<String, Path>();
        for (String declared : invocation.declaredOutputs()) {
            var path = workDirectory.resolve(declared);
            if (!Files.exists(path)) {
                throw new ToolFailure(toolName, exitCode, String.format("declared output '%s' was not produced", declared), new ArrayList<>(diagnostics));
            }
            outputs.put(declared, path);
        }
        LOGGER.info("[{}] Finished, produced {}", toolName, outputs.keySet());
        return ImmutableToolResult.builder().toolName(toolName).outputs(outputs).diagnostics(new ArrayList<>(diagnostics)).build();
    }

    private static void drain(String toolName, InputStream stream, Queue<String> diagnostics) {
        try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                LOGGER.debug("[{}] {}", toolName, line);
                diagnostics.add(line);
            }
        } catch (IOException e) {
            LOGGER.warn("[{}] Stopped reading tool output: {}", toolName, e.getMessage());
        }
    }

    private static boolean waitFor(ToolInvocation invocation, Process process) throws InterruptedException {
        if (invocation.timeout().isEmpty()) {
            process.waitFor();
            return true;
        }
        return process.waitFor(invocation.timeout().get().toMillis(), TimeUnit.MILLISECONDS);
    }

    private static String describe(Duration timeout) {
        if (timeout.toSecondsPart() == 0 && timeout.toMillisPart() == 0 && timeout.toMinutes() > 0) {
            return timeout.toMinutes() + " minutes";
        }
        return timeout.toMillis() + " ms";
    }
}
