package io.workqueue.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.workqueue.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command with the task parameters as JSON on stdin. Exit code 0 completes
 * the task with stdout (parsed as JSON when it is JSON); exit code 2 is a fatal failure, any
 * other code or a timeout is retryable.
 */
public final class ScriptExecutor implements TaskExecutor {
    private static final Logger log = LoggerFactory.getLogger(ScriptExecutor.class);
    static final int FATAL_EXIT_CODE = 2;
    private static final int MAX_ERROR_CHARS = 512;

    private final String taskType;
    private final List<String> command;
    private final long timeoutMs;

    public ScriptExecutor(String taskType, List<String> command, long timeoutMs) {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("script executor task type cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script executor command cannot be empty: " + taskType);
        }
        this.taskType = taskType;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(100L, timeoutMs);
    }

    @Override
    public String taskType() {
        return taskType;
    }

    /**
     * Output goes to a temporary file rather than a pipe, so a script that prints more than
     * the pipe buffer holds still runs to completion.
     */
    @Override
    public ExecutionResult execute(TaskContext context) throws InterruptedException {
        Path output;
        try {
            output = Files.createTempFile("workqueue-script-", ".out");
        } catch (IOException e) {
            return ExecutionResult.retryable("script output file unavailable: " + e.getMessage());
        }
        try {
            return run(context, output);
        } finally {
            try {
                Files.deleteIfExists(output);
            } catch (IOException e) {
                log.warn("Could not delete script output {}", output, e);
            }
        }
    }

    private ExecutionResult run(TaskContext context, Path output) throws InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        pb.redirectOutput(output.toFile());
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return ExecutionResult.fatal("script spawn failed: " + e.getMessage());
        }

        try {
            JsonNode params = context.parameters();
            byte[] input = params == null || params.isNull()
                    ? new byte[0]
                    : Jsons.toCompactJson(params).getBytes(StandardCharsets.UTF_8);
            process.getOutputStream().write(input);
            process.getOutputStream().flush();
            process.getOutputStream().close();

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return ExecutionResult.retryable("script timeout after " + Duration.ofMillis(timeoutMs));
            }

            String combined = Files.readString(output, StandardCharsets.UTF_8);
            int exit = process.exitValue();
            if (exit == 0) {
                return ExecutionResult.ok(toResult(combined.strip()));
            }
            String error = "script exit=" + exit + " output=" + truncate(combined);
            return exit == FATAL_EXIT_CODE ? ExecutionResult.fatal(error) : ExecutionResult.retryable(error);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } catch (IOException e) {
            process.destroyForcibly();
            return ExecutionResult.retryable("script execution failed: " + e.getMessage());
        }
    }

    private static JsonNode toResult(String output) {
        if (output.isEmpty()) {
            return TextNode.valueOf("");
        }
        try {
            return Jsons.parse(output);
        } catch (IllegalArgumentException e) {
            return TextNode.valueOf(output);
        }
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
