package io.workqueue.executor;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Always fails. {@code {"retryable": false}} makes the failure fatal.
 */
public final class FailExecutor implements TaskExecutor {
    @Override
    public String taskType() {
        return "fail";
    }

    @Override
    public ExecutionResult execute(TaskContext context) {
        JsonNode params = context.parameters();
        String message = params == null ? "" : params.path("message").asText("");
        if (message.isBlank()) {
            message = "intentional failure from fail executor";
        }
        boolean retryable = params == null || params.path("retryable").asBoolean(true);
        return retryable ? ExecutionResult.retryable(message) : ExecutionResult.fatal(message);
    }
}
