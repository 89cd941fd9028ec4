package io.workqueue.executor;

import com.fasterxml.jackson.databind.JsonNode;

public record ExecutionResult(
        boolean success,
        JsonNode result,
        String error,
        boolean retryable
) {
    public static ExecutionResult ok(JsonNode result) {
        return new ExecutionResult(true, result, null, false);
    }

    public static ExecutionResult retryable(String error) {
        return new ExecutionResult(false, null, error, true);
    }

    public static ExecutionResult fatal(String error) {
        return new ExecutionResult(false, null, error, false);
    }
}
