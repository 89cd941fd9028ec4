package io.workqueue.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.workqueue.util.Jsons;

import java.time.Instant;

/**
 * Returns its parameters. An optional {@code delayMs} parameter makes it sleep first, in
 * short slices separated by checkpoints.
 */
public final class EchoExecutor implements TaskExecutor {
    private static final long SLICE_MS = 50L;

    @Override
    public String taskType() {
        return "echo";
    }

    @Override
    public ExecutionResult execute(TaskContext context) throws InterruptedException {
        JsonNode params = context.parameters();
        long delayMs = params == null ? 0L : params.path("delayMs").asLong(0L);
        long remaining = delayMs;
        while (remaining > 0) {
            context.checkpoint();
            long slice = Math.min(SLICE_MS, remaining);
            Thread.sleep(slice);
            remaining -= slice;
        }
        context.checkpoint();
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("executor", "echo");
        out.put("taskId", context.task().id());
        out.put("timestamp", Instant.now().toString());
        out.set("received", params);
        return ExecutionResult.ok(out);
    }
}
