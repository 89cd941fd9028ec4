package io.workqueue.model;

import com.fasterxml.jackson.databind.JsonNode;

public record TaskLogEntry(
        long id,
        long taskId,
        String workerId,
        TaskEventType eventType,
        String message,
        JsonNode details,
        long timestampMs
) {
}
