package io.workqueue.model;

import com.fasterxml.jackson.databind.JsonNode;

public record Task(
        long id,
        String taskType,
        JsonNode parameters,
        int priority,
        long runAfterMs,
        TaskStatus status,
        String claimedBy,
        Long claimedAtMs,
        Long leaseUntilMs,
        String leaseToken,
        int retryCount,
        int maxRetries,
        String idempotencyKey,
        JsonNode resultData,
        String errorMessage,
        long createdAtMs,
        long updatedAtMs,
        Long completedAtMs
) {
    /**
     * Ownership handle for the current claim, or {@code null} when the task is not owned.
     */
    public Lease lease() {
        if (!status.owned() || claimedBy == null || leaseToken == null) {
            return null;
        }
        return new Lease(id, claimedBy, leaseToken, leaseUntilMs == null ? 0L : leaseUntilMs);
    }
}
