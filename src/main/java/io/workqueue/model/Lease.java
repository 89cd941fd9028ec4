package io.workqueue.model;

/**
 * Proof of ownership handed out by a successful claim. Every write made on behalf of the
 * owner is fenced by {@code token}; a reclaimed task gets a new token on its next claim.
 */
public record Lease(
        long taskId,
        String workerId,
        String token,
        long leaseUntilMs
) {
}
