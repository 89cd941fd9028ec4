package io.workqueue.claim;

import io.workqueue.model.Task;

import java.time.Duration;
import java.util.Optional;

/**
 * Selects and atomically claims at most one eligible task for a worker.
 *
 * <p>An eligible task has {@code status = queued} and {@code run_after <= now}. A returned task
 * is in the {@code claimed} state, owned by {@code workerId}, with a lease of {@code lease}.
 */
public interface ClaimStrategy {
    Optional<Task> claim(String workerId, Duration lease);

    String name();
}
