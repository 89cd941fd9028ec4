package io.workqueue.claim;

import io.workqueue.storage.TaskStore;

/**
 * Strict priority, lower number first, FIFO within a priority.
 */
public final class PriorityClaimStrategy extends OrderedClaimStrategy {
    public PriorityClaimStrategy(TaskStore store) {
        super(store);
    }

    @Override
    protected String orderBy() {
        return "priority ASC, created_at ASC, id ASC";
    }

    @Override
    public String name() {
        return ClaimStrategyType.PRIORITY.name();
    }
}
