package io.workqueue.claim;

import io.workqueue.storage.TaskStore;

/**
 * Newest eligible task first. Older tasks can starve while new ones keep arriving.
 */
public final class LifoClaimStrategy extends OrderedClaimStrategy {
    public LifoClaimStrategy(TaskStore store) {
        super(store);
    }

    @Override
    protected String orderBy() {
        return "created_at DESC, id DESC";
    }

    @Override
    public String name() {
        return ClaimStrategyType.LIFO.name();
    }
}
