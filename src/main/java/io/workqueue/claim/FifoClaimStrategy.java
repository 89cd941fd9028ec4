package io.workqueue.claim;

import io.workqueue.storage.TaskStore;

public final class FifoClaimStrategy extends OrderedClaimStrategy {
    public FifoClaimStrategy(TaskStore store) {
        super(store);
    }

    @Override
    protected String orderBy() {
        return "created_at ASC, id ASC";
    }

    @Override
    public String name() {
        return ClaimStrategyType.FIFO.name();
    }
}
