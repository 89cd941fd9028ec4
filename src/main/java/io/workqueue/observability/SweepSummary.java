package io.workqueue.observability;

import java.util.List;

public record SweepSummary(
        List<String> staleWorkers,
        int expiredLeases,
        int inactiveOwnerLeases,
        int requeued,
        int deadLettered,
        int skipped
) {
    public int reclaimed() {
        return requeued + deadLettered;
    }

    public boolean didWork() {
        return !staleWorkers.isEmpty() || reclaimed() > 0;
    }
}
