package io.workqueue.observability;

import io.workqueue.config.QueueSettings;
import io.workqueue.model.Lease;
import io.workqueue.storage.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Recovers work from crashed or hung workers.
 *
 * <p>A sweep flags workers whose heartbeat is older than the staleness threshold, then
 * reclaims every task whose lease expired or whose owner is stale or stopped. Each reclaim is
 * fenced by the lease token it was read with, so a task that completed in the meantime is left
 * alone.
 */
public final class LeaseSweeper {
    private static final Logger log = LoggerFactory.getLogger(LeaseSweeper.class);

    private final TaskStore store;
    private final QueueSettings settings;
    private final Clock clock;

    public LeaseSweeper(TaskStore store, QueueSettings settings, Clock clock) {
        this.store = store;
        this.settings = settings;
        this.clock = clock;
    }

    public SweepSummary sweep() {
        long now = clock.millis();
        List<String> staleWorkers = store.markStaleWorkers(now - settings.staleWorkerAfterMs());
        List<Lease> expired = store.expiredLeases(now, settings.sweepBatchLimit());
        List<Lease> orphaned = store.leasesOfInactiveWorkers(settings.sweepBatchLimit());

        Map<Long, Lease> targets = new LinkedHashMap<>();
        Map<Long, TaskStore.ReclaimCause> causes = new LinkedHashMap<>();
        for (Lease lease : expired) {
            targets.put(lease.taskId(), lease);
            causes.put(lease.taskId(), TaskStore.ReclaimCause.LEASE_EXPIRED);
        }
        for (Lease lease : orphaned) {
            if (targets.putIfAbsent(lease.taskId(), lease) == null) {
                causes.put(lease.taskId(), TaskStore.ReclaimCause.OWNER_INACTIVE);
            }
        }

        int requeued = 0;
        int deadLettered = 0;
        int skipped = 0;
        for (Lease lease : targets.values()) {
            TaskStore.ReclaimCause cause = causes.get(lease.taskId());
            TaskStore.ReclaimOutcome outcome = store.reclaim(lease, cause, reasonText(cause, lease));
            switch (outcome) {
                case REQUEUED -> requeued++;
                case DEAD_LETTERED -> deadLettered++;
                case SKIPPED -> skipped++;
            }
        }
        SweepSummary summary = new SweepSummary(
                staleWorkers,
                expired.size(),
                orphaned.size(),
                requeued,
                deadLettered,
                skipped
        );
        if (summary.didWork()) {
            log.info("Sweep: staleWorkers={}, requeued={}, deadLettered={}, skipped={}",
                    staleWorkers, requeued, deadLettered, skipped);
        } else {
            log.debug("Sweep found nothing to reclaim");
        }
        return summary;
    }

    private static String reasonText(TaskStore.ReclaimCause cause, Lease lease) {
        return switch (cause) {
            case LEASE_EXPIRED -> "lease expired";
            case OWNER_INACTIVE -> "owner " + lease.workerId() + " inactive";
        };
    }

    /**
     * Schedules {@link #sweep()} every {@code sweepIntervalMs}. A failing sweep is logged and
     * the schedule keeps running.
     */
    public ScheduledFuture<?> start(ScheduledExecutorService scheduler) {
        long interval = settings.sweepIntervalMs();
        return scheduler.scheduleWithFixedDelay(this::sweepLoggingErrors, interval, interval, TimeUnit.MILLISECONDS);
    }

    void sweepLoggingErrors() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Lease sweep failed", e);
        }
    }
}
