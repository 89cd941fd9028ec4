package io.workqueue.observability;

import io.workqueue.claim.FifoClaimStrategy;
import io.workqueue.config.QueueSettings;
import io.workqueue.model.Lease;
import io.workqueue.model.Task;
import io.workqueue.model.TaskEventType;
import io.workqueue.model.TaskLogEntry;
import io.workqueue.model.TaskStatus;
import io.workqueue.model.WorkerHeartbeat;
import io.workqueue.storage.TaskStore;
import io.workqueue.support.TestQueue;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;

final class LeaseSweeperTest {

    @Test
    void expiredLeaseIsRequeuedWithRetryCharged() throws Exception {
        try (TestQueue q = TestQueue.create("sweep-expired")) {
            long id = enqueue(q, 3);
            Task claimed = claim(q, "worker-a", Duration.ofSeconds(1));
            q.clock().advanceMillis(1_001);

            SweepSummary summary = sweeper(q).sweep();

            Assertions.assertEquals(1, summary.expiredLeases());
            Assertions.assertEquals(1, summary.requeued());
            Assertions.assertEquals(1, summary.reclaimed());
            Assertions.assertTrue(summary.didWork());
            Task task = q.store().get(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.QUEUED, task.status());
            Assertions.assertEquals(1, task.retryCount());
            Assertions.assertNull(task.claimedBy());
            Assertions.assertNull(task.leaseToken());
            Assertions.assertFalse(q.store().complete(claimed.lease(), null));

            TaskLogEntry last = lastEvent(q, id);
            Assertions.assertEquals(TaskEventType.RETRY, last.eventType());
            Assertions.assertTrue(last.message().contains("lease expired"));
            Assertions.assertNull(q.store().worker("worker-a").orElseThrow().currentTaskId());
        }
    }

    @Test
    void exhaustedTaskIsDeadLettered() throws Exception {
        try (TestQueue q = TestQueue.create("sweep-exhausted")) {
            long id = enqueue(q, 0);
            claim(q, "worker-a", Duration.ofSeconds(1));
            q.clock().advanceMillis(5_000);

            SweepSummary summary = sweeper(q).sweep();

            Assertions.assertEquals(1, summary.deadLettered());
            Assertions.assertEquals(0, summary.requeued());
            Task task = q.store().get(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.FAILED, task.status());
            Assertions.assertNotNull(task.completedAtMs());
            Assertions.assertEquals(TaskEventType.FAILED, lastEvent(q, id).eventType());
        }
    }

    @Test
    void staleWorkerLosesItsTasksBeforeTheLeaseRunsOut() throws Exception {
        try (TestQueue q = TestQueue.create("sweep-stale")) {
            long id = enqueue(q, 3);
            claim(q, "worker-a", Duration.ofMinutes(10));
            q.clock().advanceMillis(QueueSettings.defaults().staleWorkerAfterMs() + 1);

            SweepSummary summary = sweeper(q).sweep();

            Assertions.assertEquals(List.of("worker-a"), summary.staleWorkers());
            Assertions.assertEquals(0, summary.expiredLeases());
            Assertions.assertEquals(1, summary.inactiveOwnerLeases());
            Assertions.assertEquals(1, summary.requeued());
            Assertions.assertEquals(WorkerHeartbeat.STALE, q.store().worker("worker-a").orElseThrow().status());
            Assertions.assertEquals(TaskStatus.QUEUED, q.store().get(id).orElseThrow().status());
            Assertions.assertTrue(lastEvent(q, id).message().contains("owner worker-a inactive"));
        }
    }

    @Test
    void stoppedWorkerTasksAreReclaimed() throws Exception {
        try (TestQueue q = TestQueue.create("sweep-stopped")) {
            long id = enqueue(q, 3);
            claim(q, "worker-a", Duration.ofMinutes(10));
            q.store().markWorkerStopped("worker-a");

            SweepSummary summary = sweeper(q).sweep();

            Assertions.assertTrue(summary.staleWorkers().isEmpty());
            Assertions.assertEquals(1, summary.requeued());
            Assertions.assertEquals(TaskStatus.QUEUED, q.store().get(id).orElseThrow().status());
        }
    }

    @Test
    void healthyLeasesAreLeftAlone() throws Exception {
        try (TestQueue q = TestQueue.create("sweep-healthy")) {
            long id = enqueue(q, 3);
            Task claimed = claim(q, "worker-a", Duration.ofMinutes(2));
            q.clock().advanceMillis(60_000);

            SweepSummary summary = sweeper(q).sweep();

            Assertions.assertFalse(summary.didWork());
            Assertions.assertEquals(0, summary.expiredLeases());
            Task task = q.store().get(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.CLAIMED, task.status());
            Assertions.assertEquals(claimed.leaseToken(), task.leaseToken());
            Assertions.assertTrue(q.store().complete(claimed.lease(), null));
        }
    }

    @Test
    void reclaimIsFencedByLeaseToken() throws Exception {
        try (TestQueue q = TestQueue.create("sweep-fenced")) {
            long id = enqueue(q, 3);
            Lease lease = claim(q, "worker-a", Duration.ofSeconds(1)).lease();
            Assertions.assertTrue(q.store().complete(lease, null));

            Assertions.assertEquals(TaskStore.ReclaimOutcome.SKIPPED, q.store().reclaim(lease, TaskStore.ReclaimCause.LEASE_EXPIRED, "lease expired"));
            Assertions.assertEquals(TaskStatus.COMPLETED, q.store().get(id).orElseThrow().status());

            long other = enqueue(q, 3);
            Lease current = claim(q, "worker-b", Duration.ofSeconds(1)).lease();
            Assertions.assertEquals(other, current.taskId());
            Lease forged = new Lease(other, "worker-b", "not-the-token", current.leaseUntilMs());
            Assertions.assertEquals(TaskStore.ReclaimOutcome.SKIPPED, q.store().reclaim(forged, TaskStore.ReclaimCause.LEASE_EXPIRED, "lease expired"));
            Assertions.assertEquals(TaskStatus.CLAIMED, q.store().get(other).orElseThrow().status());
        }
    }

    @Test
    void ownerThatHeartbeatsBackKeepsItsTask() throws Exception {
        try (TestQueue q = TestQueue.create("sweep-owner-back")) {
            long id = enqueue(q, 3);
            Task claimed = claim(q, "worker-a", Duration.ofSeconds(120));
            q.clock().advanceMillis(41_000);

            Assertions.assertEquals(List.of("worker-a"), q.store().markStaleWorkers(q.clock().millis() - 40_000));
            List<Lease> orphaned = q.store().leasesOfInactiveWorkers(10);
            Assertions.assertEquals(1, orphaned.size());

            Assertions.assertEquals(TaskStore.HeartbeatResult.RENEWED,
                    q.store().heartbeat(claimed.lease(), Duration.ofSeconds(120)));
            Assertions.assertEquals(WorkerHeartbeat.ACTIVE, q.store().worker("worker-a").orElseThrow().status());

            Assertions.assertEquals(TaskStore.ReclaimOutcome.SKIPPED,
                    q.store().reclaim(orphaned.get(0), TaskStore.ReclaimCause.OWNER_INACTIVE, "owner worker-a inactive"));
            Task task = q.store().get(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.CLAIMED, task.status());
            Assertions.assertEquals(0, task.retryCount());
            Assertions.assertTrue(q.store().complete(claimed.lease(), null));
        }
    }

    @Test
    void expiredReclaimIsSkippedWhenTheLeaseIsStillLive() throws Exception {
        try (TestQueue q = TestQueue.create("sweep-live-lease")) {
            long id = enqueue(q, 3);
            Task claimed = claim(q, "worker-a", Duration.ofSeconds(60));

            Assertions.assertEquals(TaskStore.ReclaimOutcome.SKIPPED,
                    q.store().reclaim(claimed.lease(), TaskStore.ReclaimCause.LEASE_EXPIRED, "lease expired"));
            Assertions.assertEquals(TaskStatus.CLAIMED, q.store().get(id).orElseThrow().status());

            q.clock().advanceMillis(60_001);
            Assertions.assertEquals(TaskStore.ReclaimOutcome.REQUEUED,
                    q.store().reclaim(claimed.lease(), TaskStore.ReclaimCause.LEASE_EXPIRED, "lease expired"));
            Assertions.assertEquals(TaskStatus.QUEUED, q.store().get(id).orElseThrow().status());
        }
    }

    @Test
    void scheduledSweepsRunInTheBackground() throws Exception {
        QueueSettings settings = QueueSettings.parse("{\"sweepIntervalMs\": 20}");
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try (TestQueue q = TestQueue.create("sweep-scheduled", settings)) {
            long id = enqueue(q, 3);
            claim(q, "worker-a", Duration.ofSeconds(1));
            q.clock().advanceMillis(2_000);

            ScheduledFuture<?> future = new LeaseSweeper(q.store(), settings, q.clock()).start(scheduler);
            long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
            while (q.store().get(id).orElseThrow().status() != TaskStatus.QUEUED && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            future.cancel(false);

            Assertions.assertEquals(TaskStatus.QUEUED, q.store().get(id).orElseThrow().status());
            Assertions.assertEquals(1, q.store().get(id).orElseThrow().retryCount());
        } finally {
            scheduler.shutdownNow();
        }
    }

    private static LeaseSweeper sweeper(TestQueue q) {
        return new LeaseSweeper(q.store(), q.settings(), q.clock());
    }

    private static long enqueue(TestQueue q, int maxRetries) {
        return q.store().enqueue(TaskStore.EnqueueRequest.of("echo", null).withMaxRetries(maxRetries)).taskId();
    }

    private static Task claim(TestQueue q, String workerId, Duration lease) {
        return new FifoClaimStrategy(q.store()).claim(workerId, lease).orElseThrow();
    }

    private static TaskLogEntry lastEvent(TestQueue q, long taskId) {
        List<TaskLogEntry> events = q.store().eventLog().forTask(taskId);
        return events.get(events.size() - 1);
    }
}
