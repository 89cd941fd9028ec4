package io.workqueue.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.workqueue.claim.ClaimStrategy;
import io.workqueue.claim.FifoClaimStrategy;
import io.workqueue.config.QueueSettings;
import io.workqueue.executor.ExecutionResult;
import io.workqueue.executor.ExecutorRegistry;
import io.workqueue.executor.NonRetryableTaskException;
import io.workqueue.executor.TaskContext;
import io.workqueue.executor.TaskExecutor;
import io.workqueue.model.Lease;
import io.workqueue.model.Task;
import io.workqueue.model.TaskEventType;
import io.workqueue.model.TaskLogEntry;
import io.workqueue.model.TaskStatus;
import io.workqueue.model.WorkerHeartbeat;
import io.workqueue.observability.LeaseSweeper;
import io.workqueue.observability.SweepSummary;
import io.workqueue.storage.TaskStore;
import io.workqueue.support.RecordingSleeper;
import io.workqueue.support.TestQueue;
import io.workqueue.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

final class WorkerRuntimeTest {
    private static final QueueSettings SETTINGS = QueueSettings.parse("""
            {"leaseTimeoutMs": 5000, "heartbeatIntervalMs": 50}
            """);

    @Test
    void completesTaskAndStoresResult() throws Exception {
        try (TestQueue q = TestQueue.create("worker-success", SETTINGS);
             WorkerRuntime worker = newWorker(q, ExecutorRegistry.withBuiltins(SETTINGS), new RecordingSleeper())) {
            long id = enqueue(q, "echo", "{\"msg\":\"hi\"}", 3);

            WorkerOutcome outcome = worker.runOnce();

            Assertions.assertTrue(outcome.claimed());
            Assertions.assertEquals(WorkerOutcome.Kind.COMPLETED, outcome.kind());
            Assertions.assertEquals(id, outcome.taskId());
            Task task = q.store().get(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.COMPLETED, task.status());
            Assertions.assertEquals("hi", task.resultData().path("received").path("msg").asText());
            Assertions.assertNull(task.claimedBy());
            List<TaskEventType> events = q.store().eventLog().forTask(id).stream().map(TaskLogEntry::eventType).toList();
            Assertions.assertEquals(List.of(TaskEventType.CREATED, TaskEventType.CLAIMED, TaskEventType.STARTED,
                    TaskEventType.COMPLETED), events);
            Assertions.assertEquals(1, q.store().worker("worker-1").orElseThrow().tasksProcessed());
        }
    }

    @Test
    void idlePollRegistersWorkerAndClaimsNothing() throws Exception {
        try (TestQueue q = TestQueue.create("worker-idle", SETTINGS);
             WorkerRuntime worker = newWorker(q, ExecutorRegistry.withBuiltins(SETTINGS), new RecordingSleeper())) {
            WorkerOutcome outcome = worker.runOnce();

            Assertions.assertFalse(outcome.claimed());
            Assertions.assertEquals(WorkerOutcome.Kind.IDLE, outcome.kind());
            Assertions.assertEquals(WorkerState.IDLE, worker.state());
            WorkerHeartbeat row = q.store().worker("worker-1").orElseThrow();
            Assertions.assertEquals(WorkerHeartbeat.ACTIVE, row.status());
            Assertions.assertEquals("FIFO", row.strategy());
        }
    }

    @Test
    void retryableFailuresRequeueUntilRetriesRunOut() throws Exception {
        try (TestQueue q = TestQueue.create("worker-retry", SETTINGS);
             WorkerRuntime worker = newWorker(q, ExecutorRegistry.withBuiltins(SETTINGS), new RecordingSleeper())) {
            long id = enqueue(q, "fail", "{\"message\":\"flaky\"}", 2);

            Assertions.assertEquals(WorkerOutcome.Kind.REQUEUED, worker.runOnce().kind());
            Assertions.assertEquals(WorkerOutcome.Kind.REQUEUED, worker.runOnce().kind());
            Assertions.assertEquals(WorkerOutcome.Kind.DEAD_LETTERED, worker.runOnce().kind());
            Assertions.assertEquals(WorkerOutcome.Kind.IDLE, worker.runOnce().kind());

            Task task = q.store().get(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.FAILED, task.status());
            Assertions.assertEquals(2, task.retryCount());
            Assertions.assertEquals("flaky", task.errorMessage());
            Assertions.assertEquals(3, q.store().worker("worker-1").orElseThrow().tasksFailed());
        }
    }

    @Test
    void fatalResultDeadLettersImmediately() throws Exception {
        try (TestQueue q = TestQueue.create("worker-fatal", SETTINGS);
             WorkerRuntime worker = newWorker(q, ExecutorRegistry.withBuiltins(SETTINGS), new RecordingSleeper())) {
            long id = enqueue(q, "fail", "{\"message\":\"bad input\",\"retryable\":false}", 5);

            WorkerOutcome outcome = worker.runOnce();

            Assertions.assertEquals(WorkerOutcome.Kind.DEAD_LETTERED, outcome.kind());
            Task task = q.store().get(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.FAILED, task.status());
            Assertions.assertEquals(0, task.retryCount());
        }
    }

    @Test
    void thrownExceptionsAreClassified() throws Exception {
        ExecutorRegistry registry = new ExecutorRegistry()
                .register(executor("explode", ctx -> {
                    throw new IllegalStateException("disk full");
                }))
                .register(executor("reject", ctx -> {
                    throw new NonRetryableTaskException("missing field");
                }));
        try (TestQueue q = TestQueue.create("worker-thrown", SETTINGS);
             WorkerRuntime worker = newWorker(q, registry, new RecordingSleeper())) {
            long rejected = enqueue(q, "reject", null, 1);
            q.clock().advanceMillis(1);
            long retried = enqueue(q, "explode", null, 1);

            WorkerOutcome first = worker.runOnce();
            Assertions.assertEquals(rejected, first.taskId());
            Assertions.assertEquals(WorkerOutcome.Kind.DEAD_LETTERED, first.kind());
            Task task = q.store().get(rejected).orElseThrow();
            Assertions.assertEquals(0, task.retryCount());
            Assertions.assertEquals("NonRetryableTaskException: missing field", task.errorMessage());

            WorkerOutcome second = worker.runOnce();
            Assertions.assertEquals(retried, second.taskId());
            Assertions.assertEquals(WorkerOutcome.Kind.REQUEUED, second.kind());
            Assertions.assertEquals("IllegalStateException: disk full",
                    q.store().get(retried).orElseThrow().errorMessage());
        }
    }

    @Test
    void unknownTaskTypeIsDeadLettered() throws Exception {
        try (TestQueue q = TestQueue.create("worker-unknown", SETTINGS);
             WorkerRuntime worker = newWorker(q, ExecutorRegistry.withBuiltins(SETTINGS), new RecordingSleeper())) {
            long id = enqueue(q, "mystery", null, 3);

            Assertions.assertEquals(WorkerOutcome.Kind.DEAD_LETTERED, worker.runOnce().kind());
            Task task = q.store().get(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.FAILED, task.status());
            Assertions.assertEquals("No executor registered for task type: mystery", task.errorMessage());
        }
    }

    @Test
    void cancellationStopsRunningExecutor() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        ExecutorRegistry registry = new ExecutorRegistry().register(executor("spin", ctx -> {
            started.countDown();
            while (true) {
                ctx.checkpoint();
                Thread.sleep(5);
            }
        }));
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try (TestQueue q = TestQueue.create("worker-cancel", SETTINGS);
             WorkerRuntime worker = newWorker(q, registry, new RecordingSleeper())) {
            long id = enqueue(q, "spin", null, 3);
            Future<WorkerOutcome> outcome = caller.submit(worker::runOnce);

            Assertions.assertTrue(started.await(10, TimeUnit.SECONDS));
            Assertions.assertEquals(TaskStore.CancelOutcome.CANCELLED, q.store().cancel(id, "operator").outcome());

            WorkerOutcome result = outcome.get(10, TimeUnit.SECONDS);
            Assertions.assertEquals(WorkerOutcome.Kind.CANCELLED, result.kind());
            Task task = q.store().get(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.CANCELLED, task.status());
            Assertions.assertNull(task.claimedBy());
        } finally {
            caller.shutdownNow();
        }
    }

    @Test
    void lostLeaseAbortsExecutionAndSweeperRequeues() throws Exception {
        AtomicReference<TestQueue> queue = new AtomicReference<>();
        CountDownLatch started = new CountDownLatch(1);
        ExecutorRegistry registry = new ExecutorRegistry().register(executor("hang", ctx -> {
            queue.get().clock().advanceMillis(SETTINGS.leaseTimeoutMs() + 1);
            started.countDown();
            while (true) {
                ctx.checkpoint();
                Thread.sleep(5);
            }
        }));
        try (TestQueue q = TestQueue.create("worker-lease-lost", SETTINGS);
             WorkerRuntime worker = newWorker(q, registry, new RecordingSleeper())) {
            queue.set(q);
            long id = enqueue(q, "hang", null, 3);

            WorkerOutcome outcome = worker.runOnce();

            Assertions.assertTrue(started.await(1, TimeUnit.SECONDS));
            Assertions.assertEquals(WorkerOutcome.Kind.LEASE_LOST, outcome.kind());
            Task stuck = q.store().get(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.RUNNING, stuck.status());
            Lease staleLease = stuck.lease();

            SweepSummary summary = new LeaseSweeper(q.store(), SETTINGS, q.clock()).sweep();
            Assertions.assertEquals(1, summary.requeued());

            Task requeued = q.store().get(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.QUEUED, requeued.status());
            Assertions.assertEquals(1, requeued.retryCount());
            Assertions.assertFalse(q.store().complete(staleLease, Jsons.parse("{\"late\":true}")));
            Assertions.assertEquals(TaskStatus.QUEUED, q.store().get(id).orElseThrow().status());
        }
    }

    @Test
    void longTaskKeepsLeaseThroughHeartbeats() throws Exception {
        try (TestQueue q = TestQueue.create("worker-heartbeat", SETTINGS);
             WorkerRuntime worker = newWorker(q, ExecutorRegistry.withBuiltins(SETTINGS), new RecordingSleeper())) {
            long id = enqueue(q, "echo", "{\"delayMs\":300}", 0);

            Assertions.assertEquals(WorkerOutcome.Kind.COMPLETED, worker.runOnce().kind());
            Assertions.assertEquals(TaskStatus.COMPLETED, q.store().get(id).orElseThrow().status());
        }
    }

    @Test
    void idleLoopBacksOffAndStopsCleanly() throws Exception {
        AtomicReference<WorkerRuntime> holder = new AtomicReference<>();
        RecordingSleeper sleeper = new RecordingSleeper(n -> {
            if (n >= 8) {
                holder.get().stop();
            }
        });
        try (TestQueue q = TestQueue.create("worker-backoff", SETTINGS);
             WorkerRuntime worker = newWorker(q, ExecutorRegistry.withBuiltins(SETTINGS), sleeper)) {
            holder.set(worker);

            worker.run();

            List<Long> millis = sleeper.sleeps().stream().map(Duration::toMillis).toList();
            Assertions.assertEquals(List.of(5_000L, 7_500L, 11_250L, 16_875L, 25_312L, 37_968L, 56_953L, 60_000L), millis);
            Assertions.assertEquals(WorkerState.STOPPED, worker.state());
            Assertions.assertEquals(WorkerHeartbeat.STOPPED, q.store().worker("worker-1").orElseThrow().status());
        }
    }

    @Test
    void claimResetsBackoff() throws Exception {
        AtomicReference<WorkerRuntime> holder = new AtomicReference<>();
        AtomicReference<TestQueue> queue = new AtomicReference<>();
        RecordingSleeper sleeper = new RecordingSleeper(n -> {
            if (n == 2) {
                enqueue(queue.get(), "echo", null, 0);
            }
            if (n >= 4) {
                holder.get().stop();
            }
        });
        try (TestQueue q = TestQueue.create("worker-reset", SETTINGS);
             WorkerRuntime worker = newWorker(q, ExecutorRegistry.withBuiltins(SETTINGS), sleeper)) {
            holder.set(worker);
            queue.set(q);

            worker.run();

            List<Long> millis = sleeper.sleeps().stream().map(Duration::toMillis).toList();
            Assertions.assertEquals(List.of(5_000L, 7_500L, 5_000L, 7_500L), millis);
            Assertions.assertEquals(1L, q.stats().statusCounts().get("completed"));
        }
    }

    @Test
    void drainStopsAtFirstIdlePoll() throws Exception {
        try (TestQueue q = TestQueue.create("worker-drain", SETTINGS);
             WorkerRuntime worker = newWorker(q, ExecutorRegistry.withBuiltins(SETTINGS), new RecordingSleeper())) {
            for (int i = 0; i < 3; i++) {
                enqueue(q, "echo", null, 0);
            }
            Assertions.assertEquals(2, worker.drain(2));
            Assertions.assertEquals(1, worker.drain(10));
            Assertions.assertEquals(0, worker.drain(10));
        }
    }

    @Test
    void nonJsonParametersAreReadAsTextAndTheLoopKeepsGoing() throws Exception {
        AtomicReference<WorkerRuntime> holder = new AtomicReference<>();
        RecordingSleeper sleeper = new RecordingSleeper(n -> holder.get().stop());
        try (TestQueue q = TestQueue.create("worker-raw-row", SETTINGS);
             WorkerRuntime worker = newWorker(q, ExecutorRegistry.withBuiltins(SETTINGS), sleeper)) {
            holder.set(worker);
            long id = q.database().inTransaction("insert raw row", c -> {
                try (PreparedStatement ps = c.prepareStatement("""
                        INSERT INTO task_queue (task_type, parameters, run_after, created_at, updated_at)
                        VALUES ('echo', 'not json', ?, ?, ?)
                        """)) {
                    long now = q.clock().millis();
                    ps.setLong(1, now);
                    ps.setLong(2, now);
                    ps.setLong(3, now);
                    ps.executeUpdate();
                }
                try (Statement st = c.createStatement();
                     ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
                    rs.next();
                    return rs.getLong(1);
                }
            });

            worker.run();

            Task task = q.store().get(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.COMPLETED, task.status());
            Assertions.assertEquals("not json", task.parameters().asText());
            Assertions.assertEquals("not json", task.resultData().path("received").asText());
            Assertions.assertEquals(1, sleeper.sleeps().size());

            PollStats stats = worker.stats();
            Assertions.assertFalse(stats.running());
            Assertions.assertEquals(2, stats.pollsTotal());
            Assertions.assertEquals(1, stats.pollsSuccessful());
            Assertions.assertEquals(1, stats.pollsEmpty());
            Assertions.assertEquals(1, stats.consecutiveEmpty());
            Assertions.assertEquals(0.5, stats.successRate(), 1e-9);
        }
    }

    @Test
    void failingPollIsTreatedAsIdle() throws Exception {
        AtomicReference<WorkerRuntime> holder = new AtomicReference<>();
        RecordingSleeper sleeper = new RecordingSleeper(n -> {
            if (n >= 2) {
                holder.get().stop();
            }
        });
        try (TestQueue q = TestQueue.create("worker-poll-error", SETTINGS)) {
            FifoClaimStrategy fifo = new FifoClaimStrategy(q.store());
            AtomicInteger calls = new AtomicInteger();
            ClaimStrategy flaky = new ClaimStrategy() {
                @Override
                public Optional<Task> claim(String workerId, Duration lease) {
                    if (calls.incrementAndGet() == 1) {
                        throw new IllegalStateException("claim exploded");
                    }
                    return fifo.claim(workerId, lease);
                }

                @Override
                public String name() {
                    return fifo.name();
                }
            };
            try (WorkerRuntime worker = new WorkerRuntime("worker-1", flaky, q.store(),
                    ExecutorRegistry.withBuiltins(SETTINGS), q.settings(), q.clock(), sleeper)) {
                holder.set(worker);

                worker.run();

                List<Long> millis = sleeper.sleeps().stream().map(Duration::toMillis).toList();
                Assertions.assertEquals(List.of(5_000L, 7_500L), millis);
                Assertions.assertEquals(WorkerState.STOPPED, worker.state());
                PollStats stats = worker.stats();
                Assertions.assertEquals(2, stats.pollsTotal());
                Assertions.assertEquals(0, stats.pollsSuccessful());
                Assertions.assertEquals(1, stats.pollsEmpty());
                Assertions.assertEquals(0.0, stats.successRate(), 1e-9);
            }
        }
    }

    @Test
    void pollStatsTrackTheIdleStreak() throws Exception {
        try (TestQueue q = TestQueue.create("worker-poll-stats", SETTINGS);
             WorkerRuntime worker = newWorker(q, ExecutorRegistry.withBuiltins(SETTINGS), new RecordingSleeper())) {
            Assertions.assertEquals(0.0, worker.stats().successRate(), 1e-9);
            worker.runOnce();
            worker.runOnce();
            Assertions.assertEquals(2, worker.stats().consecutiveEmpty());

            enqueue(q, "echo", null, 0);
            worker.runOnce();
            worker.runOnce();

            PollStats stats = worker.stats();
            Assertions.assertEquals("worker-1", stats.workerId());
            Assertions.assertEquals(4, stats.pollsTotal());
            Assertions.assertEquals(1, stats.pollsSuccessful());
            Assertions.assertEquals(3, stats.pollsEmpty());
            Assertions.assertEquals(1, stats.consecutiveEmpty());
            Assertions.assertEquals(0.25, stats.successRate(), 1e-9);
        }
    }

    private static WorkerRuntime newWorker(TestQueue q, ExecutorRegistry registry, RecordingSleeper sleeper) {
        return new WorkerRuntime("worker-1", new FifoClaimStrategy(q.store()), q.store(), registry,
                q.settings(), q.clock(), sleeper);
    }

    private static long enqueue(TestQueue q, String type, String params, int maxRetries) {
        JsonNode parameters = params == null ? null : Jsons.parse(params);
        return q.store().enqueue(TaskStore.EnqueueRequest.of(type, parameters).withMaxRetries(maxRetries)).taskId();
    }

    private static TaskExecutor executor(String type, ThrowingBody body) {
        return new TaskExecutor() {
            @Override
            public String taskType() {
                return type;
            }

            @Override
            public ExecutionResult execute(TaskContext context) throws Exception {
                return body.run(context);
            }
        };
    }

    @FunctionalInterface
    private interface ThrowingBody {
        ExecutionResult run(TaskContext context) throws Exception;
    }
}
