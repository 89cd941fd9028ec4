package io.workqueue.worker;

import io.workqueue.claim.ClaimStrategy;
import io.workqueue.config.QueueSettings;
import io.workqueue.executor.ExecutionResult;
import io.workqueue.executor.ExecutorRegistry;
import io.workqueue.executor.NonRetryableTaskException;
import io.workqueue.executor.TaskCancelledException;
import io.workqueue.executor.TaskExecutor;
import io.workqueue.model.Lease;
import io.workqueue.model.Task;
import io.workqueue.model.TaskStatus;
import io.workqueue.storage.QueueStoreException;
import io.workqueue.storage.TaskStore;
import io.workqueue.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One sequential worker: claim, execute, report, back off when idle.
 *
 * <p>The executor runs on a dedicated execution thread while the calling thread waits in
 * heartbeat-interval slices, renewing the lease after each slice. A heartbeat that finds the
 * task cancelled or the lease gone stops waiting and interrupts the executor.
 */
public final class WorkerRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerRuntime.class);

    private final String workerId;
    private final ClaimStrategy strategy;
    private final TaskStore store;
    private final ExecutorRegistry registry;
    private final QueueSettings settings;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ExecutorService executionPool;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicLong pollsTotal = new AtomicLong();
    private final AtomicLong pollsSuccessful = new AtomicLong();
    private final AtomicLong pollsEmpty = new AtomicLong();
    private final AtomicLong consecutiveEmpty = new AtomicLong();
    private volatile WorkerState state = WorkerState.IDLE;
    private long lastIdleHeartbeatMs = -1L;

    public WorkerRuntime(
            String workerId,
            ClaimStrategy strategy,
            TaskStore store,
            ExecutorRegistry registry,
            QueueSettings settings,
            Clock clock,
            Sleeper sleeper
    ) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
        this.workerId = workerId;
        this.strategy = strategy;
        this.store = store;
        this.registry = registry;
        this.settings = settings;
        this.clock = clock;
        this.sleeper = sleeper;
        this.executionPool = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "workqueue-exec-" + workerId);
            t.setDaemon(true);
            return t;
        });
    }

    public String workerId() {
        return workerId;
    }

    public WorkerState state() {
        return state;
    }

    public String strategyName() {
        return strategy.name();
    }

    public PollStats stats() {
        return PollStats.of(
                workerId,
                running.get(),
                pollsTotal.get(),
                pollsSuccessful.get(),
                pollsEmpty.get(),
                consecutiveEmpty.get()
        );
    }

    /**
     * Polls until {@link #stop()} is called or the thread is interrupted. An idle poll sleeps
     * for the current backoff delay; a claim resets it. A poll that throws is logged and
     * counts as idle, so a bad row or a store outage never ends the loop.
     */
    public void run() {
        running.set(true);
        store.workerHeartbeat(workerId, strategy.name());
        lastIdleHeartbeatMs = clock.millis();
        log.info("Worker {} started with strategy {}", workerId, strategy.name());
        PollBackoff backoff = PollBackoff.fromSettings(settings);
        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                WorkerOutcome outcome;
                try {
                    outcome = runOnce();
                } catch (RuntimeException e) {
                    log.error("Worker {} poll failed", workerId, e);
                    outcome = WorkerOutcome.idle();
                }
                if (outcome.claimed()) {
                    backoff = backoff.reset();
                    continue;
                }
                if (!running.get()) {
                    break;
                }
                state = WorkerState.BACKOFF;
                log.debug("Worker {} idle, sleeping {} ms", workerId, backoff.delay().toMillis());
                try {
                    sleeper.sleep(backoff.delay());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                backoff = backoff.next();
            }
        } finally {
            running.set(false);
            markStopped();
        }
    }

    /**
     * Runs poll cycles until one finds nothing to claim or {@code maxTasks} tasks were handled.
     */
    public int drain(int maxTasks) {
        int handled = 0;
        while (handled < maxTasks) {
            WorkerOutcome outcome = runOnce();
            if (!outcome.claimed()) {
                break;
            }
            handled++;
        }
        return handled;
    }

    public WorkerOutcome runOnce() {
        state = WorkerState.CLAIMING;
        pollsTotal.incrementAndGet();
        Optional<Task> claimed;
        try {
            claimed = strategy.claim(workerId, settings.leaseTimeout());
        } catch (RuntimeException e) {
            state = WorkerState.IDLE;
            throw e;
        }
        if (claimed.isEmpty()) {
            pollsEmpty.incrementAndGet();
            consecutiveEmpty.incrementAndGet();
            refreshIdleHeartbeat();
            state = WorkerState.IDLE;
            return WorkerOutcome.idle();
        }
        pollsSuccessful.incrementAndGet();
        consecutiveEmpty.set(0);
        Task task = claimed.get();
        try {
            return process(task, task.lease());
        } finally {
            state = WorkerState.IDLE;
        }
    }

    public void stop() {
        running.set(false);
    }

    @Override
    public void close() {
        stop();
        executionPool.shutdown();
        try {
            if (!executionPool.awaitTermination(settings.heartbeatIntervalMs(), TimeUnit.MILLISECONDS)) {
                executionPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            executionPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        markStopped();
    }

    private WorkerOutcome process(Task task, Lease lease) {
        if (!store.markRunning(lease)) {
            return lostOrCancelled(task, "Task could not be started");
        }
        TaskExecutor executor = registry.find(task.taskType()).orElse(null);
        if (executor == null) {
            state = WorkerState.REPORTING;
            return reportFailure(task, lease, "No executor registered for task type: " + task.taskType(), false);
        }

        state = WorkerState.EXECUTING;
        WorkerTaskContext context = new WorkerTaskContext(task, lease, store);
        Future<ExecutionResult> future = executionPool.submit(() -> executor.execute(context));
        ExecutionResult result;
        try {
            result = awaitWithHeartbeats(future, context, lease);
        } catch (ExecutionException e) {
            state = WorkerState.REPORTING;
            return reportThrown(task, lease, e.getCause() == null ? e : e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            state = WorkerState.REPORTING;
            return reportFailure(task, lease, "Worker interrupted during execution", true);
        }

        state = WorkerState.REPORTING;
        if (result == null) {
            return aborted(task, context.abortReason());
        }
        if (result.success()) {
            if (store.complete(lease, result.result())) {
                log.debug("Worker {} completed task {}", workerId, task.id());
                return WorkerOutcome.of(task.id(), WorkerOutcome.Kind.COMPLETED, "Task completed");
            }
            return lostOrCancelled(task, "Completion rejected");
        }
        String error = result.error() == null ? "executor reported failure" : result.error();
        return reportFailure(task, lease, error, result.retryable());
    }

    /**
     * Returns the executor's result, or {@code null} when a heartbeat aborted the execution.
     */
    private ExecutionResult awaitWithHeartbeats(Future<ExecutionResult> future, WorkerTaskContext context, Lease lease)
            throws ExecutionException, InterruptedException {
        while (true) {
            try {
                return future.get(settings.heartbeatIntervalMs(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                TaskStore.HeartbeatResult heartbeat = store.heartbeat(lease, settings.leaseTimeout());
                if (heartbeat == TaskStore.HeartbeatResult.RENEWED) {
                    continue;
                }
                TaskCancelledException.Reason reason = heartbeat == TaskStore.HeartbeatResult.CANCELLED
                        ? TaskCancelledException.Reason.CANCELLED
                        : TaskCancelledException.Reason.LEASE_LOST;
                context.abort(reason);
                future.cancel(true);
                return null;
            }
        }
    }

    private WorkerOutcome reportThrown(Task task, Lease lease, Throwable cause) {
        if (cause instanceof TaskCancelledException) {
            return aborted(task, ((TaskCancelledException) cause).reason());
        }
        String message = cause.getMessage() == null
                ? cause.getClass().getSimpleName()
                : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        boolean retryable = !(cause instanceof NonRetryableTaskException);
        if (retryable) {
            log.debug("Task {} threw, will retry if allowed", task.id(), cause);
        }
        return reportFailure(task, lease, message, retryable);
    }

    private WorkerOutcome reportFailure(Task task, Lease lease, String error, boolean retryable) {
        TaskStore.FailureResolution resolution = store.fail(lease, error, retryable);
        return switch (resolution.outcome()) {
            case REQUEUED -> WorkerOutcome.of(task.id(), WorkerOutcome.Kind.REQUEUED,
                    "Requeued, retry " + resolution.retryCount() + "/" + task.maxRetries() + ": " + error);
            case DEAD_LETTERED -> {
                log.warn("Task {} ({}) dead-lettered: {}", task.id(), task.taskType(), error);
                yield WorkerOutcome.of(task.id(), WorkerOutcome.Kind.DEAD_LETTERED, error);
            }
            case STALE_LEASE -> lostOrCancelled(task, "Failure report rejected");
        };
    }

    private WorkerOutcome lostOrCancelled(Task task, String context) {
        TaskStatus current = store.get(task.id()).map(Task::status).orElse(null);
        if (current == TaskStatus.CANCELLED) {
            return aborted(task, TaskCancelledException.Reason.CANCELLED);
        }
        log.warn("Worker {} lost lease on task {}: {}", workerId, task.id(), context);
        return WorkerOutcome.of(task.id(), WorkerOutcome.Kind.LEASE_LOST, context + ": lease lost");
    }

    private WorkerOutcome aborted(Task task, TaskCancelledException.Reason reason) {
        if (reason == TaskCancelledException.Reason.LEASE_LOST) {
            log.warn("Worker {} lost lease on task {} during execution", workerId, task.id());
            return WorkerOutcome.of(task.id(), WorkerOutcome.Kind.LEASE_LOST, "Lease lost during execution");
        }
        log.info("Worker {} stopped cancelled task {}", workerId, task.id());
        return WorkerOutcome.of(task.id(), WorkerOutcome.Kind.CANCELLED, "Task cancelled");
    }

    private void refreshIdleHeartbeat() {
        long now = clock.millis();
        if (lastIdleHeartbeatMs >= 0 && now - lastIdleHeartbeatMs < settings.heartbeatIntervalMs()) {
            return;
        }
        store.workerHeartbeat(workerId, strategy.name());
        lastIdleHeartbeatMs = now;
    }

    private void markStopped() {
        state = WorkerState.STOPPED;
        if (stopped.compareAndSet(false, true)) {
            try {
                store.markWorkerStopped(workerId);
            } catch (QueueStoreException e) {
                log.warn("Worker {} could not record stop", workerId, e);
            }
            PollStats stats = stats();
            log.info("Worker {} stopped: polls={}, successful={}, empty={}, successRate={}",
                    workerId, stats.pollsTotal(), stats.pollsSuccessful(), stats.pollsEmpty(),
                    String.format("%.2f", stats.successRate()));
        }
    }
}
