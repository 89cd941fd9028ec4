package io.workqueue.worker;

import io.workqueue.claim.ClaimStrategyType;
import io.workqueue.config.QueueSettings;
import io.workqueue.executor.ExecutorRegistry;
import io.workqueue.storage.TaskStore;
import io.workqueue.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs several {@link WorkerRuntime}s on their own threads against one store.
 */
public final class WorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final List<WorkerRuntime> workers;
    private final int recommendedMaxWorkers;
    private ExecutorService threads;

    public WorkerPool(List<WorkerRuntime> workers, int recommendedMaxWorkers) {
        if (workers == null || workers.isEmpty()) {
            throw new IllegalArgumentException("worker pool needs at least one worker");
        }
        this.workers = List.copyOf(workers);
        this.recommendedMaxWorkers = recommendedMaxWorkers;
    }

    public static WorkerPool create(
            String workerIdPrefix,
            int count,
            ClaimStrategyType strategyType,
            TaskStore store,
            ExecutorRegistry registry,
            Clock clock,
            Sleeper sleeper
    ) {
        QueueSettings settings = store.settings();
        List<WorkerRuntime> workers = new ArrayList<>();
        for (int i = 1; i <= Math.max(1, count); i++) {
            workers.add(new WorkerRuntime(
                    workerIdPrefix + "-" + i,
                    strategyType.create(store, new Random()),
                    store,
                    registry,
                    settings,
                    clock,
                    sleeper
            ));
        }
        return new WorkerPool(workers, settings.recommendedMaxWorkers());
    }

    public List<WorkerRuntime> workers() {
        return workers;
    }

    public synchronized void start() {
        if (threads != null) {
            throw new IllegalStateException("worker pool already started");
        }
        if (workers.size() > recommendedMaxWorkers) {
            log.warn("Starting {} workers against one SQLite store; more than {} concurrent claimers "
                    + "mostly adds lock contention", workers.size(), recommendedMaxWorkers);
        }
        threads = Executors.newFixedThreadPool(workers.size(), r -> {
            Thread t = new Thread(r);
            t.setName("workqueue-worker-" + t.getId());
            return t;
        });
        for (WorkerRuntime worker : workers) {
            threads.submit(worker::run);
        }
        log.info("Worker pool started with {} workers", workers.size());
    }

    public void stop() {
        for (WorkerRuntime worker : workers) {
            worker.stop();
        }
    }

    /**
     * Waits for every worker loop to exit. Returns {@code false} on timeout.
     */
    public synchronized boolean awaitStop(Duration timeout) throws InterruptedException {
        if (threads == null) {
            return true;
        }
        threads.shutdown();
        return threads.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        stop();
        try {
            if (!awaitStop(Duration.ofSeconds(30))) {
                threads.shutdownNow();
            }
        } catch (InterruptedException e) {
            threads.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (WorkerRuntime worker : workers) {
            worker.close();
        }
    }
}
