package io.workqueue;

import io.workqueue.claim.ClaimStrategyType;
import io.workqueue.config.QueueSettings;
import io.workqueue.config.WorkQueueConfig;
import io.workqueue.executor.ExecutorRegistry;
import io.workqueue.observability.LeaseSweeper;
import io.workqueue.observability.QueueStats;
import io.workqueue.storage.Database;
import io.workqueue.storage.TaskStore;
import io.workqueue.util.Sleeper;
import io.workqueue.worker.WorkerRuntime;

import java.time.Clock;
import java.util.Random;

/**
 * Wires one queue file: settings, database, store, executors, stats and sweeper.
 */
public final class WorkQueue {
    private final WorkQueueConfig config;
    private final QueueSettings settings;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Database database;
    private final TaskStore store;
    private final ExecutorRegistry executors;
    private final QueueStats stats;
    private final LeaseSweeper sweeper;

    public WorkQueue(WorkQueueConfig config, QueueSettings settings, Clock clock, Sleeper sleeper) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.sleeper = sleeper;
        this.database = new Database(config, settings, sleeper);
        this.store = new TaskStore(database, settings, clock);
        this.executors = ExecutorRegistry.withBuiltins(settings);
        this.stats = new QueueStats(database, clock);
        this.sweeper = new LeaseSweeper(store, settings, clock);
    }

    /**
     * Opens the queue under {@code config}, reading its settings file when present.
     */
    public static WorkQueue open(WorkQueueConfig config) {
        return new WorkQueue(config, QueueSettings.load(config.settingsFile()), Clock.systemUTC(), Sleeper.system());
    }

    public WorkQueue init() {
        database.init();
        return this;
    }

    public WorkerRuntime newWorker(String workerId, ClaimStrategyType strategyType) {
        return new WorkerRuntime(
                workerId,
                strategyType.create(store, new Random()),
                store,
                executors,
                settings,
                clock,
                sleeper
        );
    }

    public WorkQueueConfig config() {
        return config;
    }

    public QueueSettings settings() {
        return settings;
    }

    public Clock clock() {
        return clock;
    }

    public Sleeper sleeper() {
        return sleeper;
    }

    public Database database() {
        return database;
    }

    public TaskStore store() {
        return store;
    }

    public ExecutorRegistry executors() {
        return executors;
    }

    public QueueStats stats() {
        return stats;
    }

    public LeaseSweeper sweeper() {
        return sweeper;
    }
}
