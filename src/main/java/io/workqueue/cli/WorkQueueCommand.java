package io.workqueue.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.workqueue.WorkQueue;
import io.workqueue.claim.ClaimStrategyType;
import io.workqueue.config.QueueSettings;
import io.workqueue.config.WorkQueueConfig;
import io.workqueue.model.Task;
import io.workqueue.model.TaskStatus;
import io.workqueue.observability.SweepSummary;
import io.workqueue.storage.TaskStore;
import io.workqueue.storage.TaskValidationException;
import io.workqueue.util.Jsons;
import io.workqueue.util.Sleeper;
import io.workqueue.worker.WorkerOutcome;
import io.workqueue.worker.WorkerPool;
import io.workqueue.worker.WorkerRuntime;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Command(
        name = "workqueue",
        mixinStandardHelpOptions = true,
        description = "Persistent SQLite task queue CLI",
        subcommands = {
                WorkQueueCommand.InitCommand.class,
                WorkQueueCommand.EnqueueCommand.class,
                WorkQueueCommand.TaskCommand.class,
                WorkQueueCommand.TasksCommand.class,
                WorkQueueCommand.CancelCommand.class,
                WorkQueueCommand.WorkerCommand.class,
                WorkQueueCommand.SweepCommand.class,
                WorkQueueCommand.StatsCommand.class,
                WorkQueueCommand.WorkersCommand.class,
                WorkQueueCommand.LogsCommand.class,
                WorkQueueCommand.PragmasCommand.class,
                WorkQueueCommand.CheckpointCommand.class,
                WorkQueueCommand.VacuumCommand.class,
                WorkQueueCommand.SchemaMigrationsCommand.class,
                WorkQueueCommand.ExecutorsCommand.class
        }
)
public final class WorkQueueCommand implements Runnable {
    @Option(names = {"--root"}, description = "Queue data root directory", defaultValue = WorkQueueConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | enqueue | task | tasks | cancel | worker | sweep | stats | workers | logs | pragmas | checkpoint | vacuum | schema-migrations | executors");
    }

    WorkQueue queue() {
        return WorkQueue.open(WorkQueueConfig.fromRoot(root)).init();
    }

    @Command(name = "init", description = "Initialize data directory and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        WorkQueueCommand parent;

        @Override
        public Integer call() {
            WorkQueue queue = parent.queue();
            System.out.println("Initialized work queue at: " + queue.config().dbFile());
            return 0;
        }
    }

    @Command(name = "enqueue", description = "Add a task to the queue")
    static final class EnqueueCommand implements Callable<Integer> {
        @ParentCommand
        WorkQueueCommand parent;

        @Option(names = {"--type"}, required = true, description = "Task type (executor key)")
        String taskType;

        @Option(names = {"--params"}, defaultValue = "{}", description = "Task parameters as JSON")
        String params;

        @Option(names = {"--priority"}, description = "Priority 1..10, lower runs first")
        Integer priority;

        @Option(names = {"--max-retries"}, description = "Retry bound")
        Integer maxRetries;

        @Option(names = {"--delay-ms"}, description = "Earliest start, relative to now")
        Long delayMs;

        @Option(names = {"--idempotency-key"}, description = "Optional idempotency key")
        String idempotencyKey;

        @Override
        public Integer call() {
            WorkQueue queue = parent.queue();
            JsonNode parameters;
            try {
                parameters = Jsons.parse(params);
            } catch (IllegalArgumentException e) {
                System.out.println(Jsons.toJson(Map.of("error", e.getMessage())));
                return 2;
            }
            Long runAfter = delayMs == null ? null : queue.clock().millis() + Math.max(0L, delayMs);
            try {
                TaskStore.EnqueueResult result = queue.store().enqueue(new TaskStore.EnqueueRequest(
                        taskType, parameters, priority, runAfter, maxRetries, idempotencyKey));
                System.out.println(Jsons.toJson(result));
                return 0;
            } catch (TaskValidationException e) {
                System.out.println(Jsons.toJson(Map.of("error", e.getMessage())));
                return 2;
            }
        }
    }

    @Command(name = "task", description = "Show one task")
    static final class TaskCommand implements Callable<Integer> {
        @ParentCommand
        WorkQueueCommand parent;

        @Parameters(index = "0", description = "Task id")
        long taskId;

        @Option(names = {"--events"}, defaultValue = "false", description = "Include the task's event log")
        boolean events;

        @Override
        public Integer call() {
            WorkQueue queue = parent.queue();
            Optional<Task> task = queue.store().get(taskId);
            if (task.isEmpty()) {
                System.out.println("{\"error\":\"task not found\"}");
                return 1;
            }
            if (events) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("task", task.get());
                out.put("events", queue.store().eventLog().forTask(taskId));
                System.out.println(Jsons.toJson(out));
            } else {
                System.out.println(Jsons.toJson(task.get()));
            }
            return 0;
        }
    }

    @Command(name = "tasks", description = "List tasks, newest first")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        WorkQueueCommand parent;

        @Option(names = {"--status"}, description = "Filter by status")
        String status;

        @Option(names = {"--type"}, description = "Filter by task type")
        String taskType;

        @Option(names = {"--worker"}, description = "Filter by owning worker")
        String worker;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Page size")
        int limit;

        @Option(names = {"--offset"}, defaultValue = "0", description = "Page offset")
        int offset;

        @Override
        public Integer call() {
            WorkQueue queue = parent.queue();
            TaskStatus statusFilter;
            try {
                statusFilter = status == null || status.isBlank() ? null : TaskStatus.fromString(status);
            } catch (IllegalArgumentException e) {
                System.out.println(Jsons.toJson(Map.of("error", e.getMessage())));
                return 2;
            }
            List<Task> tasks = queue.store().query(new TaskStore.TaskQuery(statusFilter, taskType, worker, limit, offset));
            System.out.println(Jsons.toJson(tasks));
            return 0;
        }
    }

    @Command(name = "cancel", description = "Cancel a queued or running task")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        WorkQueueCommand parent;

        @Parameters(index = "0", description = "Task id")
        long taskId;

        @Option(names = {"--reason"}, description = "Cancellation reason")
        String reason;

        @Override
        public Integer call() {
            WorkQueue queue = parent.queue();
            TaskStore.CancelResult out = queue.store().cancel(taskId, reason);
            System.out.println(Jsons.toJson(out));
            return out.outcome() == TaskStore.CancelOutcome.CANCELLED ? 0 : 1;
        }
    }

    @Command(name = "worker", description = "Run workers, or a single poll with --once")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        WorkQueueCommand parent;

        @Option(names = {"--worker-id"}, defaultValue = "worker-local", description = "Worker identity (prefix when --workers > 1)")
        String workerId;

        @Option(names = {"--strategy"}, defaultValue = "LIFO", description = "FIFO | LIFO | PRIORITY | WEIGHTED_RANDOM")
        String strategy;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run only one poll cycle")
        boolean once;

        @Option(names = {"--drain"}, defaultValue = "false", description = "Process until no task is eligible, then exit")
        boolean drain;

        @Option(names = {"--workers"}, defaultValue = "1", description = "Worker threads in this process")
        int workers;

        @Option(names = {"--no-sweep"}, defaultValue = "false", description = "Do not run the lease sweeper in this process")
        boolean noSweep;

        @Option(names = {"--lease-ms"}, description = "Lease duration override")
        Long leaseMs;

        @Option(names = {"--heartbeat-ms"}, description = "Heartbeat interval override")
        Long heartbeatMs;

        @Option(names = {"--poll-base-ms"}, description = "Idle backoff start override")
        Long pollBaseMs;

        @Option(names = {"--poll-max-ms"}, description = "Idle backoff ceiling override")
        Long pollMaxMs;

        @Override
        public Integer call() throws Exception {
            WorkQueueConfig config = WorkQueueConfig.fromRoot(parent.root);
            QueueSettings settings = QueueSettings.load(config.settingsFile())
                    .withWorkerOverrides(leaseMs, heartbeatMs, pollBaseMs, pollMaxMs);
            WorkQueue queue = new WorkQueue(config, settings, Clock.systemUTC(), Sleeper.system()).init();
            ClaimStrategyType type = ClaimStrategyType.fromString(strategy);

            if (once || drain) {
                if (!noSweep) {
                    System.out.println(Jsons.toJson(queue.sweeper().sweep()));
                }
                try (WorkerRuntime worker = queue.newWorker(workerId, type)) {
                    if (once) {
                        WorkerOutcome result = worker.runOnce();
                        System.out.println(Jsons.toJson(Map.of("outcome", result, "pollStats", worker.stats())));
                    } else {
                        int handled = worker.drain(Integer.MAX_VALUE);
                        System.out.println(Jsons.toJson(Map.of(
                                "workerId", workerId,
                                "handled", handled,
                                "pollStats", worker.stats())));
                    }
                }
                return 0;
            }

            ScheduledExecutorService sweeperThread = null;
            if (!noSweep) {
                sweeperThread = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "workqueue-sweeper");
                    t.setDaemon(true);
                    return t;
                });
                queue.sweeper().start(sweeperThread);
            }
            WorkerPool pool = workers <= 1
                    ? new WorkerPool(List.of(queue.newWorker(workerId, type)), settings.recommendedMaxWorkers())
                    : WorkerPool.create(workerId, workers, type, queue.store(), queue.executors(),
                    queue.clock(), queue.sleeper());
            ScheduledExecutorService sweeperToStop = sweeperThread;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                pool.close();
                if (sweeperToStop != null) {
                    sweeperToStop.shutdownNow();
                }
            }, "workqueue-shutdown-hook"));
            pool.start();
            while (!pool.awaitStop(Duration.ofSeconds(60))) {
                // keep the main thread alive until the pool exits
            }
            return 0;
        }
    }

    @Command(name = "sweep", description = "Mark stale workers and reclaim expired leases once")
    static final class SweepCommand implements Callable<Integer> {
        @ParentCommand
        WorkQueueCommand parent;

        @Override
        public Integer call() {
            SweepSummary summary = parent.queue().sweeper().sweep();
            System.out.println(Jsons.toJson(summary));
            return 0;
        }
    }

    @Command(name = "stats", description = "Queue statistics from the monitoring views")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        WorkQueueCommand parent;

        @Option(names = {"--active-limit"}, defaultValue = "20", description = "Active tasks to include")
        int activeLimit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.queue().stats().snapshot(activeLimit)));
            return 0;
        }
    }

    @Command(name = "workers", description = "Worker heartbeat status")
    static final class WorkersCommand implements Callable<Integer> {
        @ParentCommand
        WorkQueueCommand parent;

        @Option(names = {"--window-ms"}, defaultValue = "180000", description = "Heartbeat window for the active count")
        long windowMs;

        @Override
        public Integer call() {
            WorkQueue queue = parent.queue();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("activeWorkers", queue.stats().activeWorkerCount(Duration.ofMillis(windowMs)));
            out.put("workers", queue.stats().workerStatus());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "logs", description = "Task event log")
    static final class LogsCommand implements Callable<Integer> {
        @ParentCommand
        WorkQueueCommand parent;

        @Option(names = {"--task"}, description = "Only events of this task")
        Long taskId;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Recent events to show")
        int limit;

        @Override
        public Integer call() {
            WorkQueue queue = parent.queue();
            if (taskId != null) {
                System.out.println(Jsons.toJson(queue.store().eventLog().forTask(taskId)));
            } else {
                System.out.println(Jsons.toJson(queue.store().eventLog().recent(limit)));
            }
            return 0;
        }
    }

    @Command(name = "pragmas", description = "Effective SQLite pragmas")
    static final class PragmasCommand implements Callable<Integer> {
        @ParentCommand
        WorkQueueCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.queue().database().pragmaInfo()));
            return 0;
        }
    }

    @Command(name = "checkpoint", description = "Checkpoint and truncate the WAL")
    static final class CheckpointCommand implements Callable<Integer> {
        @ParentCommand
        WorkQueueCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.queue().database().checkpoint()));
            return 0;
        }
    }

    @Command(name = "vacuum", description = "Rebuild the database file")
    static final class VacuumCommand implements Callable<Integer> {
        @ParentCommand
        WorkQueueCommand parent;

        @Override
        public Integer call() {
            WorkQueue queue = parent.queue();
            queue.database().vacuum();
            System.out.println(Jsons.toJson(Map.of("vacuumed", true, "sizeBytes", queue.database().databaseSizeBytes())));
            return 0;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        WorkQueueCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.queue().database().listSchemaMigrations(limit)));
            return 0;
        }
    }

    @Command(name = "executors", description = "List registered task types")
    static final class ExecutorsCommand implements Callable<Integer> {
        @ParentCommand
        WorkQueueCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.queue().executors().taskTypes()));
            return 0;
        }
    }
}
