package io.workqueue.observability;

import io.workqueue.model.TaskStatus;
import io.workqueue.storage.Database;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only monitoring queries over the {@code v_*} views.
 */
public final class QueueStats {
    private final Database database;
    private final Clock clock;

    public QueueStats(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    public List<TaskTypeStats> taskStats() {
        return database.withConnection("task stats", c -> {
            List<TaskTypeStats> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT task_type,status,task_count,avg_retries,oldest_created_at,newest_created_at
                    FROM v_task_stats ORDER BY task_type, status
                    """);
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new TaskTypeStats(
                            rs.getString("task_type"),
                            rs.getString("status"),
                            rs.getLong("task_count"),
                            rs.getDouble("avg_retries"),
                            rs.getLong("oldest_created_at"),
                            rs.getLong("newest_created_at")
                    ));
                }
            }
            return out;
        });
    }

    public List<ActiveTask> activeTasks(int limit) {
        int safeLimit = Math.max(1, limit);
        return database.withConnection("active tasks", c -> {
            List<ActiveTask> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT id,task_type,priority,status,claimed_by,retry_count,max_retries,lease_until,age_ms
                    FROM v_active_tasks ORDER BY priority ASC, created_at ASC, id ASC LIMIT ?
                    """)) {
                ps.setInt(1, safeLimit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        long leaseUntil = rs.getLong("lease_until");
                        Long lease = rs.wasNull() ? null : leaseUntil;
                        out.add(new ActiveTask(
                                rs.getLong("id"),
                                rs.getString("task_type"),
                                rs.getInt("priority"),
                                rs.getString("status"),
                                rs.getString("claimed_by"),
                                rs.getInt("retry_count"),
                                rs.getInt("max_retries"),
                                lease,
                                rs.getLong("age_ms")
                        ));
                    }
                }
            }
            return out;
        });
    }

    public List<WorkerStatusRow> workerStatus() {
        return database.withConnection("worker status", c -> {
            List<WorkerStatusRow> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT worker_id,worker_status,strategy,last_heartbeat,tasks_processed,tasks_failed,
                           current_task_id,current_task_type,current_task_status
                    FROM v_worker_status ORDER BY worker_id
                    """);
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long current = rs.getLong("current_task_id");
                    Long currentTaskId = rs.wasNull() ? null : current;
                    out.add(new WorkerStatusRow(
                            rs.getString("worker_id"),
                            rs.getString("worker_status"),
                            rs.getString("strategy"),
                            rs.getLong("last_heartbeat"),
                            rs.getInt("tasks_processed"),
                            rs.getInt("tasks_failed"),
                            currentTaskId,
                            rs.getString("current_task_type"),
                            rs.getString("current_task_status")
                    ));
                }
            }
            return out;
        });
    }

    /**
     * Task count per status, including statuses with no rows.
     */
    public Map<String, Long> statusCounts() {
        return database.withConnection("status counts", c -> {
            Map<String, Long> out = new LinkedHashMap<>();
            for (TaskStatus status : TaskStatus.values()) {
                out.put(status.dbValue(), 0L);
            }
            try (PreparedStatement ps = c.prepareStatement("SELECT status, COUNT(*) FROM task_queue GROUP BY status");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(rs.getString(1), rs.getLong(2));
                }
            }
            return out;
        });
    }

    /**
     * Workers with status {@code active} that heartbeated within {@code window}.
     */
    public int activeWorkerCount(Duration window) {
        long cutoff = clock.millis() - window.toMillis();
        return database.withConnection("active worker count", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT COUNT(*) FROM worker_heartbeats WHERE status='active' AND last_heartbeat>=?")) {
                ps.setLong(1, cutoff);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    public long databaseSizeBytes() {
        return database.databaseSizeBytes();
    }

    public Snapshot snapshot(int activeLimit) {
        return new Snapshot(
                statusCounts(),
                taskStats(),
                activeTasks(activeLimit),
                workerStatus(),
                databaseSizeBytes()
        );
    }

    public record TaskTypeStats(
            String taskType,
            String status,
            long count,
            double avgRetries,
            long oldestCreatedAtMs,
            long newestCreatedAtMs
    ) {
    }

    public record ActiveTask(
            long id,
            String taskType,
            int priority,
            String status,
            String claimedBy,
            int retryCount,
            int maxRetries,
            Long leaseUntilMs,
            long ageMs
    ) {
    }

    public record WorkerStatusRow(
            String workerId,
            String status,
            String strategy,
            long lastHeartbeatMs,
            int tasksProcessed,
            int tasksFailed,
            Long currentTaskId,
            String currentTaskType,
            String currentTaskStatus
    ) {
    }

    public record Snapshot(
            Map<String, Long> statusCounts,
            List<TaskTypeStats> taskStats,
            List<ActiveTask> activeTasks,
            List<WorkerStatusRow> workers,
            long databaseSizeBytes
    ) {
    }
}
