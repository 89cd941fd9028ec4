package io.workqueue.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.workqueue.config.QueueSettings;
import io.workqueue.model.Lease;
import io.workqueue.model.Task;
import io.workqueue.model.TaskEventType;
import io.workqueue.model.TaskStatus;
import io.workqueue.model.WorkerHeartbeat;
import io.workqueue.observability.TaskEventLog;
import io.workqueue.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Sole writer of {@code task_queue}, {@code worker_heartbeats} and {@code task_logs}.
 *
 * <p>Each public mutation is one {@code BEGIN IMMEDIATE} transaction that also appends the
 * matching event. Writes made on behalf of a worker are fenced by its {@link Lease}: owner,
 * lease token, an owned status and an unexpired {@code lease_until} must all still hold.
 */
public final class TaskStore {
    private static final Logger log = LoggerFactory.getLogger(TaskStore.class);

    private static final String TASK_COLUMNS = """
            SELECT id,task_type,parameters,priority,run_after,status,claimed_by,claimed_at,lease_until,
                   lease_token,retry_count,max_retries,idempotency_key,result_data,error_message,
                   created_at,updated_at,completed_at
            FROM task_queue
            """;
    private static final String OWNED_STATUSES = "('claimed','running')";

    private final Database database;
    private final QueueSettings settings;
    private final Clock clock;
    private final TaskEventLog eventLog;

    public TaskStore(Database database, QueueSettings settings, Clock clock) {
        this.database = database;
        this.settings = settings;
        this.clock = clock;
        this.eventLog = new TaskEventLog(database);
    }

    public Database database() {
        return database;
    }

    public QueueSettings settings() {
        return settings;
    }

    public Clock clock() {
        return clock;
    }

    public TaskEventLog eventLog() {
        return eventLog;
    }

    public EnqueueResult enqueue(EnqueueRequest request) {
        if (request == null || request.taskType() == null || request.taskType().isBlank()) {
            throw new TaskValidationException("taskType must not be blank");
        }
        int priority = request.priority() == null ? settings.defaultPriority() : request.priority();
        if (priority < settings.minPriority() || priority > settings.maxPriority()) {
            throw new TaskValidationException("priority must be between " + settings.minPriority()
                    + " and " + settings.maxPriority() + ", got " + priority);
        }
        int maxRetries = request.maxRetries() == null ? settings.defaultMaxRetries() : request.maxRetries();
        if (maxRetries < 0) {
            throw new TaskValidationException("maxRetries must be >= 0, got " + maxRetries);
        }
        JsonNode parameters = request.parameters() == null || request.parameters().isNull()
                ? Jsons.mapper().createObjectNode()
                : request.parameters();
        String idempotencyKey = request.idempotencyKey() == null || request.idempotencyKey().isBlank()
                ? null
                : request.idempotencyKey().trim();
        String taskType = request.taskType().trim();

        EnqueueResult result = database.inTransaction("enqueue task", c -> {
            long now = clock.millis();
            if (idempotencyKey != null) {
                try (PreparedStatement ps = c.prepareStatement("SELECT id FROM task_queue WHERE idempotency_key=?")) {
                    ps.setString(1, idempotencyKey);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (rs.next()) {
                            return new EnqueueResult(rs.getLong(1), true);
                        }
                    }
                }
            }
            long runAfter = request.runAfterMs() == null ? now : request.runAfterMs();
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO task_queue(task_type,parameters,priority,run_after,status,retry_count,max_retries,
                                           idempotency_key,created_at,updated_at)
                    VALUES(?,?,?,?,'queued',0,?,?,?,?)
                    """)) {
                ps.setString(1, taskType);
                ps.setString(2, Jsons.toCompactJson(parameters));
                ps.setInt(3, priority);
                ps.setLong(4, runAfter);
                ps.setInt(5, maxRetries);
                ps.setString(6, idempotencyKey);
                ps.setLong(7, now);
                ps.setLong(8, now);
                ps.executeUpdate();
            }
            long id = lastInsertId(c);
            ObjectNode details = Jsons.mapper().createObjectNode();
            details.put("priority", priority);
            details.put("runAfter", runAfter);
            details.put("maxRetries", maxRetries);
            eventLog.append(c, id, null, TaskEventType.CREATED, "Task created: " + taskType, details, now);
            return new EnqueueResult(id, false);
        });
        if (result.deduplicated()) {
            log.debug("Enqueue deduplicated by idempotency key {} -> task {}", idempotencyKey, result.taskId());
        } else {
            log.debug("Enqueued task {} type={} priority={}", result.taskId(), taskType, priority);
        }
        return result;
    }

    public Optional<Task> get(long taskId) {
        return database.withConnection("get task", c -> readTask(c, taskId));
    }

    /**
     * Compare-and-swap status change. Only succeeds while the row is still in {@code expected}
     * (and holds {@link StatusUpdate#expectedLeaseToken()} when one is given). A terminal
     * {@code expected} is refused outright.
     */
    public boolean updateStatus(long taskId, TaskStatus expected, TaskStatus next, StatusUpdate update) {
        if (expected.terminal()) {
            return false;
        }
        StatusUpdate u = update == null ? StatusUpdate.none() : update;
        if (next.owned() && !expected.owned() && (u.workerId() == null || u.workerId().isBlank())) {
            throw new IllegalArgumentException("workerId is required to move a task into " + next.dbValue());
        }
        return database.inTransaction("update task status", c -> {
            long now = clock.millis();
            StringBuilder sql = new StringBuilder("UPDATE task_queue SET status=?, updated_at=?");
            if (next.owned() && !expected.owned()) {
                sql.append(", claimed_by=?, claimed_at=?, lease_until=?, lease_token=?");
            } else if (!next.owned()) {
                sql.append(", claimed_by=NULL, claimed_at=NULL, lease_until=NULL, lease_token=NULL");
            }
            if (next.terminal()) {
                sql.append(", completed_at=?");
            }
            if (u.result() != null) {
                sql.append(", result_data=?");
            }
            if (u.errorMessage() != null) {
                sql.append(", error_message=?");
            }
            sql.append(" WHERE id=? AND status=?");
            if (u.expectedLeaseToken() != null) {
                sql.append(" AND lease_token=?");
            }
            String owner = null;
            try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                int i = 1;
                ps.setString(i++, next.dbValue());
                ps.setLong(i++, now);
                if (next.owned() && !expected.owned()) {
                    owner = u.workerId();
                    ps.setString(i++, owner);
                    ps.setLong(i++, now);
                    ps.setLong(i++, now + settings.leaseTimeoutMs());
                    ps.setString(i++, UUID.randomUUID().toString());
                }
                if (next.terminal()) {
                    ps.setLong(i++, now);
                }
                if (u.result() != null) {
                    ps.setString(i++, Jsons.toCompactJson(u.result()));
                }
                if (u.errorMessage() != null) {
                    ps.setString(i++, u.errorMessage());
                }
                ps.setLong(i++, taskId);
                ps.setString(i++, expected.dbValue());
                if (u.expectedLeaseToken() != null) {
                    ps.setString(i, u.expectedLeaseToken());
                }
                if (ps.executeUpdate() == 0) {
                    return false;
                }
            }
            eventLog.append(c, taskId, owner == null ? u.workerId() : owner, eventFor(expected, next),
                    "Status " + expected.dbValue() + " -> " + next.dbValue(), null, now);
            return true;
        });
    }

    public List<Task> query(TaskQuery query) {
        TaskQuery q = query == null ? TaskQuery.all(50) : query;
        StringBuilder sql = new StringBuilder(TASK_COLUMNS).append(" WHERE 1=1");
        List<Object> args = new ArrayList<>();
        if (q.status() != null) {
            sql.append(" AND status=?");
            args.add(q.status().dbValue());
        }
        if (q.taskType() != null && !q.taskType().isBlank()) {
            sql.append(" AND task_type=?");
            args.add(q.taskType());
        }
        if (q.claimedBy() != null && !q.claimedBy().isBlank()) {
            sql.append(" AND claimed_by=?");
            args.add(q.claimedBy());
        }
        sql.append(" ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?");
        args.add(Math.max(1, q.limit()));
        args.add(Math.max(0, q.offset()));
        return database.withConnection("query tasks", c -> {
            List<Task> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                for (int i = 0; i < args.size(); i++) {
                    ps.setObject(i + 1, args.get(i));
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(mapTask(rs));
                    }
                }
            }
            return out;
        });
    }

    /**
     * Claims the candidate picked by {@code selector}. Selection, the guarded update, the
     * worker heartbeat upsert and the {@code claimed} event share one transaction, so two
     * workers can never both see their update succeed on the same row.
     */
    public Optional<Task> claim(String workerId, String strategyName, CandidateSelector selector, Duration lease) {
        requireWorkerId(workerId);
        long leaseMs = Math.max(1L, lease.toMillis());
        Optional<Task> claimed = database.inTransaction("claim task", c -> {
            long now = clock.millis();
            Long candidate = selector.select(c, now);
            if (candidate == null) {
                return Optional.<Task>empty();
            }
            String token = UUID.randomUUID().toString();
            long leaseUntil = now + leaseMs;
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE task_queue
                    SET status='claimed', claimed_by=?, claimed_at=?, lease_until=?, lease_token=?, updated_at=?
                    WHERE id=? AND status='queued' AND run_after<=?
                    """)) {
                ps.setString(1, workerId);
                ps.setLong(2, now);
                ps.setLong(3, leaseUntil);
                ps.setString(4, token);
                ps.setLong(5, now);
                ps.setLong(6, candidate);
                ps.setLong(7, now);
                if (ps.executeUpdate() == 0) {
                    return Optional.<Task>empty();
                }
            }
            upsertWorker(c, workerId, strategyName, candidate, now);
            ObjectNode details = Jsons.mapper().createObjectNode();
            details.put("strategy", strategyName);
            details.put("leaseUntil", leaseUntil);
            eventLog.append(c, candidate, workerId, TaskEventType.CLAIMED,
                    "Claimed by " + workerId + " using " + strategyName, details, now);
            return readTask(c, candidate);
        });
        claimed.ifPresent(t -> log.debug("Worker {} claimed task {} ({}, priority {})",
                workerId, t.id(), t.taskType(), t.priority()));
        return claimed;
    }

    public boolean markRunning(Lease lease) {
        return database.inTransaction("mark task running", c -> {
            long now = clock.millis();
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE task_queue SET status='running', updated_at=?
                    WHERE id=? AND status='claimed' AND claimed_by=? AND lease_token=? AND lease_until>=?
                    """)) {
                ps.setLong(1, now);
                ps.setLong(2, lease.taskId());
                ps.setString(3, lease.workerId());
                ps.setString(4, lease.token());
                ps.setLong(5, now);
                if (ps.executeUpdate() == 0) {
                    return false;
                }
            }
            eventLog.append(c, lease.taskId(), lease.workerId(), TaskEventType.STARTED,
                    "Execution started", null, now);
            return true;
        });
    }

    /**
     * Extends the lease by {@code extension} from now and refreshes the owner's heartbeat row.
     */
    public HeartbeatResult heartbeat(Lease lease, Duration extension) {
        return database.inTransaction("heartbeat lease", c -> {
            long now = clock.millis();
            Optional<LeaseRow> row = readLeaseRow(c, lease.taskId());
            if (row.isEmpty()) {
                return HeartbeatResult.LEASE_LOST;
            }
            if (row.get().status() == TaskStatus.CANCELLED) {
                return HeartbeatResult.CANCELLED;
            }
            if (!row.get().heldBy(lease, now)) {
                return HeartbeatResult.LEASE_LOST;
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE task_queue SET lease_until=?, updated_at=? WHERE id=? AND lease_token=?")) {
                ps.setLong(1, now + Math.max(1L, extension.toMillis()));
                ps.setLong(2, now);
                ps.setLong(3, lease.taskId());
                ps.setString(4, lease.token());
                ps.executeUpdate();
            }
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE worker_heartbeats
                    SET last_heartbeat=?, current_task_id=?, status='active', updated_at=?
                    WHERE worker_id=?
                    """)) {
                ps.setLong(1, now);
                ps.setLong(2, lease.taskId());
                ps.setLong(3, now);
                ps.setString(4, lease.workerId());
                ps.executeUpdate();
            }
            return HeartbeatResult.RENEWED;
        });
    }

    /**
     * Registers the worker, or refreshes its row while it has no task.
     */
    public void workerHeartbeat(String workerId, String strategyName) {
        requireWorkerId(workerId);
        database.inTransaction("worker heartbeat", c -> {
            upsertWorker(c, workerId, strategyName, null, clock.millis());
            return null;
        });
    }

    public void markWorkerStopped(String workerId) {
        database.inTransaction("stop worker", c -> {
            long now = clock.millis();
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE worker_heartbeats SET status='stopped', current_task_id=NULL, updated_at=?
                    WHERE worker_id=?
                    """)) {
                ps.setLong(1, now);
                ps.setString(2, workerId);
                ps.executeUpdate();
            }
            return null;
        });
    }

    /**
     * Completes the task if the lease still holds. Returns {@code false} (and changes nothing)
     * when the lease was lost, so a late or duplicate completion is harmless.
     */
    public boolean complete(Lease lease, JsonNode result) {
        return database.inTransaction("complete task", c -> {
            long now = clock.millis();
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE task_queue
                    SET status='completed', result_data=?, error_message=NULL, completed_at=?, updated_at=?,
                        claimed_by=NULL, claimed_at=NULL, lease_until=NULL, lease_token=NULL
                    WHERE id=? AND status IN %s AND claimed_by=? AND lease_token=? AND lease_until>=?
                    """.formatted(OWNED_STATUSES))) {
                ps.setString(1, result == null || result.isNull() ? null : Jsons.toCompactJson(result));
                ps.setLong(2, now);
                ps.setLong(3, now);
                ps.setLong(4, lease.taskId());
                ps.setString(5, lease.workerId());
                ps.setString(6, lease.token());
                ps.setLong(7, now);
                if (ps.executeUpdate() == 0) {
                    return false;
                }
            }
            releaseWorker(c, lease.workerId(), lease.taskId(), true, now);
            eventLog.append(c, lease.taskId(), lease.workerId(), TaskEventType.COMPLETED,
                    "Task completed", null, now);
            return true;
        });
    }

    /**
     * Reports a failed execution. Retryable failures with retries left go back to
     * {@code queued}; everything else is dead-lettered as {@code failed}.
     */
    public FailureResolution fail(Lease lease, String error, boolean retryable) {
        String message = error == null || error.isBlank() ? "unknown error" : error;
        return database.inTransaction("fail task", c -> {
            long now = clock.millis();
            Optional<LeaseRow> row = readLeaseRow(c, lease.taskId());
            if (row.isEmpty() || !row.get().heldBy(lease, now)) {
                return FailureResolution.staleLease();
            }
            int retryCount = row.get().retryCount();
            int maxRetries = row.get().maxRetries();
            FailureResolution resolution;
            if (retryable && retryCount < maxRetries) {
                int attempt = retryCount + 1;
                long runAfter = now + retryDelayMs(attempt);
                requeue(c, lease.taskId(), lease.token(), attempt, runAfter, message, now);
                ObjectNode details = Jsons.mapper().createObjectNode();
                details.put("retryCount", attempt);
                details.put("maxRetries", maxRetries);
                details.put("runAfter", runAfter);
                eventLog.append(c, lease.taskId(), lease.workerId(), TaskEventType.RETRY,
                        "Retry " + attempt + "/" + maxRetries + ": " + message, details, now);
                resolution = FailureResolution.requeued(attempt, runAfter);
            } else {
                deadLetter(c, lease.taskId(), lease.token(), message, now);
                eventLog.append(c, lease.taskId(), lease.workerId(), TaskEventType.FAILED,
                        (retryable ? "Retries exhausted: " : "Fatal: ") + message, null, now);
                resolution = FailureResolution.deadLettered(retryCount);
            }
            releaseWorker(c, lease.workerId(), lease.taskId(), false, now);
            return resolution;
        });
    }

    public CancelResult cancel(long taskId, String reason) {
        String message = reason == null || reason.isBlank() ? "cancelled" : reason;
        CancelResult result = database.inTransaction("cancel task", c -> {
            long now = clock.millis();
            Optional<LeaseRow> row = readLeaseRow(c, taskId);
            if (row.isEmpty()) {
                return CancelResult.notFound(taskId);
            }
            TaskStatus previous = row.get().status();
            if (previous.terminal()) {
                return CancelResult.alreadyTerminal(taskId, previous);
            }
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE task_queue
                    SET status='cancelled', error_message=?, completed_at=?, updated_at=?,
                        claimed_by=NULL, claimed_at=NULL, lease_until=NULL, lease_token=NULL
                    WHERE id=? AND status=?
                    """)) {
                ps.setString(1, message);
                ps.setLong(2, now);
                ps.setLong(3, now);
                ps.setLong(4, taskId);
                ps.setString(5, previous.dbValue());
                ps.executeUpdate();
            }
            if (row.get().claimedBy() != null) {
                clearCurrentTask(c, row.get().claimedBy(), taskId, now);
            }
            eventLog.append(c, taskId, row.get().claimedBy(), TaskEventType.CANCELLED, message, null, now);
            return CancelResult.cancelled(taskId, previous);
        });
        if (result.outcome() == CancelOutcome.CANCELLED) {
            log.info("Task {} cancelled from {}: {}", taskId, result.previousStatus().dbValue(), message);
        }
        return result;
    }

    public boolean logProgress(Lease lease, String message, JsonNode details) {
        return database.inTransaction("log progress", c -> {
            long now = clock.millis();
            Optional<LeaseRow> row = readLeaseRow(c, lease.taskId());
            if (row.isEmpty() || !row.get().heldBy(lease, now)) {
                return false;
            }
            eventLog.append(c, lease.taskId(), lease.workerId(), TaskEventType.PROGRESS, message, details, now);
            return true;
        });
    }

    /**
     * Flags active workers whose last heartbeat is older than {@code cutoffMs}.
     */
    public List<String> markStaleWorkers(long cutoffMs) {
        return database.inTransaction("mark stale workers", c -> {
            long now = clock.millis();
            List<String> stale = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT worker_id FROM worker_heartbeats WHERE status='active' AND last_heartbeat<? ORDER BY worker_id")) {
                ps.setLong(1, cutoffMs);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        stale.add(rs.getString(1));
                    }
                }
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE worker_heartbeats SET status='stale', updated_at=? WHERE worker_id=? AND status='active'")) {
                for (String workerId : stale) {
                    ps.setLong(1, now);
                    ps.setString(2, workerId);
                    ps.executeUpdate();
                }
            }
            return stale;
        });
    }

    public List<Lease> expiredLeases(long nowMs, int limit) {
        return database.withConnection("list expired leases", c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT id,claimed_by,lease_token,lease_until FROM task_queue
                    WHERE status IN %s AND lease_until<?
                    ORDER BY lease_until ASC, id ASC LIMIT ?
                    """.formatted(OWNED_STATUSES))) {
                ps.setLong(1, nowMs);
                ps.setInt(2, Math.max(1, limit));
                return readLeases(ps);
            }
        });
    }

    /**
     * Leases still held by workers that are flagged stale or stopped.
     */
    public List<Lease> leasesOfInactiveWorkers(int limit) {
        return database.withConnection("list leases of inactive workers", c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT t.id,t.claimed_by,t.lease_token,t.lease_until
                    FROM task_queue t
                    JOIN worker_heartbeats w ON w.worker_id=t.claimed_by
                    WHERE t.status IN %s AND w.status IN ('stale','stopped')
                    ORDER BY t.id ASC LIMIT ?
                    """.formatted(OWNED_STATUSES))) {
                ps.setInt(1, Math.max(1, limit));
                return readLeases(ps);
            }
        });
    }

    /**
     * Takes a task away from its owner. Guarded by the lease token, so a task that was
     * completed or re-claimed since {@code lease} was read is left alone. The {@code cause} is
     * checked again inside the transaction: a lease renewed in the meantime, or an owner that
     * heartbeated back to active, also means the task is skipped.
     */
    public ReclaimOutcome reclaim(Lease lease, ReclaimCause cause, String reason) {
        return database.inTransaction("reclaim task", c -> {
            long now = clock.millis();
            Optional<LeaseRow> row = readLeaseRow(c, lease.taskId());
            if (row.isEmpty()
                    || !row.get().status().owned()
                    || !lease.token().equals(row.get().leaseToken())
                    || !lease.workerId().equals(row.get().claimedBy())) {
                return ReclaimOutcome.SKIPPED;
            }
            boolean stillReclaimable = switch (cause) {
                case LEASE_EXPIRED -> row.get().leaseUntilMs() == null || row.get().leaseUntilMs() < now;
                case OWNER_INACTIVE -> workerInactive(c, lease.workerId());
            };
            if (!stillReclaimable) {
                log.debug("Reclaim of task {} skipped: {} no longer holds for {}", lease.taskId(), cause, lease.workerId());
                return ReclaimOutcome.SKIPPED;
            }
            int retryCount = row.get().retryCount();
            int maxRetries = row.get().maxRetries();
            ReclaimOutcome outcome;
            if (retryCount < maxRetries) {
                requeue(c, lease.taskId(), lease.token(), retryCount + 1, now, reason, now);
                eventLog.append(c, lease.taskId(), lease.workerId(), TaskEventType.RETRY,
                        "Reclaimed (" + reason + "), retry " + (retryCount + 1) + "/" + maxRetries, null, now);
                outcome = ReclaimOutcome.REQUEUED;
            } else {
                deadLetter(c, lease.taskId(), lease.token(), reason + "; retries exhausted", now);
                eventLog.append(c, lease.taskId(), lease.workerId(), TaskEventType.FAILED,
                        "Reclaimed (" + reason + "), retries exhausted", null, now);
                outcome = ReclaimOutcome.DEAD_LETTERED;
            }
            clearCurrentTask(c, lease.workerId(), lease.taskId(), now);
            return outcome;
        });
    }

    public Optional<WorkerHeartbeat> worker(String workerId) {
        return database.withConnection("get worker", c -> {
            try (PreparedStatement ps = c.prepareStatement(WORKER_COLUMNS + " WHERE worker_id=?")) {
                ps.setString(1, workerId);
                List<WorkerHeartbeat> rows = readWorkers(ps);
                return rows.isEmpty() ? Optional.<WorkerHeartbeat>empty() : Optional.of(rows.get(0));
            }
        });
    }

    public List<WorkerHeartbeat> workers() {
        return database.withConnection("list workers", c -> {
            try (PreparedStatement ps = c.prepareStatement(WORKER_COLUMNS + " ORDER BY worker_id")) {
                return readWorkers(ps);
            }
        });
    }

    long retryDelayMs(int attempt) {
        if (settings.retryBaseDelayMs() <= 0) {
            return 0L;
        }
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        long delay = settings.retryBaseDelayMs() * (1L << exponent);
        return Math.min(delay, settings.retryMaxDelayMs());
    }

    private static final String WORKER_COLUMNS = """
            SELECT worker_id,last_heartbeat,tasks_processed,tasks_failed,current_task_id,strategy,status,
                   started_at,updated_at
            FROM worker_heartbeats
            """;

    private void requeue(Connection c, long taskId, String token, int retryCount, long runAfter,
                         String error, long now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE task_queue
                SET status='queued', retry_count=?, run_after=?, error_message=?, updated_at=?,
                    claimed_by=NULL, claimed_at=NULL, lease_until=NULL, lease_token=NULL
                WHERE id=? AND lease_token=?
                """)) {
            ps.setInt(1, retryCount);
            ps.setLong(2, runAfter);
            ps.setString(3, error);
            ps.setLong(4, now);
            ps.setLong(5, taskId);
            ps.setString(6, token);
            ps.executeUpdate();
        }
    }

    private void deadLetter(Connection c, long taskId, String token, String error, long now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE task_queue
                SET status='failed', error_message=?, completed_at=?, updated_at=?,
                    claimed_by=NULL, claimed_at=NULL, lease_until=NULL, lease_token=NULL
                WHERE id=? AND lease_token=?
                """)) {
            ps.setString(1, error);
            ps.setLong(2, now);
            ps.setLong(3, now);
            ps.setLong(4, taskId);
            ps.setString(5, token);
            ps.executeUpdate();
        }
    }

    private void upsertWorker(Connection c, String workerId, String strategyName, Long currentTaskId, long now)
            throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO worker_heartbeats(worker_id,last_heartbeat,tasks_processed,tasks_failed,current_task_id,
                                              strategy,status,started_at,updated_at)
                VALUES(?,?,0,0,?,?,'active',?,?)
                ON CONFLICT(worker_id) DO UPDATE SET
                    last_heartbeat=excluded.last_heartbeat,
                    current_task_id=excluded.current_task_id,
                    strategy=excluded.strategy,
                    status='active',
                    updated_at=excluded.updated_at
                """)) {
            ps.setString(1, workerId);
            ps.setLong(2, now);
            if (currentTaskId == null) {
                ps.setNull(3, java.sql.Types.INTEGER);
            } else {
                ps.setLong(3, currentTaskId);
            }
            ps.setString(4, strategyName == null || strategyName.isBlank() ? "LIFO" : strategyName);
            ps.setLong(5, now);
            ps.setLong(6, now);
            ps.executeUpdate();
        }
    }

    private void releaseWorker(Connection c, String workerId, long taskId, boolean succeeded, long now)
            throws SQLException {
        String counter = succeeded ? "tasks_processed=tasks_processed+1" : "tasks_failed=tasks_failed+1";
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE worker_heartbeats
                SET %s, last_heartbeat=?, updated_at=?,
                    current_task_id=CASE WHEN current_task_id=? THEN NULL ELSE current_task_id END
                WHERE worker_id=?
                """.formatted(counter))) {
            ps.setLong(1, now);
            ps.setLong(2, now);
            ps.setLong(3, taskId);
            ps.setString(4, workerId);
            ps.executeUpdate();
        }
    }

    private void clearCurrentTask(Connection c, String workerId, long taskId, long now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE worker_heartbeats SET current_task_id=NULL, updated_at=? WHERE worker_id=? AND current_task_id=?")) {
            ps.setLong(1, now);
            ps.setString(2, workerId);
            ps.setLong(3, taskId);
            ps.executeUpdate();
        }
    }

    private Optional<Task> readTask(Connection c, long taskId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(TASK_COLUMNS + " WHERE id=?")) {
            ps.setLong(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapTask(rs)) : Optional.empty();
            }
        }
    }

    private static boolean workerInactive(Connection c, String workerId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT 1 FROM worker_heartbeats WHERE worker_id=? AND status IN ('stale','stopped')")) {
            ps.setString(1, workerId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private Optional<LeaseRow> readLeaseRow(Connection c, long taskId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT status,claimed_by,lease_token,lease_until,retry_count,max_retries FROM task_queue WHERE id=?")) {
            ps.setLong(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new LeaseRow(
                        TaskStatus.fromString(rs.getString("status")),
                        rs.getString("claimed_by"),
                        rs.getString("lease_token"),
                        nullableLong(rs, "lease_until"),
                        rs.getInt("retry_count"),
                        rs.getInt("max_retries")
                ));
            }
        }
    }

    private static List<Lease> readLeases(PreparedStatement ps) throws SQLException {
        List<Lease> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                Long leaseUntil = nullableLong(rs, "lease_until");
                out.add(new Lease(
                        rs.getLong("id"),
                        rs.getString("claimed_by"),
                        rs.getString("lease_token"),
                        leaseUntil == null ? 0L : leaseUntil
                ));
            }
        }
        return out;
    }

    private static List<WorkerHeartbeat> readWorkers(PreparedStatement ps) throws SQLException {
        List<WorkerHeartbeat> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new WorkerHeartbeat(
                        rs.getString("worker_id"),
                        rs.getLong("last_heartbeat"),
                        rs.getInt("tasks_processed"),
                        rs.getInt("tasks_failed"),
                        nullableLong(rs, "current_task_id"),
                        rs.getString("strategy"),
                        rs.getString("status"),
                        rs.getLong("started_at"),
                        rs.getLong("updated_at")
                ));
            }
        }
        return out;
    }

    static Task mapTask(ResultSet rs) throws SQLException {
        return new Task(
                rs.getLong("id"),
                rs.getString("task_type"),
                storedJson(rs.getString("parameters")),
                rs.getInt("priority"),
                rs.getLong("run_after"),
                TaskStatus.fromString(rs.getString("status")),
                rs.getString("claimed_by"),
                nullableLong(rs, "claimed_at"),
                nullableLong(rs, "lease_until"),
                rs.getString("lease_token"),
                rs.getInt("retry_count"),
                rs.getInt("max_retries"),
                rs.getString("idempotency_key"),
                rs.getString("result_data") == null ? null : storedJson(rs.getString("result_data")),
                rs.getString("error_message"),
                rs.getLong("created_at"),
                rs.getLong("updated_at"),
                nullableLong(rs, "completed_at")
        );
    }

    /**
     * Columns written by other producers may hold text that is not JSON; such values are kept
     * as a JSON string instead of failing the whole read.
     */
    private static JsonNode storedJson(String raw) {
        try {
            return Jsons.parse(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Stored value is not JSON, reading it as text");
            return TextNode.valueOf(raw);
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static long lastInsertId(Connection c) throws SQLException {
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) {
                throw new SQLException("last_insert_rowid() returned no row");
            }
            return rs.getLong(1);
        }
    }

    private static TaskEventType eventFor(TaskStatus expected, TaskStatus next) {
        return switch (next) {
            case QUEUED -> expected.owned() ? TaskEventType.RETRY : TaskEventType.PROGRESS;
            case CLAIMED -> TaskEventType.CLAIMED;
            case RUNNING -> TaskEventType.STARTED;
            case COMPLETED -> TaskEventType.COMPLETED;
            case FAILED -> TaskEventType.FAILED;
            case CANCELLED -> TaskEventType.CANCELLED;
        };
    }

    private static void requireWorkerId(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
    }

    /**
     * Picks the id of the row a strategy wants to claim, or {@code null} when nothing is
     * eligible. Runs inside the claim transaction.
     */
    @FunctionalInterface
    public interface CandidateSelector {
        Long select(Connection connection, long nowMs) throws SQLException;
    }

    private record LeaseRow(
            TaskStatus status,
            String claimedBy,
            String leaseToken,
            Long leaseUntilMs,
            int retryCount,
            int maxRetries
    ) {
        boolean heldBy(Lease lease, long nowMs) {
            return status.owned()
                    && lease.workerId().equals(claimedBy)
                    && lease.token().equals(leaseToken)
                    && leaseUntilMs != null
                    && leaseUntilMs >= nowMs;
        }
    }

    public record EnqueueRequest(
            String taskType,
            JsonNode parameters,
            Integer priority,
            Long runAfterMs,
            Integer maxRetries,
            String idempotencyKey
    ) {
        public static EnqueueRequest of(String taskType, JsonNode parameters) {
            return new EnqueueRequest(taskType, parameters, null, null, null, null);
        }

        public EnqueueRequest withPriority(int value) {
            return new EnqueueRequest(taskType, parameters, value, runAfterMs, maxRetries, idempotencyKey);
        }

        public EnqueueRequest withRunAfter(long value) {
            return new EnqueueRequest(taskType, parameters, priority, value, maxRetries, idempotencyKey);
        }

        public EnqueueRequest withMaxRetries(int value) {
            return new EnqueueRequest(taskType, parameters, priority, runAfterMs, value, idempotencyKey);
        }

        public EnqueueRequest withIdempotencyKey(String value) {
            return new EnqueueRequest(taskType, parameters, priority, runAfterMs, maxRetries, value);
        }
    }

    public record EnqueueResult(long taskId, boolean deduplicated) {
    }

    public record StatusUpdate(String workerId, String expectedLeaseToken, JsonNode result, String errorMessage) {
        public static StatusUpdate none() {
            return new StatusUpdate(null, null, null, null);
        }

        public static StatusUpdate ownedBy(String workerId) {
            return new StatusUpdate(workerId, null, null, null);
        }
    }

    public record TaskQuery(TaskStatus status, String taskType, String claimedBy, int limit, int offset) {
        public static TaskQuery all(int limit) {
            return new TaskQuery(null, null, null, limit, 0);
        }

        public static TaskQuery byStatus(TaskStatus status, int limit) {
            return new TaskQuery(status, null, null, limit, 0);
        }
    }

    public enum HeartbeatResult {
        RENEWED,
        LEASE_LOST,
        CANCELLED
    }

    public enum FailureOutcome {
        REQUEUED,
        DEAD_LETTERED,
        STALE_LEASE
    }

    public record FailureResolution(FailureOutcome outcome, int retryCount, Long runAfterMs) {
        public static FailureResolution requeued(int retryCount, long runAfterMs) {
            return new FailureResolution(FailureOutcome.REQUEUED, retryCount, runAfterMs);
        }

        public static FailureResolution deadLettered(int retryCount) {
            return new FailureResolution(FailureOutcome.DEAD_LETTERED, retryCount, null);
        }

        public static FailureResolution staleLease() {
            return new FailureResolution(FailureOutcome.STALE_LEASE, 0, null);
        }
    }

    public enum CancelOutcome {
        CANCELLED,
        NOT_FOUND,
        ALREADY_TERMINAL
    }

    public record CancelResult(long taskId, CancelOutcome outcome, TaskStatus previousStatus) {
        public static CancelResult cancelled(long taskId, TaskStatus previous) {
            return new CancelResult(taskId, CancelOutcome.CANCELLED, previous);
        }

        public static CancelResult notFound(long taskId) {
            return new CancelResult(taskId, CancelOutcome.NOT_FOUND, null);
        }

        public static CancelResult alreadyTerminal(long taskId, TaskStatus current) {
            return new CancelResult(taskId, CancelOutcome.ALREADY_TERMINAL, current);
        }
    }

    public enum ReclaimCause {
        LEASE_EXPIRED,
        OWNER_INACTIVE
    }

    public enum ReclaimOutcome {
        REQUEUED,
        DEAD_LETTERED,
        SKIPPED
    }
}
