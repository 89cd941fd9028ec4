package io.workqueue.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.workqueue.model.TaskEventType;
import io.workqueue.model.TaskLogEntry;
import io.workqueue.storage.Database;
import io.workqueue.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only {@code task_logs} table. Writers append on the connection of the transaction
 * that performs the state change, so an event exists exactly when its transition committed.
 */
public final class TaskEventLog {
    private static final String SELECT_COLUMNS =
            "SELECT id,task_id,worker_id,event_type,message,details,timestamp FROM task_logs ";

    private final Database database;

    public TaskEventLog(Database database) {
        this.database = database;
    }

    public void append(Connection c, long taskId, String workerId, TaskEventType type,
                       String message, JsonNode details, long nowMs) throws SQLException {
        // worker_id references worker_heartbeats; ids with no row are logged as NULL
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO task_logs(task_id,worker_id,event_type,message,details,timestamp)
                VALUES(?,(SELECT worker_id FROM worker_heartbeats WHERE worker_id=?),?,?,?,?)
                """)) {
            ps.setLong(1, taskId);
            ps.setString(2, workerId);
            ps.setString(3, type.dbValue());
            ps.setString(4, message);
            ps.setString(5, details == null || details.isNull() ? null : Jsons.toCompactJson(details));
            ps.setLong(6, nowMs);
            ps.executeUpdate();
        }
    }

    public List<TaskLogEntry> forTask(long taskId) {
        return database.withConnection("read task events", c -> {
            try (PreparedStatement ps = c.prepareStatement(SELECT_COLUMNS + "WHERE task_id=? ORDER BY timestamp ASC, id ASC")) {
                ps.setLong(1, taskId);
                return readAll(ps);
            }
        });
    }

    public List<TaskLogEntry> recent(int limit) {
        int safeLimit = Math.max(1, limit);
        return database.withConnection("read recent events", c -> {
            try (PreparedStatement ps = c.prepareStatement(SELECT_COLUMNS + "ORDER BY id DESC LIMIT ?")) {
                ps.setInt(1, safeLimit);
                return readAll(ps);
            }
        });
    }

    private static List<TaskLogEntry> readAll(PreparedStatement ps) throws SQLException {
        List<TaskLogEntry> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new TaskLogEntry(
                        rs.getLong("id"),
                        rs.getLong("task_id"),
                        rs.getString("worker_id"),
                        TaskEventType.fromString(rs.getString("event_type")),
                        rs.getString("message"),
                        Jsons.parseNullable(rs.getString("details")),
                        rs.getLong("timestamp")
                ));
            }
        }
        return out;
    }
}
