package io.workqueue.claim;

import io.workqueue.model.Task;
import io.workqueue.storage.TaskStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;

/**
 * Claims the first eligible row under a fixed {@code ORDER BY}.
 */
public abstract class OrderedClaimStrategy implements ClaimStrategy {
    private final TaskStore store;

    protected OrderedClaimStrategy(TaskStore store) {
        this.store = store;
    }

    protected abstract String orderBy();

    @Override
    public Optional<Task> claim(String workerId, Duration lease) {
        return store.claim(workerId, name(), this::selectCandidate, lease);
    }

    Long selectCandidate(Connection c, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT id FROM task_queue WHERE status='queued' AND run_after<=? ORDER BY " + orderBy() + " LIMIT 1")) {
            ps.setLong(1, nowMs);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : null;
            }
        }
    }
}
