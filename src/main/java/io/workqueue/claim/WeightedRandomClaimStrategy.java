package io.workqueue.claim;

import io.workqueue.model.Task;
import io.workqueue.storage.TaskStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Random claim weighted by {@code 1/(priority+1)}.
 *
 * <p>A priority bucket is drawn with weight {@code count * 1/(p+1)}, then a row is drawn
 * uniformly inside the bucket, so each eligible task is picked with probability
 * {@code (1/(p+1)) / sum(1/(p_i+1))}. Low-importance tasks keep a non-zero chance.
 */
public final class WeightedRandomClaimStrategy implements ClaimStrategy {
    private final TaskStore store;
    private final Random random;

    public WeightedRandomClaimStrategy(TaskStore store, Random random) {
        this.store = store;
        this.random = random;
    }

    @Override
    public Optional<Task> claim(String workerId, Duration lease) {
        return store.claim(workerId, name(), this::selectCandidate, lease);
    }

    @Override
    public String name() {
        return ClaimStrategyType.WEIGHTED_RANDOM.name();
    }

    Long selectCandidate(Connection c, long nowMs) throws SQLException {
        Map<Integer, Long> counts = new LinkedHashMap<>();
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT priority, COUNT(*) FROM task_queue
                WHERE status='queued' AND run_after<=?
                GROUP BY priority ORDER BY priority
                """)) {
            ps.setLong(1, nowMs);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    counts.put(rs.getInt(1), rs.getLong(2));
                }
            }
        }
        Integer priority = pickPriority(counts, random);
        if (priority == null) {
            return null;
        }
        long offset = (long) (random.nextDouble() * counts.get(priority));
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT id FROM task_queue
                WHERE status='queued' AND run_after<=? AND priority=?
                ORDER BY id LIMIT 1 OFFSET ?
                """)) {
            ps.setLong(1, nowMs);
            ps.setInt(2, priority);
            ps.setLong(3, offset);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : null;
            }
        }
    }

    /**
     * Draws a priority from per-priority eligible counts, or {@code null} when there are none.
     */
    static Integer pickPriority(Map<Integer, Long> counts, Random random) {
        double total = 0d;
        for (Map.Entry<Integer, Long> e : counts.entrySet()) {
            total += weight(e.getKey()) * e.getValue();
        }
        if (total <= 0d) {
            return null;
        }
        double target = random.nextDouble() * total;
        Integer last = null;
        for (Map.Entry<Integer, Long> e : counts.entrySet()) {
            if (e.getValue() <= 0) {
                continue;
            }
            last = e.getKey();
            target -= weight(e.getKey()) * e.getValue();
            if (target < 0d) {
                return e.getKey();
            }
        }
        return last;
    }

    static double weight(int priority) {
        return 1.0d / (priority + 1);
    }
}
