package io.workqueue.storage;

import io.workqueue.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteErrorCode;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Locale;

/**
 * Bounded exponential retry for work that fails with SQLITE_BUSY / SQLITE_LOCKED.
 *
 * <p>The SQLite busy handler already waits up to {@code busy_timeout} inside a single call;
 * this layer retries the whole unit of work when that wait is not enough.
 */
public final class LockRetry {
    private static final Logger log = LoggerFactory.getLogger(LockRetry.class);

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final Sleeper sleeper;

    public LockRetry(int maxAttempts, long baseDelayMs, long maxDelayMs, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = Math.max(1L, baseDelayMs);
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
        this.sleeper = sleeper;
    }

    public <T> T call(String operation, SqlWork<T> work) {
        SQLException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return work.run();
            } catch (SQLException e) {
                if (!isLockContention(e)) {
                    throw new QueueStoreException("Failed " + operation, e);
                }
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                long delayMs = delayBeforeAttempt(attempt + 1);
                log.warn("Database busy during {} (attempt {}/{}), retrying in {} ms",
                        operation, attempt, maxAttempts, delayMs);
                try {
                    sleeper.sleep(Duration.ofMillis(delayMs));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new QueueStoreException("Interrupted while retrying " + operation, ie);
                }
            }
        }
        throw new QueueStoreException(
                "Failed " + operation + ": database still locked after " + maxAttempts + " attempts", last);
    }

    /**
     * Delay slept before {@code attempt} (2-based): base, 2×base, 4×base ... capped.
     */
    long delayBeforeAttempt(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 2, 30));
        long delay = baseDelayMs * (1L << exponent);
        return Math.min(delay, maxDelayMs);
    }

    public static boolean isLockContention(SQLException e) {
        int primary = e.getErrorCode() & 0xFF;
        if (primary == SQLiteErrorCode.SQLITE_BUSY.code || primary == SQLiteErrorCode.SQLITE_LOCKED.code) {
            return true;
        }
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        return message.contains("database is locked")
                || message.contains("sqlite_busy")
                || message.contains("sqlite_locked");
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T run() throws SQLException;
    }
}
