package io.workqueue.storage;

import io.workqueue.config.QueueSettings;
import io.workqueue.config.WorkQueueConfig;
import io.workqueue.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Owns the single SQLite file: connection tuning, schema, migrations and maintenance.
 *
 * <p>Every connection is opened with the queue's pragmas and starts write transactions with
 * {@code BEGIN IMMEDIATE}, so a writer takes the database lock before it reads the rows it is
 * about to change.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "workqueue.schema.migration.v1";

    private final WorkQueueConfig config;
    private final QueueSettings settings;
    private final String jdbcUrl;
    private final LockRetry lockRetry;

    public Database(WorkQueueConfig config, QueueSettings settings) {
        this(config, settings, Sleeper.system());
    }

    public Database(WorkQueueConfig config, QueueSettings settings, Sleeper sleeper) {
        this.config = config;
        this.settings = settings;
        this.jdbcUrl = config.jdbcUrl();
        this.lockRetry = new LockRetry(
                settings.lockRetryAttempts(),
                settings.lockRetryBaseMs(),
                settings.lockRetryMaxMs(),
                sleeper
        );
    }

    public QueueSettings settings() {
        return settings;
    }

    public void init() {
        initDirectories();
        enableWriteAheadLog();
        initSchema();
        validatePragmas();
        log.info("Queue database initialized: {}", config.dbFile());
    }

    public Connection openConnection() throws SQLException {
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setBusyTimeout(settings.busyTimeoutMs());
        sqlite.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        sqlite.setTempStore(SQLiteConfig.TempStore.MEMORY);
        sqlite.setCacheSize(settings.cacheSize());
        sqlite.enforceForeignKeys(true);
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        Connection conn = DriverManager.getConnection(jdbcUrl, sqlite.toProperties());
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA wal_autocheckpoint=" + settings.walAutocheckpointPages());
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    /**
     * Runs {@code work} in one write transaction, retrying the whole transaction on lock
     * contention.
     */
    public <T> T inTransaction(String operation, ConnectionWork<T> work) {
        return lockRetry.call(operation, () -> {
            try (Connection c = openConnection()) {
                c.setAutoCommit(false);
                try {
                    T result = work.apply(c);
                    c.commit();
                    return result;
                } catch (SQLException | RuntimeException e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            }
        });
    }

    public <T> T withConnection(String operation, ConnectionWork<T> work) {
        return lockRetry.call(operation, () -> {
            try (Connection c = openConnection()) {
                return work.apply(c);
            }
        });
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new QueueStoreException("Failed to initialize data directory: " + config.rootDir(), e);
        }
    }

    private void enableWriteAheadLog() {
        withConnection("enable WAL", c -> {
            try (Statement st = c.createStatement()) {
                st.execute("PRAGMA journal_mode=WAL");
            }
            return null;
        });
    }

    private void initSchema() {
        inTransaction("initialize schema", c -> {
            try (Statement st = c.createStatement()) {
                st.execute("""
                        CREATE TABLE IF NOT EXISTS task_queue (
                            id INTEGER PRIMARY KEY AUTOINCREMENT,
                            task_type TEXT NOT NULL,
                            parameters TEXT NOT NULL DEFAULT '{}',
                            priority INTEGER NOT NULL DEFAULT 5,
                            run_after INTEGER NOT NULL,
                            status TEXT NOT NULL DEFAULT 'queued',
                            claimed_by TEXT,
                            claimed_at INTEGER,
                            lease_until INTEGER,
                            lease_token TEXT,
                            retry_count INTEGER NOT NULL DEFAULT 0,
                            max_retries INTEGER NOT NULL DEFAULT 3,
                            idempotency_key TEXT,
                            result_data TEXT,
                            error_message TEXT,
                            created_at INTEGER NOT NULL,
                            updated_at INTEGER NOT NULL,
                            completed_at INTEGER,
                            CHECK (priority BETWEEN 1 AND 10),
                            CHECK (retry_count <= max_retries),
                            CHECK (status IN ('queued', 'claimed', 'running', 'completed', 'failed', 'cancelled')),
                            CHECK ((claimed_by IS NOT NULL) = (status IN ('claimed', 'running')))
                        )
                        """);
                st.execute("""
                        CREATE TABLE IF NOT EXISTS worker_heartbeats (
                            worker_id TEXT PRIMARY KEY,
                            last_heartbeat INTEGER NOT NULL,
                            tasks_processed INTEGER NOT NULL DEFAULT 0,
                            tasks_failed INTEGER NOT NULL DEFAULT 0,
                            current_task_id INTEGER,
                            strategy TEXT NOT NULL DEFAULT 'LIFO',
                            status TEXT NOT NULL DEFAULT 'active',
                            started_at INTEGER NOT NULL,
                            updated_at INTEGER NOT NULL,
                            FOREIGN KEY (current_task_id) REFERENCES task_queue(id)
                        )
                        """);
                st.execute("""
                        CREATE TABLE IF NOT EXISTS task_logs (
                            id INTEGER PRIMARY KEY AUTOINCREMENT,
                            task_id INTEGER NOT NULL,
                            worker_id TEXT,
                            event_type TEXT NOT NULL,
                            message TEXT,
                            details TEXT,
                            timestamp INTEGER NOT NULL,
                            CHECK (event_type IN ('created', 'claimed', 'started', 'progress',
                                                  'completed', 'failed', 'retry', 'cancelled')),
                            FOREIGN KEY (task_id) REFERENCES task_queue(id),
                            FOREIGN KEY (worker_id) REFERENCES worker_heartbeats(worker_id)
                        )
                        """);
            }
            ensureTaskQueueColumns(c);
            ensureHeartbeatColumns(c);
            ensureSchemaMigrationsTable(c);
            applyVersionedMigrations(c);
            return null;
        });
    }

    private Set<String> columnsOf(Connection conn, String table) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        return columns;
    }

    private void ensureTaskQueueColumns(Connection conn) throws SQLException {
        Set<String> columns = columnsOf(conn, "task_queue");
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("lease_until")) {
                st.execute("ALTER TABLE task_queue ADD COLUMN lease_until INTEGER");
            }
            if (!columns.contains("lease_token")) {
                st.execute("ALTER TABLE task_queue ADD COLUMN lease_token TEXT");
            }
            if (!columns.contains("idempotency_key")) {
                st.execute("ALTER TABLE task_queue ADD COLUMN idempotency_key TEXT");
            }
        }
    }

    private void ensureHeartbeatColumns(Connection conn) throws SQLException {
        Set<String> columns = columnsOf(conn, "worker_heartbeats");
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("status")) {
                st.execute("ALTER TABLE worker_heartbeats ADD COLUMN status TEXT NOT NULL DEFAULT 'active'");
            }
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261001_001_claim_and_lease_indexes",
                "Partial claim index, lease expiry index, idempotency key and log indexes",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_task_queue_claiming ON task_queue(status, priority, created_at) WHERE status = 'queued'",
                        "CREATE INDEX IF NOT EXISTS idx_task_queue_run_after ON task_queue(status, run_after)",
                        "CREATE INDEX IF NOT EXISTS idx_task_queue_lease ON task_queue(status, lease_until)",
                        "CREATE INDEX IF NOT EXISTS idx_task_queue_claimed_by ON task_queue(claimed_by)",
                        "CREATE UNIQUE INDEX IF NOT EXISTS idx_task_queue_idempotency ON task_queue(idempotency_key) WHERE idempotency_key IS NOT NULL",
                        "CREATE INDEX IF NOT EXISTS idx_task_logs_task ON task_logs(task_id, timestamp)",
                        "CREATE INDEX IF NOT EXISTS idx_worker_heartbeats_last ON worker_heartbeats(status, last_heartbeat)"
                )
        ));
        steps.add(new MigrationStep(
                "20261001_002_monitoring_views",
                "Active tasks, worker status and task statistics views",
                List.of(
                        """
                        CREATE VIEW IF NOT EXISTS v_active_tasks AS
                        SELECT id, task_type, priority, status, claimed_by, retry_count, max_retries,
                               run_after, lease_until, created_at,
                               (CAST(strftime('%s', 'now') AS INTEGER) * 1000 - created_at) AS age_ms
                        FROM task_queue
                        WHERE status IN ('queued', 'claimed', 'running')
                        """,
                        """
                        CREATE VIEW IF NOT EXISTS v_worker_status AS
                        SELECT w.worker_id, w.status AS worker_status, w.strategy, w.last_heartbeat,
                               w.tasks_processed, w.tasks_failed, w.current_task_id,
                               t.task_type AS current_task_type, t.status AS current_task_status,
                               w.started_at, w.updated_at
                        FROM worker_heartbeats w
                        LEFT JOIN task_queue t ON t.id = w.current_task_id
                        """,
                        """
                        CREATE VIEW IF NOT EXISTS v_task_stats AS
                        SELECT task_type, status, COUNT(*) AS task_count, AVG(retry_count) AS avg_retries,
                               MIN(created_at) AS oldest_created_at, MAX(created_at) AS newest_created_at
                        FROM task_queue
                        GROUP BY task_type, status
                        """
                )
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
            log.info("Applied schema migration {}", step.version());
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private void validatePragmas() {
        withConnection("validate pragmas", c -> {
            try (Statement st = c.createStatement()) {
                validatePragma(st, "journal_mode", "wal");
                validatePragma(st, "synchronous", "1");
                validatePragma(st, "foreign_keys", "1");
                validatePragma(st, "temp_store", "2");
            }
            return null;
        });
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public Map<String, String> pragmaInfo() {
        return withConnection("read pragmas", c -> {
            Map<String, String> out = new LinkedHashMap<>();
            try (Statement st = c.createStatement()) {
                for (String pragma : List.of("journal_mode", "synchronous", "busy_timeout", "cache_size",
                        "temp_store", "wal_autocheckpoint", "foreign_keys", "page_size")) {
                    try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
                        out.put(pragma, rs.next() ? rs.getString(1) : null);
                    }
                }
            }
            return out;
        });
    }

    /**
     * Flushes the WAL into the main file and truncates it.
     */
    public CheckpointResult checkpoint() {
        CheckpointResult result = withConnection("wal checkpoint", c -> {
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("PRAGMA wal_checkpoint(TRUNCATE)")) {
                if (!rs.next()) {
                    return new CheckpointResult(false, 0, 0);
                }
                return new CheckpointResult(rs.getInt(1) != 0, rs.getInt(2), rs.getInt(3));
            }
        });
        log.info("WAL checkpoint finished: busy={}, logFrames={}, checkpointed={}",
                result.busy(), result.logFrames(), result.checkpointedFrames());
        return result;
    }

    public void vacuum() {
        withConnection("vacuum", c -> {
            try (Statement st = c.createStatement()) {
                st.execute("VACUUM");
            }
            return null;
        });
        log.info("Database vacuumed: {}", config.dbFile());
    }

    public long databaseSizeBytes() {
        return withConnection("database size", c -> {
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery(
                         "SELECT page_count * page_size AS size FROM pragma_page_count(), pragma_page_size()")) {
                return rs.next() ? rs.getLong("size") : 0L;
            }
        });
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        int safeLimit = Math.max(1, limit);
        return withConnection("list schema migrations", c -> {
            List<SchemaMigrationRow> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setInt(1, safeLimit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new SchemaMigrationRow(
                                rs.getString("version"),
                                rs.getString("description"),
                                rs.getString("checksum"),
                                rs.getLong("applied_at_ms"),
                                rs.getInt("success") == 1
                        ));
                    }
                }
            }
            return out;
        });
    }

    @FunctionalInterface
    public interface ConnectionWork<T> {
        T apply(Connection connection) throws SQLException;
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }

    public record CheckpointResult(boolean busy, int logFrames, int checkpointedFrames) {
    }
}
