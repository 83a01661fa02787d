package io.steadyloop.storage;

import io.steadyloop.config.SteadyLoopConfig;
import io.steadyloop.pool.PoolSettings;
import io.steadyloop.pool.PoolStats;
import io.steadyloop.pool.PooledHandle;
import io.steadyloop.pool.ResourcePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;

public final class Database implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "steadyloop.schema.migration.v1";

    private final SteadyLoopConfig config;
    private final PoolSettings poolSettings;
    private final String jdbcUrl;
    private volatile ResourcePool<Connection> pool;

    public Database(SteadyLoopConfig config, PoolSettings poolSettings) {
        this.config = config;
        this.poolSettings = poolSettings;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public synchronized void init() {
        if (pool != null) {
            return;
        }
        initDirectories();
        pool = new ResourcePool<>("sqlite", new SqliteConnectionFactory(jdbcUrl), poolSettings);
        applyAndValidatePragmas();
        initSchema();
        log.info("Database ready at {}", config.dbFile());
    }

    public PooledHandle<Connection> lease() {
        ResourcePool<Connection> p = pool;
        if (p == null) {
            throw new IllegalStateException("Database not initialized: " + config.dbFile());
        }
        return p.lease();
    }

    public PoolStats poolStats() {
        ResourcePool<Connection> p = pool;
        if (p == null) {
            throw new IllegalStateException("Database not initialized: " + config.dbFile());
        }
        return p.stats();
    }

    public int runPoolMaintenance() {
        ResourcePool<Connection> p = pool;
        return p == null ? 0 : p.runMaintenance();
    }

    @Override
    public synchronized void close() {
        if (pool != null) {
            pool.close();
            pool = null;
        }
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.journalRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (PooledHandle<Connection> h = lease(); Statement st = h.get().createStatement()) {
            Connection conn = h.get();
            st.execute("""
                    CREATE TABLE IF NOT EXISTS tasks (
                        task_id TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        category TEXT NOT NULL,
                        priority INTEGER NOT NULL,
                        status TEXT NOT NULL,
                        payload TEXT,
                        deadline_at_ms INTEGER,
                        attempts INTEGER NOT NULL DEFAULT 0,
                        last_error TEXT,
                        progress REAL NOT NULL DEFAULT 0,
                        checkpoint TEXT,
                        result_payload TEXT,
                        lease_owner TEXT,
                        lease_token TEXT,
                        created_at_ms INTEGER NOT NULL,
                        started_at_ms INTEGER,
                        completed_at_ms INTEGER,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS task_dependencies (
                        task_id TEXT NOT NULL,
                        depends_on_task_id TEXT NOT NULL,
                        PRIMARY KEY(task_id, depends_on_task_id),
                        FOREIGN KEY(task_id) REFERENCES tasks(task_id) ON DELETE CASCADE
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize schema", e);
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
        List<MigrationStep> steps = List.of(
                new MigrationStep(
                        "20260301_001_dispatch_indexes",
                        "Index pending dispatch order and finished-task cleanup",
                        List.of(
                                "CREATE INDEX IF NOT EXISTS idx_tasks_dispatch ON tasks(status, priority, deadline_at_ms, created_at_ms)",
                                "CREATE INDEX IF NOT EXISTS idx_tasks_completed ON tasks(status, completed_at_ms)"
                        )
                ),
                new MigrationStep(
                        "20260301_002_dependency_lookup",
                        "Index reverse dependency lookups",
                        List.of("CREATE INDEX IF NOT EXISTS idx_task_deps_target ON task_dependencies(depends_on_task_id)")
                ),
                new MigrationStep(
                        "20260315_003_result_cache",
                        "Persistent tier for the result cache",
                        List.of(
                                """
                                CREATE TABLE IF NOT EXISTS result_cache (
                                    cache_key TEXT PRIMARY KEY,
                                    value_type TEXT NOT NULL,
                                    value_json TEXT NOT NULL,
                                    expires_at_ms INTEGER,
                                    size_bytes INTEGER NOT NULL,
                                    created_at_ms INTEGER NOT NULL
                                )
                                """,
                                """
                                CREATE TABLE IF NOT EXISTS result_cache_tags (
                                    cache_key TEXT NOT NULL,
                                    tag TEXT NOT NULL,
                                    PRIMARY KEY(cache_key, tag),
                                    FOREIGN KEY(cache_key) REFERENCES result_cache(cache_key) ON DELETE CASCADE
                                )
                                """,
                                "CREATE INDEX IF NOT EXISTS idx_result_cache_expires ON result_cache(expires_at_ms)",
                                "CREATE INDEX IF NOT EXISTS idx_result_cache_tags ON result_cache_tags(tag)"
                        )
                )
        );
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

    private void applyAndValidatePragmas() {
        try (PooledHandle<Connection> h = lease(); Statement st = h.get().createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
            validatePragma(st, "busy_timeout", String.valueOf(SqliteConnectionFactory.BUSY_TIMEOUT_MS));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
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

    private record MigrationStep(String version, String description, List<String> sql) {
    }
}
