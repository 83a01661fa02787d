package io.steadyloop.storage;

import io.steadyloop.pool.HandleFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Opens SQLite connections for the pool. Connection-scoped pragmas are applied to every new
 * connection since SQLite does not persist them. Transactions begin IMMEDIATE so a
 * read-then-update claim never hits a lock upgrade conflict.
 */
final class SqliteConnectionFactory implements HandleFactory<Connection> {
    private static final Logger log = LoggerFactory.getLogger(SqliteConnectionFactory.class);
    static final int BUSY_TIMEOUT_MS = 5_000;

    private final String jdbcUrl;

    SqliteConnectionFactory(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
    }

    @Override
    public Connection create() throws SQLException {
        SQLiteConfig cfg = new SQLiteConfig();
        cfg.setBusyTimeout(BUSY_TIMEOUT_MS);
        cfg.enforceForeignKeys(true);
        cfg.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        cfg.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        return DriverManager.getConnection(jdbcUrl, cfg.toProperties());
    }

    @Override
    public boolean isHealthy(Connection handle) {
        try {
            if (handle.isClosed()) {
                return false;
            }
            try (Statement st = handle.createStatement(); ResultSet rs = st.executeQuery("SELECT 1")) {
                return rs.next();
            }
        } catch (SQLException e) {
            log.debug("SQLite health check failed", e);
            return false;
        }
    }

    @Override
    public void reset(Connection handle) throws SQLException {
        if (!handle.getAutoCommit()) {
            handle.rollback();
            handle.setAutoCommit(true);
        }
    }

    @Override
    public void close(Connection handle) throws SQLException {
        handle.close();
    }
}
