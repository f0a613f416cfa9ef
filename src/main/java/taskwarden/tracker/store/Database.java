package taskwarden.tracker.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import taskwarden.tracker.config.TrackerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(TrackerConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("taskwarden-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Roll back after a failed statement. A rollback failure is attached to the
     * original error instead of replacing it.
     */
    public static void rollback(Connection conn, Throwable cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- EXECUTIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_executions (
                            task_id         VARCHAR(255) PRIMARY KEY,
                            task_name       VARCHAR(255) NOT NULL,
                            module          VARCHAR(100) NOT NULL,
                            status          VARCHAR(20) NOT NULL DEFAULT 'PENDING',
                            created_at      TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP,
                            started_at      TIMESTAMP,
                            finished_at     TIMESTAMP,
                            task_args       CLOB,
                            task_kwargs     CLOB,
                            result          CLOB,
                            error           CLOB,
                            traceback       CLOB,
                            created_by      VARCHAR(255),
                            metadata        CLOB
                        );
                    """);

            // ---------- LOCKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_locks (
                            lock_key        VARCHAR(512) PRIMARY KEY,
                            owner_token     VARCHAR(64) NOT NULL,
                            expires_at      TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- CONFIG OVERRIDES (global scope) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_config (
                            config_key      VARCHAR(128) PRIMARY KEY,
                            config_value    CLOB NOT NULL,
                            updated_at      TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // Indexes: reaper scans (status, started_at), cleaner scans (status, created_at)
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_exec_status_started ON task_executions(status, started_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_exec_status_finished ON task_executions(status, finished_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_exec_status_created ON task_executions(status, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_exec_module_status ON task_executions(module, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_exec_name_status ON task_executions(task_name, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_exec_created_by ON task_executions(created_by, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_locks_expires ON task_locks(expires_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
