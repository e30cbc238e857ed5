package skillcron.cron.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import skillcron.cron.config.CronConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling. Connections are handed out with
 * auto-commit off; every repository method commits explicitly.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CronConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("skillcron-db-pool");
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
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS cron_jobs (
                            id                  VARCHAR(64) PRIMARY KEY,
                            name                VARCHAR(256) NOT NULL,
                            description         VARCHAR(2048),
                            enabled             BOOLEAN DEFAULT TRUE,
                            schedule_kind       VARCHAR(16) NOT NULL,
                            schedule_at_ms      BIGINT,
                            schedule_every_ms   BIGINT,
                            schedule_cron_expr  VARCHAR(128),
                            schedule_cron_tz    VARCHAR(64),
                            target_kind         VARCHAR(16) DEFAULT 'skill',
                            target_id           VARCHAR(256) NOT NULL,
                            target_query        CLOB,
                            target_profile_id   VARCHAR(128),
                            max_retries         INT DEFAULT 0,
                            backoff_ms          BIGINT DEFAULT 60000,
                            source_channel      VARCHAR(64),
                            source_user_id      VARCHAR(256),
                            source_chat_id      VARCHAR(256),
                            notify_channel      VARCHAR(64),
                            notify_user_id      VARCHAR(256),
                            notify_chat_id      VARCHAR(256),
                            next_run_at_ms      BIGINT,
                            last_run_at_ms      BIGINT,
                            last_status         VARCHAR(16),
                            last_error          CLOB,
                            running_session_id  VARCHAR(128),
                            retry_count         INT DEFAULT 0,
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- RUNS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS cron_runs (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            job_id          VARCHAR(64) NOT NULL REFERENCES cron_jobs(id) ON DELETE CASCADE,
                            session_id      VARCHAR(128) NOT NULL,
                            status          VARCHAR(16),
                            error           CLOB,
                            duration_ms     BIGINT,
                            started_at      TIMESTAMP NOT NULL,
                            completed_at    TIMESTAMP
                        );
                    """);

            // ---------- NOTIFICATIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS notifications (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            type            VARCHAR(32) NOT NULL,
                            title           VARCHAR(512) NOT NULL,
                            content         CLOB,
                            is_read         BOOLEAN DEFAULT FALSE,
                            job_id          VARCHAR(64),
                            session_id      VARCHAR(128),
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_cron_jobs_due ON cron_jobs(enabled, next_run_at_ms);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_cron_jobs_source ON cron_jobs(source_channel, source_user_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_cron_runs_job ON cron_runs(job_id, started_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_notifications_read ON notifications(is_read, created_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize database schema", e);
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
