package tempo.scheduler.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.scheduler.config.SchedulerConfig;

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

    public Database(SchedulerConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("tempo-db-pool");
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

            // ---------- ONE-OFF JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS time_jobs (
                            id               UUID PRIMARY KEY,
                            function_name    VARCHAR(256) NOT NULL,
                            description      VARCHAR(1024),
                            payload          VARBINARY,
                            execution_time   TIMESTAMP(6) WITH TIME ZONE,
                            status           VARCHAR(20) NOT NULL,
                            lock_holder      VARCHAR(256),
                            locked_at        TIMESTAMP(6) WITH TIME ZONE,
                            executed_at      TIMESTAMP(6) WITH TIME ZONE,
                            elapsed_ms       BIGINT,
                            exception        CLOB,
                            retries          INT DEFAULT 0 NOT NULL,
                            retry_count      INT DEFAULT 0 NOT NULL,
                            retry_intervals  VARCHAR(1024),
                            parent_id        UUID REFERENCES time_jobs(id) ON DELETE CASCADE,
                            run_condition    VARCHAR(40),
                            created_at       TIMESTAMP(6) WITH TIME ZONE NOT NULL,
                            updated_at       TIMESTAMP(6) WITH TIME ZONE NOT NULL
                        );
                    """);

            // ---------- CRON DEFINITIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS cron_jobs (
                            id               UUID PRIMARY KEY,
                            function_name    VARCHAR(256) NOT NULL,
                            description      VARCHAR(1024),
                            expression       VARCHAR(256) NOT NULL,
                            payload          VARBINARY,
                            retries          INT DEFAULT 0 NOT NULL,
                            retry_intervals  VARCHAR(1024),
                            created_at       TIMESTAMP(6) WITH TIME ZONE NOT NULL,
                            updated_at       TIMESTAMP(6) WITH TIME ZONE NOT NULL
                        );
                    """);

            // ---------- INTERVAL DEFINITIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS interval_jobs (
                            id               UUID PRIMARY KEY,
                            function_name    VARCHAR(256) NOT NULL,
                            description      VARCHAR(1024),
                            interval_ms      BIGINT NOT NULL,
                            start_time       TIMESTAMP(6) WITH TIME ZONE,
                            end_time         TIMESTAMP(6) WITH TIME ZONE,
                            active           BOOLEAN DEFAULT TRUE NOT NULL,
                            last_executed_at TIMESTAMP(6) WITH TIME ZONE,
                            execution_count  BIGINT DEFAULT 0 NOT NULL,
                            payload          VARBINARY,
                            retries          INT DEFAULT 0 NOT NULL,
                            retry_intervals  VARCHAR(1024),
                            created_at       TIMESTAMP(6) WITH TIME ZONE NOT NULL,
                            updated_at       TIMESTAMP(6) WITH TIME ZONE NOT NULL
                        );
                    """);

            // ---------- OCCURRENCES (cron + interval) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS occurrences (
                            id               UUID PRIMARY KEY,
                            kind             VARCHAR(20) NOT NULL,
                            definition_id    UUID NOT NULL,
                            execution_time   TIMESTAMP(6) WITH TIME ZONE NOT NULL,
                            status           VARCHAR(20) NOT NULL,
                            lock_holder      VARCHAR(256),
                            locked_at        TIMESTAMP(6) WITH TIME ZONE,
                            executed_at      TIMESTAMP(6) WITH TIME ZONE,
                            elapsed_ms       BIGINT,
                            exception        CLOB,
                            retry_count      INT DEFAULT 0 NOT NULL,
                            created_at       TIMESTAMP(6) WITH TIME ZONE NOT NULL,
                            updated_at       TIMESTAMP(6) WITH TIME ZONE NOT NULL,
                            CONSTRAINT uq_occurrence_instant UNIQUE (kind, definition_id, execution_time)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_time_jobs_due ON time_jobs(status, execution_time);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_time_jobs_parent ON time_jobs(parent_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_time_jobs_holder ON time_jobs(lock_holder, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_occurrences_due ON occurrences(kind, status, execution_time);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_occurrences_holder ON occurrences(lock_holder, status);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
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
