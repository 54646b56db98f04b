package io.cronops.core.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Connection factory and schema owner for the single SQLite file shared by the user, job and
 * execution-log stores. Every connection enables foreign keys so deleting a user or a job
 * cascades to its dependants.
 */
public final class SqliteDatabase {
    private static final List<String> SCHEMA = List.of(
        """
        CREATE TABLE IF NOT EXISTS users (
            id TEXT PRIMARY KEY,
            email TEXT NOT NULL UNIQUE,
            name TEXT NOT NULL,
            role TEXT NOT NULL,
            plan TEXT NOT NULL,
            api_token TEXT NOT NULL UNIQUE,
            created_at TEXT NOT NULL
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS cron_jobs (
            id TEXT PRIMARY KEY,
            user_id TEXT NOT NULL REFERENCES users(id) ON DELETE CASCADE,
            name TEXT NOT NULL,
            cron_expression TEXT NOT NULL,
            timezone TEXT NOT NULL,
            target_type TEXT NOT NULL,
            target_url TEXT,
            http_method TEXT,
            headers_json TEXT,
            payload TEXT,
            command TEXT,
            max_retries INTEGER NOT NULL,
            retry_delay_seconds INTEGER,
            timeout_ms INTEGER NOT NULL,
            status TEXT NOT NULL,
            last_run_at TEXT,
            last_status TEXT,
            next_run_at TEXT,
            created_at TEXT NOT NULL,
            updated_at TEXT NOT NULL
        )
        """,
        """
        CREATE INDEX IF NOT EXISTS idx_cron_jobs_user_status
        ON cron_jobs(user_id, status)
        """,
        """
        CREATE TABLE IF NOT EXISTS execution_logs (
            id TEXT PRIMARY KEY,
            cron_job_id TEXT NOT NULL REFERENCES cron_jobs(id) ON DELETE CASCADE,
            attempt INTEGER NOT NULL,
            trigger_source TEXT NOT NULL,
            status TEXT NOT NULL,
            status_code INTEGER,
            response TEXT,
            error TEXT,
            started_at TEXT NOT NULL,
            started_at_ms INTEGER NOT NULL,
            finished_at TEXT,
            duration_ms INTEGER
        )
        """,
        """
        CREATE INDEX IF NOT EXISTS idx_execution_logs_job_started
        ON execution_logs(cron_job_id, started_at_ms DESC)
        """,
        """
        CREATE INDEX IF NOT EXISTS idx_execution_logs_started
        ON execution_logs(started_at_ms DESC)
        """
    );

    private final String jdbcUrl;

    public SqliteDatabase(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        init();
    }

    public Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
            statement.execute("PRAGMA foreign_keys=ON;");
            statement.execute("PRAGMA busy_timeout=5000;");
        }
        return connection;
    }

    private void init() throws IOException {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            for (String ddl : SCHEMA) {
                statement.execute(ddl);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite database at " + jdbcUrl, e);
        }
    }
}
