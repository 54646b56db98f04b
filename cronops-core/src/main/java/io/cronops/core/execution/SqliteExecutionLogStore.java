package io.cronops.core.execution;

import io.cronops.core.storage.Page;
import io.cronops.core.storage.PageRequest;
import io.cronops.core.storage.SqliteDatabase;
import io.cronops.core.user.Plan;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class SqliteExecutionLogStore implements ExecutionLogStore {
    private static final String SELECT_ENTRY = """
        SELECT l.id, l.cron_job_id, l.attempt, l.trigger_source, l.status, l.status_code, l.response, l.error,
               l.started_at, l.finished_at, l.duration_ms, j.name AS job_name, j.user_id, u.email AS owner_email
        FROM execution_logs l
        JOIN cron_jobs j ON j.id = l.cron_job_id
        JOIN users u ON u.id = j.user_id
        """;
    private static final String FILTER = """
        WHERE (? IS NULL OR j.user_id = ?)
          AND (? IS NULL OR l.cron_job_id = ?)
          AND (? IS NULL OR l.status = ?)
          AND l.started_at_ms >= ?
        """;

    private final SqliteDatabase database;

    public SqliteExecutionLogStore(SqliteDatabase database) {
        this.database = Objects.requireNonNull(database, "database must not be null");
    }

    @Override
    public synchronized void insert(ExecutionLog log) throws IOException {
        String sql = """
            INSERT INTO execution_logs (
                id, cron_job_id, attempt, trigger_source, status, status_code, response, error,
                started_at, started_at_ms, finished_at, duration_ms
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, log.id());
            statement.setString(2, log.cronJobId());
            statement.setInt(3, log.attempt());
            statement.setString(4, log.trigger().name());
            statement.setString(5, log.status().name());
            setInteger(statement, 6, log.statusCode());
            statement.setString(7, log.response());
            statement.setString(8, log.error());
            statement.setString(9, log.startedAt().toString());
            statement.setLong(10, log.startedAt().toEpochMilli());
            statement.setString(11, log.finishedAt() == null ? null : log.finishedAt().toString());
            setLong(statement, 12, log.durationMs());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to insert execution log for job " + log.cronJobId(), e);
        }
    }

    @Override
    public synchronized boolean complete(ExecutionLog log) throws IOException {
        String sql = """
            UPDATE execution_logs
            SET status = ?, status_code = ?, response = ?, error = ?, finished_at = ?, duration_ms = ?
            WHERE id = ? AND status = 'RUNNING'
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, log.status().name());
            setInteger(statement, 2, log.statusCode());
            statement.setString(3, log.response());
            statement.setString(4, log.error());
            statement.setString(5, log.finishedAt() == null ? null : log.finishedAt().toString());
            setLong(statement, 6, log.durationMs());
            statement.setString(7, log.id());
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to complete execution log " + log.id(), e);
        }
    }

    @Override
    public synchronized Optional<LogEntry> findById(String id) throws IOException {
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(SELECT_ENTRY + " WHERE l.id = ?")) {
            statement.setString(1, id);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(readEntry(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load execution log " + id, e);
        }
    }

    @Override
    public synchronized Page<LogEntry> list(LogQuery query, PageRequest page) throws IOException {
        try (Connection connection = database.openConnection()) {
            long total;
            String countSql = """
                SELECT COUNT(*)
                FROM execution_logs l
                JOIN cron_jobs j ON j.id = l.cron_job_id
                """ + FILTER;
            try (PreparedStatement count = connection.prepareStatement(countSql)) {
                bindFilter(count, query, null);
                try (ResultSet resultSet = count.executeQuery()) {
                    total = resultSet.next() ? resultSet.getLong(1) : 0;
                }
            }
            List<LogEntry> entries = new ArrayList<>();
            String sql = SELECT_ENTRY + FILTER + " ORDER BY l.started_at_ms DESC, l.rowid DESC LIMIT ? OFFSET ?";
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                int index = bindFilter(statement, query, null);
                statement.setInt(index++, page.limit());
                statement.setInt(index, page.offset());
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        entries.add(readEntry(resultSet));
                    }
                }
            }
            return new Page<>(entries, page.page(), page.limit(), total);
        } catch (SQLException e) {
            throw new IOException("Failed to list execution logs", e);
        }
    }

    @Override
    public synchronized Map<ExecutionStatus, Long> countByStatus(LogQuery query, Instant since) throws IOException {
        String sql = """
            SELECT l.status, COUNT(*) AS log_count
            FROM execution_logs l
            JOIN cron_jobs j ON j.id = l.cron_job_id
            """ + FILTER + " GROUP BY l.status";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            bindFilter(statement, query, since);
            Map<ExecutionStatus, Long> counts = new EnumMap<>(ExecutionStatus.class);
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    counts.put(ExecutionStatus.valueOf(resultSet.getString("status")), resultSet.getLong("log_count"));
                }
            }
            return counts;
        } catch (SQLException e) {
            throw new IOException("Failed to count execution logs", e);
        }
    }

    @Override
    public synchronized List<ExecutionPoint> points(LogQuery query, Instant since) throws IOException {
        String sql = """
            SELECT l.started_at_ms, l.status
            FROM execution_logs l
            JOIN cron_jobs j ON j.id = l.cron_job_id
            """ + FILTER;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            bindFilter(statement, query, since);
            List<ExecutionPoint> points = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    points.add(new ExecutionPoint(
                        Instant.ofEpochMilli(resultSet.getLong(1)),
                        ExecutionStatus.valueOf(resultSet.getString(2))
                    ));
                }
            }
            return points;
        } catch (SQLException e) {
            throw new IOException("Failed to read execution start times", e);
        }
    }

    @Override
    public synchronized Optional<Double> averageDurationMs(LogQuery query) throws IOException {
        String sql = """
            SELECT AVG(l.duration_ms)
            FROM execution_logs l
            JOIN cron_jobs j ON j.id = l.cron_job_id
            """ + FILTER + " AND l.duration_ms IS NOT NULL";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            bindFilter(statement, query, null);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                double average = resultSet.getDouble(1);
                return resultSet.wasNull() ? Optional.empty() : Optional.of(average);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to average execution durations", e);
        }
    }

    @Override
    public synchronized int failStaleRunning(Instant now, String error) throws IOException {
        String sql = """
            UPDATE execution_logs
            SET status = 'FAILED', error = ?, finished_at = ?, duration_ms = MAX(0, ? - started_at_ms)
            WHERE status = 'RUNNING'
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, error);
            statement.setString(2, now.toString());
            statement.setLong(3, now.toEpochMilli());
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to close stale running execution logs", e);
        }
    }

    @Override
    public synchronized int deleteStartedBefore(Plan ownerPlan, Instant cutoff) throws IOException {
        String sql = """
            DELETE FROM execution_logs
            WHERE started_at_ms < ?
              AND cron_job_id IN (
                  SELECT j.id FROM cron_jobs j JOIN users u ON u.id = j.user_id WHERE u.plan = ?
              )
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, cutoff.toEpochMilli());
            statement.setString(2, ownerPlan.name());
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to purge execution logs for plan " + ownerPlan, e);
        }
    }

    private int bindFilter(PreparedStatement statement, LogQuery query, Instant since) throws SQLException {
        String status = query.status() == null ? null : query.status().name();
        statement.setString(1, query.userId());
        statement.setString(2, query.userId());
        statement.setString(3, query.jobId());
        statement.setString(4, query.jobId());
        statement.setString(5, status);
        statement.setString(6, status);
        statement.setLong(7, since == null ? Long.MIN_VALUE : since.toEpochMilli());
        return 8;
    }

    private LogEntry readEntry(ResultSet resultSet) throws SQLException {
        int code = resultSet.getInt("status_code");
        Integer statusCode = resultSet.wasNull() ? null : code;
        long duration = resultSet.getLong("duration_ms");
        Long durationMs = resultSet.wasNull() ? null : duration;
        String finishedAt = resultSet.getString("finished_at");
        ExecutionLog log = new ExecutionLog(
            resultSet.getString("id"),
            resultSet.getString("cron_job_id"),
            resultSet.getInt("attempt"),
            RunTrigger.valueOf(resultSet.getString("trigger_source")),
            ExecutionStatus.valueOf(resultSet.getString("status")),
            statusCode,
            resultSet.getString("response"),
            resultSet.getString("error"),
            Instant.parse(resultSet.getString("started_at")),
            finishedAt == null ? null : Instant.parse(finishedAt),
            durationMs
        );
        return new LogEntry(log, resultSet.getString("job_name"), resultSet.getString("user_id"), resultSet.getString("owner_email"));
    }

    private static void setInteger(PreparedStatement statement, int index, Integer value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setInt(index, value);
        }
    }

    private static void setLong(PreparedStatement statement, int index, Long value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.BIGINT);
        } else {
            statement.setLong(index, value);
        }
    }
}
