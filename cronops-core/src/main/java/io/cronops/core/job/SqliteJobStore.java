package io.cronops.core.job;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronops.core.execution.ExecutionStatus;
import io.cronops.core.storage.Page;
import io.cronops.core.storage.PageRequest;
import io.cronops.core.storage.SqliteDatabase;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class SqliteJobStore implements JobStore {
    private static final TypeReference<Map<String, String>> HEADERS_TYPE = new TypeReference<>() {
    };
    private static final String COLUMNS = """
        j.id, j.user_id, j.name, j.cron_expression, j.timezone, j.target_type, j.target_url, j.http_method,
        j.headers_json, j.payload, j.command, j.max_retries, j.retry_delay_seconds, j.timeout_ms, j.status,
        j.last_run_at, j.last_status, j.next_run_at, j.created_at, j.updated_at
        """;

    private final SqliteDatabase database;
    private final ObjectMapper mapper = new ObjectMapper();

    public SqliteJobStore(SqliteDatabase database) {
        this.database = Objects.requireNonNull(database, "database must not be null");
    }

    @Override
    public synchronized boolean insertWithinQuota(CronJob job, int activeCeiling) throws IOException {
        boolean gated = job.isActive() && activeCeiling != UNBOUNDED;
        String sql = """
            INSERT INTO cron_jobs (
                id, user_id, name, cron_expression, timezone, target_type, target_url, http_method,
                headers_json, payload, command, max_retries, retry_delay_seconds, timeout_ms, status,
                last_run_at, last_status, next_run_at, created_at, updated_at
            )
            SELECT ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?
            WHERE ? = 0
               OR (SELECT COUNT(*) FROM cron_jobs WHERE user_id = ? AND status = 'ACTIVE') < ?
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, job.id());
            statement.setString(2, job.userId());
            int index = bindDefinition(statement, 3, job);
            statement.setString(index++, job.status().name());
            setInstant(statement, index++, job.lastRunAt());
            statement.setString(index++, job.lastStatus() == null ? null : job.lastStatus().name());
            setInstant(statement, index++, job.nextRunAt());
            setInstant(statement, index++, job.createdAt());
            setInstant(statement, index++, job.updatedAt());
            statement.setInt(index++, gated ? 1 : 0);
            statement.setString(index++, job.userId());
            statement.setInt(index, Math.max(0, activeCeiling));
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to insert job " + job.id(), e);
        }
    }

    @Override
    public synchronized boolean activateWithinQuota(String id, Instant nextRunAt, Instant now, int activeCeiling)
        throws IOException {
        String sql = """
            UPDATE cron_jobs
            SET status = 'ACTIVE', next_run_at = ?, updated_at = ?
            WHERE id = ? AND status = 'PAUSED'
              AND (? = 0
                   OR (SELECT COUNT(*) FROM cron_jobs other
                       WHERE other.user_id = cron_jobs.user_id AND other.status = 'ACTIVE') < ?)
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            setInstant(statement, 1, nextRunAt);
            setInstant(statement, 2, now);
            statement.setString(3, id);
            statement.setInt(4, activeCeiling == UNBOUNDED ? 0 : 1);
            statement.setInt(5, Math.max(0, activeCeiling));
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to activate job " + id, e);
        }
    }

    @Override
    public synchronized boolean pause(String id, Instant now) throws IOException {
        String sql = """
            UPDATE cron_jobs
            SET status = 'PAUSED', next_run_at = NULL, updated_at = ?
            WHERE id = ? AND status = 'ACTIVE'
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            setInstant(statement, 1, now);
            statement.setString(2, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to pause job " + id, e);
        }
    }

    @Override
    public synchronized boolean updateDefinition(CronJob job) throws IOException {
        String sql = """
            UPDATE cron_jobs
            SET name = ?, cron_expression = ?, timezone = ?, target_type = ?, target_url = ?,
                http_method = ?, headers_json = ?, payload = ?, command = ?, max_retries = ?,
                retry_delay_seconds = ?, timeout_ms = ?,
                next_run_at = CASE WHEN status = 'ACTIVE' THEN ? ELSE NULL END,
                updated_at = ?
            WHERE id = ?
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            int index = bindDefinition(statement, 1, job);
            setInstant(statement, index++, job.nextRunAt());
            setInstant(statement, index++, job.updatedAt());
            statement.setString(index, job.id());
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to update job " + job.id(), e);
        }
    }

    @Override
    public synchronized boolean updateNextRunAt(String id, Instant nextRunAt) throws IOException {
        String sql = "UPDATE cron_jobs SET next_run_at = ? WHERE id = ? AND status = 'ACTIVE'";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            setInstant(statement, 1, nextRunAt);
            statement.setString(2, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to advance job " + id, e);
        }
    }

    @Override
    public synchronized boolean recordRun(String id, Instant lastRunAt, ExecutionStatus lastStatus) throws IOException {
        String sql = "UPDATE cron_jobs SET last_run_at = ?, last_status = ? WHERE id = ?";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            setInstant(statement, 1, lastRunAt);
            statement.setString(2, lastStatus.name());
            statement.setString(3, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to record run for job " + id, e);
        }
    }

    @Override
    public synchronized boolean delete(String id) throws IOException {
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM cron_jobs WHERE id = ?")) {
            statement.setString(1, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to delete job " + id, e);
        }
    }

    @Override
    public synchronized Optional<CronJob> findById(String id) throws IOException {
        String sql = "SELECT " + COLUMNS + " FROM cron_jobs j WHERE j.id = ?";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, id);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(read(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load job " + id, e);
        }
    }

    @Override
    public synchronized Page<CronJob> listByUser(String userId, JobStatus status, String search, PageRequest page)
        throws IOException {
        String filter = """
            FROM cron_jobs j
            WHERE j.user_id = ?
              AND (? IS NULL OR j.status = ?)
              AND (? IS NULL OR instr(lower(j.name), lower(?)) > 0)
            """;
        String term = search == null || search.isBlank() ? null : search.trim();
        String statusName = status == null ? null : status.name();
        try (Connection connection = database.openConnection()) {
            long total;
            try (PreparedStatement count = connection.prepareStatement("SELECT COUNT(*) " + filter)) {
                bindUserFilter(count, userId, statusName, term);
                try (ResultSet resultSet = count.executeQuery()) {
                    total = resultSet.next() ? resultSet.getLong(1) : 0;
                }
            }
            String sql = "SELECT " + COLUMNS + filter + " ORDER BY j.created_at DESC, j.rowid DESC LIMIT ? OFFSET ?";
            List<CronJob> jobs = new ArrayList<>();
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                int index = bindUserFilter(statement, userId, statusName, term);
                statement.setInt(index++, page.limit());
                statement.setInt(index, page.offset());
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        jobs.add(read(resultSet));
                    }
                }
            }
            return new Page<>(jobs, page.page(), page.limit(), total);
        } catch (SQLException e) {
            throw new IOException("Failed to list jobs for user " + userId, e);
        }
    }

    @Override
    public synchronized Page<OwnedJob> listAll(JobStatus status, PageRequest page) throws IOException {
        String statusName = status == null ? null : status.name();
        String sql = "SELECT " + COLUMNS + """
            , u.email AS owner_email, u.name AS owner_name,
              (SELECT COUNT(*) FROM execution_logs l WHERE l.cron_job_id = j.id) AS execution_count
            FROM cron_jobs j
            JOIN users u ON u.id = j.user_id
            WHERE (? IS NULL OR j.status = ?)
            ORDER BY j.created_at DESC, j.rowid DESC
            LIMIT ? OFFSET ?
            """;
        try (Connection connection = database.openConnection()) {
            long total;
            try (PreparedStatement count = connection.prepareStatement(
                "SELECT COUNT(*) FROM cron_jobs WHERE (? IS NULL OR status = ?)")) {
                count.setString(1, statusName);
                count.setString(2, statusName);
                try (ResultSet resultSet = count.executeQuery()) {
                    total = resultSet.next() ? resultSet.getLong(1) : 0;
                }
            }
            List<OwnedJob> jobs = new ArrayList<>();
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, statusName);
                statement.setString(2, statusName);
                statement.setInt(3, page.limit());
                statement.setInt(4, page.offset());
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        jobs.add(new OwnedJob(
                            read(resultSet),
                            resultSet.getString("owner_email"),
                            resultSet.getString("owner_name"),
                            resultSet.getLong("execution_count")
                        ));
                    }
                }
            }
            return new Page<>(jobs, page.page(), page.limit(), total);
        } catch (SQLException e) {
            throw new IOException("Failed to list jobs", e);
        }
    }

    @Override
    public synchronized List<CronJob> listActive() throws IOException {
        String sql = "SELECT " + COLUMNS + " FROM cron_jobs j WHERE j.status = 'ACTIVE'";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<CronJob> jobs = new ArrayList<>();
            while (resultSet.next()) {
                jobs.add(read(resultSet));
            }
            return jobs;
        } catch (SQLException e) {
            throw new IOException("Failed to list active jobs", e);
        }
    }

    @Override
    public synchronized JobCounts countsForUser(String userId) throws IOException {
        return counts("WHERE user_id = ?", userId);
    }

    @Override
    public synchronized JobCounts countsForAll() throws IOException {
        return counts("", null);
    }

    @Override
    public synchronized Map<String, Long> jobCountsByUser() throws IOException {
        String sql = "SELECT user_id, COUNT(*) AS job_count FROM cron_jobs GROUP BY user_id";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            Map<String, Long> counts = new HashMap<>();
            while (resultSet.next()) {
                counts.put(resultSet.getString("user_id"), resultSet.getLong("job_count"));
            }
            return counts;
        } catch (SQLException e) {
            throw new IOException("Failed to count jobs per user", e);
        }
    }

    private JobCounts counts(String where, String userId) throws IOException {
        String sql = """
            SELECT COUNT(*) AS total,
                   COALESCE(SUM(CASE WHEN status = 'ACTIVE' THEN 1 ELSE 0 END), 0) AS active,
                   COALESCE(SUM(CASE WHEN status = 'PAUSED' THEN 1 ELSE 0 END), 0) AS paused
            FROM cron_jobs
            """ + where;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            if (userId != null) {
                statement.setString(1, userId);
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return JobCounts.empty();
                }
                return new JobCounts(resultSet.getLong("total"), resultSet.getLong("active"), resultSet.getLong("paused"));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to count jobs", e);
        }
    }

    private int bindUserFilter(PreparedStatement statement, String userId, String status, String term) throws SQLException {
        statement.setString(1, userId);
        statement.setString(2, status);
        statement.setString(3, status);
        statement.setString(4, term);
        statement.setString(5, term);
        return 6;
    }

    private int bindDefinition(PreparedStatement statement, int start, CronJob job) throws SQLException, IOException {
        int index = start;
        statement.setString(index++, job.name());
        statement.setString(index++, job.cronExpression());
        statement.setString(index++, job.timezone());
        statement.setString(index++, job.targetType().name());
        if (job.target() instanceof HttpTarget http) {
            statement.setString(index++, http.url());
            statement.setString(index++, http.method().name());
            statement.setString(index++, http.headers().isEmpty() ? null : mapper.writeValueAsString(http.headers()));
            statement.setString(index++, http.payload());
            statement.setNull(index++, Types.VARCHAR);
        } else if (job.target() instanceof ScriptTarget script) {
            statement.setNull(index++, Types.VARCHAR);
            statement.setNull(index++, Types.VARCHAR);
            statement.setNull(index++, Types.VARCHAR);
            statement.setNull(index++, Types.VARCHAR);
            statement.setString(index++, script.command());
        }
        statement.setInt(index++, job.maxRetries());
        if (job.retryDelaySeconds() == null) {
            statement.setNull(index++, Types.INTEGER);
        } else {
            statement.setInt(index++, job.retryDelaySeconds());
        }
        statement.setLong(index++, job.timeoutMs());
        return index;
    }

    private CronJob read(ResultSet resultSet) throws SQLException, IOException {
        TargetType type = TargetType.valueOf(resultSet.getString("target_type"));
        JobTarget target;
        if (type == TargetType.HTTP) {
            String headersJson = resultSet.getString("headers_json");
            Map<String, String> headers = headersJson == null ? Map.of() : mapper.readValue(headersJson, HEADERS_TYPE);
            target = new HttpTarget(
                resultSet.getString("target_url"),
                HttpMethod.valueOf(resultSet.getString("http_method")),
                headers,
                resultSet.getString("payload")
            );
        } else {
            target = new ScriptTarget(resultSet.getString("command"));
        }
        int retryDelay = resultSet.getInt("retry_delay_seconds");
        Integer retryDelaySeconds = resultSet.wasNull() ? null : retryDelay;
        String lastStatus = resultSet.getString("last_status");
        return new CronJob(
            resultSet.getString("id"),
            resultSet.getString("user_id"),
            resultSet.getString("name"),
            resultSet.getString("cron_expression"),
            resultSet.getString("timezone"),
            target,
            resultSet.getInt("max_retries"),
            retryDelaySeconds,
            resultSet.getLong("timeout_ms"),
            JobStatus.valueOf(resultSet.getString("status")),
            readInstant(resultSet, "last_run_at"),
            lastStatus == null ? null : ExecutionStatus.valueOf(lastStatus),
            readInstant(resultSet, "next_run_at"),
            readInstant(resultSet, "created_at"),
            readInstant(resultSet, "updated_at")
        );
    }

    private static void setInstant(PreparedStatement statement, int index, Instant value) throws SQLException {
        statement.setString(index, value == null ? null : value.toString());
    }

    private static Instant readInstant(ResultSet resultSet, String column) throws SQLException {
        String raw = resultSet.getString(column);
        return raw == null ? null : Instant.parse(raw);
    }
}
