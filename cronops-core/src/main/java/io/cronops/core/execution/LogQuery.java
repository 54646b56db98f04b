package io.cronops.core.execution;

/**
 * Narrows log reads. Null fields do not filter.
 */
public record LogQuery(String userId, String jobId, ExecutionStatus status) {
    public static LogQuery everything() {
        return new LogQuery(null, null, null);
    }

    public static LogQuery ofUser(String userId) {
        return new LogQuery(userId, null, null);
    }

    public static LogQuery ofJob(String jobId) {
        return new LogQuery(null, jobId, null);
    }

    public LogQuery withStatus(ExecutionStatus newStatus) {
        return new LogQuery(userId, jobId, newStatus);
    }
}
