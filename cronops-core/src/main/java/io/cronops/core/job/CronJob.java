package io.cronops.core.job;

import io.cronops.core.execution.ExecutionStatus;
import java.time.Instant;
import java.util.Objects;

public record CronJob(
    String id,
    String userId,
    String name,
    String cronExpression,
    String timezone,
    JobTarget target,
    int maxRetries,
    Integer retryDelaySeconds,
    long timeoutMs,
    JobStatus status,
    Instant lastRunAt,
    ExecutionStatus lastStatus,
    Instant nextRunAt,
    Instant createdAt,
    Instant updatedAt
) {
    public CronJob {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(target, "target must not be null");
        name = name == null ? "" : name.trim();
        cronExpression = cronExpression == null ? "" : cronExpression.trim();
        timezone = timezone == null || timezone.isBlank() ? "UTC" : timezone.trim();
        status = status == null ? JobStatus.ACTIVE : status;
        // paused jobs carry no schedule
        nextRunAt = status == JobStatus.PAUSED ? null : nextRunAt;
    }

    public boolean isActive() {
        return status == JobStatus.ACTIVE;
    }

    public TargetType targetType() {
        return target.type();
    }

    public CronJob withNextRunAt(Instant newNextRunAt) {
        return new CronJob(id, userId, name, cronExpression, timezone, target, maxRetries, retryDelaySeconds,
            timeoutMs, status, lastRunAt, lastStatus, newNextRunAt, createdAt, updatedAt);
    }
}
