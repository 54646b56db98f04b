package io.cronops.core.execution;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One attempt of one run. Starts RUNNING and moves to exactly one terminal status; the timing
 * fields are present only once terminal.
 */
public record ExecutionLog(
    String id,
    String cronJobId,
    int attempt,
    RunTrigger trigger,
    ExecutionStatus status,
    Integer statusCode,
    String response,
    String error,
    Instant startedAt,
    Instant finishedAt,
    Long durationMs
) {
    public ExecutionLog {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(cronJobId, "cronJobId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        trigger = trigger == null ? RunTrigger.SCHEDULED : trigger;
        attempt = Math.max(1, attempt);
        if (status.isTerminal()) {
            if (finishedAt == null || durationMs == null || durationMs < 0) {
                throw new IllegalArgumentException("terminal log requires finishedAt and a non-negative duration");
            }
        } else if (finishedAt != null || durationMs != null) {
            throw new IllegalArgumentException("running log must not carry finishedAt or duration");
        }
    }

    public static ExecutionLog running(String cronJobId, int attempt, RunTrigger trigger, Instant startedAt) {
        return new ExecutionLog(
            UUID.randomUUID().toString(),
            cronJobId,
            attempt,
            trigger,
            ExecutionStatus.RUNNING,
            null,
            null,
            null,
            startedAt,
            null,
            null
        );
    }

    public ExecutionLog complete(ExecutionStatus terminal, Integer code, String body, String failure, Instant finished) {
        if (status.isTerminal()) {
            throw new IllegalStateException("execution log " + id + " is already " + status);
        }
        if (terminal == null || !terminal.isTerminal()) {
            throw new IllegalArgumentException("completion status must be terminal");
        }
        Instant end = finished.isBefore(startedAt) ? startedAt : finished;
        long duration = Duration.between(startedAt, end).toMillis();
        String recordedError = terminal == ExecutionStatus.SUCCESS ? null : failure;
        return new ExecutionLog(id, cronJobId, attempt, trigger, terminal, code, body, recordedError, startedAt, end, duration);
    }
}
