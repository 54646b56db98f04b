package io.cronops.core.stats;

import io.cronops.core.execution.ExecutionStatus;
import java.time.Instant;

public record JobStats(
    String jobId,
    ExecutionSummary executions,
    Double averageDurationMs,
    Instant lastRunAt,
    ExecutionStatus lastStatus,
    Instant nextRunAt
) {
}
