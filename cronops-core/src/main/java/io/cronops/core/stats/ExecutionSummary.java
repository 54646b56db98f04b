package io.cronops.core.stats;

import io.cronops.core.execution.ExecutionStatus;
import java.util.Map;

public record ExecutionSummary(long total, long successful, long failed, long timedOut, long running, double successRate) {

    public static ExecutionSummary of(Map<ExecutionStatus, Long> counts) {
        long successful = counts.getOrDefault(ExecutionStatus.SUCCESS, 0L);
        long failed = counts.getOrDefault(ExecutionStatus.FAILED, 0L);
        long timedOut = counts.getOrDefault(ExecutionStatus.TIMEOUT, 0L);
        long running = counts.getOrDefault(ExecutionStatus.RUNNING, 0L);
        long total = successful + failed + timedOut + running;
        return new ExecutionSummary(total, successful, failed, timedOut, running, StatsService.successRate(successful, total));
    }
}
