package io.cronops.core.stats;

import io.cronops.core.execution.ExecutionStatus;
import java.util.List;
import java.util.Map;

/**
 * Execution activity over a trailing window of whole days in the viewer's zone.
 */
public record ActivityReport(
    int days,
    String zone,
    ExecutionSummary executions,
    List<DailyBucket> daily,
    List<HourlyBucket> hourly,
    Map<ExecutionStatus, Long> statusBreakdown
) {
}
