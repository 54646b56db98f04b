package io.cronops.core.stats;

import io.cronops.core.execution.LogEntry;
import io.cronops.core.job.JobCounts;
import java.util.List;

public record DashboardStats(JobCounts jobs, ExecutionSummary executions, List<LogEntry> recentExecutions) {
}
