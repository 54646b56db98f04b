package io.cronops.core.stats;

import io.cronops.core.execution.LogEntry;
import io.cronops.core.job.JobCounts;
import io.cronops.core.user.Plan;
import io.cronops.core.user.Role;
import io.cronops.core.user.User;
import java.util.List;
import java.util.Map;

public record AdminStats(
    long totalUsers,
    Map<Role, Long> usersByRole,
    Map<Plan, Long> usersByPlan,
    JobCounts jobs,
    ExecutionSummary executions,
    List<User> recentUsers,
    List<LogEntry> recentExecutions
) {
}
