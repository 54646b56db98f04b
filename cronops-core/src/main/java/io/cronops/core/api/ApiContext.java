package io.cronops.core.api;

import io.cronops.core.execution.ExecutionLogStore;
import io.cronops.core.execution.JobRunner;
import io.cronops.core.job.JobService;
import io.cronops.core.job.JobStore;
import io.cronops.core.stats.StatsService;
import io.cronops.core.user.UserService;

/**
 * The services the REST surface calls into.
 */
public record ApiContext(
    JobService jobs,
    JobStore jobStore,
    UserService users,
    StatsService stats,
    ExecutionLogStore logs,
    JobRunner runner
) {
}
