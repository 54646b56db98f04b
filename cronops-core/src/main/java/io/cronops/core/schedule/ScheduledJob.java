package io.cronops.core.schedule;

import io.cronops.core.job.CronJob;
import io.cronops.core.user.Plan;

public record ScheduledJob(CronJob job, Plan ownerPlan) {
}
