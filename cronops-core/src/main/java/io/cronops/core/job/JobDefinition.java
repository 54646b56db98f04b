package io.cronops.core.job;

import io.cronops.core.schedule.CronSchedule;

/**
 * A validated, fully defaulted job definition.
 */
public record JobDefinition(
    String name,
    CronSchedule schedule,
    JobTarget target,
    int maxRetries,
    Integer retryDelaySeconds,
    long timeoutMs,
    JobStatus status
) {

    public String cronExpression() {
        return schedule.expression();
    }

    public String timezone() {
        return schedule.zone().getId();
    }
}
