package io.cronops.core.error;

import io.cronops.core.user.Plan;

public final class QuotaExceededException extends CronOpsException {
    private final Plan plan;
    private final int limit;

    public QuotaExceededException(Plan plan, int limit) {
        super(
            "quota_exceeded",
            "The " + plan.name() + " plan allows " + limit + " active jobs. Pause a job or upgrade your plan."
        );
        this.plan = plan;
        this.limit = limit;
    }

    public Plan plan() {
        return plan;
    }

    public int limit() {
        return limit;
    }
}
