package io.cronops.core.quota;

import io.cronops.core.error.QuotaExceededException;
import io.cronops.core.job.CronJob;
import io.cronops.core.job.JobStore;
import io.cronops.core.user.User;
import java.io.IOException;
import java.time.Instant;

/**
 * Gates job creation and resumption on the owner's plan ceiling. The check and the write are
 * one conditional statement in the store, so concurrent requests cannot both take the last slot.
 */
public final class QuotaEnforcer {
    private final JobStore store;

    public QuotaEnforcer(JobStore store) {
        this.store = store;
    }

    public void insert(User owner, CronJob job) throws IOException {
        PlanPolicy policy = PlanPolicy.of(owner.plan());
        if (!store.insertWithinQuota(job, ceilingFor(owner))) {
            throw new QuotaExceededException(owner.plan(), policy.activeJobCeiling());
        }
    }

    /**
     * Returns false when the job was not PAUSED (nothing to do); throws when the ceiling blocks it.
     */
    public boolean activate(User owner, String jobId, Instant nextRunAt, Instant now) throws IOException {
        if (store.activateWithinQuota(jobId, nextRunAt, now, ceilingFor(owner))) {
            return true;
        }
        CronJob current = store.findById(jobId).orElse(null);
        if (current == null || current.isActive()) {
            return false;
        }
        throw new QuotaExceededException(owner.plan(), PlanPolicy.of(owner.plan()).activeJobCeiling());
    }

    private int ceilingFor(User owner) {
        PlanPolicy policy = PlanPolicy.of(owner.plan());
        if (owner.isAdmin() || policy.isUnlimited()) {
            return JobStore.UNBOUNDED;
        }
        return policy.activeJobCeiling();
    }
}
