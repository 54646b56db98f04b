package io.cronops.core.schedule;

import io.cronops.core.job.CronJob;
import io.cronops.core.job.JobChangeListener;
import io.cronops.core.job.JobStore;
import io.cronops.core.user.Plan;
import io.cronops.core.user.User;
import io.cronops.core.user.UserStore;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The scheduler's view of ACTIVE jobs and their owners' plans. Reloaded from the stores on the
 * next read after any job mutation or plan change.
 */
public final class JobCache implements JobChangeListener {
    private final JobStore jobs;
    private final UserStore users;
    private final Map<String, ScheduledJob> entries = new LinkedHashMap<>();
    private volatile boolean stale = true;

    public JobCache(JobStore jobs, UserStore users) {
        this.jobs = jobs;
        this.users = users;
    }

    public synchronized List<ScheduledJob> activeJobs() throws IOException {
        if (stale) {
            reload();
        }
        return new ArrayList<>(entries.values());
    }

    /**
     * Records bookkeeping the scheduler wrote itself, so that it does not force a reload.
     */
    public synchronized void refresh(CronJob job) {
        ScheduledJob existing = entries.get(job.id());
        if (existing == null) {
            return;
        }
        if (job.isActive()) {
            entries.put(job.id(), new ScheduledJob(job, existing.ownerPlan()));
        } else {
            entries.remove(job.id());
        }
    }

    @Override
    public void jobChanged(String jobId) {
        stale = true;
    }

    @Override
    public void ownerChanged(String userId) {
        stale = true;
    }

    private void reload() throws IOException {
        // cleared first so an invalidation that races this reload triggers another one
        stale = false;
        try {
            Map<String, Plan> plans = new HashMap<>();
            for (User user : users.list()) {
                plans.put(user.id(), user.plan());
            }
            entries.clear();
            for (CronJob job : jobs.listActive()) {
                entries.put(job.id(), new ScheduledJob(job, plans.getOrDefault(job.userId(), Plan.FREE)));
            }
        } catch (IOException | RuntimeException e) {
            stale = true;
            throw e;
        }
    }
}
