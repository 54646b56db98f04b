package io.cronops.core.schedule;

import io.cronops.core.execution.JobRunner;
import io.cronops.core.execution.RunTrigger;
import io.cronops.core.job.CronJob;
import io.cronops.core.job.JobLocks;
import io.cronops.core.job.JobStore;
import io.cronops.core.quota.PlanPolicy;
import io.cronops.core.user.Plan;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ticks on a single thread and fires ACTIVE jobs whose {@code nextRunAt} has passed. Each plan's
 * jobs are only looked at once per resolution slot of that plan.
 */
public final class JobScheduler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(JobScheduler.class);

    private final JobCache cache;
    private final JobStore store;
    private final JobLocks locks;
    private final JobRunner runner;
    private final Clock clock;
    private final Duration tick;
    private final Map<Plan, Long> lastSlots = new EnumMap<>(Plan.class);
    private ScheduledExecutorService executor;

    public JobScheduler(JobCache cache, JobStore store, JobLocks locks, JobRunner runner, Clock clock, Duration tick) {
        this.cache = cache;
        this.store = store;
        this.locks = locks;
        this.runner = runner;
        this.clock = clock;
        this.tick = tick == null || tick.isZero() || tick.isNegative() ? Duration.ofSeconds(1) : tick;
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "cronops-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(this::tickSafely, 0, tick.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Scheduler started with tick {} ms", tick.toMillis());
    }

    /**
     * Evaluates due jobs once. Returns how many runs were handed to the runner.
     */
    public synchronized int tick() throws IOException {
        Instant now = clock.instant();
        Set<Plan> duePlans = advanceSlots(now);
        if (duePlans.isEmpty()) {
            return 0;
        }
        int fired = 0;
        for (ScheduledJob entry : cache.activeJobs()) {
            CronJob job = entry.job();
            if (!duePlans.contains(entry.ownerPlan()) || job.nextRunAt() == null || job.nextRunAt().isAfter(now)) {
                continue;
            }
            if (fire(job.id(), now)) {
                fired++;
            }
        }
        return fired;
    }

    @Override
    public synchronized void close() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        executor = null;
        LOG.info("Scheduler stopped");
    }

    private Set<Plan> advanceSlots(Instant now) {
        Set<Plan> due = EnumSet.noneOf(Plan.class);
        for (Plan plan : Plan.values()) {
            long resolution = Math.max(1, PlanPolicy.of(plan).resolution().getSeconds());
            long slot = now.getEpochSecond() / resolution;
            Long previous = lastSlots.get(plan);
            if (previous == null || slot != previous) {
                lastSlots.put(plan, slot);
                due.add(plan);
            }
        }
        return due;
    }

    private boolean fire(String jobId, Instant now) throws IOException {
        return locks.withLock(jobId, () -> {
            CronJob current = store.findById(jobId).orElse(null);
            if (current == null || !current.isActive()) {
                cache.jobChanged(jobId);
                return false;
            }
            if (current.nextRunAt() == null || current.nextRunAt().isAfter(now)) {
                cache.refresh(current);
                return false;
            }
            Optional<Instant> upcoming = CronSchedule.parse(current.cronExpression(), current.timezone()).nextAfter(now);
            if (upcoming.isEmpty()) {
                // ACTIVE implies a next run
                LOG.warn("Job {} has no execution after {} for '{}', pausing it", jobId, now, current.cronExpression());
                store.pause(jobId, now);
                cache.jobChanged(jobId);
                return runner.submit(current, RunTrigger.SCHEDULED).isPresent();
            }
            Instant next = upcoming.get();
            store.updateNextRunAt(jobId, next);
            CronJob advanced = current.withNextRunAt(next);
            cache.refresh(advanced);
            LOG.debug("Firing job {} (next run {})", jobId, next);
            return runner.submit(advanced, RunTrigger.SCHEDULED).isPresent();
        });
    }

    private void tickSafely() {
        try {
            tick();
        } catch (Exception e) {
            LOG.warn("Scheduler tick failed", e);
        }
    }
}
