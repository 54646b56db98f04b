package io.cronops.core.runtime;

import io.cronops.core.api.ApiContext;
import io.cronops.core.api.ApiServer;
import io.cronops.core.config.ConfigPaths;
import io.cronops.core.config.model.CronOpsConfig;
import io.cronops.core.config.model.DispatchConfig;
import io.cronops.core.config.model.SchedulerConfig;
import io.cronops.core.config.model.ServerConfig;
import io.cronops.core.execution.Dispatcher;
import io.cronops.core.execution.ExecutionLogStore;
import io.cronops.core.execution.ExecutionLogWriter;
import io.cronops.core.execution.HttpTargetExecutor;
import io.cronops.core.execution.JobRunner;
import io.cronops.core.execution.LogRetentionSweeper;
import io.cronops.core.execution.RetryPolicy;
import io.cronops.core.execution.ScriptTargetExecutor;
import io.cronops.core.execution.SqliteExecutionLogStore;
import io.cronops.core.job.JobLocks;
import io.cronops.core.job.JobService;
import io.cronops.core.job.JobStore;
import io.cronops.core.job.JobValidator;
import io.cronops.core.job.SqliteJobStore;
import io.cronops.core.quota.QuotaEnforcer;
import io.cronops.core.schedule.JobCache;
import io.cronops.core.schedule.JobScheduler;
import io.cronops.core.stats.StatsService;
import io.cronops.core.storage.SqliteDatabase;
import io.cronops.core.user.SqliteUserStore;
import io.cronops.core.user.UserService;
import io.cronops.core.user.UserStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires stores, services, the scheduler and its executors from one config. Closing it stops the
 * background work and any API server it started.
 */
public final class CronOpsRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(CronOpsRuntime.class);

    private final CronOpsConfig config;
    private final Clock clock;
    private final UserStore userStore;
    private final JobStore jobStore;
    private final ExecutionLogStore logStore;
    private final UserService users;
    private final JobService jobs;
    private final StatsService stats;
    private final JobRunner runner;
    private final JobScheduler scheduler;
    private final LogRetentionSweeper sweeper;
    private final ExecutorService workers;
    private final ScheduledExecutorService timers;
    private ApiServer apiServer;
    private boolean started;

    private CronOpsRuntime(CronOpsConfig config, Clock clock) throws IOException {
        this.config = config;
        this.clock = clock;
        SqliteDatabase database = new SqliteDatabase(ConfigPaths.resolveDatabase(config.storage().databasePath()));
        this.userStore = new SqliteUserStore(database);
        this.jobStore = new SqliteJobStore(database);
        this.logStore = new SqliteExecutionLogStore(database);

        JobCache cache = new JobCache(jobStore, userStore);
        JobLocks locks = new JobLocks();
        DispatchConfig dispatch = config.dispatch();
        this.jobs = new JobService(
            jobStore,
            userStore,
            new QuotaEnforcer(jobStore),
            new JobValidator(dispatch, clock),
            locks,
            cache,
            clock
        );
        this.users = new UserService(userStore, jobStore, cache, clock);
        this.stats = new StatsService(jobStore, logStore, userStore, clock);

        SchedulerConfig schedulerConfig = config.scheduler();
        this.workers = Executors.newFixedThreadPool(Math.max(1, schedulerConfig.workerThreads()), named("cronops-worker"));
        this.timers = Executors.newScheduledThreadPool(1, named("cronops-timer"));
        this.runner = new JobRunner(
            jobStore,
            new Dispatcher(
                new HttpTargetExecutor(dispatch.maxResponseChars()),
                new ScriptTargetExecutor(dispatch.shell(), dispatch.maxResponseChars())
            ),
            new ExecutionLogWriter(logStore, clock),
            new RetryPolicy(dispatch.defaultRetryDelaySeconds(), dispatch.maxRetryDelaySeconds()),
            workers,
            timers
        );
        this.scheduler = new JobScheduler(cache, jobStore, locks, runner, clock, Duration.ofMillis(schedulerConfig.tickMillis()));
        this.sweeper = new LogRetentionSweeper(logStore, config.retention(), clock);
    }

    public static CronOpsRuntime open(CronOpsConfig config, Clock clock) throws IOException {
        return new CronOpsRuntime(config, clock);
    }

    /**
     * Fails execution logs a previous process left RUNNING, then starts the scheduler loop and
     * the periodic retention sweep.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        closeStaleRuns();
        scheduler.start();
        long sweepMinutes = Math.max(1, config.scheduler().retentionSweepMinutes());
        timers.scheduleWithFixedDelay(this::sweepSafely, sweepMinutes, sweepMinutes, TimeUnit.MINUTES);
    }

    public synchronized ApiServer startApi(ServerConfig serverConfig) {
        if (apiServer == null) {
            apiServer = new ApiServer(serverConfig, new ApiContext(jobs, jobStore, users, stats, logStore, runner));
            apiServer.start();
        }
        return apiServer;
    }

    public CronOpsConfig config() {
        return config;
    }

    public UserService users() {
        return users;
    }

    public JobService jobs() {
        return jobs;
    }

    public JobStore jobStore() {
        return jobStore;
    }

    public ExecutionLogStore logStore() {
        return logStore;
    }

    public StatsService stats() {
        return stats;
    }

    public JobRunner runner() {
        return runner;
    }

    public JobScheduler scheduler() {
        return scheduler;
    }

    public LogRetentionSweeper sweeper() {
        return sweeper;
    }

    @Override
    public synchronized void close() {
        if (apiServer != null) {
            apiServer.close();
            apiServer = null;
        }
        scheduler.close();
        timers.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void closeStaleRuns() {
        try {
            int closed = logStore.failStaleRunning(clock.instant(), "Interrupted before completion");
            if (closed > 0) {
                LOG.warn("Marked {} execution logs left RUNNING by a previous process as FAILED", closed);
            }
        } catch (IOException e) {
            LOG.warn("Could not close execution logs left RUNNING", e);
        }
    }

    private void sweepSafely() {
        try {
            sweeper.sweep();
        } catch (Exception e) {
            LOG.warn("Retention sweep failed", e);
        }
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
