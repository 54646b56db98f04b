package io.cronops.core.execution;

import io.cronops.core.job.CronJob;
import io.cronops.core.job.JobStore;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a job's attempts on the worker pool and schedules its retries. At most one run per job
 * is in flight; a run includes its pending retries.
 */
public final class JobRunner {
    private static final Logger LOG = LoggerFactory.getLogger(JobRunner.class);

    private final JobStore jobs;
    private final Dispatcher dispatcher;
    private final ExecutionLogWriter writer;
    private final RetryPolicy retryPolicy;
    private final ExecutorService workers;
    private final ScheduledExecutorService retryTimer;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public JobRunner(
        JobStore jobs,
        Dispatcher dispatcher,
        ExecutionLogWriter writer,
        RetryPolicy retryPolicy,
        ExecutorService workers,
        ScheduledExecutorService retryTimer
    ) {
        this.jobs = jobs;
        this.dispatcher = dispatcher;
        this.writer = writer;
        this.retryPolicy = retryPolicy;
        this.workers = workers;
        this.retryTimer = retryTimer;
    }

    /**
     * Starts a run unless one is already in flight for the job, in which case nothing happens and
     * the result is empty.
     */
    public Optional<CompletableFuture<RunOutcome>> submit(CronJob job, RunTrigger trigger) {
        if (!inFlight.add(job.id())) {
            LOG.debug("Skipping {} run of job {}: previous run still in flight", trigger, job.id());
            return Optional.empty();
        }
        CompletableFuture<RunOutcome> outcome = new CompletableFuture<>();
        boolean startedActive = job.isActive();
        try {
            workers.execute(() -> attempt(job, trigger, 1, startedActive, outcome));
        } catch (RejectedExecutionException e) {
            finish(new RunOutcome(job.id(), trigger, 0, null), outcome);
        }
        return Optional.of(outcome);
    }

    public boolean isRunning(String jobId) {
        return inFlight.contains(jobId);
    }

    private void attempt(CronJob job, RunTrigger trigger, int attempt, boolean startedActive, CompletableFuture<RunOutcome> outcome) {
        ExecutionLog log;
        try {
            log = writer.start(job.id(), attempt, trigger);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Attempt {} of job {} could not be started", attempt, job.id(), e);
            finish(new RunOutcome(job.id(), trigger, attempt, null), outcome);
            return;
        }

        DispatchResult result = dispatch(job, attempt);
        try {
            record(job, log, result);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Attempt {} of job {} could not be recorded", attempt, job.id(), e);
            finish(new RunOutcome(job.id(), trigger, attempt, null), outcome);
            return;
        }

        if (result.succeeded() || attempt > job.maxRetries()) {
            finish(new RunOutcome(job.id(), trigger, attempt, result.status()), outcome);
            return;
        }

        CronJob current;
        try {
            current = jobs.findById(job.id()).orElse(null);
        } catch (IOException e) {
            LOG.warn("Could not reload job {} before retry", job.id(), e);
            current = null;
        }
        if (current == null || (startedActive && !current.isActive())) {
            LOG.debug("Job {} was deleted or paused, dropping remaining retries", job.id());
            finish(new RunOutcome(job.id(), trigger, attempt, result.status()), outcome);
            return;
        }

        CronJob next = current;
        Duration delay = retryPolicy.delayBefore(attempt, next.retryDelaySeconds());
        LOG.debug("Job {} attempt {} ended {}, retrying in {}", job.id(), attempt, result.status(), delay);
        try {
            retryTimer.schedule(
                () -> runRetry(next, trigger, attempt + 1, startedActive, outcome, result.status()),
                delay.toMillis(),
                TimeUnit.MILLISECONDS
            );
        } catch (RejectedExecutionException e) {
            finish(new RunOutcome(job.id(), trigger, attempt, result.status()), outcome);
        }
    }

    private DispatchResult dispatch(CronJob job, int attempt) {
        try {
            return dispatcher.dispatch(job);
        } catch (RuntimeException e) {
            LOG.warn("Attempt {} of job {} failed unexpectedly", attempt, job.id(), e);
            return DispatchResult.failed(null, null, "Unexpected error: " + e.getMessage());
        }
    }

    private void record(CronJob job, ExecutionLog log, DispatchResult result) throws IOException {
        try {
            writer.finish(log, result);
        } catch (IOException e) {
            // the row must not stay RUNNING
            LOG.warn("Could not record result of log {}, marking it failed", log.id(), e);
            writer.finish(log, DispatchResult.failed(result.statusCode(), null, "Result could not be recorded: " + e.getMessage()));
        }
        jobs.recordRun(job.id(), log.startedAt(), result.status());
    }

    private void runRetry(
        CronJob job,
        RunTrigger trigger,
        int attempt,
        boolean startedActive,
        CompletableFuture<RunOutcome> outcome,
        ExecutionStatus previous
    ) {
        try {
            workers.execute(() -> attempt(job, trigger, attempt, startedActive, outcome));
        } catch (RejectedExecutionException e) {
            finish(new RunOutcome(job.id(), trigger, attempt - 1, previous), outcome);
        }
    }

    private void finish(RunOutcome result, CompletableFuture<RunOutcome> outcome) {
        inFlight.remove(result.jobId());
        outcome.complete(result);
    }
}
