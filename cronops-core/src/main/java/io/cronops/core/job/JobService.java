package io.cronops.core.job;

import io.cronops.core.error.NotFoundException;
import io.cronops.core.error.ValidationException;
import io.cronops.core.quota.QuotaEnforcer;
import io.cronops.core.schedule.CronSchedule;
import io.cronops.core.storage.Page;
import io.cronops.core.storage.PageRequest;
import io.cronops.core.user.User;
import io.cronops.core.user.UserStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

public final class JobService {
    private final JobStore store;
    private final UserStore users;
    private final QuotaEnforcer quota;
    private final JobValidator validator;
    private final JobLocks locks;
    private final JobChangeListener listener;
    private final Clock clock;

    public JobService(
        JobStore store,
        UserStore users,
        QuotaEnforcer quota,
        JobValidator validator,
        JobLocks locks,
        JobChangeListener listener,
        Clock clock
    ) {
        this.store = store;
        this.users = users;
        this.quota = quota;
        this.validator = validator;
        this.locks = locks;
        this.listener = listener == null ? JobChangeListener.NONE : listener;
        this.clock = clock;
    }

    public CronJob create(User owner, JobRequest request) throws IOException {
        JobDefinition definition = validator.validate(request);
        Instant now = clock.instant();
        Instant nextRunAt = definition.status() == JobStatus.ACTIVE ? firstRun(definition.schedule(), now) : null;
        CronJob job = new CronJob(
            UUID.randomUUID().toString(),
            owner.id(),
            definition.name(),
            definition.cronExpression(),
            definition.timezone(),
            definition.target(),
            definition.maxRetries(),
            definition.retryDelaySeconds(),
            definition.timeoutMs(),
            definition.status(),
            null,
            null,
            nextRunAt,
            now,
            now
        );
        quota.insert(owner, job);
        listener.jobChanged(job.id());
        return job;
    }

    public CronJob get(User caller, String id) throws IOException {
        return requireVisible(caller, id);
    }

    public Page<CronJob> list(User caller, JobStatus status, String search, PageRequest page) throws IOException {
        return store.listByUser(caller.id(), status, search, page);
    }

    public CronJob update(User caller, String id, JobRequest patch) throws IOException {
        if (patch == null) {
            throw new ValidationException("request body is required");
        }
        return locks.withLock(id, () -> {
            CronJob existing = requireVisible(caller, id);
            JobDefinition definition = validator.validate(patch.overlay(JobRequest.from(existing)));
            Instant now = clock.instant();
            CronJob updated = new CronJob(
                existing.id(),
                existing.userId(),
                definition.name(),
                definition.cronExpression(),
                definition.timezone(),
                definition.target(),
                definition.maxRetries(),
                definition.retryDelaySeconds(),
                definition.timeoutMs(),
                existing.status(),
                existing.lastRunAt(),
                existing.lastStatus(),
                existing.isActive() ? firstRun(definition.schedule(), now) : null,
                existing.createdAt(),
                now
            );
            store.updateDefinition(updated);
            if (definition.status() != existing.status()) {
                if (definition.status() == JobStatus.PAUSED) {
                    store.pause(id, now);
                } else {
                    activate(existing, definition.schedule(), now);
                }
            }
            listener.jobChanged(id);
            return reload(id);
        });
    }

    public void delete(User caller, String id) throws IOException {
        locks.withLock(id, () -> {
            requireVisible(caller, id);
            store.delete(id);
            listener.jobChanged(id);
            return null;
        });
        locks.forget(id);
    }

    public CronJob pause(User caller, String id) throws IOException {
        return locks.withLock(id, () -> {
            CronJob existing = requireVisible(caller, id);
            if (existing.isActive()) {
                store.pause(id, clock.instant());
                listener.jobChanged(id);
            }
            return reload(id);
        });
    }

    public CronJob resume(User caller, String id) throws IOException {
        return locks.withLock(id, () -> {
            CronJob existing = requireVisible(caller, id);
            if (!existing.isActive()) {
                Instant now = clock.instant();
                activate(existing, CronSchedule.parse(existing.cronExpression(), existing.timezone()), now);
                listener.jobChanged(id);
            }
            return reload(id);
        });
    }

    /**
     * Returns the job if {@code caller} owns it or is an admin. Jobs of other users are reported as
     * missing rather than forbidden.
     */
    public CronJob requireVisible(User caller, String id) throws IOException {
        CronJob job = store.findById(id).orElseThrow(() -> new NotFoundException("job", id));
        if (!caller.isAdmin() && !job.userId().equals(caller.id())) {
            throw new NotFoundException("job", id);
        }
        return job;
    }

    private void activate(CronJob existing, CronSchedule schedule, Instant now) throws IOException {
        User owner = users.findById(existing.userId())
            .orElseThrow(() -> new NotFoundException("user", existing.userId()));
        quota.activate(owner, existing.id(), firstRun(schedule, now), now);
    }

    private CronJob reload(String id) throws IOException {
        return store.findById(id).orElseThrow(() -> new NotFoundException("job", id));
    }

    private static Instant firstRun(CronSchedule schedule, Instant now) {
        return schedule.nextAfter(now)
            .orElseThrow(() -> new ValidationException("cronExpression has no future execution: " + schedule.expression()));
    }
}
