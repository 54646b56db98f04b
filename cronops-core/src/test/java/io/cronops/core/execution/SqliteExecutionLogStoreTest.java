package io.cronops.core.execution;

import static org.assertj.core.api.Assertions.assertThat;

import io.cronops.core.job.CronJob;
import io.cronops.core.storage.Page;
import io.cronops.core.storage.PageRequest;
import io.cronops.core.support.CoreFixture;
import io.cronops.core.support.Jobs;
import io.cronops.core.support.Logs;
import io.cronops.core.support.MutableClock;
import io.cronops.core.user.Plan;
import io.cronops.core.user.User;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteExecutionLogStoreTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    @TempDir
    Path tempDir;

    private CoreFixture fixture;
    private User alice;
    private CronJob job;

    @BeforeEach
    void setUp() throws Exception {
        fixture = new CoreFixture(tempDir, new MutableClock(NOW));
        alice = fixture.user("alice@example.com", Plan.FREE);
        job = fixture.jobs.create(alice, Jobs.http("ping", "0 * * * *", "https://example.com"));
    }

    @Test
    void shouldCompleteRunningLogExactlyOnce() throws Exception {
        ExecutionLog running = ExecutionLog.running(job.id(), 1, RunTrigger.MANUAL, NOW);
        fixture.logStore.insert(running);

        boolean first = fixture.logStore.complete(running.complete(ExecutionStatus.SUCCESS, 200, "ok", null, NOW.plusMillis(40)));
        boolean second = fixture.logStore.complete(running.complete(ExecutionStatus.FAILED, 500, null, "late", NOW.plusMillis(90)));

        assertThat(first).isTrue();
        assertThat(second).isFalse();
        LogEntry stored = fixture.logStore.findById(running.id()).orElseThrow();
        assertThat(stored.log().status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(stored.log().durationMs()).isEqualTo(40L);
        assertThat(stored.jobName()).isEqualTo("ping");
        assertThat(stored.ownerEmail()).isEqualTo("alice@example.com");
    }

    @Test
    void shouldFailLogsLeftRunningAndLeaveFinishedOnesAlone() throws Exception {
        ExecutionLog stale = ExecutionLog.running(job.id(), 1, RunTrigger.SCHEDULED, NOW);
        fixture.logStore.insert(stale);
        ExecutionLog done = ExecutionLog.running(job.id(), 1, RunTrigger.MANUAL, NOW);
        fixture.logStore.insert(done);
        fixture.logStore.complete(done.complete(ExecutionStatus.SUCCESS, 200, "ok", null, NOW.plusMillis(10)));

        int closed = fixture.logStore.failStaleRunning(NOW.plusSeconds(5), "Interrupted before completion");

        assertThat(closed).isEqualTo(1);
        ExecutionLog failed = fixture.logStore.findById(stale.id()).orElseThrow().log();
        assertThat(failed.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(failed.error()).isEqualTo("Interrupted before completion");
        assertThat(failed.finishedAt()).isEqualTo(NOW.plusSeconds(5));
        assertThat(failed.durationMs()).isEqualTo(5_000L);
        assertThat(fixture.logStore.findById(done.id()).orElseThrow().log().status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(fixture.logStore.failStaleRunning(NOW.plusSeconds(6), "again")).isZero();
    }

    @Test
    void shouldListNewestFirstWithFilters() throws Exception {
        fixture.logStore.insert(Logs.finished(job.id(), ExecutionStatus.SUCCESS, NOW.minusSeconds(300), 10));
        fixture.logStore.insert(Logs.finished(job.id(), ExecutionStatus.FAILED, NOW.minusSeconds(200), 10));
        fixture.logStore.insert(Logs.finished(job.id(), ExecutionStatus.SUCCESS, NOW.minusSeconds(100), 10));

        Page<LogEntry> all = fixture.logStore.list(LogQuery.ofUser(alice.id()), PageRequest.first(2));
        Page<LogEntry> failed = fixture.logStore.list(LogQuery.ofJob(job.id()).withStatus(ExecutionStatus.FAILED), PageRequest.first(10));

        assertThat(all.total()).isEqualTo(3);
        assertThat(all.totalPages()).isEqualTo(2);
        assertThat(all.items()).extracting(entry -> entry.log().startedAt())
            .containsExactly(NOW.minusSeconds(100), NOW.minusSeconds(200));
        assertThat(failed.items()).hasSize(1);
        assertThat(failed.items().get(0).log().error()).isEqualTo("failed");
    }

    @Test
    void shouldAggregateCountsAndDurations() throws Exception {
        fixture.logStore.insert(Logs.finished(job.id(), ExecutionStatus.SUCCESS, NOW.minusSeconds(300), 100));
        fixture.logStore.insert(Logs.finished(job.id(), ExecutionStatus.TIMEOUT, NOW.minusSeconds(200), 300));
        fixture.logStore.insert(ExecutionLog.running(job.id(), 1, RunTrigger.SCHEDULED, NOW));

        Map<ExecutionStatus, Long> counts = fixture.logStore.countByStatus(LogQuery.ofJob(job.id()), null);
        Map<ExecutionStatus, Long> recent = fixture.logStore.countByStatus(LogQuery.ofJob(job.id()), NOW.minusSeconds(250));

        assertThat(counts).containsEntry(ExecutionStatus.SUCCESS, 1L)
            .containsEntry(ExecutionStatus.TIMEOUT, 1L)
            .containsEntry(ExecutionStatus.RUNNING, 1L);
        assertThat(recent.getOrDefault(ExecutionStatus.SUCCESS, 0L)).isZero();
        assertThat(fixture.logStore.averageDurationMs(LogQuery.ofJob(job.id()))).contains(200.0);
        assertThat(fixture.logStore.points(LogQuery.everything(), NOW.minusSeconds(250))).hasSize(2);
    }

    @Test
    void shouldCascadeWhenJobOrOwnerIsDeleted() throws Exception {
        CronJob other = fixture.jobs.create(alice, Jobs.http("other", "0 * * * *", "https://example.com"));
        fixture.logStore.insert(Logs.finished(job.id(), ExecutionStatus.SUCCESS, NOW, 5));
        fixture.logStore.insert(Logs.finished(other.id(), ExecutionStatus.SUCCESS, NOW, 5));

        fixture.jobs.delete(alice, job.id());
        assertThat(fixture.logStore.list(LogQuery.everything(), PageRequest.first(10)).total()).isEqualTo(1);

        fixture.userStore.delete(alice.id());
        assertThat(fixture.jobStore.findById(other.id())).isEmpty();
        assertThat(fixture.logStore.list(LogQuery.everything(), PageRequest.first(10)).total()).isZero();
    }
}
