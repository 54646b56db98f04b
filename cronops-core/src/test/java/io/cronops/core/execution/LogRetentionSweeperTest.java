package io.cronops.core.execution;

import static org.assertj.core.api.Assertions.assertThat;

import io.cronops.core.config.model.RetentionConfig;
import io.cronops.core.job.CronJob;
import io.cronops.core.storage.PageRequest;
import io.cronops.core.support.CoreFixture;
import io.cronops.core.support.Jobs;
import io.cronops.core.support.Logs;
import io.cronops.core.support.MutableClock;
import io.cronops.core.user.Plan;
import io.cronops.core.user.User;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LogRetentionSweeperTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void shouldPurgeLogsOlderThanOwnersPlanAllows() throws Exception {
        MutableClock clock = new MutableClock(NOW);
        CoreFixture fixture = new CoreFixture(tempDir, clock);
        User free = fixture.user("free@example.com", Plan.FREE);
        User pro = fixture.user("pro@example.com", Plan.PRO);
        CronJob freeJob = fixture.jobs.create(free, Jobs.http("free", "0 * * * *", "https://example.com"));
        CronJob proJob = fixture.jobs.create(pro, Jobs.http("pro", "0 * * * *", "https://example.com"));

        fixture.logStore.insert(Logs.finished(freeJob.id(), ExecutionStatus.SUCCESS, NOW.minus(Duration.ofDays(8)), 5));
        fixture.logStore.insert(Logs.finished(freeJob.id(), ExecutionStatus.SUCCESS, NOW.minus(Duration.ofDays(1)), 5));
        fixture.logStore.insert(Logs.finished(proJob.id(), ExecutionStatus.SUCCESS, NOW.minus(Duration.ofDays(8)), 5));
        fixture.logStore.insert(Logs.finished(proJob.id(), ExecutionStatus.SUCCESS, NOW.minus(Duration.ofDays(91)), 5));

        LogRetentionSweeper sweeper = new LogRetentionSweeper(fixture.logStore, RetentionConfig.defaults(), clock);

        assertThat(sweeper.sweep()).isEqualTo(2);
        assertThat(fixture.logStore.list(LogQuery.ofJob(freeJob.id()), PageRequest.first(10)).total()).isEqualTo(1);
        assertThat(fixture.logStore.list(LogQuery.ofJob(proJob.id()), PageRequest.first(10)).total()).isEqualTo(1);
        assertThat(sweeper.sweep()).isZero();
    }
}
