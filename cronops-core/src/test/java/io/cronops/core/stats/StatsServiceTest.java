package io.cronops.core.stats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cronops.core.error.ValidationException;
import io.cronops.core.execution.ExecutionStatus;
import io.cronops.core.job.CronJob;
import io.cronops.core.support.CoreFixture;
import io.cronops.core.support.Jobs;
import io.cronops.core.support.Logs;
import io.cronops.core.support.MutableClock;
import io.cronops.core.user.Plan;
import io.cronops.core.user.Role;
import io.cronops.core.user.User;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StatsServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    @TempDir
    Path tempDir;

    private CoreFixture fixture;
    private StatsService stats;
    private User alice;
    private CronJob job;

    @BeforeEach
    void setUp() throws Exception {
        MutableClock clock = new MutableClock(NOW);
        fixture = new CoreFixture(tempDir, clock);
        stats = new StatsService(fixture.jobStore, fixture.logStore, fixture.userStore, clock);
        alice = fixture.user("alice@example.com", Plan.PREMIUM);
        job = fixture.jobs.create(alice, Jobs.http("ping", "0 * * * *", "https://example.com"));
        fixture.jobs.create(alice, Jobs.paused("idle"));
    }

    @Test
    void shouldReportZeroSuccessRateWithoutRuns() throws Exception {
        DashboardStats dashboard = stats.dashboard(alice);

        assertThat(dashboard.jobs().total()).isEqualTo(2);
        assertThat(dashboard.jobs().active()).isEqualTo(1);
        assertThat(dashboard.jobs().paused()).isEqualTo(1);
        assertThat(dashboard.executions().total()).isZero();
        assertThat(dashboard.executions().successRate()).isEqualTo(0.0);
        assertThat(dashboard.recentExecutions()).isEmpty();
    }

    @Test
    void shouldSummarizeExecutionsWithRoundedRate() throws Exception {
        fixture.logStore.insert(Logs.finished(job.id(), ExecutionStatus.SUCCESS, NOW.minusSeconds(30), 100));
        fixture.logStore.insert(Logs.finished(job.id(), ExecutionStatus.SUCCESS, NOW.minusSeconds(20), 200));
        fixture.logStore.insert(Logs.finished(job.id(), ExecutionStatus.FAILED, NOW.minusSeconds(10), 150));

        DashboardStats dashboard = stats.dashboard(alice);
        JobStats jobStats = stats.jobStats(job);

        assertThat(dashboard.executions().successful()).isEqualTo(2);
        assertThat(dashboard.executions().failed()).isEqualTo(1);
        assertThat(dashboard.executions().successRate()).isEqualTo(66.7);
        assertThat(dashboard.recentExecutions()).hasSize(3);
        assertThat(jobStats.averageDurationMs()).isEqualTo(150.0);
        assertThat(jobStats.nextRunAt()).isEqualTo(job.nextRunAt());
    }

    @Test
    void shouldBucketActivityByViewerDay() throws Exception {
        // 02:00Z on the 19th is still the evening of the 18th in New York
        fixture.logStore.insert(Logs.finished(job.id(), ExecutionStatus.SUCCESS, Instant.parse("2026-10-19T02:00:00Z"), 10));
        fixture.logStore.insert(Logs.finished(job.id(), ExecutionStatus.TIMEOUT, Instant.parse("2026-10-19T11:00:00Z"), 10));
        fixture.logStore.insert(Logs.finished(job.id(), ExecutionStatus.SUCCESS, NOW.minus(Duration.ofDays(20)), 10));

        ActivityReport report = stats.activity(alice, 7, ZoneId.of("America/New_York"));

        assertThat(report.daily()).hasSize(7);
        assertThat(report.daily().get(6).date()).isEqualTo(LocalDate.parse("2026-10-19"));
        assertThat(report.daily().get(0).date()).isEqualTo(LocalDate.parse("2026-10-13"));
        DailyBucket eighteenth = report.daily().get(5);
        assertThat(eighteenth.total()).isEqualTo(1);
        assertThat(eighteenth.successful()).isEqualTo(1);
        DailyBucket nineteenth = report.daily().get(6);
        assertThat(nineteenth.failed()).isEqualTo(1);
        assertThat(report.daily().get(0).total()).isZero();
        assertThat(report.hourly()).hasSize(24);
        assertThat(report.hourly().get(22).total()).isEqualTo(1);
        assertThat(report.hourly().get(7).total()).isEqualTo(1);
        assertThat(report.executions().total()).isEqualTo(2);
        assertThat(report.statusBreakdown()).containsOnlyKeys(ExecutionStatus.SUCCESS, ExecutionStatus.TIMEOUT);
    }

    @Test
    void shouldRejectUnsupportedWindow() {
        assertThatThrownBy(() -> stats.activity(alice, 10, ZoneOffset.UTC))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("7, 14, 30");
    }

    @Test
    void shouldReportPlatformWideNumbersForAdmins() throws Exception {
        fixture.user("bob@example.com", Plan.FREE);
        fixture.users.create("root@example.com", null, Role.ADMIN, Plan.PRO);
        fixture.logStore.insert(Logs.finished(job.id(), ExecutionStatus.SUCCESS, NOW.minusSeconds(5), 10));

        AdminStats admin = stats.adminStats();
        AdminAnalytics analytics = stats.adminAnalytics(14, ZoneOffset.UTC);

        assertThat(admin.totalUsers()).isEqualTo(3);
        assertThat(admin.usersByRole()).containsEntry(Role.ADMIN, 1L).containsEntry(Role.USER, 2L);
        assertThat(admin.usersByPlan()).containsEntry(Plan.FREE, 1L).containsEntry(Plan.PREMIUM, 1L).containsEntry(Plan.PRO, 1L);
        assertThat(admin.jobs().total()).isEqualTo(2);
        assertThat(admin.executions().successRate()).isEqualTo(100.0);
        assertThat(analytics.activity().daily()).hasSize(14);
        assertThat(analytics.userGrowth()).hasSize(14);
        assertThat(analytics.userGrowth().get(13).users()).isEqualTo(3);
        assertThat(analytics.userGrowth().get(0).users()).isZero();
    }

    @Test
    void planDistributionShouldLeaveOutEmptyPlans() throws Exception {
        fixture.user("bob@example.com", Plan.PREMIUM);

        assertThat(StatsService.planDistribution(fixture.users.list()))
            .containsOnlyKeys(Plan.PREMIUM)
            .containsEntry(Plan.PREMIUM, 2L);
        assertThat(StatsService.successRate(1, 3)).isEqualTo(33.3);
        assertThat(StatsService.successRate(0, 0)).isEqualTo(0.0);
    }
}
