package io.cronops.core.stats;

import io.cronops.core.error.ValidationException;
import io.cronops.core.execution.ExecutionLogStore;
import io.cronops.core.execution.ExecutionPoint;
import io.cronops.core.execution.ExecutionStatus;
import io.cronops.core.execution.LogQuery;
import io.cronops.core.job.CronJob;
import io.cronops.core.job.JobStore;
import io.cronops.core.storage.PageRequest;
import io.cronops.core.user.Plan;
import io.cronops.core.user.Role;
import io.cronops.core.user.User;
import io.cronops.core.user.UserStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class StatsService {
    public static final Set<Integer> WINDOWS = Set.of(7, 14, 30);
    private static final int RECENT_EXECUTIONS = 5;
    private static final int RECENT_ADMIN_EXECUTIONS = 10;
    private static final int RECENT_USERS = 5;

    private final JobStore jobs;
    private final ExecutionLogStore logs;
    private final UserStore users;
    private final Clock clock;

    public StatsService(JobStore jobs, ExecutionLogStore logs, UserStore users, Clock clock) {
        this.jobs = Objects.requireNonNull(jobs, "jobs must not be null");
        this.logs = Objects.requireNonNull(logs, "logs must not be null");
        this.users = Objects.requireNonNull(users, "users must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public DashboardStats dashboard(User user) throws IOException {
        LogQuery scope = LogQuery.ofUser(user.id());
        return new DashboardStats(
            jobs.countsForUser(user.id()),
            ExecutionSummary.of(logs.countByStatus(scope, null)),
            logs.list(scope, PageRequest.first(RECENT_EXECUTIONS)).items()
        );
    }

    public JobStats jobStats(CronJob job) throws IOException {
        LogQuery scope = LogQuery.ofJob(job.id());
        Double average = logs.averageDurationMs(scope).map(StatsService::round1).orElse(null);
        return new JobStats(
            job.id(),
            ExecutionSummary.of(logs.countByStatus(scope, null)),
            average,
            job.lastRunAt(),
            job.lastStatus(),
            job.nextRunAt()
        );
    }

    public ActivityReport activity(User user, int days, ZoneId zone) throws IOException {
        return activity(LogQuery.ofUser(user.id()), days, zone);
    }

    public AdminStats adminStats() throws IOException {
        List<User> all = users.list();
        Map<Role, Long> byRole = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            byRole.put(role, 0L);
        }
        Map<Plan, Long> byPlan = new EnumMap<>(Plan.class);
        for (Plan plan : Plan.values()) {
            byPlan.put(plan, 0L);
        }
        for (User user : all) {
            byRole.merge(user.role(), 1L, Long::sum);
            byPlan.merge(user.plan(), 1L, Long::sum);
        }
        return new AdminStats(
            all.size(),
            byRole,
            byPlan,
            jobs.countsForAll(),
            ExecutionSummary.of(logs.countByStatus(LogQuery.everything(), null)),
            all.stream().limit(RECENT_USERS).toList(),
            logs.list(LogQuery.everything(), PageRequest.first(RECENT_ADMIN_EXECUTIONS)).items()
        );
    }

    public AdminAnalytics adminAnalytics(int days, ZoneId zone) throws IOException {
        ActivityReport activity = activity(LogQuery.everything(), days, zone);
        List<User> all = users.list();
        return new AdminAnalytics(activity, planDistribution(all), userGrowth(all, days, zone));
    }

    /**
     * Users per plan; plans nobody is on are left out.
     */
    public static Map<Plan, Long> planDistribution(List<User> all) {
        Map<Plan, Long> distribution = new EnumMap<>(Plan.class);
        for (User user : all) {
            distribution.merge(user.plan(), 1L, Long::sum);
        }
        return distribution;
    }

    static double successRate(long successful, long total) {
        if (total <= 0) {
            return 0.0;
        }
        return round1(successful * 100.0 / total);
    }

    private ActivityReport activity(LogQuery scope, int days, ZoneId zone) throws IOException {
        if (!WINDOWS.contains(days)) {
            throw new ValidationException("days must be one of 7, 14, 30");
        }
        List<LocalDate> window = window(days, zone);
        Instant since = window.get(0).atStartOfDay(zone).toInstant();

        Map<LocalDate, long[]> daily = new LinkedHashMap<>();
        for (LocalDate date : window) {
            daily.put(date, new long[3]);
        }
        long[] hourly = new long[24];
        for (ExecutionPoint point : logs.points(scope, since)) {
            ZonedDateTime local = point.startedAt().atZone(zone);
            long[] bucket = daily.get(local.toLocalDate());
            if (bucket != null) {
                bucket[0]++;
                if (point.status() == ExecutionStatus.SUCCESS) {
                    bucket[1]++;
                } else if (point.status() == ExecutionStatus.FAILED || point.status() == ExecutionStatus.TIMEOUT) {
                    bucket[2]++;
                }
            }
            hourly[local.getHour()]++;
        }

        List<DailyBucket> dailyBuckets = new ArrayList<>();
        daily.forEach((date, counts) -> dailyBuckets.add(new DailyBucket(date, counts[0], counts[1], counts[2])));
        List<HourlyBucket> hourlyBuckets = new ArrayList<>();
        for (int hour = 0; hour < 24; hour++) {
            hourlyBuckets.add(new HourlyBucket(hour, hourly[hour]));
        }

        Map<ExecutionStatus, Long> counts = logs.countByStatus(scope, since);
        Map<ExecutionStatus, Long> breakdown = new EnumMap<>(ExecutionStatus.class);
        counts.forEach((status, count) -> {
            if (count > 0) {
                breakdown.put(status, count);
            }
        });

        return new ActivityReport(days, zone.getId(), ExecutionSummary.of(counts), dailyBuckets, hourlyBuckets, breakdown);
    }

    private List<GrowthPoint> userGrowth(List<User> all, int days, ZoneId zone) {
        List<GrowthPoint> growth = new ArrayList<>();
        for (LocalDate date : window(days, zone)) {
            Instant endOfDay = date.plusDays(1).atStartOfDay(zone).toInstant();
            long count = all.stream().filter(user -> user.createdAt().isBefore(endOfDay)).count();
            growth.add(new GrowthPoint(date, count));
        }
        return growth;
    }

    private List<LocalDate> window(int days, ZoneId zone) {
        LocalDate today = LocalDate.ofInstant(clock.instant(), zone);
        List<LocalDate> dates = new ArrayList<>();
        for (int offset = days - 1; offset >= 0; offset--) {
            dates.add(today.minusDays(offset));
        }
        return dates;
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
