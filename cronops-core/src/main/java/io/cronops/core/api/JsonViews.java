package io.cronops.core.api;

import io.cronops.core.execution.ExecutionLog;
import io.cronops.core.execution.LogEntry;
import io.cronops.core.job.CronJob;
import io.cronops.core.job.HttpTarget;
import io.cronops.core.job.OwnedJob;
import io.cronops.core.job.ScriptTarget;
import io.cronops.core.stats.AdminAnalytics;
import io.cronops.core.stats.AdminStats;
import io.cronops.core.stats.DashboardStats;
import io.cronops.core.stats.JobStats;
import io.cronops.core.storage.Page;
import io.cronops.core.user.User;
import io.cronops.core.user.UserProfile;
import io.cronops.core.user.UserSummary;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Wire shapes of the REST payloads. Jobs are flattened so that only the fields of their target
 * kind appear.
 */
final class JsonViews {

    private JsonViews() {
    }

    static Map<String, Object> job(CronJob job) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", job.id());
        view.put("userId", job.userId());
        view.put("name", job.name());
        view.put("cronExpression", job.cronExpression());
        view.put("timezone", job.timezone());
        view.put("targetType", job.targetType().name());
        if (job.target() instanceof HttpTarget http) {
            view.put("targetUrl", http.url());
            view.put("httpMethod", http.method().name());
            view.put("headers", http.headers());
            view.put("payload", http.payload());
        } else if (job.target() instanceof ScriptTarget script) {
            view.put("command", script.command());
        }
        view.put("maxRetries", job.maxRetries());
        view.put("retryDelaySeconds", job.retryDelaySeconds());
        view.put("timeout", job.timeoutMs());
        view.put("status", job.status().name());
        view.put("lastRunAt", job.lastRunAt());
        view.put("lastStatus", job.lastStatus());
        view.put("nextRunAt", job.nextRunAt());
        view.put("createdAt", job.createdAt());
        view.put("updatedAt", job.updatedAt());
        return view;
    }

    static Map<String, Object> ownedJob(OwnedJob owned) {
        Map<String, Object> view = job(owned.job());
        view.put("user", Map.of("id", owned.job().userId(), "email", owned.ownerEmail(), "name", owned.ownerName()));
        view.put("executionCount", owned.executionCount());
        return view;
    }

    static Map<String, Object> log(LogEntry entry) {
        ExecutionLog log = entry.log();
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", log.id());
        view.put("cronJobId", log.cronJobId());
        view.put("cronJob", Map.of("id", log.cronJobId(), "name", entry.jobName()));
        view.put("attempt", log.attempt());
        view.put("trigger", log.trigger().name());
        view.put("status", log.status().name());
        view.put("statusCode", log.statusCode());
        view.put("response", log.response());
        view.put("error", log.error());
        view.put("startedAt", log.startedAt());
        view.put("finishedAt", log.finishedAt());
        view.put("duration", log.durationMs());
        return view;
    }

    static Map<String, Object> adminLog(LogEntry entry) {
        Map<String, Object> view = log(entry);
        view.put("user", Map.of("id", entry.userId(), "email", entry.ownerEmail()));
        return view;
    }

    static Map<String, Object> user(User user) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", user.id());
        view.put("email", user.email());
        view.put("name", user.name());
        view.put("role", user.role().name());
        view.put("plan", user.plan().name());
        view.put("createdAt", user.createdAt());
        return view;
    }

    static Map<String, Object> userSummary(UserSummary summary) {
        Map<String, Object> view = user(summary.user());
        view.put("jobCount", summary.jobCount());
        return view;
    }

    static Map<String, Object> profile(UserProfile profile) {
        Map<String, Object> view = user(profile.user());
        Map<String, Object> quota = new LinkedHashMap<>();
        quota.put("activeJobs", profile.activeJobs());
        quota.put("limit", profile.activeJobLimit());
        view.put("quota", quota);
        return view;
    }

    static Map<String, Object> dashboard(DashboardStats stats) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("jobs", stats.jobs());
        view.put("executions", stats.executions());
        view.put("recentExecutions", stats.recentExecutions().stream().map(JsonViews::log).toList());
        return view;
    }

    static Map<String, Object> jobStats(JobStats stats) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("jobId", stats.jobId());
        view.put("executions", stats.executions());
        view.put("averageDurationMs", stats.averageDurationMs());
        view.put("lastRunAt", stats.lastRunAt());
        view.put("lastStatus", stats.lastStatus());
        view.put("nextRunAt", stats.nextRunAt());
        return view;
    }

    static Map<String, Object> adminStats(AdminStats stats) {
        Map<String, Object> users = new LinkedHashMap<>();
        users.put("total", stats.totalUsers());
        users.put("byRole", stats.usersByRole());
        users.put("byPlan", stats.usersByPlan());

        Map<String, Object> view = new LinkedHashMap<>();
        view.put("users", users);
        view.put("jobs", stats.jobs());
        view.put("executions", stats.executions());
        view.put("recentUsers", stats.recentUsers().stream().map(JsonViews::user).toList());
        view.put("recentExecutions", stats.recentExecutions().stream().map(JsonViews::adminLog).toList());
        return view;
    }

    static Map<String, Object> adminAnalytics(AdminAnalytics analytics) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("activity", analytics.activity());
        view.put("planDistribution", analytics.planDistribution());
        view.put("userGrowth", analytics.userGrowth());
        return view;
    }

    static <T> Map<String, Object> page(String key, Page<T> page, Function<T, Map<String, Object>> view) {
        Map<String, Object> pagination = new LinkedHashMap<>();
        pagination.put("page", page.page());
        pagination.put("limit", page.limit());
        pagination.put("total", page.total());
        pagination.put("totalPages", page.totalPages());

        Map<String, Object> payload = new LinkedHashMap<>();
        List<Map<String, Object>> items = page.items().stream().map(view).toList();
        payload.put(key, items);
        payload.put("pagination", pagination);
        return payload;
    }
}
