package io.cronops.core.job;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

/**
 * Job fields as submitted by API clients. Every field is optional at this level; {@link JobValidator}
 * decides what a complete definition needs. On update, absent fields keep their current value.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobRequest(
    String name,
    @JsonAlias({"schedule"}) String cronExpression,
    String timezone,
    @JsonAlias({"type"}) String targetType,
    @JsonAlias({"url"}) String targetUrl,
    String httpMethod,
    @JsonAlias({"httpHeaders"}) Map<String, String> headers,
    @JsonAlias({"httpBody"}) String payload,
    @JsonAlias({"script"}) String command,
    @JsonAlias({"retryCount"}) Integer maxRetries,
    @JsonAlias({"retryDelay"}) Integer retryDelaySeconds,
    Long timeout,
    String status
) {

    public static JobRequest from(CronJob job) {
        String url = null;
        String method = null;
        Map<String, String> headers = null;
        String payload = null;
        String command = null;
        if (job.target() instanceof HttpTarget http) {
            url = http.url();
            method = http.method().name();
            headers = http.headers();
            payload = http.payload();
        } else if (job.target() instanceof ScriptTarget script) {
            command = script.command();
        }
        return new JobRequest(
            job.name(),
            job.cronExpression(),
            job.timezone(),
            job.targetType().name(),
            url,
            method,
            headers,
            payload,
            command,
            job.maxRetries(),
            job.retryDelaySeconds(),
            job.timeoutMs(),
            job.status().name()
        );
    }

    /**
     * Fills every field this request leaves out from {@code base}. Switching the target type
     * drops the previous target's fields.
     */
    public JobRequest overlay(JobRequest base) {
        boolean sameType = targetType == null
            || base.targetType() == null
            || targetType.trim().equalsIgnoreCase(base.targetType().trim());
        return new JobRequest(
            pick(name, base.name()),
            pick(cronExpression, base.cronExpression()),
            pick(timezone, base.timezone()),
            pick(targetType, base.targetType()),
            sameType ? pick(targetUrl, base.targetUrl()) : targetUrl,
            sameType ? pick(httpMethod, base.httpMethod()) : httpMethod,
            sameType ? pick(headers, base.headers()) : headers,
            sameType ? pick(payload, base.payload()) : payload,
            sameType ? pick(command, base.command()) : command,
            pick(maxRetries, base.maxRetries()),
            pick(retryDelaySeconds, base.retryDelaySeconds()),
            pick(timeout, base.timeout()),
            pick(status, base.status())
        );
    }

    private static <T> T pick(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
