package io.cronops.core.job;

import io.cronops.core.config.model.DispatchConfig;
import io.cronops.core.error.ValidationException;
import io.cronops.core.schedule.CronSchedule;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import okhttp3.Headers;

public final class JobValidator {
    static final int MAX_NAME_LENGTH = 200;
    static final int MAX_RETRIES = 10;
    static final long MAX_TIMEOUT_MS = 300_000L;
    static final int MAX_RETRY_DELAY_SECONDS = 86_400;

    private final DispatchConfig defaults;
    private final Clock clock;

    public JobValidator(DispatchConfig defaults, Clock clock) {
        this.defaults = defaults;
        this.clock = clock;
    }

    public JobDefinition validate(JobRequest request) {
        if (request == null) {
            throw new ValidationException("request body is required");
        }

        String name = request.name() == null ? "" : request.name().trim();
        if (name.isEmpty()) {
            throw new ValidationException("name is required");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("name must be at most " + MAX_NAME_LENGTH + " characters");
        }

        CronSchedule schedule = CronSchedule.parse(request.cronExpression(), request.timezone());
        if (schedule.nextAfter(clock.instant()).isEmpty()) {
            throw new ValidationException("cronExpression has no future execution: " + schedule.expression());
        }

        JobTarget target = switch (TargetType.parse(request.targetType())) {
            case HTTP -> httpTarget(request);
            case SCRIPT -> scriptTarget(request);
        };

        int maxRetries = request.maxRetries() == null ? defaults.defaultMaxRetries() : request.maxRetries();
        if (maxRetries < 0 || maxRetries > MAX_RETRIES) {
            throw new ValidationException("maxRetries must be between 0 and " + MAX_RETRIES);
        }

        long timeoutMs = request.timeout() == null ? defaults.defaultTimeoutMs() : request.timeout();
        if (timeoutMs < 1 || timeoutMs > MAX_TIMEOUT_MS) {
            throw new ValidationException("timeout must be between 1 and " + MAX_TIMEOUT_MS + " ms");
        }

        Integer retryDelay = request.retryDelaySeconds();
        if (retryDelay != null && (retryDelay < 0 || retryDelay > MAX_RETRY_DELAY_SECONDS)) {
            throw new ValidationException("retryDelaySeconds must be between 0 and " + MAX_RETRY_DELAY_SECONDS);
        }

        JobStatus status = request.status() == null ? JobStatus.ACTIVE : JobStatus.parse(request.status());
        return new JobDefinition(name, schedule, target, maxRetries, retryDelay, timeoutMs, status);
    }

    private HttpTarget httpTarget(JobRequest request) {
        String url = request.targetUrl() == null ? "" : request.targetUrl().trim();
        if (url.isEmpty()) {
            throw new ValidationException("targetUrl is required for HTTP jobs");
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!uri.isAbsolute() || !(scheme.equals("http") || scheme.equals("https")) || uri.getHost() == null) {
                throw new ValidationException("targetUrl must be an absolute http(s) URL");
            }
        } catch (URISyntaxException e) {
            throw new ValidationException("targetUrl is not a valid URL: " + url);
        }

        Map<String, String> headers = request.headers() == null ? Map.of() : request.headers();
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (header.getKey() == null || header.getKey().isBlank()) {
                throw new ValidationException("header names must not be blank");
            }
            if (header.getValue() == null) {
                throw new ValidationException("header '" + header.getKey() + "' has no value");
            }
            try {
                new Headers.Builder().add(header.getKey(), header.getValue());
            } catch (IllegalArgumentException e) {
                throw new ValidationException("invalid header: " + e.getMessage());
            }
        }
        return new HttpTarget(url, HttpMethod.parse(request.httpMethod()), headers, request.payload());
    }

    private ScriptTarget scriptTarget(JobRequest request) {
        String command = request.command() == null ? "" : request.command().trim();
        if (command.isEmpty()) {
            throw new ValidationException("command is required for SCRIPT jobs");
        }
        return new ScriptTarget(command);
    }
}
