package io.cronops.core.execution;

import java.time.Duration;

/**
 * Exponential backoff between attempts: the job's base delay doubled for every retry already made,
 * never above the configured ceiling.
 */
public final class RetryPolicy {
    private final int defaultDelaySeconds;
    private final int maxDelaySeconds;

    public RetryPolicy(int defaultDelaySeconds, int maxDelaySeconds) {
        this.defaultDelaySeconds = Math.max(0, defaultDelaySeconds);
        this.maxDelaySeconds = Math.max(0, maxDelaySeconds);
    }

    /**
     * Delay before retry number {@code retry} (1 for the first retry).
     */
    public Duration delayBefore(int retry, Integer jobDelaySeconds) {
        long base = jobDelaySeconds == null ? defaultDelaySeconds : Math.max(0, jobDelaySeconds);
        long delay = base;
        for (int i = 1; i < retry && delay < maxDelaySeconds; i++) {
            delay *= 2;
        }
        return Duration.ofSeconds(Math.min(delay, maxDelaySeconds));
    }
}
