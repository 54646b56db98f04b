package io.cronops.core.execution;

import io.cronops.core.job.JobTarget;
import java.time.Duration;

/**
 * Performs one attempt against a job target. Implementations never throw; every failure is
 * reported through the returned result.
 */
public interface TargetExecutor<T extends JobTarget> {
    DispatchResult execute(T target, Duration timeout);

    static String truncate(String text, int maxChars) {
        if (text == null || text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + "\n[truncated]";
    }
}
