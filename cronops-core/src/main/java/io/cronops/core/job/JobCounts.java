package io.cronops.core.job;

public record JobCounts(long total, long active, long paused) {
    public static JobCounts empty() {
        return new JobCounts(0, 0, 0);
    }
}
