package io.cronops.core.stats;

public record HourlyBucket(int hour, long total) {
}
