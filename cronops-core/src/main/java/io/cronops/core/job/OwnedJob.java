package io.cronops.core.job;

public record OwnedJob(CronJob job, String ownerEmail, String ownerName, long executionCount) {
}
