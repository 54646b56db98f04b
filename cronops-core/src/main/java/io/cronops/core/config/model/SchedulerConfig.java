package io.cronops.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(
    @JsonAlias({"tick_millis"}) long tickMillis,
    @JsonAlias({"worker_threads"}) int workerThreads,
    @JsonAlias({"retention_sweep_minutes"}) int retentionSweepMinutes
) {

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(1_000, 16, 60);
    }
}
