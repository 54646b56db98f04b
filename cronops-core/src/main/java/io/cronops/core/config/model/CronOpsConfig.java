package io.cronops.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CronOpsConfig(
    ServerConfig server,
    StorageConfig storage,
    SchedulerConfig scheduler,
    DispatchConfig dispatch,
    RetentionConfig retention
) {

    public static CronOpsConfig defaults() {
        return new CronOpsConfig(
            ServerConfig.defaults(),
            StorageConfig.defaults(),
            SchedulerConfig.defaults(),
            DispatchConfig.defaults(),
            RetentionConfig.defaults()
        );
    }
}
