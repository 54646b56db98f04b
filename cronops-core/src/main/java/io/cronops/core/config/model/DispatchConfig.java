package io.cronops.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DispatchConfig(
    @JsonAlias({"default_timeout_ms"}) int defaultTimeoutMs,
    @JsonAlias({"default_max_retries"}) int defaultMaxRetries,
    @JsonAlias({"default_retry_delay_seconds"}) int defaultRetryDelaySeconds,
    @JsonAlias({"max_retry_delay_seconds"}) int maxRetryDelaySeconds,
    @JsonAlias({"max_response_chars"}) int maxResponseChars,
    String shell
) {

    public static DispatchConfig defaults() {
        return new DispatchConfig(30_000, 3, 60, 3_600, 10_000, "/bin/sh");
    }
}
