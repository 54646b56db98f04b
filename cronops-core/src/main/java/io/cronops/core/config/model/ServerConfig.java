package io.cronops.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerConfig(
    String host,
    int port,
    List<String> corsOrigins
) {

    public static ServerConfig defaults() {
        return new ServerConfig("0.0.0.0", 8787, List.of("http://localhost:3000"));
    }
}
