package io.cronops.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        String override = System.getenv("CRONOPS_CONFIG");
        if (override != null && !override.isBlank()) {
            return expandHome(override.trim());
        }
        return Path.of(System.getProperty("user.home"), ".cronops", "config.json");
    }

    public static Path resolveDatabase(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".cronops", "data", "cronops.db");
        }
        return expandHome(rawPath);
    }

    private static Path expandHome(String rawPath) {
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
