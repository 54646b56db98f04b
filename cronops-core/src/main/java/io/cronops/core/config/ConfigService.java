package io.cronops.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cronops.core.config.model.CronOpsConfig;
import io.cronops.core.config.model.DispatchConfig;
import io.cronops.core.config.model.RetentionConfig;
import io.cronops.core.config.model.SchedulerConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads and writes {@code config.json}. A file only needs the keys it changes: it is merged over
 * {@link CronOpsConfig#defaults()}, with snake_case keys accepted wherever camelCase is.
 */
public final class ConfigService {
    private static final int MAX_TIMEOUT_MS = 300_000;
    private static final int MAX_RETRIES = 10;

    private final ObjectMapper mapper = new ObjectMapper();

    public CronOpsConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return CronOpsConfig.defaults();
        }

        JsonNode fileNode = mapper.readTree(Files.readString(configPath));
        if (fileNode == null || fileNode.isMissingNode() || fileNode.isNull()) {
            return CronOpsConfig.defaults();
        }
        if (!fileNode.isObject()) {
            throw new IOException("Config " + configPath + " must contain a JSON object");
        }

        JsonNode merged = merge(mapper.valueToTree(CronOpsConfig.defaults()), camelCaseKeys(fileNode));
        CronOpsConfig config = mapper.treeToValue(merged, CronOpsConfig.class);
        List<String> problems = problems(config);
        if (!problems.isEmpty()) {
            throw new IOException("Invalid config " + configPath + ": " + String.join("; ", problems));
        }
        return config;
    }

    public void save(Path configPath, CronOpsConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(configPath, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config) + System.lineSeparator());
    }

    /**
     * Writes the default config unless one exists (or {@code overwrite} is set) and creates the
     * directory that will hold the database.
     */
    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        CronOpsConfig config = created || overwrite ? CronOpsConfig.defaults() : load(configPath);
        save(configPath, config);

        Path database = ConfigPaths.resolveDatabase(config.storage().databasePath()).toAbsolutePath();
        Files.createDirectories(database.getParent());
        return new OnboardResult(configPath, database, created, !created && overwrite);
    }

    static List<String> problems(CronOpsConfig config) {
        List<String> problems = new ArrayList<>();
        int port = config.server().port();
        if (port < 0 || port > 65_535) {
            problems.add("server.port must be between 0 and 65535");
        }
        if (config.storage().databasePath() == null || config.storage().databasePath().isBlank()) {
            problems.add("storage.databasePath is required");
        }

        SchedulerConfig scheduler = config.scheduler();
        if (scheduler.tickMillis() < 1) {
            problems.add("scheduler.tickMillis must be positive");
        }
        if (scheduler.workerThreads() < 1) {
            problems.add("scheduler.workerThreads must be positive");
        }
        if (scheduler.retentionSweepMinutes() < 1) {
            problems.add("scheduler.retentionSweepMinutes must be positive");
        }

        DispatchConfig dispatch = config.dispatch();
        if (dispatch.defaultTimeoutMs() < 1 || dispatch.defaultTimeoutMs() > MAX_TIMEOUT_MS) {
            problems.add("dispatch.defaultTimeoutMs must be between 1 and " + MAX_TIMEOUT_MS);
        }
        if (dispatch.defaultMaxRetries() < 0 || dispatch.defaultMaxRetries() > MAX_RETRIES) {
            problems.add("dispatch.defaultMaxRetries must be between 0 and " + MAX_RETRIES);
        }
        if (dispatch.defaultRetryDelaySeconds() < 0 || dispatch.maxRetryDelaySeconds() < dispatch.defaultRetryDelaySeconds()) {
            problems.add("dispatch retry delays must satisfy 0 <= defaultRetryDelaySeconds <= maxRetryDelaySeconds");
        }
        if (dispatch.maxResponseChars() < 1) {
            problems.add("dispatch.maxResponseChars must be positive");
        }
        if (dispatch.shell() == null || dispatch.shell().isBlank()) {
            problems.add("dispatch.shell is required");
        }

        RetentionConfig retention = config.retention();
        if (retention.freeDays() < 1 || retention.premiumDays() < 1 || retention.proDays() < 1) {
            problems.add("retention days must be positive");
        }
        return problems;
    }

    private JsonNode merge(JsonNode base, JsonNode override) {
        if (base == null || !base.isObject() || !override.isObject()) {
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> merged.set(entry.getKey(), merge(merged.get(entry.getKey()), entry.getValue())));
        return merged;
    }

    private JsonNode camelCaseKeys(JsonNode node) {
        if (!node.isObject()) {
            return node;
        }
        ObjectNode renamed = mapper.createObjectNode();
        node.fields().forEachRemaining(entry -> renamed.set(camelCase(entry.getKey()), camelCaseKeys(entry.getValue())));
        return renamed;
    }

    static String camelCase(String key) {
        if (key.indexOf('_') < 0) {
            return key;
        }
        StringBuilder out = new StringBuilder(key.length());
        boolean upper = false;
        for (char c : key.toCharArray()) {
            if (c == '_') {
                upper = out.length() > 0;
            } else {
                out.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return out.toString();
    }
}
