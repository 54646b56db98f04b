package io.cronops.cli;

import io.cronops.core.config.ConfigService;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    RuntimeFactory runtimeFactory,
    ServerRunner serverRunner
) {
}
