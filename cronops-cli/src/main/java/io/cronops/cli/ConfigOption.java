package io.cronops.cli;

import java.nio.file.Path;
import picocli.CommandLine.Option;

public final class ConfigOption {

    @Option(names = "--config", description = "Config file (defaults to $CRONOPS_CONFIG or ~/.cronops/config.json)")
    Path path;

    Path resolve(CliContext context) {
        return path != null ? path : context.configPath();
    }
}
