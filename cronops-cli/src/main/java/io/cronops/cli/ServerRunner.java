package io.cronops.cli;

import java.nio.file.Path;

@FunctionalInterface
public interface ServerRunner {
    int run(Path configPath, Integer portOverride) throws Exception;
}
