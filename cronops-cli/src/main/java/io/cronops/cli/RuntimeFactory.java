package io.cronops.cli;

import io.cronops.core.config.model.CronOpsConfig;
import io.cronops.core.runtime.CronOpsRuntime;
import java.io.IOException;

@FunctionalInterface
public interface RuntimeFactory {
    CronOpsRuntime open(CronOpsConfig config) throws IOException;
}
