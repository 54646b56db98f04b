package io.cronops.app;

import io.cronops.cli.CliContext;
import io.cronops.cli.CronOpsCommandLine;
import io.cronops.core.api.ApiServer;
import io.cronops.core.config.ConfigPaths;
import io.cronops.core.config.ConfigService;
import io.cronops.core.config.model.CronOpsConfig;
import io.cronops.core.config.model.ServerConfig;
import io.cronops.core.runtime.CronOpsRuntime;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;

public final class CronOpsApplication {

    private CronOpsApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        CliContext context = new CliContext(
            configService,
            ConfigPaths.defaultConfigPath(),
            config -> CronOpsRuntime.open(config, Clock.systemUTC()),
            (configPath, port) -> runServer(configService, configPath, port)
        );

        int exitCode = CronOpsCommandLine.create(context).execute(args);
        System.exit(exitCode);
    }

    private static int runServer(ConfigService configService, Path configPath, Integer portOverride) throws Exception {
        CronOpsConfig config = configService.load(configPath);
        ServerConfig server = config.server();
        if (portOverride != null) {
            server = new ServerConfig(server.host(), portOverride, server.corsOrigins());
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        try (CronOpsRuntime runtime = CronOpsRuntime.open(config, Clock.systemUTC())) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            runtime.start();
            ApiServer api = runtime.startApi(server);
            System.out.println("CronOps started on http://127.0.0.1:" + api.port());
            System.out.println("Database: " + ConfigPaths.resolveDatabase(config.storage().databasePath()));
            shutdown.await();
        }
        return 0;
    }
}
