package io.cronops.cli;

import io.cronops.core.config.ConfigPaths;
import io.cronops.core.config.model.CronOpsConfig;
import io.cronops.core.job.JobCounts;
import io.cronops.core.runtime.CronOpsRuntime;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

@Command(name = "status", description = "Show configuration and database status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    ConfigOption config;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Path configPath = config.resolve(context);
            CronOpsConfig loaded = context.configService().load(configPath);
            Path database = ConfigPaths.resolveDatabase(loaded.storage().databasePath());
            System.out.println("Config path: " + configPath);
            System.out.println("Config exists: " + Files.exists(configPath));
            System.out.println("Database: " + database);
            System.out.println("Database exists: " + Files.exists(database));
            System.out.println("Listen address: " + loaded.server().host() + ":" + loaded.server().port());
            System.out.println("Scheduler tick: " + loaded.scheduler().tickMillis() + " ms, workers: "
                + loaded.scheduler().workerThreads());
            if (Files.exists(database)) {
                try (CronOpsRuntime runtime = context.runtimeFactory().open(loaded)) {
                    JobCounts jobs = runtime.jobStore().countsForAll();
                    System.out.println("Users: " + runtime.users().list().size());
                    System.out.println("Jobs: " + jobs.total() + " (" + jobs.active() + " active, " + jobs.paused() + " paused)");
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
