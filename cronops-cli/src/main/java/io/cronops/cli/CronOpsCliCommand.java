package io.cronops.cli;

import picocli.CommandLine.Command;

@Command(name = "cronops", mixinStandardHelpOptions = true, description = "CronOps job scheduling backend")
public final class CronOpsCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
