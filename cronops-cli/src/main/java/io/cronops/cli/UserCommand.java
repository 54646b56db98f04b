package io.cronops.cli;

import picocli.CommandLine.Command;

@Command(name = "user", mixinStandardHelpOptions = true, description = "Manage users and their API tokens")
public final class UserCommand implements Runnable {

    @Override
    public void run() {
        // Shows help when no subcommand is provided.
    }
}
