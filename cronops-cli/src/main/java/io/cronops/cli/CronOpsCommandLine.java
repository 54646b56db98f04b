package io.cronops.cli;

import picocli.CommandLine;

public final class CronOpsCommandLine {

    private CronOpsCommandLine() {
    }

    public static CommandLine create(CliContext context) {
        CommandLine users = new CommandLine(new UserCommand())
            .addSubcommand("add", new UserAddCommand(context))
            .addSubcommand("list", new UserListCommand(context));

        return new CommandLine(new CronOpsCliCommand())
            .addSubcommand("onboard", new OnboardCommand(context))
            .addSubcommand("status", new StatusCommand(context))
            .addSubcommand("serve", new ServeCommand(context))
            .addSubcommand("user", users);
    }
}
