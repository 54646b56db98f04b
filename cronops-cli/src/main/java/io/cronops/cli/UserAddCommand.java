package io.cronops.cli;

import io.cronops.core.config.model.CronOpsConfig;
import io.cronops.core.runtime.CronOpsRuntime;
import io.cronops.core.user.Plan;
import io.cronops.core.user.Role;
import io.cronops.core.user.User;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Command(name = "add", description = "Create a user and print its API token")
public final class UserAddCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    ConfigOption config;

    @Option(names = "--email", required = true, description = "Email address (unique)")
    String email;

    @Option(names = "--name", description = "Display name")
    String name;

    @Option(names = "--role", defaultValue = "USER", description = "USER or ADMIN")
    String role;

    @Option(names = "--plan", defaultValue = "FREE", description = "FREE, PREMIUM or PRO")
    String plan;

    public UserAddCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CronOpsConfig loaded = context.configService().load(config.resolve(context));
            try (CronOpsRuntime runtime = context.runtimeFactory().open(loaded)) {
                User user = runtime.users().create(email, name, Role.parse(role), Plan.parse(plan));
                System.out.println("Created user " + user.email() + " (" + user.id() + ")");
                System.out.println("Role: " + user.role() + ", plan: " + user.plan());
                System.out.println("API token: " + user.apiToken());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("User add failed: " + e.getMessage());
            return 1;
        }
    }
}
