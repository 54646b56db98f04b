package io.cronops.cli;

import io.cronops.core.config.model.CronOpsConfig;
import io.cronops.core.runtime.CronOpsRuntime;
import io.cronops.core.user.User;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

@Command(name = "list", description = "List users")
public final class UserListCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    ConfigOption config;

    public UserListCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CronOpsConfig loaded = context.configService().load(config.resolve(context));
            try (CronOpsRuntime runtime = context.runtimeFactory().open(loaded)) {
                List<User> users = runtime.users().list();
                if (users.isEmpty()) {
                    System.out.println("No users.");
                    return 0;
                }
                for (User user : users) {
                    System.out.printf("%-36s  %-32s  %-5s  %-7s  %s%n",
                        user.id(), user.email(), user.role(), user.plan(), user.createdAt());
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("User list failed: " + e.getMessage());
            return 1;
        }
    }
}
