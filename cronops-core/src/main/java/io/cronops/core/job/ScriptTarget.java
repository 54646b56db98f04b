package io.cronops.core.job;

public record ScriptTarget(String command) implements JobTarget {
    public ScriptTarget {
        command = command == null ? "" : command.trim();
    }

    @Override
    public TargetType type() {
        return TargetType.SCRIPT;
    }
}
