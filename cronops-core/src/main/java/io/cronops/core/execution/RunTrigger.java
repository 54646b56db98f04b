package io.cronops.core.execution;

public enum RunTrigger {
    SCHEDULED,
    MANUAL
}
