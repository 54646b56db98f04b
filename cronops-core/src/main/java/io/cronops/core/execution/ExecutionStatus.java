package io.cronops.core.execution;

import io.cronops.core.error.ValidationException;
import java.util.Locale;

public enum ExecutionStatus {
    RUNNING,
    SUCCESS,
    FAILED,
    TIMEOUT;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public static ExecutionStatus parse(String raw) {
        try {
            return ExecutionStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ValidationException("status must be one of RUNNING, SUCCESS, FAILED, TIMEOUT");
        }
    }
}
