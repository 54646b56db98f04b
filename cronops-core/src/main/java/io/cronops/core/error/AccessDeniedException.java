package io.cronops.core.error;

public final class AccessDeniedException extends CronOpsException {

    public AccessDeniedException(String message) {
        super("forbidden", message);
    }
}
