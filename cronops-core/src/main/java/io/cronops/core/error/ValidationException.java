package io.cronops.core.error;

public final class ValidationException extends CronOpsException {

    public ValidationException(String message) {
        super("validation_failed", message);
    }
}
