package io.cronops.core.error;

public final class AuthenticationException extends CronOpsException {

    public AuthenticationException(String message) {
        super("unauthorized", message);
    }
}
