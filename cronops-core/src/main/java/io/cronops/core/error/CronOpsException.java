package io.cronops.core.error;

public class CronOpsException extends RuntimeException {
    private final String code;

    public CronOpsException(String code, String message) {
        super(message);
        this.code = code == null || code.isBlank() ? "internal_error" : code;
    }

    public String code() {
        return code;
    }
}
