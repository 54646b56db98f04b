package io.cronops.core.error;

public final class NotFoundException extends CronOpsException {

    public NotFoundException(String kind, String id) {
        super("not_found", kind + " not found: " + id);
    }
}
