package io.cronops.core.job;

import io.cronops.core.error.ValidationException;
import java.util.Locale;

public enum JobStatus {
    ACTIVE,
    PAUSED;

    public static JobStatus parse(String raw) {
        try {
            return JobStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ValidationException("status must be ACTIVE or PAUSED");
        }
    }
}
