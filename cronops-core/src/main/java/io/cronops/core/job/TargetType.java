package io.cronops.core.job;

import io.cronops.core.error.ValidationException;
import java.util.Locale;

public enum TargetType {
    HTTP,
    SCRIPT;

    public static TargetType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("targetType is required");
        }
        try {
            return TargetType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("targetType must be HTTP or SCRIPT");
        }
    }
}
