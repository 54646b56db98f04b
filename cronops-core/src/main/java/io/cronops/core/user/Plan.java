package io.cronops.core.user;

import io.cronops.core.error.ValidationException;
import java.util.Locale;

public enum Plan {
    FREE,
    PREMIUM,
    PRO;

    public static Plan parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("plan is required");
        }
        try {
            return Plan.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("unknown plan: " + raw);
        }
    }
}
