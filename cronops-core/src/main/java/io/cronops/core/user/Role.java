package io.cronops.core.user;

import io.cronops.core.error.ValidationException;
import java.util.Locale;

public enum Role {
    USER,
    ADMIN;

    public static Role parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("role is required");
        }
        try {
            return Role.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("unknown role: " + raw);
        }
    }
}
