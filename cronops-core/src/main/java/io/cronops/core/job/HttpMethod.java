package io.cronops.core.job;

import io.cronops.core.error.ValidationException;
import java.util.Locale;

public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE;

    public boolean carriesBody() {
        return this == POST || this == PUT || this == PATCH;
    }

    public static HttpMethod parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return GET;
        }
        try {
            return HttpMethod.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("httpMethod must be one of GET, POST, PUT, PATCH, DELETE");
        }
    }
}
