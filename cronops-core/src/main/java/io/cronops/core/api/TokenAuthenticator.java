package io.cronops.core.api;

import io.cronops.core.error.AuthenticationException;
import io.cronops.core.user.User;
import io.cronops.core.user.UserService;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import java.io.IOException;

/**
 * Resolves {@code Authorization: Bearer <token>} to a user. Tokens are issued out of band.
 */
final class TokenAuthenticator {
    private static final String BEARER = "bearer ";

    private final UserService users;

    TokenAuthenticator(UserService users) {
        this.users = users;
    }

    User authenticate(HttpServerExchange exchange) throws IOException {
        String header = exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
        if (header == null || header.length() <= BEARER.length()
            || !header.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            throw new AuthenticationException("missing bearer token");
        }
        return users.authenticate(header.substring(BEARER.length()).trim());
    }
}
