package io.cronops.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronops.core.error.CronOpsException;
import io.cronops.core.error.ValidationException;
import io.cronops.core.schedule.CronSchedule;
import io.cronops.core.storage.PageRequest;
import io.cronops.core.user.User;
import io.undertow.server.HttpServerExchange;
import java.io.IOException;
import java.time.ZoneId;
import java.util.Deque;
import java.util.Optional;

/**
 * An authenticated request: the caller plus typed access to path, query and body.
 */
final class ApiRequest {
    private final HttpServerExchange exchange;
    private final User user;
    private final ObjectMapper mapper;

    ApiRequest(HttpServerExchange exchange, User user, ObjectMapper mapper) {
        this.exchange = exchange;
        this.user = user;
        this.mapper = mapper;
    }

    User user() {
        return user;
    }

    String pathParam(String name) {
        return query(name).orElseThrow(() -> new CronOpsException("bad_request", "missing path parameter " + name));
    }

    Optional<String> query(String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        String value = values.peekFirst();
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    int intQuery(String name, int fallback) {
        Optional<String> raw = query(name);
        if (raw.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.get());
        } catch (NumberFormatException e) {
            throw new ValidationException(name + " must be an integer");
        }
    }

    PageRequest page() {
        return new PageRequest(intQuery("page", 1), intQuery("limit", PageRequest.DEFAULT_LIMIT));
    }

    ZoneId zone() {
        return CronSchedule.parseZone(query("zone").orElse("UTC"));
    }

    <T> T body(Class<T> type) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            throw new ValidationException("request body is required");
        }
        try {
            return mapper.readValue(bytes, type);
        } catch (JsonProcessingException e) {
            throw new CronOpsException("bad_request", "malformed JSON body: " + e.getOriginalMessage());
        }
    }
}
