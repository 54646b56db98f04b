package io.cronops.core.job;

import java.util.LinkedHashMap;
import java.util.Map;

public record HttpTarget(String url, HttpMethod method, Map<String, String> headers, String payload) implements JobTarget {
    public HttpTarget {
        url = url == null ? "" : url.trim();
        method = method == null ? HttpMethod.GET : method;
        headers = headers == null ? Map.of() : Map.copyOf(new LinkedHashMap<>(headers));
        payload = payload == null || payload.isEmpty() ? null : payload;
    }

    @Override
    public TargetType type() {
        return TargetType.HTTP;
    }
}
