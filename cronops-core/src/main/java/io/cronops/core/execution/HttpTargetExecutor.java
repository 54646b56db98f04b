package io.cronops.core.execution;

import io.cronops.core.job.HttpTarget;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Map;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public final class HttpTargetExecutor implements TargetExecutor<HttpTarget> {
    private static final MediaType DEFAULT_CONTENT_TYPE = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final int maxResponseChars;

    public HttpTargetExecutor(int maxResponseChars) {
        this(new OkHttpClient.Builder().followRedirects(true).build(), maxResponseChars);
    }

    public HttpTargetExecutor(OkHttpClient client, int maxResponseChars) {
        this.client = client;
        this.maxResponseChars = Math.max(1, maxResponseChars);
    }

    @Override
    public DispatchResult execute(HttpTarget target, Duration timeout) {
        Request request;
        try {
            request = buildRequest(target);
        } catch (IllegalArgumentException e) {
            return DispatchResult.failed(null, null, "Invalid request: " + e.getMessage());
        }

        OkHttpClient timed = client.newBuilder()
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .writeTimeout(timeout)
            .callTimeout(timeout)
            .build();
        try (Response response = timed.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = TargetExecutor.truncate(body == null ? "" : body.string(), maxResponseChars);
            if (response.isSuccessful()) {
                return DispatchResult.success(response.code(), text);
            }
            return DispatchResult.failed(response.code(), text, "HTTP " + response.code());
        } catch (InterruptedIOException e) {
            return DispatchResult.timeout("Request timed out after " + timeout.toMillis() + " ms");
        } catch (IOException e) {
            return DispatchResult.failed(null, null, "Request failed: " + e.getMessage());
        }
    }

    private Request buildRequest(HttpTarget target) {
        Request.Builder builder = new Request.Builder().url(target.url());
        MediaType contentType = DEFAULT_CONTENT_TYPE;
        for (Map.Entry<String, String> header : target.headers().entrySet()) {
            if (header.getKey().equalsIgnoreCase("content-type")) {
                MediaType parsed = MediaType.parse(header.getValue());
                contentType = parsed == null ? DEFAULT_CONTENT_TYPE : parsed;
            }
            builder.header(header.getKey(), header.getValue());
        }

        RequestBody body = null;
        if (target.method().carriesBody()) {
            body = RequestBody.create(target.payload() == null ? "" : target.payload(), contentType);
        }
        return builder.method(target.method().name(), body).build();
    }
}
