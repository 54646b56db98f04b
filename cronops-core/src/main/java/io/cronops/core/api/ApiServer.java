package io.cronops.core.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.cronops.core.config.model.ServerConfig;
import io.cronops.core.error.CronOpsException;
import io.cronops.core.error.NotFoundException;
import io.cronops.core.execution.ExecutionStatus;
import io.cronops.core.execution.LogEntry;
import io.cronops.core.execution.LogQuery;
import io.cronops.core.execution.RunTrigger;
import io.cronops.core.job.CronJob;
import io.cronops.core.job.JobRequest;
import io.cronops.core.job.JobStatus;
import io.cronops.core.stats.StatsService;
import io.cronops.core.user.Plan;
import io.cronops.core.user.Role;
import io.cronops.core.user.User;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The REST surface consumed by the dashboard. Every endpoint except {@code /healthz} needs a bearer
 * token; successes are wrapped as {@code {"data": ...}} and failures as {@code {"error", "message"}}.
 */
public final class ApiServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ApiServer.class);
    private static final HttpString CORS_ALLOW_ORIGIN = new HttpString("Access-Control-Allow-Origin");
    private static final HttpString CORS_ALLOW_METHODS = new HttpString("Access-Control-Allow-Methods");
    private static final HttpString CORS_ALLOW_HEADERS = new HttpString("Access-Control-Allow-Headers");
    private static final HttpString CORS_MAX_AGE = new HttpString("Access-Control-Max-Age");

    private final ServerConfig config;
    private final ApiContext context;
    private final TokenAuthenticator authenticator;
    private final ObjectMapper mapper;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public ApiServer(ServerConfig config, ApiContext context) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.authenticator = new TokenAuthenticator(context.users());
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        RoutingHandler routes = Handlers.routing()
            .get("/healthz", this::handleHealth)
            .get("/jobs", endpoint(this::listJobs))
            .post("/jobs", endpoint(this::createJob))
            .get("/jobs/{id}", endpoint(this::getJob))
            .put("/jobs/{id}", endpoint(this::updateJob))
            .delete("/jobs/{id}", endpoint(this::deleteJob))
            .post("/jobs/{id}/pause", endpoint(this::pauseJob))
            .post("/jobs/{id}/resume", endpoint(this::resumeJob))
            .post("/jobs/{id}/run", endpoint(this::runJob))
            .get("/jobs/{id}/logs", endpoint(this::jobLogs))
            .get("/jobs/{id}/stats", endpoint(this::jobStats))
            .get("/logs", endpoint(this::listLogs))
            .get("/logs/{id}", endpoint(this::getLog))
            .get("/stats", endpoint(this::dashboard))
            .get("/stats/analytics", endpoint(this::analytics))
            .get("/users/me", endpoint(this::me))
            .put("/users/plan", endpoint(this::changePlan))
            .get("/admin/stats", endpoint(this::adminStats))
            .get("/admin/users", endpoint(this::adminUsers))
            .put("/admin/users/{id}/role", endpoint(this::adminChangeRole))
            .delete("/admin/users/{id}", endpoint(this::adminDeleteUser))
            .get("/admin/jobs", endpoint(this::adminJobs))
            .get("/admin/logs", endpoint(this::adminLogs))
            .get("/admin/analytics", endpoint(this::adminAnalytics))
            .setFallbackHandler(exchange -> sendError(exchange, 404, "not_found", "no route for " + exchange.getRequestPath()))
            .setInvalidMethodHandler(exchange -> sendError(exchange, 405, "method_not_allowed", "method not allowed"));

        server = Undertow.builder()
            .addHttpListener(config.port(), config.host())
            .setHandler(exchange -> handleWithCors(routes, exchange))
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, config.port());
        LOG.info("API listening on {}:{}", config.host(), actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (server != null) {
            server.stop();
            server = null;
        }
        LOG.info("API stopped");
    }

    private ApiResponse listJobs(ApiRequest request) throws IOException {
        JobStatus status = request.query("status").map(JobStatus::parse).orElse(null);
        var page = context.jobs().list(request.user(), status, request.query("search").orElse(null), request.page());
        return ApiResponse.ok(JsonViews.page("jobs", page, JsonViews::job));
    }

    private ApiResponse createJob(ApiRequest request) throws IOException {
        CronJob job = context.jobs().create(request.user(), request.body(JobRequest.class));
        return ApiResponse.created(JsonViews.job(job));
    }

    private ApiResponse getJob(ApiRequest request) throws IOException {
        return ApiResponse.ok(JsonViews.job(context.jobs().get(request.user(), request.pathParam("id"))));
    }

    private ApiResponse updateJob(ApiRequest request) throws IOException {
        JobRequest patch = request.body(JobRequest.class);
        return ApiResponse.ok(JsonViews.job(context.jobs().update(request.user(), request.pathParam("id"), patch)));
    }

    private ApiResponse deleteJob(ApiRequest request) throws IOException {
        String id = request.pathParam("id");
        context.jobs().delete(request.user(), id);
        return ApiResponse.ok(Map.of("id", id, "deleted", true));
    }

    private ApiResponse pauseJob(ApiRequest request) throws IOException {
        return ApiResponse.ok(JsonViews.job(context.jobs().pause(request.user(), request.pathParam("id"))));
    }

    private ApiResponse resumeJob(ApiRequest request) throws IOException {
        return ApiResponse.ok(JsonViews.job(context.jobs().resume(request.user(), request.pathParam("id"))));
    }

    private ApiResponse runJob(ApiRequest request) throws IOException {
        CronJob job = context.jobs().get(request.user(), request.pathParam("id"));
        boolean accepted = context.runner().submit(job, RunTrigger.MANUAL).isPresent();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jobId", job.id());
        payload.put("accepted", accepted);
        payload.put("reason", accepted ? null : "already_running");
        return ApiResponse.accepted(payload);
    }

    private ApiResponse jobLogs(ApiRequest request) throws IOException {
        CronJob job = context.jobs().get(request.user(), request.pathParam("id"));
        var page = context.logs().list(LogQuery.ofJob(job.id()), request.page());
        return ApiResponse.ok(JsonViews.page("logs", page, JsonViews::log));
    }

    private ApiResponse jobStats(ApiRequest request) throws IOException {
        CronJob job = context.jobs().get(request.user(), request.pathParam("id"));
        return ApiResponse.ok(JsonViews.jobStats(context.stats().jobStats(job)));
    }

    private ApiResponse listLogs(ApiRequest request) throws IOException {
        ExecutionStatus status = request.query("status").map(ExecutionStatus::parse).orElse(null);
        LogQuery query = new LogQuery(request.user().id(), request.query("jobId").orElse(null), status);
        var page = context.logs().list(query, request.page());
        return ApiResponse.ok(JsonViews.page("logs", page, JsonViews::log));
    }

    private ApiResponse getLog(ApiRequest request) throws IOException {
        String id = request.pathParam("id");
        LogEntry entry = context.logs().findById(id).orElseThrow(() -> new NotFoundException("log", id));
        User user = request.user();
        if (!user.isAdmin() && !entry.userId().equals(user.id())) {
            throw new NotFoundException("log", id);
        }
        return ApiResponse.ok(JsonViews.log(entry));
    }

    private ApiResponse dashboard(ApiRequest request) throws IOException {
        return ApiResponse.ok(JsonViews.dashboard(context.stats().dashboard(request.user())));
    }

    private ApiResponse analytics(ApiRequest request) throws IOException {
        int days = request.intQuery("days", 7);
        return ApiResponse.ok(context.stats().activity(request.user(), days, request.zone()));
    }

    private ApiResponse me(ApiRequest request) throws IOException {
        return ApiResponse.ok(JsonViews.profile(context.users().profile(request.user())));
    }

    private ApiResponse changePlan(ApiRequest request) throws IOException {
        PlanChange change = request.body(PlanChange.class);
        User updated = context.users().changePlan(request.user(), Plan.parse(change.plan()));
        return ApiResponse.ok(JsonViews.profile(context.users().profile(updated)));
    }

    private ApiResponse adminStats(ApiRequest request) throws IOException {
        context.users().requireAdmin(request.user());
        return ApiResponse.ok(JsonViews.adminStats(context.stats().adminStats()));
    }

    private ApiResponse adminUsers(ApiRequest request) throws IOException {
        List<Map<String, Object>> users = context.users().listWithJobCounts(request.user()).stream()
            .map(JsonViews::userSummary)
            .toList();
        return ApiResponse.ok(Map.of("users", users));
    }

    private ApiResponse adminChangeRole(ApiRequest request) throws IOException {
        context.users().requireAdmin(request.user());
        RoleChange change = request.body(RoleChange.class);
        User updated = context.users().changeRole(request.user(), request.pathParam("id"), Role.parse(change.role()));
        return ApiResponse.ok(JsonViews.user(updated));
    }

    private ApiResponse adminDeleteUser(ApiRequest request) throws IOException {
        String id = request.pathParam("id");
        context.users().delete(request.user(), id);
        return ApiResponse.ok(Map.of("id", id, "deleted", true));
    }

    private ApiResponse adminJobs(ApiRequest request) throws IOException {
        context.users().requireAdmin(request.user());
        JobStatus status = request.query("status").map(JobStatus::parse).orElse(null);
        var page = context.jobStore().listAll(status, request.page());
        return ApiResponse.ok(JsonViews.page("jobs", page, JsonViews::ownedJob));
    }

    private ApiResponse adminLogs(ApiRequest request) throws IOException {
        context.users().requireAdmin(request.user());
        ExecutionStatus status = request.query("status").map(ExecutionStatus::parse).orElse(null);
        var page = context.logs().list(LogQuery.everything().withStatus(status), request.page());
        return ApiResponse.ok(JsonViews.page("logs", page, JsonViews::adminLog));
    }

    private ApiResponse adminAnalytics(ApiRequest request) throws IOException {
        context.users().requireAdmin(request.user());
        int days = request.intQuery("days", 7);
        StatsService stats = context.stats();
        return ApiResponse.ok(JsonViews.adminAnalytics(stats.adminAnalytics(days, request.zone())));
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private HttpHandler endpoint(ApiHandler handler) {
        return new HttpHandler() {
            @Override
            public void handleRequest(HttpServerExchange exchange) {
                if (exchange.isInIoThread()) {
                    exchange.dispatch(this);
                    return;
                }
                respond(exchange, handler);
            }
        };
    }

    private void respond(HttpServerExchange exchange, ApiHandler handler) {
        try {
            User user = authenticator.authenticate(exchange);
            ApiResponse response = handler.handle(new ApiRequest(exchange, user, mapper));
            sendJson(exchange, response.status(), Collections.singletonMap("data", response.data()));
        } catch (CronOpsException e) {
            sendError(exchange, statusFor(e), e.code(), e.getMessage());
        } catch (Exception e) {
            LOG.warn("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), e);
            sendError(exchange, 500, "internal_error", "unexpected server error");
        }
    }

    static int statusFor(CronOpsException error) {
        return switch (error.code()) {
            case "validation_failed", "bad_request" -> 400;
            case "unauthorized" -> 401;
            case "forbidden", "quota_exceeded" -> 403;
            case "not_found" -> 404;
            default -> 500;
        };
    }

    private void handleWithCors(RoutingHandler routes, HttpServerExchange exchange) throws Exception {
        applyCorsHeaders(exchange);
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            exchange.setStatusCode(204);
            exchange.endExchange();
            return;
        }
        routes.handleRequest(exchange);
    }

    private void applyCorsHeaders(HttpServerExchange exchange) {
        String origin = exchange.getRequestHeaders().getFirst(Headers.ORIGIN);
        if (origin == null || origin.isBlank() || !isAllowedCorsOrigin(origin)) {
            return;
        }
        exchange.getResponseHeaders().put(CORS_ALLOW_ORIGIN, origin);
        exchange.getResponseHeaders().put(CORS_ALLOW_METHODS, "GET,POST,PUT,DELETE,OPTIONS");
        exchange.getResponseHeaders().put(CORS_ALLOW_HEADERS, "Content-Type,Authorization");
        exchange.getResponseHeaders().put(CORS_MAX_AGE, "86400");
        exchange.getResponseHeaders().put(Headers.VARY, "Origin");
    }

    private boolean isAllowedCorsOrigin(String origin) {
        if (config.corsOrigins() != null && config.corsOrigins().contains(origin)) {
            return true;
        }
        try {
            URI uri = URI.create(origin);
            return "http".equalsIgnoreCase(uri.getScheme())
                && ("localhost".equalsIgnoreCase(uri.getHost()) || "127.0.0.1".equals(uri.getHost()));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private void sendError(HttpServerExchange exchange, int status, String code, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", code);
        payload.put("message", message == null ? code : message);
        try {
            sendJson(exchange, status, payload);
        } catch (IOException e) {
            LOG.debug("Could not write error response", e);
            exchange.endExchange();
        }
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }

    record PlanChange(String plan) {
    }

    record RoleChange(String role) {
    }
}
