package io.cronops.core.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronops.core.config.model.ServerConfig;
import io.cronops.core.stats.StatsService;
import io.cronops.core.support.CoreFixture;
import io.cronops.core.user.Plan;
import io.cronops.core.user.User;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ApiServerTest {

    private static final String JOB = """
        {"name": "%s", "schedule": "*/5 * * * *", "type": "HTTP", "url": "https://example.com/hook"}
        """;

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private CoreFixture fixture;
    private ExecutorService workers;
    private ScheduledExecutorService timers;
    private ApiServer server;
    private User alice;
    private User bob;
    private User admin;

    @BeforeEach
    void setUp() throws Exception {
        fixture = new CoreFixture(tempDir, Clock.systemUTC());
        workers = Executors.newFixedThreadPool(2);
        timers = Executors.newSingleThreadScheduledExecutor();
        ApiContext context = new ApiContext(
            fixture.jobs,
            fixture.jobStore,
            fixture.users,
            new StatsService(fixture.jobStore, fixture.logStore, fixture.userStore, Clock.systemUTC()),
            fixture.logStore,
            fixture.runner(workers, timers)
        );
        server = new ApiServer(new ServerConfig("127.0.0.1", 0, List.of("https://app.example.com")), context);
        server.start();
        alice = fixture.user("alice@example.com", Plan.FREE);
        bob = fixture.user("bob@example.com", Plan.FREE);
        admin = fixture.admin("root@example.com");
    }

    @AfterEach
    void tearDown() {
        server.close();
        workers.shutdownNow();
        timers.shutdownNow();
    }

    @Test
    void healthShouldNotRequireToken() throws Exception {
        HttpResponse<String> response = send(null, "GET", "/healthz", null);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(json(response).path("status").asText()).isEqualTo("ok");
    }

    @Test
    void shouldRejectMissingOrUnknownToken() throws Exception {
        HttpResponse<String> missing = send(null, "GET", "/jobs", null);
        HttpResponse<String> unknown = send("cro_unknown", "GET", "/jobs", null);

        assertThat(missing.statusCode()).isEqualTo(401);
        assertThat(json(missing).path("error").asText()).isEqualTo("unauthorized");
        assertThat(unknown.statusCode()).isEqualTo(401);
    }

    @Test
    void shouldCreateAndListJobsInsideEnvelope() throws Exception {
        HttpResponse<String> created = send(alice.apiToken(), "POST", "/jobs", JOB.formatted("ping"));

        assertThat(created.statusCode()).isEqualTo(201);
        JsonNode job = json(created).path("data");
        assertThat(job.path("name").asText()).isEqualTo("ping");
        assertThat(job.path("status").asText()).isEqualTo("ACTIVE");
        assertThat(job.path("targetType").asText()).isEqualTo("HTTP");
        assertThat(job.path("nextRunAt").asText()).endsWith("Z");

        HttpResponse<String> listed = send(alice.apiToken(), "GET", "/jobs?limit=10", null);
        JsonNode data = json(listed).path("data");
        assertThat(data.path("jobs")).hasSize(1);
        assertThat(data.path("pagination").path("total").asInt()).isEqualTo(1);
        assertThat(data.path("pagination").path("limit").asInt()).isEqualTo(10);
    }

    @Test
    void shouldReportQuotaExceededOnFourthFreeJob() throws Exception {
        for (int i = 0; i < 3; i++) {
            assertThat(send(alice.apiToken(), "POST", "/jobs", JOB.formatted("job-" + i)).statusCode()).isEqualTo(201);
        }

        HttpResponse<String> fourth = send(alice.apiToken(), "POST", "/jobs", JOB.formatted("job-4"));

        assertThat(fourth.statusCode()).isEqualTo(403);
        assertThat(json(fourth).path("error").asText()).isEqualTo("quota_exceeded");
        JsonNode me = json(send(alice.apiToken(), "GET", "/users/me", null)).path("data");
        assertThat(me.path("quota").path("activeJobs").asInt()).isEqualTo(3);
        assertThat(me.path("quota").path("limit").asInt()).isEqualTo(3);
    }

    @Test
    void shouldMapValidationAndMalformedBodies() throws Exception {
        HttpResponse<String> badCron = send(alice.apiToken(), "POST", "/jobs",
            "{\"name\": \"x\", \"cronExpression\": \"not a cron\", \"targetType\": \"HTTP\", \"targetUrl\": \"https://example.com\"}");
        HttpResponse<String> malformed = send(alice.apiToken(), "POST", "/jobs", "{\"name\": ");

        assertThat(badCron.statusCode()).isEqualTo(400);
        assertThat(json(badCron).path("error").asText()).isEqualTo("validation_failed");
        assertThat(malformed.statusCode()).isEqualTo(400);
        assertThat(json(malformed).path("error").asText()).isEqualTo("bad_request");
    }

    @Test
    void otherUsersJobShouldBeNotFound() throws Exception {
        String id = json(send(alice.apiToken(), "POST", "/jobs", JOB.formatted("private"))).path("data").path("id").asText();

        HttpResponse<String> asBob = send(bob.apiToken(), "GET", "/jobs/" + id, null);
        HttpResponse<String> asAdmin = send(admin.apiToken(), "GET", "/jobs/" + id, null);

        assertThat(asBob.statusCode()).isEqualTo(404);
        assertThat(json(asBob).path("error").asText()).isEqualTo("not_found");
        assertThat(asAdmin.statusCode()).isEqualTo(200);
    }

    @Test
    void shouldPauseResumeUpdateAndDelete() throws Exception {
        String id = json(send(alice.apiToken(), "POST", "/jobs", JOB.formatted("cycle"))).path("data").path("id").asText();

        JsonNode paused = json(send(alice.apiToken(), "POST", "/jobs/" + id + "/pause", null)).path("data");
        JsonNode resumed = json(send(alice.apiToken(), "POST", "/jobs/" + id + "/resume", null)).path("data");
        JsonNode renamed = json(send(alice.apiToken(), "PUT", "/jobs/" + id, "{\"name\": \"renamed\"}")).path("data");
        HttpResponse<String> deleted = send(alice.apiToken(), "DELETE", "/jobs/" + id, null);

        assertThat(paused.path("status").asText()).isEqualTo("PAUSED");
        assertThat(paused.path("nextRunAt").isNull()).isTrue();
        assertThat(resumed.path("status").asText()).isEqualTo("ACTIVE");
        assertThat(renamed.path("name").asText()).isEqualTo("renamed");
        assertThat(renamed.path("targetUrl").asText()).isEqualTo("https://example.com/hook");
        assertThat(json(deleted).path("data").path("deleted").asBoolean()).isTrue();
        assertThat(send(alice.apiToken(), "GET", "/jobs/" + id, null).statusCode()).isEqualTo(404);
    }

    @Test
    void manualRunShouldBeAcceptedAndLogged() throws Exception {
        String body = "{\"name\": \"echo\", \"schedule\": \"0 0 * * *\", \"type\": \"SCRIPT\", \"script\": \"echo hi\", \"retryCount\": 0}";
        String id = json(send(alice.apiToken(), "POST", "/jobs", body)).path("data").path("id").asText();

        HttpResponse<String> run = send(alice.apiToken(), "POST", "/jobs/" + id + "/run", null);

        assertThat(run.statusCode()).isEqualTo(202);
        assertThat(json(run).path("data").path("accepted").asBoolean()).isTrue();
        JsonNode logs = awaitLogs(id);
        assertThat(logs.get(0).path("trigger").asText()).isEqualTo("MANUAL");
        assertThat(logs.get(0).path("status").asText()).isEqualTo("SUCCESS");
        assertThat(logs.get(0).path("response").asText()).isEqualTo("hi\n");
    }

    @Test
    void adminRoutesShouldRequireAdminRole() throws Exception {
        HttpResponse<String> asUser = send(alice.apiToken(), "GET", "/admin/users", null);
        HttpResponse<String> asAdmin = send(admin.apiToken(), "GET", "/admin/users", null);
        HttpResponse<String> selfDelete = send(admin.apiToken(), "DELETE", "/admin/users/" + admin.id(), null);

        assertThat(asUser.statusCode()).isEqualTo(403);
        assertThat(json(asUser).path("error").asText()).isEqualTo("forbidden");
        assertThat(asAdmin.statusCode()).isEqualTo(200);
        assertThat(json(asAdmin).path("data").path("users")).hasSize(3);
        assertThat(selfDelete.statusCode()).isEqualTo(400);
    }

    @Test
    void planChangeShouldRaiseCeiling() throws Exception {
        HttpResponse<String> response = send(alice.apiToken(), "PUT", "/users/plan", "{\"plan\": \"premium\"}");

        JsonNode profile = json(response).path("data");
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(profile.path("plan").asText()).isEqualTo("PREMIUM");
        assertThat(profile.path("quota").path("limit").asInt()).isEqualTo(100);
    }

    @Test
    void unknownRouteShouldReturnJsonNotFound() throws Exception {
        HttpResponse<String> response = send(alice.apiToken(), "GET", "/nope", null);

        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(json(response).path("error").asText()).isEqualTo("not_found");
    }

    @Test
    void shouldAnswerCorsPreflightForConfiguredOrigin() throws Exception {
        HttpRequest preflight = HttpRequest.newBuilder(uri("/jobs"))
            .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
            .header("Origin", "https://app.example.com")
            .build();

        HttpResponse<String> response = client.send(preflight, HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(204);
        assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).contains("https://app.example.com");
    }

    private JsonNode awaitLogs(String jobId) throws Exception {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            JsonNode logs = json(send(alice.apiToken(), "GET", "/jobs/" + jobId + "/logs", null)).path("data").path("logs");
            if (logs.size() > 0 && !"RUNNING".equals(logs.get(0).path("status").asText())) {
                return logs;
            }
            Thread.sleep(50);
        }
        throw new AssertionError("no finished log for job " + jobId);
    }

    private HttpResponse<String> send(String token, String method, String path, String body) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri(path))
            .method(method, body == null ? HttpRequest.BodyPublishers.noBody() : HttpRequest.BodyPublishers.ofString(body));
        if (body != null) {
            builder.header("Content-Type", "application/json");
        }
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        }
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.port() + path);
    }

    private JsonNode json(HttpResponse<String> response) throws Exception {
        return mapper.readTree(response.body());
    }
}
