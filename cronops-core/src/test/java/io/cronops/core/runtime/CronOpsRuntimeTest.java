package io.cronops.core.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import io.cronops.core.api.ApiServer;
import io.cronops.core.config.model.CronOpsConfig;
import io.cronops.core.config.model.DispatchConfig;
import io.cronops.core.config.model.RetentionConfig;
import io.cronops.core.config.model.SchedulerConfig;
import io.cronops.core.config.model.ServerConfig;
import io.cronops.core.config.model.StorageConfig;
import io.cronops.core.execution.ExecutionLog;
import io.cronops.core.execution.ExecutionStatus;
import io.cronops.core.execution.RunTrigger;
import io.cronops.core.job.CronJob;
import io.cronops.core.job.JobRequest;
import io.cronops.core.user.Plan;
import io.cronops.core.user.Role;
import io.cronops.core.user.User;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CronOpsRuntimeTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldScheduleJobsAndServeApiFromOneConfig() throws Exception {
        CronOpsConfig config = new CronOpsConfig(
            new ServerConfig("127.0.0.1", 0, List.of()),
            new StorageConfig(tempDir.resolve("cronops.db").toString()),
            new SchedulerConfig(100, 2, 60),
            DispatchConfig.defaults(),
            RetentionConfig.defaults()
        );
        MockWebServer target = new MockWebServer();
        for (int i = 0; i < 20; i++) {
            target.enqueue(new MockResponse().setResponseCode(200));
        }
        target.start();

        try (CronOpsRuntime runtime = CronOpsRuntime.open(config, Clock.systemUTC())) {
            User owner = runtime.users().create("ops@example.com", "Ops", Role.USER, Plan.PRO);
            runtime.jobs().create(owner, new JobRequest(
                "every-second", "* * * * * *", "UTC", "HTTP", target.url("/tick").toString(),
                null, null, null, null, 0, 0, null, null
            ));

            runtime.start();
            ApiServer api = runtime.startApi(config.server());

            assertThat(target.takeRequest(10, TimeUnit.SECONDS)).isNotNull();
            HttpResponse<String> health = HttpClient.newHttpClient().send(
                HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + api.port() + "/healthz")).GET().build(),
                HttpResponse.BodyHandlers.ofString()
            );
            assertThat(health.statusCode()).isEqualTo(200);
        } finally {
            target.shutdown();
        }
    }

    @Test
    void shouldFailLogsLeftRunningByPreviousProcessOnStart() throws Exception {
        CronOpsConfig config = new CronOpsConfig(
            new ServerConfig("127.0.0.1", 0, List.of()),
            new StorageConfig(tempDir.resolve("cronops.db").toString()),
            new SchedulerConfig(1_000, 1, 60),
            DispatchConfig.defaults(),
            RetentionConfig.defaults()
        );
        ExecutionLog orphan;
        try (CronOpsRuntime previous = CronOpsRuntime.open(config, Clock.systemUTC())) {
            User owner = previous.users().create("ops@example.com", "Ops", Role.USER, Plan.PRO);
            CronJob job = previous.jobs().create(owner, new JobRequest(
                "nightly", "0 3 * * *", "UTC", "HTTP", "https://example.com/nightly",
                null, null, null, null, 0, 0, null, null
            ));
            orphan = ExecutionLog.running(job.id(), 1, RunTrigger.SCHEDULED, Instant.now().minusSeconds(30));
            previous.logStore().insert(orphan);
        }

        try (CronOpsRuntime runtime = CronOpsRuntime.open(config, Clock.systemUTC())) {
            runtime.start();

            ExecutionLog closed = runtime.logStore().findById(orphan.id()).orElseThrow().log();
            assertThat(closed.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(closed.finishedAt()).isNotNull();
            assertThat(closed.durationMs()).isGreaterThanOrEqualTo(30_000L);
            assertThat(closed.error()).isEqualTo("Interrupted before completion");
        }
    }
}
