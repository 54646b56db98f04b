package io.cronops.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class ExecutionLogTest {

    private static final Instant START = Instant.parse("2026-10-19T12:00:00Z");

    @Test
    void runningLogShouldCarryNoTiming() {
        ExecutionLog log = ExecutionLog.running("job-1", 1, RunTrigger.MANUAL, START);

        assertThat(log.status()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(log.finishedAt()).isNull();
        assertThat(log.durationMs()).isNull();
        assertThat(log.trigger()).isEqualTo(RunTrigger.MANUAL);
    }

    @Test
    void completeShouldComputeDurationAndDropErrorOnSuccess() {
        ExecutionLog log = ExecutionLog.running("job-1", 1, RunTrigger.SCHEDULED, START)
            .complete(ExecutionStatus.SUCCESS, 200, "ok", "ignored", START.plusMillis(250));

        assertThat(log.status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(log.durationMs()).isEqualTo(250L);
        assertThat(log.finishedAt()).isEqualTo(START.plusMillis(250));
        assertThat(log.error()).isNull();
    }

    @Test
    void completeShouldKeepErrorOnFailureAndClampClockSkew() {
        ExecutionLog log = ExecutionLog.running("job-1", 2, RunTrigger.SCHEDULED, START)
            .complete(ExecutionStatus.FAILED, 503, null, "HTTP 503", START.minusMillis(5));

        assertThat(log.error()).isEqualTo("HTTP 503");
        assertThat(log.durationMs()).isZero();
        assertThat(log.attempt()).isEqualTo(2);
    }

    @Test
    void terminalLogShouldNotTransitionAgain() {
        ExecutionLog done = ExecutionLog.running("job-1", 1, RunTrigger.SCHEDULED, START)
            .complete(ExecutionStatus.TIMEOUT, null, null, "timed out", START.plusSeconds(1));

        assertThatThrownBy(() -> done.complete(ExecutionStatus.SUCCESS, 200, "ok", null, START.plusSeconds(2)))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRejectInconsistentTiming() {
        assertThatThrownBy(() -> new ExecutionLog(
            "id", "job-1", 1, RunTrigger.SCHEDULED, ExecutionStatus.SUCCESS, 200, null, null, START, null, null
        )).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExecutionLog(
            "id", "job-1", 1, RunTrigger.SCHEDULED, ExecutionStatus.RUNNING, null, null, null, START, START, 0L
        )).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ExecutionLog.running("job-1", 1, RunTrigger.SCHEDULED, START)
            .complete(ExecutionStatus.RUNNING, null, null, null, START))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
