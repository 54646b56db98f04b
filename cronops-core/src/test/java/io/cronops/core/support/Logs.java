package io.cronops.core.support;

import io.cronops.core.execution.ExecutionLog;
import io.cronops.core.execution.ExecutionStatus;
import io.cronops.core.execution.RunTrigger;
import java.time.Instant;
import java.util.Locale;

public final class Logs {

    private Logs() {
    }

    public static ExecutionLog finished(String jobId, ExecutionStatus status, Instant startedAt, long durationMs) {
        Integer code = status == ExecutionStatus.SUCCESS ? 200 : null;
        String error = status == ExecutionStatus.SUCCESS ? null : status.name().toLowerCase(Locale.ROOT);
        return ExecutionLog.running(jobId, 1, RunTrigger.SCHEDULED, startedAt)
            .complete(status, code, null, error, startedAt.plusMillis(durationMs));
    }
}
