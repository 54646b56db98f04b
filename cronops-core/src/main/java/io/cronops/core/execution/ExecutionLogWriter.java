package io.cronops.core.execution;

import java.io.IOException;
import java.time.Clock;

/**
 * Writes the RUNNING row before an attempt and its single terminal update afterwards.
 */
public final class ExecutionLogWriter {
    private final ExecutionLogStore store;
    private final Clock clock;

    public ExecutionLogWriter(ExecutionLogStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public ExecutionLog start(String jobId, int attempt, RunTrigger trigger) throws IOException {
        ExecutionLog log = ExecutionLog.running(jobId, attempt, trigger, clock.instant());
        store.insert(log);
        return log;
    }

    public ExecutionLog finish(ExecutionLog running, DispatchResult result) throws IOException {
        ExecutionLog done = running.complete(
            result.status(),
            result.statusCode(),
            result.response(),
            result.error(),
            clock.instant()
        );
        if (!store.complete(done)) {
            throw new IllegalStateException("execution log " + running.id() + " was not RUNNING");
        }
        return done;
    }
}
