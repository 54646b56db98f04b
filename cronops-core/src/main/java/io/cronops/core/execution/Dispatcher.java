package io.cronops.core.execution;

import io.cronops.core.job.CronJob;
import io.cronops.core.job.HttpTarget;
import io.cronops.core.job.ScriptTarget;
import java.time.Duration;

/**
 * Routes one attempt of a job to the executor for its target kind.
 */
public final class Dispatcher {
    private final HttpTargetExecutor http;
    private final ScriptTargetExecutor script;

    public Dispatcher(HttpTargetExecutor http, ScriptTargetExecutor script) {
        this.http = http;
        this.script = script;
    }

    public DispatchResult dispatch(CronJob job) {
        Duration timeout = Duration.ofMillis(Math.max(1, job.timeoutMs()));
        if (job.target() instanceof HttpTarget target) {
            return http.execute(target, timeout);
        }
        if (job.target() instanceof ScriptTarget target) {
            return script.execute(target, timeout);
        }
        return DispatchResult.failed(null, null, "Unsupported target " + job.targetType());
    }
}
