package io.cronops.core.execution;

import io.cronops.core.config.model.RetentionConfig;
import io.cronops.core.user.Plan;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Purges execution logs older than the retention window of their owner's plan.
 */
public final class LogRetentionSweeper {
    private static final Logger LOG = LoggerFactory.getLogger(LogRetentionSweeper.class);

    private final ExecutionLogStore store;
    private final RetentionConfig retention;
    private final Clock clock;

    public LogRetentionSweeper(ExecutionLogStore store, RetentionConfig retention, Clock clock) {
        this.store = store;
        this.retention = retention;
        this.clock = clock;
    }

    public int sweep() throws IOException {
        Instant now = clock.instant();
        int deleted = 0;
        for (Plan plan : Plan.values()) {
            Instant cutoff = now.minus(Duration.ofDays(retention.daysFor(plan)));
            deleted += store.deleteStartedBefore(plan, cutoff);
        }
        if (deleted > 0) {
            LOG.info("Retention sweep removed {} execution logs", deleted);
        }
        return deleted;
    }
}
