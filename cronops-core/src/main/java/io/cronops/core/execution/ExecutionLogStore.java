package io.cronops.core.execution;

import io.cronops.core.storage.Page;
import io.cronops.core.storage.PageRequest;
import io.cronops.core.user.Plan;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface ExecutionLogStore {
    void insert(ExecutionLog log) throws IOException;

    /**
     * Writes the terminal state of a log that is still RUNNING. Returns false if the row is gone
     * or already terminal.
     */
    boolean complete(ExecutionLog log) throws IOException;

    /**
     * Marks every log still RUNNING as FAILED with {@code error}, finishing it at {@code now}.
     * Only safe while no attempt is in flight.
     */
    int failStaleRunning(Instant now, String error) throws IOException;

    Optional<LogEntry> findById(String id) throws IOException;

    Page<LogEntry> list(LogQuery query, PageRequest page) throws IOException;

    Map<ExecutionStatus, Long> countByStatus(LogQuery query, Instant since) throws IOException;

    List<ExecutionPoint> points(LogQuery query, Instant since) throws IOException;

    Optional<Double> averageDurationMs(LogQuery query) throws IOException;

    int deleteStartedBefore(Plan ownerPlan, Instant cutoff) throws IOException;
}
