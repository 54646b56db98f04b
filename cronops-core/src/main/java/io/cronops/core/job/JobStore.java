package io.cronops.core.job;

import io.cronops.core.execution.ExecutionStatus;
import io.cronops.core.storage.Page;
import io.cronops.core.storage.PageRequest;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface JobStore {
    int UNBOUNDED = -1;

    /**
     * Inserts the job unless it is ACTIVE and its owner already holds {@code activeCeiling} ACTIVE
     * jobs. The count and the insert are one statement. Returns false when the ceiling blocked it.
     */
    boolean insertWithinQuota(CronJob job, int activeCeiling) throws IOException;

    /**
     * Flips a PAUSED job to ACTIVE under the same conditional-count rule as
     * {@link #insertWithinQuota(CronJob, int)}.
     */
    boolean activateWithinQuota(String id, Instant nextRunAt, Instant now, int activeCeiling) throws IOException;

    boolean pause(String id, Instant now) throws IOException;

    /**
     * Rewrites the user-editable columns. Status and bookkeeping columns are left alone.
     */
    boolean updateDefinition(CronJob job) throws IOException;

    boolean updateNextRunAt(String id, Instant nextRunAt) throws IOException;

    boolean recordRun(String id, Instant lastRunAt, ExecutionStatus lastStatus) throws IOException;

    boolean delete(String id) throws IOException;

    Optional<CronJob> findById(String id) throws IOException;

    Page<CronJob> listByUser(String userId, JobStatus status, String search, PageRequest page) throws IOException;

    Page<OwnedJob> listAll(JobStatus status, PageRequest page) throws IOException;

    List<CronJob> listActive() throws IOException;

    JobCounts countsForUser(String userId) throws IOException;

    JobCounts countsForAll() throws IOException;

    Map<String, Long> jobCountsByUser() throws IOException;
}
