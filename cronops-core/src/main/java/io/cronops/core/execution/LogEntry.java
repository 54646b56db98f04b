package io.cronops.core.execution;

/**
 * An execution log joined with the job it belongs to and that job's owner.
 */
public record LogEntry(ExecutionLog log, String jobName, String userId, String ownerEmail) {
}
