package io.cronops.core.execution;

/**
 * How a run ended. {@code finalStatus} is null when the run stopped before any attempt finished,
 * for example because the job was deleted.
 */
public record RunOutcome(String jobId, RunTrigger trigger, int attempts, ExecutionStatus finalStatus) {
}
