package io.cronops.core.job;

/**
 * What a job invokes when it fires. Exactly one variant is populated per job.
 */
public sealed interface JobTarget permits HttpTarget, ScriptTarget {
    TargetType type();
}
