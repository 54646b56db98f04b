package io.cronops.core.execution;

import java.time.Instant;

public record ExecutionPoint(Instant startedAt, ExecutionStatus status) {
}
