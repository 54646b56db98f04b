package io.cronops.core.stats;

import java.time.LocalDate;

public record DailyBucket(LocalDate date, long total, long successful, long failed) {
}
