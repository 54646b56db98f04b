package io.cronops.core.stats;

import java.time.LocalDate;

public record GrowthPoint(LocalDate date, long users) {
}
