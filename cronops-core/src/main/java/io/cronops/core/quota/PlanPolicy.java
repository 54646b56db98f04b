package io.cronops.core.quota;

import io.cronops.core.user.Plan;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-plan limits: how many ACTIVE jobs a user may hold and how often the scheduler looks at
 * that user's jobs.
 */
public record PlanPolicy(Plan plan, int activeJobCeiling, Duration resolution) {
    public static final int UNLIMITED = -1;

    private static final Map<Plan, PlanPolicy> TABLE = table();

    public static PlanPolicy of(Plan plan) {
        return TABLE.get(plan == null ? Plan.FREE : plan);
    }

    public boolean isUnlimited() {
        return activeJobCeiling == UNLIMITED;
    }

    private static Map<Plan, PlanPolicy> table() {
        Map<Plan, PlanPolicy> table = new EnumMap<>(Plan.class);
        table.put(Plan.FREE, new PlanPolicy(Plan.FREE, 3, Duration.ofSeconds(60)));
        table.put(Plan.PREMIUM, new PlanPolicy(Plan.PREMIUM, 100, Duration.ofSeconds(30)));
        table.put(Plan.PRO, new PlanPolicy(Plan.PRO, UNLIMITED, Duration.ofSeconds(1)));
        return table;
    }
}
