package io.cronops.core.stats;

import io.cronops.core.user.Plan;
import java.util.List;
import java.util.Map;

public record AdminAnalytics(ActivityReport activity, Map<Plan, Long> planDistribution, List<GrowthPoint> userGrowth) {
}
