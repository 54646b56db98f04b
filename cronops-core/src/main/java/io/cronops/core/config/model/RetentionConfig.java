package io.cronops.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.cronops.core.user.Plan;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RetentionConfig(
    @JsonAlias({"free_days"}) int freeDays,
    @JsonAlias({"premium_days"}) int premiumDays,
    @JsonAlias({"pro_days"}) int proDays
) {

    public static RetentionConfig defaults() {
        return new RetentionConfig(7, 30, 90);
    }

    public int daysFor(Plan plan) {
        return switch (plan) {
            case FREE -> freeDays;
            case PREMIUM -> premiumDays;
            case PRO -> proDays;
        };
    }
}
