package io.cronops.core.user;

public record UserSummary(User user, long jobCount) {
}
