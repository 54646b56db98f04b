package io.cronops.core.user;

/**
 * A user with their quota usage. {@code activeJobLimit} is null when the user has no ceiling.
 */
public record UserProfile(User user, long activeJobs, Integer activeJobLimit) {
}
