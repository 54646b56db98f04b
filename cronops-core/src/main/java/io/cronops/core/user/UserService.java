package io.cronops.core.user;

import io.cronops.core.error.AccessDeniedException;
import io.cronops.core.error.AuthenticationException;
import io.cronops.core.error.NotFoundException;
import io.cronops.core.error.ValidationException;
import io.cronops.core.job.JobChangeListener;
import io.cronops.core.job.JobStore;
import io.cronops.core.quota.PlanPolicy;
import java.io.IOException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public final class UserService {
    private static final String TOKEN_PREFIX = "cro_";

    private final UserStore store;
    private final JobStore jobs;
    private final JobChangeListener listener;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public UserService(UserStore store, JobStore jobs, JobChangeListener listener, Clock clock) {
        this.store = store;
        this.jobs = jobs;
        this.listener = listener == null ? JobChangeListener.NONE : listener;
        this.clock = clock;
    }

    public User create(String email, String name, Role role, Plan plan) throws IOException {
        String normalizedEmail = email == null ? "" : email.trim();
        if (normalizedEmail.isEmpty() || !normalizedEmail.contains("@")) {
            throw new ValidationException("a valid email is required");
        }
        if (store.findByEmail(normalizedEmail).isPresent()) {
            throw new ValidationException("email already registered: " + normalizedEmail);
        }
        String displayName = name == null || name.isBlank() ? normalizedEmail.substring(0, normalizedEmail.indexOf('@')) : name;
        User user = new User(
            UUID.randomUUID().toString(),
            normalizedEmail,
            displayName,
            role,
            plan,
            newToken(),
            clock.instant()
        );
        store.insert(user);
        return user;
    }

    public User authenticate(String token) throws IOException {
        return store.findByToken(token).orElseThrow(() -> new AuthenticationException("invalid or missing API token"));
    }

    public UserProfile profile(User user) throws IOException {
        long active = jobs.countsForUser(user.id()).active();
        PlanPolicy policy = PlanPolicy.of(user.plan());
        Integer limit = user.isAdmin() || policy.isUnlimited() ? null : policy.activeJobCeiling();
        return new UserProfile(user, active, limit);
    }

    /**
     * Applies immediately. Existing ACTIVE jobs stay ACTIVE even when the new plan's ceiling is lower.
     */
    public User changePlan(User user, Plan plan) throws IOException {
        if (!store.updatePlan(user.id(), plan)) {
            throw new NotFoundException("user", user.id());
        }
        listener.ownerChanged(user.id());
        return user.withPlan(plan);
    }

    public List<User> list() throws IOException {
        return store.list();
    }

    public List<UserSummary> listWithJobCounts(User admin) throws IOException {
        requireAdmin(admin);
        Map<String, Long> counts = jobs.jobCountsByUser();
        return store.list().stream()
            .map(user -> new UserSummary(user, counts.getOrDefault(user.id(), 0L)))
            .toList();
    }

    public User changeRole(User admin, String userId, Role role) throws IOException {
        requireAdmin(admin);
        User target = store.findById(userId).orElseThrow(() -> new NotFoundException("user", userId));
        store.updateRole(userId, role);
        return target.withRole(role);
    }

    public void delete(User admin, String userId) throws IOException {
        requireAdmin(admin);
        if (admin.id().equals(userId)) {
            throw new ValidationException("admins cannot delete their own account");
        }
        if (!store.delete(userId)) {
            throw new NotFoundException("user", userId);
        }
        listener.ownerChanged(userId);
    }

    public void requireAdmin(User user) {
        if (user == null || !user.isAdmin()) {
            throw new AccessDeniedException("admin role required");
        }
    }

    private String newToken() {
        byte[] bytes = new byte[32];
        random.nextBytes(bytes);
        return TOKEN_PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
