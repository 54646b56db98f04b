package io.cronops.core.user;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;

public record User(
    String id,
    String email,
    String name,
    Role role,
    Plan plan,
    @JsonIgnore String apiToken,
    Instant createdAt
) {
    public User {
        id = id == null ? "" : id.trim();
        email = email == null ? "" : email.trim();
        name = name == null ? "" : name.trim();
        role = role == null ? Role.USER : role;
        plan = plan == null ? Plan.FREE : plan;
        apiToken = apiToken == null ? "" : apiToken;
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
    }

    @JsonIgnore
    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public User withRole(Role newRole) {
        return new User(id, email, name, newRole, plan, apiToken, createdAt);
    }

    public User withPlan(Plan newPlan) {
        return new User(id, email, name, role, newPlan, apiToken, createdAt);
    }
}
