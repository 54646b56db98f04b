package io.cronops.core.user;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface UserStore {
    void insert(User user) throws IOException;

    Optional<User> findById(String id) throws IOException;

    Optional<User> findByToken(String apiToken) throws IOException;

    Optional<User> findByEmail(String email) throws IOException;

    List<User> list() throws IOException;

    boolean updateRole(String id, Role role) throws IOException;

    boolean updatePlan(String id, Plan plan) throws IOException;

    boolean delete(String id) throws IOException;
}
