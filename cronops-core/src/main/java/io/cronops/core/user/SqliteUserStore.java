package io.cronops.core.user;

import io.cronops.core.storage.SqliteDatabase;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class SqliteUserStore implements UserStore {
    private static final String COLUMNS = "id, email, name, role, plan, api_token, created_at";

    private final SqliteDatabase database;

    public SqliteUserStore(SqliteDatabase database) {
        this.database = Objects.requireNonNull(database, "database must not be null");
    }

    @Override
    public synchronized void insert(User user) throws IOException {
        String sql = """
            INSERT INTO users (id, email, name, role, plan, api_token, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, user.id());
            statement.setString(2, user.email());
            statement.setString(3, user.name());
            statement.setString(4, user.role().name());
            statement.setString(5, user.plan().name());
            statement.setString(6, user.apiToken());
            statement.setString(7, user.createdAt().toString());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to insert user " + user.email(), e);
        }
    }

    @Override
    public synchronized Optional<User> findById(String id) throws IOException {
        return findOne("SELECT " + COLUMNS + " FROM users WHERE id = ?", id);
    }

    @Override
    public synchronized Optional<User> findByToken(String apiToken) throws IOException {
        if (apiToken == null || apiToken.isBlank()) {
            return Optional.empty();
        }
        return findOne("SELECT " + COLUMNS + " FROM users WHERE api_token = ?", apiToken);
    }

    @Override
    public synchronized Optional<User> findByEmail(String email) throws IOException {
        return findOne("SELECT " + COLUMNS + " FROM users WHERE lower(email) = lower(?)", email);
    }

    @Override
    public synchronized List<User> list() throws IOException {
        String sql = "SELECT " + COLUMNS + " FROM users ORDER BY created_at DESC, rowid DESC";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<User> users = new ArrayList<>();
            while (resultSet.next()) {
                users.add(read(resultSet));
            }
            return users;
        } catch (SQLException e) {
            throw new IOException("Failed to list users", e);
        }
    }

    @Override
    public synchronized boolean updateRole(String id, Role role) throws IOException {
        return update("UPDATE users SET role = ? WHERE id = ?", role.name(), id);
    }

    @Override
    public synchronized boolean updatePlan(String id, Plan plan) throws IOException {
        return update("UPDATE users SET plan = ? WHERE id = ?", plan.name(), id);
    }

    @Override
    public synchronized boolean delete(String id) throws IOException {
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM users WHERE id = ?")) {
            statement.setString(1, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to delete user " + id, e);
        }
    }

    private boolean update(String sql, String value, String id) throws IOException {
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, value);
            statement.setString(2, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to update user " + id, e);
        }
    }

    private Optional<User> findOne(String sql, String key) throws IOException {
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, key);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(read(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load user", e);
        }
    }

    private User read(ResultSet resultSet) throws SQLException {
        return new User(
            resultSet.getString("id"),
            resultSet.getString("email"),
            resultSet.getString("name"),
            Role.valueOf(resultSet.getString("role")),
            Plan.valueOf(resultSet.getString("plan")),
            resultSet.getString("api_token"),
            Instant.parse(resultSet.getString("created_at"))
        );
    }
}
