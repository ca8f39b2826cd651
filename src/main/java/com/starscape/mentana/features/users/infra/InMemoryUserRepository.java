package com.starscape.mentana.features.users.infra;

import com.starscape.mentana.common.domain.Result;
import com.starscape.mentana.common.exception.DomainError;
import com.starscape.mentana.common.health.ProbeResult;
import com.starscape.mentana.features.users.domain.User;
import com.starscape.mentana.features.users.domain.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Process-local {@link UserRepository} backed by maps.
 *
 * <p>Users are kept in insertion order. A second map from email to id gives the same
 * uniqueness guarantee the DynamoDB adapter gets from its lock items. All access goes
 * through the instance monitor, so create is atomic with respect to the email check.</p>
 *
 * <p>Entities are copied on the way in and out; callers never share state with the store.
 * Data is lost on restart.</p>
 */
public class InMemoryUserRepository implements UserRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryUserRepository.class);

    private final Map<UUID, User> users = new LinkedHashMap<>();
    private final Map<String, UUID> idsByEmail = new HashMap<>();

    @Override
    public synchronized Result<User> create(User user) {
        if (user == null) {
            return Result.failure(DomainError.validation("User is required"));
        }
        if (users.containsKey(user.getId())) {
            return Result.failure(DomainError.conflict("User already exists: " + user.getId()));
        }
        if (idsByEmail.containsKey(user.getEmail())) {
            return Result.failure(DomainError.conflict("Email is already registered: " + user.getEmail()));
        }
        users.put(user.getId(), user.copy());
        idsByEmail.put(user.getEmail(), user.getId());
        log.debug("Stored user {} in memory", user.getId());
        return Result.success(user);
    }

    @Override
    public synchronized Result<User> findById(UUID id) {
        User user = users.get(id);
        if (user == null) {
            return Result.failure(DomainError.notFound("User not found: " + id));
        }
        return Result.success(user.copy());
    }

    @Override
    public synchronized Result<User> findByEmail(String email) {
        UUID id = email == null ? null : idsByEmail.get(User.normalizeEmail(email));
        if (id == null) {
            return Result.failure(DomainError.notFound("User not found for email: " + email));
        }
        return Result.success(users.get(id).copy());
    }

    @Override
    public synchronized Result<List<User>> findAll() {
        List<User> result = new ArrayList<>(users.size());
        users.values().forEach(user -> result.add(user.copy()));
        return Result.success(result);
    }

    @Override
    public synchronized Result<List<User>> findActive() {
        List<User> result = new ArrayList<>();
        users.values().stream()
                .filter(User::isActive)
                .forEach(user -> result.add(user.copy()));
        return Result.success(result);
    }

    @Override
    public synchronized Result<User> update(User user) {
        User existing = users.get(user.getId());
        if (existing == null) {
            return Result.failure(DomainError.notFound("User not found: " + user.getId()));
        }
        // email is immutable; keep the stored one
        User updated = User.restore(existing.getId(), existing.getEmail(), user.getName(),
                user.isActive(), existing.getCreatedAt(), user.getUpdatedAt());
        users.put(updated.getId(), updated);
        return Result.success(updated.copy());
    }

    @Override
    public synchronized Result<User> delete(UUID id) {
        User removed = users.remove(id);
        if (removed == null) {
            return Result.failure(DomainError.notFound("User not found: " + id));
        }
        idsByEmail.remove(removed.getEmail());
        return Result.success(removed);
    }

    @Override
    public ProbeResult probe() {
        return ProbeResult.reachable("in-memory store, " + size() + " users");
    }

    public synchronized int size() {
        return users.size();
    }
}
