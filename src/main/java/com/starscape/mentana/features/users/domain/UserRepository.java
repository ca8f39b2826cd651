package com.starscape.mentana.features.users.domain;

import com.starscape.mentana.common.domain.Result;
import com.starscape.mentana.common.health.LivenessProbe;

import java.util.List;
import java.util.UUID;

/**
 * Persistence port for {@link User}.
 *
 * <p>Failures come back as {@link com.starscape.mentana.common.exception.ErrorKind}:
 * CONFLICT for a taken email, VALIDATION for an unusable entity, NOT_FOUND for a missing id,
 * UNAVAILABLE for transient backend trouble.
 */
public interface UserRepository extends LivenessProbe {

    /**
     * Stores a new user. Fails with CONFLICT when the email is already registered.
     */
    Result<User> create(User user);

    Result<User> findById(UUID id);

    Result<User> findByEmail(String email);

    /**
     * All users in backend-defined order. An empty store yields an empty list.
     */
    Result<List<User>> findAll();

    Result<List<User>> findActive();

    /**
     * Persists name and active flag of an existing user. Email is immutable.
     */
    Result<User> update(User user);

    /**
     * Removes the user and releases its email.
     *
     * @return the removed user
     */
    Result<User> delete(UUID id);
}
