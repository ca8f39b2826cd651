package com.starscape.mentana.features.users.domain;

import com.starscape.mentana.common.domain.Entity;
import com.starscape.mentana.common.domain.Result;
import com.starscape.mentana.common.exception.DomainError;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

public class User extends Entity<UUID> {

    public static final int MAX_NAME_LENGTH = 100;

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private final String email;
    private String name;
    private boolean active;
    private final Instant createdAt;
    private Instant updatedAt;

    private User(UUID id, String email, String name, boolean active, Instant createdAt, Instant updatedAt) {
        super(id);
        this.email = Objects.requireNonNull(email);
        this.name = Objects.requireNonNull(name);
        this.active = active;
        this.createdAt = Objects.requireNonNull(createdAt);
        this.updatedAt = Objects.requireNonNull(updatedAt);
    }

    /**
     * Validates the input and builds a new active user with a fresh id.
     * Email is trimmed and lower-cased, name is trimmed.
     *
     * @return the user, or a VALIDATION failure describing the first invalid field
     */
    public static Result<User> create(String email, String name) {
        if (email == null || email.isBlank()) {
            return Result.failure(DomainError.validation("Email is required"));
        }
        String normalizedEmail = normalizeEmail(email);
        if (!EMAIL_PATTERN.matcher(normalizedEmail).matches()) {
            return Result.failure(DomainError.validation("Invalid email: " + email.trim()));
        }
        Result<String> validName = validateName(name);
        if (validName.isFailure()) {
            return Result.failure(validName.error());
        }
        Instant now = Instant.now();
        return Result.success(new User(UUID.randomUUID(), normalizedEmail, validName.value(), true, now, now));
    }

    /**
     * Rebuilds a user from stored attributes. No id is generated.
     */
    public static User restore(UUID id, String email, String name, boolean active,
                               Instant createdAt, Instant updatedAt) {
        return new User(id, email, name, active, createdAt, updatedAt);
    }

    /**
     * Parses an id received from outside. A malformed id is a VALIDATION failure.
     */
    public static Result<UUID> parseId(String id) {
        if (id == null || id.isBlank()) {
            return Result.failure(DomainError.validation("User id is required"));
        }
        try {
            return Result.success(UUID.fromString(id.trim()));
        } catch (IllegalArgumentException e) {
            return Result.failure(DomainError.validation("Invalid user id: " + id));
        }
    }

    /**
     * Canonical form of an email address as stored: trimmed and lower-cased.
     * Lookups must go through this so they match what {@link #create} stored.
     */
    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public User copy() {
        return new User(getId(), email, name, active, createdAt, updatedAt);
    }

    public Result<User> rename(String newName) {
        Result<String> validName = validateName(newName);
        if (validName.isFailure()) {
            return Result.failure(validName.error());
        }
        this.name = validName.value();
        this.updatedAt = Instant.now();
        return Result.success(this);
    }

    public void activate() {
        this.active = true;
        this.updatedAt = Instant.now();
    }

    public void deactivate() {
        this.active = false;
        this.updatedAt = Instant.now();
    }

    public String getEmail() {
        return email;
    }

    public String getName() {
        return name;
    }

    public boolean isActive() {
        return active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    private static Result<String> validateName(String name) {
        if (name == null || name.isBlank()) {
            return Result.failure(DomainError.validation("Name is required"));
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            return Result.failure(DomainError.validation(
                    "Name must be at most " + MAX_NAME_LENGTH + " characters"));
        }
        return Result.success(trimmed);
    }

    @Override
    public String toString() {
        return "User{id=" + getId() + ", email='" + email + "', active=" + active + "}";
    }
}
