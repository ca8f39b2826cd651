package com.starscape.mentana.common.exception;

import java.util.Objects;

/**
 * A typed failure travelling inside a {@link com.starscape.mentana.common.domain.Result}.
 *
 * @param kind      failure category
 * @param message   human-readable description
 * @param operation use case that was attempted, or null when raised below the use case layer
 */
public record DomainError(
    ErrorKind kind,
    String message,
    String operation
) {

    public DomainError {
        Objects.requireNonNull(kind, "kind");
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be blank");
        }
    }

    public static DomainError of(ErrorKind kind, String message) {
        return new DomainError(kind, message, null);
    }

    public static DomainError validation(String message) {
        return of(ErrorKind.VALIDATION, message);
    }

    public static DomainError conflict(String message) {
        return of(ErrorKind.CONFLICT, message);
    }

    public static DomainError notFound(String message) {
        return of(ErrorKind.NOT_FOUND, message);
    }

    public static DomainError unavailable(String message) {
        return of(ErrorKind.UNAVAILABLE, message);
    }

    /**
     * Returns a copy tagged with the use case that was attempted.
     * The kind and message are left untouched.
     */
    public DomainError withOperation(String operation) {
        return new DomainError(kind, message, operation);
    }
}
