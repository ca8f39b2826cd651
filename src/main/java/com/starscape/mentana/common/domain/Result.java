package com.starscape.mentana.common.domain;

import com.starscape.mentana.common.exception.DomainError;
import com.starscape.mentana.common.exception.DomainException;
import com.starscape.mentana.common.exception.ErrorKind;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a port or use case call.
 *
 * <p>Sealed so that callers handle exactly two shapes:</p>
 * <ul>
 *   <li>{@link Success}: carries the value</li>
 *   <li>{@link Failure}: carries a {@link DomainError} whose {@link ErrorKind} says what went wrong</li>
 * </ul>
 *
 * @param <T> value type
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(DomainError error) {
        return new Failure<>(error);
    }

    static <T> Result<T> failure(ErrorKind kind, String message) {
        return new Failure<>(DomainError.of(kind, message));
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isFailure() {
        return this instanceof Failure;
    }

    /**
     * @throws IllegalStateException when called on a failure
     */
    default T value() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        throw new IllegalStateException("No value on failed result: " + error().message());
    }

    /**
     * @throws IllegalStateException when called on a success
     */
    default DomainError error() {
        if (this instanceof Failure<T> failure) {
            return failure.error();
        }
        throw new IllegalStateException("No error on successful result");
    }

    default <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Success<T> success) {
            return new Success<>(mapper.apply(success.value()));
        }
        return new Failure<>(error());
    }

    default <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
        if (this instanceof Success<T> success) {
            return mapper.apply(success.value());
        }
        return new Failure<>(error());
    }

    /**
     * Tags a failure with the use case that produced it. Successes pass through.
     */
    default Result<T> withOperation(String operation) {
        if (this instanceof Failure<T> failure) {
            return new Failure<>(failure.error().withOperation(operation));
        }
        return this;
    }

    /**
     * Unwraps the value or raises {@link DomainException} for the global exception handler.
     */
    default T orElseThrow() {
        if (this instanceof Failure<T> failure) {
            throw new DomainException(failure.error());
        }
        return value();
    }

    record Success<T>(T value) implements Result<T> {
    }

    record Failure<T>(DomainError error) implements Result<T> {

        public Failure {
            Objects.requireNonNull(error, "error");
        }
    }
}
