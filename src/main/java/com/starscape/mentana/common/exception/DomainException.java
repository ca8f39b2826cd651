package com.starscape.mentana.common.exception;

/**
 * Raised at the HTTP edge when a failed {@link com.starscape.mentana.common.domain.Result}
 * is unwrapped. {@link GlobalExceptionHandler} maps the carried kind to a status code.
 */
public class DomainException extends RuntimeException {

    private final DomainError error;

    public DomainException(DomainError error) {
        super(error.message());
        this.error = error;
    }

    public DomainError getError() {
        return error;
    }

    public ErrorKind getKind() {
        return error.kind();
    }
}
