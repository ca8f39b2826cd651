package com.starscape.mentana.common.exception;

/**
 * Failure categories shared by every port, adapter and use case.
 * Adapters translate backend-native errors into one of these at their boundary.
 */
public enum ErrorKind {
    /** Bad input. Never retried. */
    VALIDATION,
    /** A unique field is already taken. */
    CONFLICT,
    /** The requested entity does not exist. */
    NOT_FOUND,
    /** Transient backend or network failure; the caller may retry. */
    UNAVAILABLE,
    /** The backend refused the call for the configured credentials. */
    PERMISSION_DENIED,
    /** Unknown backend type or missing required setting. */
    CONFIGURATION
}
