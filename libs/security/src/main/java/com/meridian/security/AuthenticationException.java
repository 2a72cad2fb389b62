package com.meridian.security;

/**
 * Thrown when a request carries no usable identity: the bearer token is missing,
 * malformed, unverifiable, expired, or its signing key cannot be resolved.
 * <p>
 * The message is meant for server-side logs. The HTTP layer replaces it with a generic
 * text unless verbose errors are explicitly enabled.
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
