package com.meridian.security;

/**
 * Thrown when the token is valid but its subject holds neither the admin role nor the
 * basic-access role.
 * <p>
 * Extends {@link AuthenticationException} so that it surfaces exactly like an invalid
 * token and does not reveal whether the username exists.
 */
public class AccessDisabledException extends AuthenticationException {

    private final String username;

    public AccessDisabledException(String username) {
        super("API access is not enabled for user '%s'".formatted(username));
        this.username = username;
    }

    public String username() {
        return username;
    }
}
