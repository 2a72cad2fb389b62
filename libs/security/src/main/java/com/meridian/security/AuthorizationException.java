package com.meridian.security;

/**
 * Thrown when an enabled identity is denied an (object, action) pair by the access policy.
 */
public class AuthorizationException extends RuntimeException {

    private final String username;
    private final String object;
    private final String action;

    public AuthorizationException(String username, String object, String action) {
        super("User '%s' is not allowed to '%s' on '%s'".formatted(username, action, object));
        this.username = username;
        this.object = object;
        this.action = action;
    }

    public String username() {
        return username;
    }

    public String object() {
        return object;
    }

    public String action() {
        return action;
    }
}
