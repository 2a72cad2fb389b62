package com.meridian.security.policy;

/**
 * Thrown when the static access policy cannot be read or contains invalid entries.
 * Raised at start-up only.
 */
public class PolicyDefinitionException extends RuntimeException {

    public PolicyDefinitionException(String message) {
        super(message);
    }

    public PolicyDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
