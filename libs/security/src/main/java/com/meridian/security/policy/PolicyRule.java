package com.meridian.security.policy;

/**
 * An allow rule: holders of {@code subject} (a user name or role) may perform
 * {@code action} on {@code object}. {@value #WILDCARD} in object or action matches anything.
 */
public record PolicyRule(String subject, String object, String action) {

    public static final String WILDCARD = "*";

    public PolicyRule {
        requireText(subject, "subject");
        requireText(object, "object");
        requireText(action, "action");
    }

    /** Whether this rule covers the requested object and action. */
    public boolean covers(String requestedObject, String requestedAction) {
        return matches(object, requestedObject) && matches(action, requestedAction);
    }

    private static boolean matches(String pattern, String value) {
        return WILDCARD.equals(pattern) || pattern.equals(value);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new PolicyDefinitionException("rule " + name + " must not be blank");
        }
    }
}
