package com.meridian.security;

/**
 * Actions that can be performed on an {@link EntityType}.
 */
public enum Action {

    CREATE("create"),
    READ("read"),
    UPDATE("update"),
    DELETE("delete");

    private final String value;

    Action(String value) {
        this.value = value;
    }

    /** The action name as written in the policy file (e.g., "read"). */
    public String value() {
        return value;
    }
}
