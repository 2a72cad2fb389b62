package com.meridian.security.token;

/**
 * A role asserted by a token, kept as a structured (namespace, role) pair.
 * <p>
 * Realm roles have no namespace; resource (client) roles are namespaced by the resource
 * they were granted on. The colon-joined form produced by {@link #qualified()} is only
 * used where roles meet policy rules.
 *
 * @param namespace resource the role belongs to, or {@code null} for realm roles
 * @param role      the role name within its namespace
 */
public record RoleName(String namespace, String role) {

    /** Separator between namespace and role in the qualified form. */
    public static final char SEPARATOR = ':';

    public RoleName {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role must not be null or blank");
        }
        if (namespace != null && namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must be null or non-blank");
        }
    }

    /** Creates a realm-level role. */
    public static RoleName realm(String role) {
        return new RoleName(null, role);
    }

    /** Creates a role scoped to the given resource. */
    public static RoleName resource(String namespace, String role) {
        return new RoleName(namespace, role);
    }

    /**
     * Parses a qualified role name. The last separator splits namespace from role, so a
     * namespace may itself contain colons; a role name never does.
     *
     * @param qualified e.g. {@code "apisix:api_admin"} or {@code "offline_access"}
     */
    public static RoleName parse(String qualified) {
        if (qualified == null || qualified.isBlank()) {
            throw new IllegalArgumentException("qualified role name must not be null or blank");
        }
        int idx = qualified.lastIndexOf(SEPARATOR);
        if (idx <= 0 || idx == qualified.length() - 1) {
            return realm(qualified);
        }
        return resource(qualified.substring(0, idx), qualified.substring(idx + 1));
    }

    /** Whether this role is scoped to a resource. */
    public boolean isResourceRole() {
        return namespace != null;
    }

    /** The policy-facing form: {@code role} or {@code namespace:role}. */
    public String qualified() {
        return namespace == null ? role : namespace + SEPARATOR + role;
    }

    @Override
    public String toString() {
        return qualified();
    }
}
