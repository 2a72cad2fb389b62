package com.meridian.security.policy;

/**
 * Role hierarchy edge: {@code member} (a user or role) holds {@code role}.
 */
public record RoleGrant(String member, String role) {

    public RoleGrant {
        if (member == null || member.isBlank() || role == null || role.isBlank()) {
            throw new PolicyDefinitionException("grant member and role must not be blank");
        }
        if (member.equals(role)) {
            throw new PolicyDefinitionException("role '%s' cannot be granted to itself".formatted(role));
        }
    }
}
