package com.meridian.security.identity;

import com.meridian.security.token.RoleName;

/**
 * The two roles that gate API access: holders of {@code admin} may do anything, holders
 * of {@code basicAccess} are enabled and subject to the policy rules. Both are scoped to
 * the API gateway's client.
 */
public record AccessRoles(RoleName admin, RoleName basicAccess) {

    public static final String DEFAULT_ADMIN_ROLE = "api_admin";
    public static final String DEFAULT_BASIC_ACCESS_ROLE = "api_basic_access";

    public AccessRoles {
        if (admin == null || basicAccess == null) {
            throw new IllegalArgumentException("admin and basicAccess roles are required");
        }
    }

    /**
     * Builds the access roles for a client, e.g. {@code apisix:api_admin}.
     */
    public static AccessRoles forClient(String clientId, String adminRole, String basicAccessRole) {
        return new AccessRoles(RoleName.resource(clientId, adminRole), RoleName.resource(clientId, basicAccessRole));
    }

    /** Default role names for the given client. */
    public static AccessRoles forClient(String clientId) {
        return forClient(clientId, DEFAULT_ADMIN_ROLE, DEFAULT_BASIC_ACCESS_ROLE);
    }
}
