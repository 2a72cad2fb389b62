package com.meridian.security.token;

import com.meridian.security.AuthenticationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed view over the decoded payload of an OIDC access token.
 * <p>
 * Only the fields the authorization core reads are lifted into components; everything
 * else stays available through {@link #raw()}. Role paths that are absent or have an
 * unexpected shape resolve to empty collections.
 *
 * @param username      value of {@code preferred_username}
 * @param realmRoles    {@code realm_access.roles}
 * @param resourceRoles {@code resource_access.<resource>.roles}, keyed by resource
 * @param raw           the complete, unmodifiable claim map
 */
public record Claims(
        String username,
        List<String> realmRoles,
        Map<String, List<String>> resourceRoles,
        Map<String, Object> raw
) {

    public static final String PREFERRED_USERNAME = "preferred_username";
    public static final String REALM_ACCESS = "realm_access";
    public static final String RESOURCE_ACCESS = "resource_access";
    public static final String ROLES = "roles";

    public Claims {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username must not be null or blank");
        }
        realmRoles = List.copyOf(realmRoles);
        Map<String, List<String>> copy = new LinkedHashMap<>();
        resourceRoles.forEach((resource, roles) -> copy.put(resource, List.copyOf(roles)));
        resourceRoles = Collections.unmodifiableMap(copy);
        raw = Collections.unmodifiableMap(new LinkedHashMap<>(raw));
    }

    /**
     * Builds claims from a decoded token payload.
     *
     * @param payload the JSON object of the token body
     * @return the typed claims
     * @throws AuthenticationException if {@code preferred_username} is missing or blank
     */
    public static Claims from(Map<String, Object> payload) {
        Object username = payload.get(PREFERRED_USERNAME);
        if (!(username instanceof String name) || name.isBlank()) {
            throw new AuthenticationException("Token has no '%s' claim".formatted(PREFERRED_USERNAME));
        }

        List<String> realmRoles = rolesOf(payload.get(REALM_ACCESS));

        Map<String, List<String>> resourceRoles = new LinkedHashMap<>();
        if (payload.get(RESOURCE_ACCESS) instanceof Map<?, ?> resources) {
            for (Map.Entry<?, ?> entry : resources.entrySet()) {
                if (entry.getKey() instanceof String resource && !resource.isBlank()) {
                    resourceRoles.put(resource, rolesOf(entry.getValue()));
                }
            }
        }

        return new Claims(name, realmRoles, resourceRoles, payload);
    }

    /**
     * Flattens realm and resource roles into one ordered set: realm roles first, then
     * resource roles in claim order.
     */
    public Set<RoleName> effectiveRoles() {
        Set<RoleName> roles = new LinkedHashSet<>();
        realmRoles.forEach(role -> roles.add(RoleName.realm(role)));
        resourceRoles.forEach((resource, names) ->
                names.forEach(role -> roles.add(RoleName.resource(resource, role))));
        return Collections.unmodifiableSet(roles);
    }

    private static List<String> rolesOf(Object access) {
        if (!(access instanceof Map<?, ?> map) || !(map.get(ROLES) instanceof List<?> values)) {
            return List.of();
        }
        List<String> roles = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value instanceof String role && !role.isBlank()) {
                roles.add(role);
            }
        }
        return roles;
    }
}
