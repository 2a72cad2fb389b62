package com.meridian.security.identity;

import java.util.List;
import java.util.Map;

/**
 * Serializable description of an {@link Identity}. Claims are redacted.
 */
public record IdentitySummary(
        String username,
        boolean admin,
        boolean enabled,
        List<String> roles,
        Map<String, Object> claims
) {
}
