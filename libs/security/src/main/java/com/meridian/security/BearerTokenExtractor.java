package com.meridian.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Extracts bearer tokens from HTTP Authorization headers.
 */
public final class BearerTokenExtractor {

    private static final String SCHEME = "bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the bearer token from an Authorization header value.
     * <p>
     * Expects format: {@code "Bearer <token>"}. The scheme is matched case-insensitively
     * and must be followed by whitespace, so {@code "Bearerxyz"} is rejected.
     *
     * @param authorizationHeader the full Authorization header value (may be null)
     * @return the token string, or empty if the header is missing/malformed
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (!trimmed.toLowerCase(Locale.ROOT).startsWith(SCHEME)) {
            return Optional.empty();
        }
        String rest = trimmed.substring(SCHEME.length());
        if (!rest.isEmpty() && !Character.isWhitespace(rest.charAt(0))) {
            return Optional.empty();
        }
        String token = rest.strip();
        if (token.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(token);
    }
}
