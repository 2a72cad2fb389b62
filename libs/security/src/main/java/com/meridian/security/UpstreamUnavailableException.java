package com.meridian.security;

import java.net.URI;

/**
 * Thrown when the OIDC discovery document or the JWK set cannot be fetched.
 * <p>
 * Treated as an {@link AuthenticationException} at the HTTP boundary; the failing URI
 * is kept for server-side logging only.
 */
public class UpstreamUnavailableException extends AuthenticationException {

    private final URI uri;

    public UpstreamUnavailableException(URI uri, String message, Throwable cause) {
        super("Failed to fetch '%s': %s".formatted(uri, message), cause);
        this.uri = uri;
    }

    public URI uri() {
        return uri;
    }
}
