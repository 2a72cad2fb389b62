package com.meridian.security.token;

import com.nimbusds.jose.jwk.JWKSet;

import java.net.URI;

/**
 * Supplies the signing keys published behind an OIDC discovery endpoint.
 */
public interface JwkSetSource {

    /**
     * Returns the current JWK set for the discovery endpoint, possibly from cache.
     *
     * @throws com.meridian.security.UpstreamUnavailableException if the keys cannot be fetched
     */
    JWKSet get(URI discoveryUrl);

    /**
     * Drops the cached JWK set so the next {@link #get} re-fetches it, unless it was
     * loaded too recently to be worth refreshing.
     *
     * @return true if the cached set was dropped
     */
    boolean refresh(URI discoveryUrl);
}
