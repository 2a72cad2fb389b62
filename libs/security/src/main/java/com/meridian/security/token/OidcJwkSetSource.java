package com.meridian.security.token;

import com.meridian.security.AuthenticationException;
import com.meridian.security.UpstreamUnavailableException;
import com.nimbusds.jose.jwk.JWKSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.text.ParseException;
import java.time.Duration;
import java.util.Map;

/**
 * {@link JwkSetSource} that follows an OIDC discovery document to its {@code jwks_uri}
 * and caches the parsed key set per discovery URL.
 */
public class OidcJwkSetSource implements JwkSetSource {

    private static final Logger log = LoggerFactory.getLogger(OidcJwkSetSource.class);

    /** Discovery document field pointing at the key set. */
    public static final String JWKS_URI = "jwks_uri";

    private final JsonFetcher fetcher;
    private final ExpiringCache<URI, JWKSet> cache;
    private final Duration minRefreshInterval;

    /**
     * @param fetcher            HTTP JSON fetcher with timeouts
     * @param cache              shared key-set cache, keyed by discovery URL
     * @param minRefreshInterval minimum age of a cached set before {@link #refresh} drops it
     */
    public OidcJwkSetSource(JsonFetcher fetcher, ExpiringCache<URI, JWKSet> cache, Duration minRefreshInterval) {
        this.fetcher = fetcher;
        this.cache = cache;
        this.minRefreshInterval = minRefreshInterval;
    }

    @Override
    public JWKSet get(URI discoveryUrl) {
        try {
            return cache.get(discoveryUrl, this::load);
        } catch (AuthenticationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UpstreamUnavailableException(discoveryUrl, e.getMessage(), e);
        }
    }

    @Override
    public boolean refresh(URI discoveryUrl) {
        boolean dropped = cache.invalidateIfOlderThan(discoveryUrl, minRefreshInterval);
        if (dropped) {
            log.info("Dropped cached JWK set for {} to pick up rotated keys", discoveryUrl);
        }
        return dropped;
    }

    private JWKSet load(URI discoveryUrl) {
        log.info("Fetching OpenID configuration from: {}", discoveryUrl);
        Map<String, Object> discovery = fetcher.fetch(discoveryUrl);

        if (!(discovery.get(JWKS_URI) instanceof String jwksUri) || jwksUri.isBlank()) {
            throw new UpstreamUnavailableException(discoveryUrl, "discovery document has no " + JWKS_URI, null);
        }

        URI keysUri = URI.create(jwksUri);
        log.debug("Fetching JWK set from: {}", keysUri);
        Map<String, Object> jwks = fetcher.fetch(keysUri);

        try {
            JWKSet keys = JWKSet.parse(jwks);
            log.debug("Loaded {} signing keys from {}", keys.getKeys().size(), keysUri);
            return keys;
        } catch (ParseException e) {
            throw new UpstreamUnavailableException(keysUri, "invalid JWK set: " + e.getMessage(), e);
        }
    }
}
