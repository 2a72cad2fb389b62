package com.meridian.security.token;

import com.meridian.security.UpstreamUnavailableException;

import java.net.URI;
import java.util.Map;

/**
 * Fetches a JSON object over HTTP. Implementations must apply connect and read timeouts
 * and must not retry.
 */
@FunctionalInterface
public interface JsonFetcher {

    /**
     * @param uri the document to fetch
     * @return the parsed JSON object
     * @throws UpstreamUnavailableException on any network, status or parse failure
     */
    Map<String, Object> fetch(URI uri);
}
