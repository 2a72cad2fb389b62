package com.meridian.platformapi.infrastructure.http;

import com.meridian.observability.MetricFactory;
import com.meridian.security.UpstreamUnavailableException;
import com.meridian.security.token.JsonFetcher;
import io.micrometer.core.instrument.Timer;
import java.net.URI;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * {@link JsonFetcher} over a {@link RestTemplate} configured with connect and read timeouts.
 *
 * <p>No retries: a failed fetch fails the request being authenticated.
 */
public class RestTemplateJsonFetcher implements JsonFetcher {

    private static final Logger log = LoggerFactory.getLogger(RestTemplateJsonFetcher.class);

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final MetricFactory metrics;

    public RestTemplateJsonFetcher(RestTemplate restTemplate, MetricFactory metrics) {
        this.restTemplate = restTemplate;
        this.metrics = metrics;
    }

    @Override
    public Map<String, Object> fetch(URI uri) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        Timer.Sample sample = Timer.start(metrics.registry());
        String outcome = "error";
        try {
            ResponseEntity<Map<String, Object>> response =
                    restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), JSON_OBJECT);
            Map<String, Object> body = response.getBody();
            if (body == null) {
                throw new UpstreamUnavailableException(uri, "empty response body", null);
            }
            outcome = "success";
            return body;
        } catch (RestClientException e) {
            log.warn("Request to {} failed: {}", uri, e.getMessage());
            throw new UpstreamUnavailableException(uri, e.getMessage(), e);
        } finally {
            sample.stop(
                    metrics.timer(
                            "meridian.auth.upstream.fetch",
                            "OIDC discovery and JWKS fetches",
                            "outcome",
                            outcome));
        }
    }
}
