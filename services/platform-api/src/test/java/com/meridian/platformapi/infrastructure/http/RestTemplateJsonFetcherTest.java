package com.meridian.platformapi.infrastructure.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.meridian.observability.MetricFactory;
import com.meridian.security.UpstreamUnavailableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.URI;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

@DisplayName("RestTemplateJsonFetcher")
class RestTemplateJsonFetcherTest {

    private static final URI DISCOVERY =
            URI.create("http://idp.test/realms/meridian/.well-known/openid-configuration");

    private SimpleMeterRegistry registry;
    private MockRestServiceServer server;
    private RestTemplateJsonFetcher fetcher;

    @BeforeEach
    void setUp() {
        var restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        registry = new SimpleMeterRegistry();
        fetcher = new RestTemplateJsonFetcher(restTemplate, new MetricFactory(registry, "platform-api-test"));
    }

    @Test
    @DisplayName("returns the JSON object and times the call as a success")
    void fetchesJsonObject() {
        server.expect(requestTo(DISCOVERY))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE))
                .andRespond(withSuccess(
                        "{\"issuer\":\"http://idp.test/realms/meridian\","
                                + "\"jwks_uri\":\"http://idp.test/realms/meridian/certs\"}",
                        MediaType.APPLICATION_JSON));

        var body = fetcher.fetch(DISCOVERY);

        assertThat(body).containsEntry("jwks_uri", "http://idp.test/realms/meridian/certs");
        server.verify();
        assertThat(registry.find("meridian.auth.upstream.fetch").tag("outcome", "success").timer())
                .isNotNull()
                .satisfies(timer -> assertThat(timer.count()).isEqualTo(1));
    }

    @Test
    @DisplayName("wraps HTTP errors in UpstreamUnavailableException")
    void wrapsServerErrors() {
        server.expect(requestTo(DISCOVERY)).andRespond(withServerError());

        assertThatThrownBy(() -> fetcher.fetch(DISCOVERY))
                .isInstanceOf(UpstreamUnavailableException.class)
                .satisfies(e -> assertThat(((UpstreamUnavailableException) e).uri()).isEqualTo(DISCOVERY));
        assertThat(registry.find("meridian.auth.upstream.fetch").tag("outcome", "error").timer()).isNotNull();
    }

    @Test
    @DisplayName("rejects an empty response body")
    void rejectsEmptyBody() {
        server.expect(requestTo(DISCOVERY)).andRespond(withSuccess());

        assertThatThrownBy(() -> fetcher.fetch(DISCOVERY))
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageContaining("empty response body");
    }
}
