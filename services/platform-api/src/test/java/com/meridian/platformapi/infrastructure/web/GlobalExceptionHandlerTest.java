package com.meridian.platformapi.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.meridian.observability.CorrelationContext;
import com.meridian.observability.CorrelationContextHolder;
import com.meridian.platformapi.config.PlatformApiProperties;
import com.meridian.platformapi.domain.ResourceNotFoundException;
import com.meridian.security.AccessDisabledException;
import com.meridian.security.AuthenticationException;
import com.meridian.security.AuthorizationException;
import com.meridian.security.UpstreamUnavailableException;
import java.net.URI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ProblemDetail;
import org.springframework.web.HttpRequestMethodNotSupportedException;

/** Unit tests for {@link GlobalExceptionHandler}, without a Spring context. */
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler =
            new GlobalExceptionHandler(new PlatformApiProperties("platform-api", "test", false));

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("authentication failures")
    class Authentication {

        @Test
        @DisplayName("map to 401 with a Bearer challenge and a generic detail")
        void unauthorized() {
            var response = handler.handleAuthentication(new AuthenticationException("Signature verification failed"));

            assertThat(response.getStatusCode().value()).isEqualTo(401);
            assertThat(response.getHeaders().getFirst(HttpHeaders.WWW_AUTHENTICATE)).isEqualTo("Bearer");
            assertThat(response.getBody()).isNotNull();
            assertThat(response.getBody().getDetail()).isEqualTo(GlobalExceptionHandler.GENERIC_UNAUTHORIZED);
            assertThat(response.getBody().getTitle()).isEqualTo("Unauthorized");
        }

        @Test
        @DisplayName("look the same for disabled accounts and unreachable identity providers")
        void indistinguishable() {
            var disabled = handler.handleAuthentication(new AccessDisabledException("mallory"));
            var upstream = handler.handleAuthentication(new UpstreamUnavailableException(
                    URI.create("http://idp.test/jwks"), "connect timed out", null));

            assertThat(disabled.getStatusCode().value()).isEqualTo(401);
            assertThat(upstream.getStatusCode().value()).isEqualTo(401);
            assertThat(disabled.getBody().getDetail()).isEqualTo(upstream.getBody().getDetail());
            assertThat(disabled.getBody().getDetail()).doesNotContain("mallory");
        }

        @Test
        @DisplayName("carry the reason when verbose errors are on")
        void verbose() {
            var verbose = new GlobalExceptionHandler(new PlatformApiProperties("platform-api", "test", true));

            var response = verbose.handleAuthentication(new AuthenticationException("Token expired"));

            assertThat(response.getBody().getDetail()).isEqualTo("Token expired");
        }
    }

    @Test
    @DisplayName("maps AuthorizationException to 403 without naming the object")
    void forbidden() {
        ProblemDetail result = handler.handleAuthorization(new AuthorizationException("bob", "asset", "delete"));

        assertThat(result.getStatus()).isEqualTo(403);
        assertThat(result.getDetail()).isEqualTo(GlobalExceptionHandler.GENERIC_FORBIDDEN);
    }

    @Test
    @DisplayName("maps ResourceNotFoundException to 404")
    void notFound() {
        ProblemDetail result = handler.handleNotFound(new ResourceNotFoundException("Asset", 42));

        assertThat(result.getStatus()).isEqualTo(404);
        assertThat(result.getDetail()).isEqualTo("Asset 42 not found");
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400 Bad Request")
    void handlesIllegalArgumentAsBadRequest() {
        ProblemDetail result = handler.handleIllegalArgument(new IllegalArgumentException("invalid input"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("invalid input");
        assertThat(result.getTitle()).isEqualTo("Bad Request");
    }

    @Test
    @DisplayName("maps generic Exception to 500 Internal Server Error")
    void handlesGenericExceptionAsInternalError() {
        var response = handler.handleGeneric(new RuntimeException("something broke"));

        assertThat(response.getStatusCode().value()).isEqualTo(500);
        assertThat(response.getBody().getTitle()).isEqualTo("Internal Server Error");
        assertThat(response.getBody().getDetail()).doesNotContain("something broke");
    }

    @Test
    @DisplayName("keeps the status of Spring MVC's own errors")
    void keepsFrameworkStatus() {
        var response = handler.handleGeneric(new HttpRequestMethodNotSupportedException("PUT"));

        assertThat(response.getStatusCode().value()).isEqualTo(405);
        assertThat(response.getBody().getProperties()).containsKey("timestamp");
    }

    @Test
    @DisplayName("error response includes timestamp and correlation ID")
    void errorResponseIncludesCorrelation() {
        CorrelationContextHolder.set(new CorrelationContext("corr-1", null, "req-1"));

        ProblemDetail result = handler.handleIllegalArgument(new IllegalArgumentException("oops"));

        assertThat(result.getProperties())
                .containsKey("timestamp")
                .containsEntry("correlationId", "corr-1");
    }
}
