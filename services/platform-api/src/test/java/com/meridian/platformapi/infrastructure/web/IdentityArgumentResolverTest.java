package com.meridian.platformapi.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.meridian.observability.CorrelationContext;
import com.meridian.observability.CorrelationContextHolder;
import com.meridian.observability.MetricFactory;
import com.meridian.security.AccessDisabledException;
import com.meridian.security.AuthenticationException;
import com.meridian.security.identity.AccessRoles;
import com.meridian.security.identity.Identity;
import com.meridian.security.identity.IdentityFactory;
import com.meridian.security.policy.PolicyModelLoader;
import com.meridian.security.testing.InMemoryJwkSetSource;
import com.meridian.security.testing.TestTokens;
import com.meridian.security.token.TokenResolver;
import com.meridian.security.token.TokenVerificationSettings;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.ServletWebRequest;

@DisplayName("IdentityArgumentResolver")
class IdentityArgumentResolverTest {

    private static final TestTokens TOKENS = TestTokens.create();

    private SimpleMeterRegistry registry;
    private InMemoryJwkSetSource keys;
    private IdentityArgumentResolver resolver;

    @BeforeEach
    void setUp() {
        var model =
                new PolicyModelLoader(
                                Map.of(
                                        "client-id", TestTokens.CLIENT_ID,
                                        "role-admin", AccessRoles.DEFAULT_ADMIN_ROLE,
                                        "role-basic-access", AccessRoles.DEFAULT_BASIC_ACCESS_ROLE))
                        .loadClasspath("policy/access-policy.yaml");
        keys = TOKENS.keySource();
        var tokenResolver =
                new TokenResolver(TokenVerificationSettings.verifying(TestTokens.DISCOVERY_URL), keys);
        registry = new SimpleMeterRegistry();
        resolver =
                new IdentityArgumentResolver(
                        new IdentityFactory(tokenResolver, model, TestTokens.ACCESS_ROLES),
                        new MetricFactory(registry, "platform-api-test"));
        CorrelationContextHolder.set(new CorrelationContext("corr-1", null, "req-1"));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("supports only annotated Identity parameters")
    void supportsParameter() throws Exception {
        assertThat(resolver.supportsParameter(parameter("required"))).isTrue();
        assertThat(resolver.supportsParameter(parameter("optional"))).isTrue();
        assertThat(resolver.supportsParameter(parameter("unannotated"))).isFalse();
    }

    @Test
    @DisplayName("resolves a valid token and records the user in the correlation context")
    void resolvesValidToken() throws Exception {
        var request = requestWith(TestTokens.bearer(TOKENS.sign(TOKENS.basicUser("alice"))));

        var resolved = resolver.resolveArgument(parameter("required"), null, request, null);

        assertThat(resolved).isInstanceOf(Identity.class);
        assertThat(((Identity) resolved).username()).isEqualTo("alice");
        assertThat(CorrelationContextHolder.get()).map(CorrelationContext::userId).contains("alice");
        assertThat(outcomeCount(IdentityArgumentResolver.OUTCOME_AUTHENTICATED)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("evaluates the token once per request")
    void memoizesPerRequest() throws Exception {
        var request = requestWith(TestTokens.bearer(TOKENS.sign(TOKENS.basicUser("alice"))));

        var first = resolver.resolveArgument(parameter("required"), null, request, null);
        var second = resolver.resolveArgument(parameter("optional"), null, request, null);

        assertThat(second).isSameAs(first);
        assertThat(keys.getCount()).isEqualTo(1);
        assertThat(outcomeCount(IdentityArgumentResolver.OUTCOME_AUTHENTICATED)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("throws for a required identity without a token")
    void requiredWithoutToken() throws Exception {
        var request = requestWith(null);

        assertThatThrownBy(() -> resolver.resolveArgument(parameter("required"), null, request, null))
                .isInstanceOf(AuthenticationException.class);
        assertThat(outcomeCount(IdentityArgumentResolver.OUTCOME_ANONYMOUS)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("yields null for an optional identity with a bad token")
    void optionalWithBadToken() throws Exception {
        var request = requestWith("Bearer not-a-jwt");

        var resolved = resolver.resolveArgument(parameter("optional"), null, request, null);

        assertThat(resolved).isNull();
        assertThat(outcomeCount(IdentityArgumentResolver.OUTCOME_REJECTED)).isEqualTo(1.0);
        assertThat(CorrelationContextHolder.get()).map(CorrelationContext::userId).isEmpty();
    }

    @Test
    @DisplayName("reports a disabled account")
    void disabledAccount() throws Exception {
        var request = requestWith(TestTokens.bearer(TOKENS.sign(TOKENS.withoutAccess("mallory"))));

        assertThatThrownBy(() -> resolver.resolveArgument(parameter("required"), null, request, null))
                .isInstanceOf(AccessDisabledException.class);
        // the stored failure is reused for the second parameter
        assertThatThrownBy(() -> resolver.resolveArgument(parameter("required"), null, request, null))
                .isInstanceOf(AccessDisabledException.class);
        assertThat(outcomeCount(IdentityArgumentResolver.OUTCOME_DISABLED)).isEqualTo(1.0);
    }

    private double outcomeCount(String outcome) {
        var counter = registry.find(IdentityArgumentResolver.METRIC).tag("outcome", outcome).counter();
        return counter == null ? 0.0 : counter.count();
    }

    private static ServletWebRequest requestWith(String authorization) {
        var request = new MockHttpServletRequest();
        if (authorization != null) {
            request.addHeader(HttpHeaders.AUTHORIZATION, authorization);
        }
        return new ServletWebRequest(request);
    }

    private static MethodParameter parameter(String method) throws NoSuchMethodException {
        return new MethodParameter(Handlers.class.getDeclaredMethod(method, Identity.class), 0);
    }

    @SuppressWarnings("unused")
    private static final class Handlers {

        void required(@CurrentIdentity Identity identity) {}

        void optional(@CurrentIdentity(required = false) Identity identity) {}

        void unannotated(Identity identity) {}
    }
}
