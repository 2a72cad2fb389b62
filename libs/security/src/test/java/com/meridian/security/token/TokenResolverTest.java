package com.meridian.security.token;

import com.meridian.security.AuthenticationException;
import com.meridian.security.UpstreamUnavailableException;
import com.meridian.security.testing.InMemoryJwkSetSource;
import com.meridian.security.testing.TestTokens;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.util.Base64URL;
import com.nimbusds.jwt.JWTClaimsSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TokenResolver")
class TokenResolverTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final TestTokens tokens = new TestTokens(TestTokens.generateKey(TestTokens.DEFAULT_KEY_ID), clock);

    @Nested
    @DisplayName("with verification enabled")
    class Verifying {

        private InMemoryJwkSetSource keys;
        private TokenResolver resolver;

        @BeforeEach
        void setUp() {
            keys = tokens.keySource();
            resolver = new TokenResolver(TokenVerificationSettings.verifying(TestTokens.DISCOVERY_URL), keys, clock);
        }

        @Test
        @DisplayName("a valid signed token yields its payload")
        void validToken() {
            var claims = resolver.resolve(TestTokens.bearer(tokens.sign(tokens.basicUser("alice"))));

            assertThat(claims.username()).isEqualTo("alice");
            assertThat(claims.resourceRoles()).containsEntry(TestTokens.CLIENT_ID, List.of("api_basic_access"));
            assertThat(claims.realmRoles()).contains("offline_access");
            assertThat(claims.raw()).containsEntry("azp", TestTokens.CLIENT_ID);
        }

        @Test
        @DisplayName("an unknown kid is rejected after one refresh attempt")
        void unknownKid() {
            var stranger = TestTokens.generateKey("someone-else");
            var token = TestTokens.sign(stranger, tokens.basicUser("alice").build());

            assertThatThrownBy(() -> resolver.decode(token))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessageContaining("someone-else");
            assertThat(keys.refreshCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("picks up rotated keys on a kid miss")
        void rotatedKey() {
            var rotated = TestTokens.generateKey("test-key-2");
            keys.rotateTo(new JWKSet(List.of(rotated.toPublicJWK(), tokens.signingKey().toPublicJWK())));

            var claims = resolver.decode(TestTokens.sign(rotated, tokens.basicUser("alice").build()));

            assertThat(claims.username()).isEqualTo("alice");
            assertThat(keys.refreshCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("a signature from a different key with the same kid is rejected")
        void forgedSignature() {
            var impostor = TestTokens.generateKey(TestTokens.DEFAULT_KEY_ID);
            var token = TestTokens.sign(impostor, tokens.basicUser("mallory").build());

            assertThatThrownBy(() -> resolver.decode(token))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessageContaining("signature");
        }

        @Test
        @DisplayName("an unsigned token is rejected")
        void unsigned() {
            var token = TestTokens.unsigned(tokens.basicUser("alice").build());

            assertThatThrownBy(() -> resolver.decode(token))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessageContaining("not signed");
        }

        @Test
        @DisplayName("an expired token is rejected")
        void expired() {
            var token = tokens.sign(tokens.basicUser("alice")
                    .expirationTime(Date.from(NOW.minusSeconds(600))));

            assertThatThrownBy(() -> resolver.decode(token))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessageContaining("expired");
        }

        @Test
        @DisplayName("expiry within the leeway is tolerated")
        void expiredWithinLeeway() {
            var token = tokens.sign(tokens.basicUser("alice")
                    .expirationTime(Date.from(NOW.minusSeconds(10))));

            assertThat(resolver.decode(token).username()).isEqualTo("alice");
        }

        @Test
        @DisplayName("exp and iat are required")
        void requiredTimestamps() {
            var noExp = tokens.sign(tokens.basicUser("alice").expirationTime(null));
            var noIat = tokens.sign(tokens.basicUser("alice").issueTime(null));

            assertThatThrownBy(() -> resolver.decode(noExp)).hasMessageContaining("'exp'");
            assertThatThrownBy(() -> resolver.decode(noIat)).hasMessageContaining("'iat'");
        }

        @Test
        @DisplayName("a token not valid before a future instant is rejected")
        void notYetValid() {
            var token = tokens.sign(tokens.basicUser("alice").notBeforeTime(Date.from(NOW.plusSeconds(300))));

            assertThatThrownBy(() -> resolver.decode(token)).hasMessageContaining("not yet valid");
        }

        @Test
        @DisplayName("the audience is not checked")
        void audienceIgnored() {
            var token = tokens.sign(tokens.basicUser("alice").audience("some-other-client"));

            assertThat(resolver.decode(token).username()).isEqualTo("alice");
        }

        @Test
        @DisplayName("a missing Authorization header is rejected")
        void missingHeader() {
            assertThatThrownBy(() -> resolver.resolve(null))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessageContaining("Authorization");
        }

        @Test
        @DisplayName("garbage is rejected as malformed")
        void garbage() {
            assertThatThrownBy(() -> resolver.decode("not-a-jwt"))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessageContaining("Malformed");
        }

        @Test
        @DisplayName("key source failures propagate as UpstreamUnavailableException")
        void upstreamFailure() {
            JwkSetSource broken = new JwkSetSource() {
                @Override
                public JWKSet get(URI discoveryUrl) {
                    throw new UpstreamUnavailableException(discoveryUrl, "connection refused", null);
                }

                @Override
                public boolean refresh(URI discoveryUrl) {
                    return false;
                }
            };
            var failing = new TokenResolver(TokenVerificationSettings.verifying(TestTokens.DISCOVERY_URL), broken, clock);

            assertThatThrownBy(() -> failing.decode(tokens.sign(tokens.basicUser("alice"))))
                    .isInstanceOf(UpstreamUnavailableException.class);
        }
    }

    @Nested
    @DisplayName("with verification disabled")
    class Unverified {

        private final TokenResolver resolver =
                new TokenResolver(TokenVerificationSettings.unverified(), null, clock);

        @Test
        @DisplayName("accepts an unsigned token without kid")
        void unsignedWithoutKid() {
            var payload = new JWTClaimsSet.Builder()
                    .claim("preferred_username", "dev")
                    .claim("realm_access", Map.of("roles", List.of("api_basic_access")))
                    .build();

            var claims = resolver.decode(TestTokens.unsigned(payload));

            assertThat(claims.username()).isEqualTo("dev");
            assertThat(claims.realmRoles()).containsExactly("api_basic_access");
        }

        @Test
        @DisplayName("accepts a token signed with an unknown key")
        void unknownSigner() {
            var token = TestTokens.sign(TestTokens.generateKey("whatever"), tokens.basicUser("alice").build());

            assertThat(resolver.decode(token).username()).isEqualTo("alice");
        }

        @Test
        @DisplayName("still rejects an elapsed exp")
        void expired() {
            var token = TestTokens.unsigned(tokens.basicUser("alice")
                    .expirationTime(Date.from(NOW.minusSeconds(3600))).build());

            assertThatThrownBy(() -> resolver.decode(token))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessageContaining("expired");
        }

        @Test
        @DisplayName("rejects an encrypted token")
        void encrypted() {
            var header = Base64URL.encode("{\"alg\":\"dir\",\"enc\":\"A128GCM\"}");
            var token = header + "..AAAAAAAAAAAAAAAA.AAAAAAAAAAAA.AAAAAAAAAAAAAAAAAAAAAA";

            assertThatThrownBy(() -> resolver.decode(token))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessageContaining("Encrypted");
        }
    }
}
