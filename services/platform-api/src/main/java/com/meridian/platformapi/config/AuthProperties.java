package com.meridian.platformapi.config;

import jakarta.validation.constraints.NotBlank;
import java.net.URI;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Token verification and authorization settings, bound from {@code meridian.auth.*}.
 *
 * <pre>
 * meridian:
 *   auth:
 *     openid-config-url: https://idp.example.org/realms/meridian/.well-known/openid-configuration
 *     client-id: apisix
 *     leeway: 30s
 * </pre>
 *
 * @param openidConfigUrl OIDC discovery document; required unless verification is disabled.
 * @param disableTokenVerification Trust token payloads without checking signatures. Local
 *     development only; refused in production.
 * @param clientId API gateway client whose roles gate access.
 * @param roleAdmin Client role granting unrestricted access.
 * @param roleBasicAccess Client role granting policy-governed access.
 * @param leeway Clock skew tolerated on token timestamps.
 * @param jwksCacheTtl How long a fetched JWK set is reused.
 * @param jwksCacheCapacity Maximum number of cached JWK sets.
 * @param jwksMinRefreshInterval Minimum age of a cached JWK set before an unknown key id may
 *     force a re-fetch.
 * @param connectTimeout Connect timeout for discovery and JWKS requests.
 * @param readTimeout Read timeout for discovery and JWKS requests.
 * @param policyLocation Spring resource location of the access policy.
 */
@ConfigurationProperties(prefix = "meridian.auth")
@Validated
public record AuthProperties(
        URI openidConfigUrl,
        boolean disableTokenVerification,
        @NotBlank String clientId,
        String roleAdmin,
        String roleBasicAccess,
        Duration leeway,
        Duration jwksCacheTtl,
        int jwksCacheCapacity,
        Duration jwksMinRefreshInterval,
        Duration connectTimeout,
        Duration readTimeout,
        String policyLocation) {

    public AuthProperties {
        if (roleAdmin == null || roleAdmin.isBlank()) {
            roleAdmin = "api_admin";
        }
        if (roleBasicAccess == null || roleBasicAccess.isBlank()) {
            roleBasicAccess = "api_basic_access";
        }
        if (leeway == null) {
            leeway = Duration.ofSeconds(30);
        }
        if (jwksCacheTtl == null) {
            jwksCacheTtl = Duration.ofHours(24);
        }
        if (jwksCacheCapacity <= 0) {
            jwksCacheCapacity = 128;
        }
        if (jwksMinRefreshInterval == null) {
            jwksMinRefreshInterval = Duration.ofSeconds(60);
        }
        if (connectTimeout == null) {
            connectTimeout = Duration.ofSeconds(2);
        }
        if (readTimeout == null) {
            readTimeout = Duration.ofSeconds(5);
        }
        if (policyLocation == null || policyLocation.isBlank()) {
            policyLocation = "classpath:policy/access-policy.yaml";
        }
    }
}
