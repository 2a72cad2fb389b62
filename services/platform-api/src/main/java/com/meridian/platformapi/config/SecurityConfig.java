package com.meridian.platformapi.config;

import com.meridian.observability.MetricFactory;
import com.meridian.platformapi.infrastructure.http.RestTemplateJsonFetcher;
import com.meridian.security.identity.AccessRoles;
import com.meridian.security.identity.IdentityFactory;
import com.meridian.security.policy.PolicyDefinitionException;
import com.meridian.security.policy.PolicyModel;
import com.meridian.security.policy.PolicyModelLoader;
import com.meridian.security.token.ExpiringCache;
import com.meridian.security.token.JsonFetcher;
import com.meridian.security.token.JwkSetSource;
import com.meridian.security.token.OidcJwkSetSource;
import com.meridian.security.token.TokenResolver;
import com.meridian.security.token.TokenVerificationSettings;
import com.nimbusds.jose.jwk.JWKSet;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Clock;
import java.util.Map;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.web.client.RestTemplate;

/**
 * Wires the authorization core: token resolver with its cached JWK source, the access policy
 * loaded once at start-up, and the per-request identity factory.
 */
@Configuration
public class SecurityConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, PlatformApiProperties api) {
        return new MetricFactory(registry, api.name());
    }

    @Bean
    public TokenVerificationSettings tokenVerificationSettings(
            AuthProperties auth, PlatformApiProperties api, Environment environment) {
        TokenVerificationGuard.check(
                auth.disableTokenVerification(), api.environment(), environment.getActiveProfiles());
        return new TokenVerificationSettings(
                auth.openidConfigUrl(), auth.disableTokenVerification(), auth.leeway());
    }

    @Bean
    public RestTemplate oidcRestTemplate(RestTemplateBuilder builder, AuthProperties auth) {
        return builder.setConnectTimeout(auth.connectTimeout())
                .setReadTimeout(auth.readTimeout())
                .build();
    }

    @Bean
    public JsonFetcher oidcJsonFetcher(RestTemplate oidcRestTemplate, MetricFactory metrics) {
        return new RestTemplateJsonFetcher(oidcRestTemplate, metrics);
    }

    @Bean
    public ExpiringCache<URI, JWKSet> jwkSetCache(AuthProperties auth, Clock clock) {
        // a waiter may sit behind a discovery fetch and a JWKS fetch
        var waitTimeout = auth.connectTimeout().plus(auth.readTimeout()).multipliedBy(2);
        return new ExpiringCache<>(auth.jwksCacheTtl(), auth.jwksCacheCapacity(), waitTimeout, clock);
    }

    @Bean
    public JwkSetSource jwkSetSource(
            JsonFetcher oidcJsonFetcher, ExpiringCache<URI, JWKSet> jwkSetCache, AuthProperties auth) {
        return new OidcJwkSetSource(oidcJsonFetcher, jwkSetCache, auth.jwksMinRefreshInterval());
    }

    @Bean
    public TokenResolver tokenResolver(
            TokenVerificationSettings settings, JwkSetSource jwkSetSource, Clock clock) {
        return new TokenResolver(settings, jwkSetSource, clock);
    }

    @Bean
    public AccessRoles accessRoles(AuthProperties auth) {
        return AccessRoles.forClient(auth.clientId(), auth.roleAdmin(), auth.roleBasicAccess());
    }

    @Bean
    public PolicyModel policyModel(AuthProperties auth, ResourceLoader resourceLoader) {
        Resource resource = resourceLoader.getResource(auth.policyLocation());
        if (!resource.exists()) {
            throw new PolicyDefinitionException("Policy not found at " + auth.policyLocation());
        }
        var loader =
                new PolicyModelLoader(
                        Map.of(
                                "client-id", auth.clientId(),
                                "role-admin", auth.roleAdmin(),
                                "role-basic-access", auth.roleBasicAccess()));
        try (InputStream in = resource.getInputStream()) {
            return loader.load(in, auth.policyLocation());
        } catch (IOException e) {
            throw new PolicyDefinitionException("Failed to read policy at " + auth.policyLocation(), e);
        }
    }

    @Bean
    public IdentityFactory identityFactory(
            TokenResolver tokenResolver, PolicyModel policyModel, AccessRoles accessRoles) {
        return new IdentityFactory(tokenResolver, policyModel, accessRoles);
    }
}
