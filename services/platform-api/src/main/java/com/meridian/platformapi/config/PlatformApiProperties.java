package com.meridian.platformapi.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service-level settings, bound from {@code meridian.api.*}.
 *
 * <pre>
 * meridian:
 *   api:
 *     name: platform-api
 *     environment: production
 *     verbose-errors: false
 * </pre>
 *
 * @param name Service name used for logging and metrics. Required.
 * @param environment Deployment environment (development, staging, production).
 * @param verboseErrors Include authentication failure details in 401 responses. Never in
 *     production.
 */
@ConfigurationProperties(prefix = "meridian.api")
@Validated
public record PlatformApiProperties(@NotBlank String name, String environment, boolean verboseErrors) {

    public static final String PRODUCTION = "production";

    public PlatformApiProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }

    public boolean isProduction() {
        return PRODUCTION.equalsIgnoreCase(environment);
    }
}
