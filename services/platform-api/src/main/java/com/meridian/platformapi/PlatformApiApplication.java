package com.meridian.platformapi;

import com.meridian.platformapi.config.AuthProperties;
import com.meridian.platformapi.config.PlatformApiProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Meridian platform HTTP API.
 *
 * <p>Every {@code /api/v1} endpoint derives the caller's identity from an OIDC bearer token,
 * checks the access policy and narrows storage reads with row-level visibility filters.
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, info and Prometheus endpoints
 *   <li>Correlation ID propagation
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties({PlatformApiProperties.class, AuthProperties.class})
public class PlatformApiApplication {

    private static final Logger log = LoggerFactory.getLogger(PlatformApiApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(PlatformApiApplication.class, args);
        log.info("Meridian Platform API started successfully");
    }
}
