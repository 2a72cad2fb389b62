package com.meridian.platformapi.config;

import com.meridian.observability.MetricFactory;
import com.meridian.platformapi.infrastructure.web.IdentityArgumentResolver;
import com.meridian.security.identity.IdentityFactory;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: identity injection and CORS for local development frontends.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final IdentityFactory identityFactory;
    private final MetricFactory metricFactory;

    public WebConfig(IdentityFactory identityFactory, MetricFactory metricFactory) {
        this.identityFactory = identityFactory;
        this.metricFactory = metricFactory;
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new IdentityArgumentResolver(identityFactory, metricFactory));
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("X-Total-Count", "X-Correlation-ID")
                .allowCredentials(true)
                .maxAge(3600);
    }
}
