package com.meridian.platformapi.infrastructure.web;

import com.meridian.observability.CorrelationContextHolder;
import com.meridian.observability.MetricFactory;
import com.meridian.security.AccessDisabledException;
import com.meridian.security.AuthenticationException;
import com.meridian.security.UpstreamUnavailableException;
import com.meridian.security.identity.Identity;
import com.meridian.security.identity.IdentityFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link CurrentIdentity} parameters from the request's Authorization header.
 *
 * <p>The identity, or the reason it could not be built, is kept in a request attribute so all
 * parameters of one request share a single token evaluation. Each evaluation is counted in
 * {@value #METRIC} tagged with its outcome, and a successful one puts the username into the
 * correlation context.
 */
public class IdentityArgumentResolver implements HandlerMethodArgumentResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityArgumentResolver.class);

    public static final String METRIC = "meridian.auth.identity";
    public static final String IDENTITY_ATTRIBUTE = IdentityArgumentResolver.class.getName() + ".identity";
    public static final String FAILURE_ATTRIBUTE = IdentityArgumentResolver.class.getName() + ".failure";

    static final String OUTCOME_AUTHENTICATED = "authenticated";
    static final String OUTCOME_ANONYMOUS = "anonymous";
    static final String OUTCOME_REJECTED = "rejected";
    static final String OUTCOME_DISABLED = "disabled";
    static final String OUTCOME_UPSTREAM_UNAVAILABLE = "upstream_unavailable";

    private final IdentityFactory identityFactory;
    private final MetricFactory metrics;

    public IdentityArgumentResolver(IdentityFactory identityFactory, MetricFactory metrics) {
        this.identityFactory = identityFactory;
        this.metrics = metrics;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentIdentity.class)
                && Identity.class.isAssignableFrom(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        CurrentIdentity annotation = parameter.getParameterAnnotation(CurrentIdentity.class);
        boolean required = annotation == null || annotation.required();

        Object cached = webRequest.getAttribute(IDENTITY_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        if (cached instanceof Identity identity) {
            return identity;
        }

        Object failure = webRequest.getAttribute(FAILURE_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        AuthenticationException rejection =
                failure instanceof AuthenticationException known ? known : authenticate(webRequest);
        if (rejection == null) {
            return webRequest.getAttribute(IDENTITY_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        }

        if (required) {
            throw rejection;
        }
        log.debug("Optional identity unavailable, continuing anonymously: {}", rejection.getMessage());
        return null;
    }

    /** Builds and stores the identity; returns the failure instead when there is none. */
    private AuthenticationException authenticate(NativeWebRequest webRequest) {
        String header = webRequest.getHeader(HttpHeaders.AUTHORIZATION);
        try {
            Identity identity = identityFactory.require(header);
            webRequest.setAttribute(IDENTITY_ATTRIBUTE, identity, RequestAttributes.SCOPE_REQUEST);
            CorrelationContextHolder.update(ctx -> ctx.withUserId(identity.username()));
            count(OUTCOME_AUTHENTICATED);
            return null;
        } catch (AuthenticationException e) {
            webRequest.setAttribute(FAILURE_ATTRIBUTE, e, RequestAttributes.SCOPE_REQUEST);
            count(outcomeOf(e, header));
            if (e instanceof UpstreamUnavailableException upstream) {
                log.warn("Identity provider unreachable at {}: {}", upstream.uri(), e.getMessage());
            } else {
                log.debug("Rejected bearer token: {}", e.getMessage());
            }
            return e;
        }
    }

    private static String outcomeOf(AuthenticationException e, String header) {
        if (e instanceof UpstreamUnavailableException) {
            return OUTCOME_UPSTREAM_UNAVAILABLE;
        }
        if (e instanceof AccessDisabledException) {
            return OUTCOME_DISABLED;
        }
        if (header == null || header.isBlank()) {
            return OUTCOME_ANONYMOUS;
        }
        return OUTCOME_REJECTED;
    }

    private void count(String outcome) {
        metrics.counter(METRIC, "Bearer token evaluations by outcome", "outcome", outcome).increment();
    }
}
