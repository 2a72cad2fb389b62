package com.meridian.platformapi.infrastructure.web;

import com.meridian.observability.CorrelationContext;
import com.meridian.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that propagates or generates a correlation ID for every HTTP request.
 *
 * <p>A well-formed {@code X-Correlation-ID} sent by the client (or the API gateway) is kept;
 * otherwise a new UUID is generated. The ID is echoed in the response and placed in the
 * {@link CorrelationContextHolder}, and from there in the logging MDC, for the duration of the
 * request.
 *
 * <p>Runs at {@link Ordered#HIGHEST_PRECEDENCE} so correlation is available to all subsequent
 * filters and handlers.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || !ACCEPTED_ID.matcher(correlationId).matches()) {
            correlationId = UUID.randomUUID().toString();
        }

        var context = new CorrelationContext(correlationId, null, UUID.randomUUID().toString());
        CorrelationContextHolder.set(context);

        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            CorrelationContextHolder.clear();
        }
    }
}
