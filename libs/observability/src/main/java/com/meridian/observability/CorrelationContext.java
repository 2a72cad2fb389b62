package com.meridian.observability;

/**
 * Immutable correlation context that flows with a single HTTP request.
 * <p>
 * The context is established by the web layer as soon as a request arrives and enriched
 * with the authenticated username once the bearer token has been resolved. Its values
 * are mirrored into SLF4J MDC so every log line written while serving the request can
 * be traced back to it.
 *
 * @param correlationId unique ID for the request flow (propagated from {@code X-Correlation-ID})
 * @param userId        authenticated username (null until the identity is known, or for public calls)
 * @param requestId     unique ID for this specific request
 */
public record CorrelationContext(
        String correlationId,
        String userId,
        String requestId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the authenticated username. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /**
     * Rejects a null or blank correlationId.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns a copy of this context carrying the given username.
     */
    public CorrelationContext withUserId(String userId) {
        return new CorrelationContext(correlationId, userId, requestId);
    }
}
