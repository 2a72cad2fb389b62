/**
 * Request correlation, metrics and log redaction shared by Meridian modules.
 *
 * <p>{@link com.meridian.observability.CorrelationContextHolder} carries per-request
 * identifiers into SLF4J MDC, {@link com.meridian.observability.MetricFactory} wraps
 * Micrometer with a fixed {@code service} tag, and
 * {@link com.meridian.observability.SensitiveDataRedactor} strips credentials from maps
 * (typically decoded token claims) before they are logged or echoed back to clients.
 */
package com.meridian.observability;
