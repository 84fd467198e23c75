package com.expertagent.observability;

/**
 * Immutable correlation context that flows with a request through the platform.
 * <p>
 * Every inbound request establishes a {@code CorrelationContext} carrying the identifiers that tie
 * its log lines, metrics and authorization decisions together. The values are pushed into the
 * SLF4J MDC by {@link CorrelationContextHolder} so that every log statement on the request thread
 * carries them.
 *
 * @param correlationId unique ID for the business flow (propagated via {@code X-Correlation-ID})
 * @param orgId         active organization of the caller (nullable before the principal is resolved)
 * @param principalId   principal performing the request (nullable for anonymous traffic)
 * @param requestId     unique ID for this specific request
 * @param spanId        current OpenTelemetry span ID (nullable if tracing is not active)
 * @param traceId       current OpenTelemetry trace ID (nullable if tracing is not active)
 */
public record CorrelationContext(
        String correlationId,
        String orgId,
        String principalId,
        String requestId,
        String spanId,
        String traceId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the active organization. */
    public static final String MDC_ORG_ID = "orgId";

    /** MDC key for the principal ID. */
    public static final String MDC_PRINCIPAL_ID = "principalId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for span ID. */
    public static final String MDC_SPAN_ID = "spanId";

    /** MDC key for trace ID. */
    public static final String MDC_TRACE_ID = "traceId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context carrying only a correlation ID.
     */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null, null, null);
    }

    /**
     * Returns a copy with the principal and active organization filled in. Used once the
     * caller's identity is known, after the correlation ID was established at the edge.
     */
    public CorrelationContext withPrincipal(String principalId, String orgId) {
        return new CorrelationContext(correlationId, orgId, principalId, requestId, spanId, traceId);
    }
}
