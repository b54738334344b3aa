package com.courier.observability;

/**
 * Immutable correlation context that flows with a request through the delivery service.
 * <p>
 * Every incoming HTTP request establishes a {@code CorrelationContext}. Its values are injected
 * into SLF4J MDC so that every log line written while handling the request, including the lines
 * written by the command dispatcher, can be tied back to it.
 *
 * @param correlationId unique ID for the business flow, propagated from the caller when present
 * @param requestId     unique ID for this specific request (nullable)
 * @param clientAddress remote address of the caller (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String requestId,
        String clientAddress
) {

    /**
     * MDC key for correlation ID.
     */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /**
     * MDC key for request ID.
     */
    public static final String MDC_REQUEST_ID = "requestId";

    /**
     * MDC key for the caller's address.
     */
    public static final String MDC_CLIENT_ADDRESS = "clientAddress";

    /**
     * Rejects a missing correlationId.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }
}
