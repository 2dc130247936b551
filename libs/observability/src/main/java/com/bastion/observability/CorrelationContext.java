package com.bastion.observability;

/**
 * Immutable correlation context that travels with a single validation request.
 * <p>
 * Every inbound request establishes a {@code CorrelationContext} before the validators run.
 * The same context is handed to the legacy and enhanced worker threads and to the audit
 * recorder, so log lines from all three can be joined on {@code requestId}.
 *
 * @param correlationId         ID for the business flow, propagated from the caller when present
 * @param requestId             unique ID for this validation request (pairs legacy and enhanced)
 * @param tenantId              requested tenant (nullable until the request body is parsed)
 * @param credentialFingerprint fingerprint of the presented credential, never the raw value (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String requestId,
        String tenantId,
        String credentialFingerprint
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for requested tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for the credential fingerprint. */
    public static final String MDC_CREDENTIAL_FINGERPRINT = "credentialFingerprint";

    /**
     * Compact constructor: correlationId is mandatory, requestId defaults to it.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
        if (requestId == null || requestId.isBlank()) {
            requestId = correlationId;
        }
    }

    /**
     * Creates a context carrying only a correlation ID (HTTP filter entry point).
     */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null);
    }

    /**
     * Returns a copy bound to a specific request, tenant and credential.
     */
    public CorrelationContext forRequest(String requestId, String tenantId, String credentialFingerprint) {
        return new CorrelationContext(correlationId, requestId, tenantId, credentialFingerprint);
    }
}
