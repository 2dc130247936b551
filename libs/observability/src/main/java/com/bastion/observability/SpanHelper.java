package com.bastion.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that tags every span with the
 * request identifiers from {@link CorrelationContextHolder}.
 * <p>
 * This helper does not configure the SDK. Without an SDK on the classpath the
 * {@link #noop()} instance produces non-recording spans at negligible cost.
 */
public final class SpanHelper {

    /** Span attribute for the request ID. */
    public static final String ATTR_REQUEST_ID = "bastion.request.id";

    /** Span attribute for the requested tenant. */
    public static final String ATTR_TENANT_ID = "bastion.tenant.id";

    /** Span attribute for the credential fingerprint. */
    public static final String ATTR_FINGERPRINT = "bastion.credential.fingerprint";

    private final Tracer tracer;

    /**
     * Creates a SpanHelper backed by the given OTel tracer.
     *
     * @param tracer the OpenTelemetry tracer
     */
    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Returns a helper backed by the no-op OpenTelemetry implementation.
     */
    public static SpanHelper noop() {
        return new SpanHelper(OpenTelemetry.noop().getTracer("bastion"));
    }

    /**
     * Executes a {@link Callable} within a new INTERNAL span.
     *
     * @param spanName name for the span
     * @param callable the work to execute within the span
     * @param <T>      return type
     * @return the result of the callable
     * @throws Exception if the callable throws
     */
    public <T> T withSpan(String spanName, Callable<T> callable) throws Exception {
        return withSpan(spanName, SpanKind.INTERNAL, Map.of(), callable);
    }

    /**
     * Executes a {@link Callable} within a new span with explicit kind and attributes.
     * The span records the exception and ends with ERROR status if the callable throws.
     *
     * @param spanName   name for the span
     * @param kind       span kind
     * @param attributes additional span attributes
     * @param callable   the work to execute within the span
     * @param <T>        return type
     * @return the result of the callable
     * @throws Exception if the callable throws
     */
    public <T> T withSpan(String spanName, SpanKind kind, Map<String, String> attributes,
                          Callable<T> callable) throws Exception {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(spanBuilder::setAttribute);

        Span span = spanBuilder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_REQUEST_ID, ctx.requestId());
            if (ctx.tenantId() != null) {
                span.setAttribute(ATTR_TENANT_ID, ctx.tenantId());
            }
            if (ctx.credentialFingerprint() != null) {
                span.setAttribute(ATTR_FINGERPRINT, ctx.credentialFingerprint());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = callable.call();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (Exception e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Returns the underlying OTel tracer.
     */
    public Tracer tracer() {
        return tracer;
    }
}
