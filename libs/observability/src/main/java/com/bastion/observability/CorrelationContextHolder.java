package com.bastion.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * When a correlation context is set, the MDC keys (correlationId, requestId, tenantId,
 * credentialFingerprint) are populated so that every log statement on this thread
 * includes them. When cleared, all MDC keys are removed.
 * <p>
 * Validators and the audit recorder run on pooled threads; work submitted there must be
 * wrapped with {@link #wrap(CorrelationContext, Callable)} or
 * {@link #supplyWithContext(CorrelationContext, Supplier)} so the pooled thread logs under the
 * request's identifiers and leaves no residue behind for the next task.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the correlation context for the current thread and populates SLF4J MDC.
     *
     * @param context the correlation context to set (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's correlation context, if set.
     */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Clears the correlation context and removes all MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Evaluates a {@link Supplier} with the given correlation context set on the calling thread,
     * then restores the previous context (or clears if there was none).
     *
     * @param context  the correlation context for the duration of the supplier
     * @param supplier the work to execute
     * @param <T>      result type
     * @return the supplier's result
     */
    public static <T> T supplyWithContext(CorrelationContext context, Supplier<T> supplier) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return supplier.get();
        } finally {
            restore(previous);
        }
    }

    /**
     * Wraps a {@link Callable} so that it runs under the given context on whichever thread
     * eventually executes it. A null context yields a callable that runs with no context.
     *
     * @param context  the context to install while the callable runs (nullable)
     * @param callable the work to execute
     * @param <T>      return type
     * @return a context-carrying callable
     */
    public static <T> Callable<T> wrap(CorrelationContext context, Callable<T> callable) {
        return () -> {
            CorrelationContext previous = CONTEXT.get();
            try {
                if (context != null) {
                    set(context);
                } else {
                    clear();
                }
                return callable.call();
            } finally {
                restore(previous);
            }
        };
    }

    private static void restore(CorrelationContext previous) {
        if (previous != null) {
            set(previous);
        } else {
            clear();
        }
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
        setMdc(CorrelationContext.MDC_TENANT_ID, ctx.tenantId());
        setMdc(CorrelationContext.MDC_CREDENTIAL_FINGERPRINT, ctx.credentialFingerprint());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_CREDENTIAL_FINGERPRINT);
    }
}
