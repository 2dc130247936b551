package com.bastion.validation.audit;

import com.bastion.audit.ComparisonRecord;
import com.bastion.observability.CorrelationContext;
import com.bastion.observability.CorrelationContextHolder;
import com.bastion.observability.MetricFactory;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands comparison records to an {@link AuditSink} off the request path.
 *
 * <p>Each record is appended on the recorder's own executor and retried with exponential
 * backoff, giving at-least-once delivery while the sink recovers within the retry budget.
 * Records that exhaust the budget are counted as dropped, never thrown back to the caller.
 */
public class AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);

    private final AuditSink sink;
    private final Executor executor;
    private final Retry retry;

    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong appended = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final Counter droppedCounter;

    public AuditRecorder(AuditSink sink, Executor executor, AuditRetrySettings settings, MetricFactory metrics) {
        if (sink == null || executor == null || settings == null || metrics == null) {
            throw new IllegalArgumentException("sink, executor, settings and metrics must not be null");
        }
        this.sink = sink;
        this.executor = executor;
        this.retry = Retry.of("audit-sink", RetryConfig.custom()
                .maxAttempts(settings.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.initialBackoff().toMillis(), settings.backoffMultiplier()))
                .retryExceptions(RuntimeException.class)
                .build());
        this.droppedCounter = metrics.counter("audit.dropped", "Comparison records dropped after retries");
        registerEventListeners();
    }

    private void registerEventListeners() {
        retry.getEventPublisher()
                .onRetry(event -> {
                    retries.incrementAndGet();
                    log.warn("Audit append attempt {} failed, retrying in {}: {}",
                            event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                            String.valueOf(event.getLastThrowable()));
                })
                .onError(event -> log.error("Audit append gave up after {} attempts",
                        event.getNumberOfRetryAttempts(), event.getLastThrowable()));
    }

    /**
     * Schedules the record for appending and returns immediately. The future completes with
     * {@code true} once stored, {@code false} if the record was dropped; it never completes
     * exceptionally.
     */
    public CompletableFuture<Boolean> submit(ComparisonRecord record) {
        submitted.incrementAndGet();
        CorrelationContext context = CorrelationContextHolder.get().orElse(null);
        try {
            return CompletableFuture.supplyAsync(() -> appendWithRetry(context, record), executor);
        } catch (RejectedExecutionException e) {
            markDropped();
            log.error("Audit executor saturated, dropping comparison record {}", record.requestId());
            return CompletableFuture.completedFuture(false);
        }
    }

    public RecorderStats stats() {
        return new RecorderStats(submitted.get(), appended.get(), retries.get(), dropped.get());
    }

    public AuditSink sink() {
        return sink;
    }

    private boolean appendWithRetry(CorrelationContext context, ComparisonRecord record) {
        try {
            return CorrelationContextHolder.wrap(context, () -> {
                retry.executeRunnable(() -> sink.appendComparisonRecord(record));
                appended.incrementAndGet();
                return true;
            }).call();
        } catch (Exception e) {
            markDropped();
            log.error("Dropping comparison record {}: {}", record.requestId(), e.getMessage());
            return false;
        }
    }

    private void markDropped() {
        dropped.incrementAndGet();
        droppedCounter.increment();
    }
}
