package com.bastion.validation;

import com.bastion.audit.ComparisonRecord;
import com.bastion.audit.ValidationOutcome;
import com.bastion.observability.MetricFactory;
import com.bastion.validation.cache.ValidationCache;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instruments of the validation path.
 *
 * <ul>
 *   <li>{@code bastion.validation.duration}: timer tagged {@code validator} and {@code outcome}</li>
 *   <li>{@code bastion.validation.discrepancies}: counter tagged {@code type} (outcome, security)</li>
 *   <li>{@code bastion.validation.cross_tenant_blocks}: counter</li>
 *   <li>{@code bastion.validation.extensions}: counter</li>
 *   <li>{@code bastion.cache.*}: gauges over {@link ValidationCache#stats()}</li>
 * </ul>
 */
public class GatewayMetrics {

    private final MetricFactory metrics;

    public GatewayMetrics(MetricFactory metrics) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.metrics = metrics;
    }

    /** Metrics backed by a private in-memory registry. */
    public static GatewayMetrics inMemory() {
        return new GatewayMetrics(new MetricFactory(new SimpleMeterRegistry(), "validation-gateway"));
    }

    public void recordOutcome(ValidationOutcome outcome) {
        if (outcome == null) {
            return;
        }
        metrics.timer("validation.duration", "Validator execution time",
                        "validator", outcome.validator().tagValue(),
                        "outcome", outcomeTag(outcome))
                .record(outcome.duration().toNanos(), TimeUnit.NANOSECONDS);
    }

    public void recordComparison(ComparisonRecord record) {
        if (record.bothRan() && !record.outcomesAgree()) {
            metrics.counter("validation.discrepancies", "Requests where legacy and enhanced disagreed",
                    "type", "outcome").increment();
        }
        if (record.securityDiscrepancy()) {
            metrics.counter("validation.discrepancies", "Requests where legacy and enhanced disagreed",
                    "type", "security").increment();
        }
        if (record.crossTenantBlockTriggered()) {
            metrics.counter("validation.cross_tenant_blocks", "Cross-tenant requests blocked by enhanced validation")
                    .increment();
        }
        if (record.extensionApplied()) {
            metrics.counter("validation.extensions", "Credentials extended during validation").increment();
        }
    }

    /** Registers gauges sampling the cache counters. */
    public void bindCache(ValidationCache cache) {
        metrics.gauge("cache.hits", "Cache hits", cache, c -> c.stats().hits());
        metrics.gauge("cache.misses", "Cache misses", cache, c -> c.stats().misses());
        metrics.gauge("cache.evictions", "Entries evicted on expiry or overflow", cache, c -> c.stats().evictions());
        metrics.gauge("cache.invalidations", "Entries removed by invalidation", cache,
                c -> c.stats().invalidations());
        metrics.gauge("cache.size", "Current number of entries", cache, c -> c.size());
    }

    public MetricFactory factory() {
        return metrics;
    }

    private static String outcomeTag(ValidationOutcome outcome) {
        if (outcome.success()) {
            return "allowed";
        }
        return outcome.errorKind().fault() ? "fault" : "denied";
    }
}
