package com.bastion.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.function.ToDoubleFunction;

/**
 * Factory for Micrometer meters with a consistent name prefix and a {@code service} tag.
 * <p>
 * Every meter created here is named {@code <prefix>.<name>} (prefix {@value #DEFAULT_PREFIX}
 * unless overridden) and carries the service tag, so dashboards can separate gateway
 * instances deployed under different service names. Micrometer caches meters by name and
 * tags, so calling a factory method repeatedly with the same arguments is cheap and returns
 * the same meter.
 */
public final class MetricFactory {

    /** Default metric name prefix. */
    public static final String DEFAULT_PREFIX = "bastion";

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;
    private final String prefix;

    /**
     * Creates a MetricFactory bound to the given registry and service name.
     *
     * @param registry    the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param serviceName logical service name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        this(registry, serviceName, DEFAULT_PREFIX);
    }

    /**
     * Creates a MetricFactory with a custom metric name prefix.
     *
     * @param registry    the Micrometer meter registry
     * @param serviceName logical service name included as a default tag
     * @param prefix      metric name prefix (without trailing dot)
     */
    public MetricFactory(MeterRegistry registry, String serviceName, String prefix) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
        this.prefix = prefix;
    }

    /**
     * Creates (or looks up) a counter.
     *
     * @param name        metric name without prefix (e.g., "validation.discrepancies")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     * @return the counter
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(qualify(name))
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Creates (or looks up) a timer.
     *
     * @param name        metric name without prefix (e.g., "validation.duration")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     * @return the timer
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(qualify(name))
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Registers a gauge that samples {@code valueFunction} on the given state object.
     * The registry holds the state object weakly, so callers must keep a reference to it.
     *
     * @param name          metric name without prefix
     * @param description   human-readable description
     * @param stateObject   object the gauge samples
     * @param valueFunction function extracting the current value
     * @param tags          additional tags (key-value pairs)
     * @param <T>           state object type
     * @return the registered gauge
     */
    public <T> Gauge gauge(String name, String description, T stateObject,
                           ToDoubleFunction<T> valueFunction, String... tags) {
        return Gauge.builder(qualify(name), stateObject, valueFunction)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }

    /**
     * Returns the service name used as a default tag.
     */
    public String serviceName() {
        return serviceName;
    }

    /**
     * Returns the fully-qualified metric name for a short name.
     */
    public String qualify(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        return prefix + "." + name;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
