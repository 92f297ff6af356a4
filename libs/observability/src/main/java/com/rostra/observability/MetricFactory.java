package com.rostra.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Factory for Micrometer meters that carry a {@code service} tag.
 *
 * <p>Wraps {@link MeterRegistry} to enforce consistent naming across Rostra services. Counters and
 * timers are resolved through the registry on every call, which returns the existing meter for an
 * identical name and tag set, so callers may ask for a meter per event without caching it.
 */
public final class MetricFactory {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;
    private final Map<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    /**
     * Creates a MetricFactory bound to the given registry and service name.
     *
     * @param registry the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param serviceName logical service name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Returns the counter for the given name and tags, registering it on first use.
     *
     * @param name metric name (e.g., "rostra.eventbus.events.published")
     * @param description human-readable description
     * @param tags additional tags (key-value pairs)
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns the timer for the given name and tags, registering it on first use.
     *
     * @param name metric name (e.g., "rostra.transport.publish.duration")
     * @param description human-readable description
     * @param tags additional tags (key-value pairs)
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns the value holder backing a gauge, registering the gauge on first use. Repeated calls
     * with the same name return the same holder.
     *
     * @param name metric name (e.g., "rostra.eventbus.subscribers")
     * @param description human-readable description
     */
    public AtomicLong gauge(String name, String description) {
        return gauges.computeIfAbsent(name, key -> {
            AtomicLong value = new AtomicLong(0);
            Gauge.builder(key, value, AtomicLong::doubleValue)
                    .description(description)
                    .tags(baseTags())
                    .register(registry);
            return value;
        });
    }

    /** Returns the underlying meter registry. */
    public MeterRegistry registry() {
        return registry;
    }

    /** Returns the service name used as a default tag. */
    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
