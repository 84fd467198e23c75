package com.expertagent.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Factory for Micrometer meters that carry the owning service's name as a {@code service} tag.
 * <p>
 * Meters are registered lazily: asking twice for the same name and tag set returns the meter
 * that is already registered, so callers may look meters up on the hot path (for example with a
 * per-action tag) instead of caching them.
 */
public final class MetricFactory {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * Creates a MetricFactory bound to the given registry and service name.
     *
     * @param registry    the Micrometer meter registry (e.g., PrometheusMeterRegistry)
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
     * Returns the counter with the given name and tags, registering it on first use.
     *
     * @param name        metric name (e.g., "authz.decisions")
     * @param description human-readable description
     * @param tags        additional tags as alternating key/value pairs
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns the timer with the given name and tags, registering it on first use.
     *
     * @param name        metric name (e.g., "authz.evaluation")
     * @param description human-readable description
     * @param tags        additional tags as alternating key/value pairs
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        if (extraTags.length % 2 != 0) {
            throw new IllegalArgumentException("tags must be key/value pairs, got " + extraTags.length + " values");
        }
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
