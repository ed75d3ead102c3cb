package com.beacon.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

/**
 * Factory for creating Micrometer metrics with a consistent {@code client} tag.
 * <p>
 * Every metric created through this factory carries the name of the client instance that produced
 * it, so several clients in one process (e.g. one per write key) stay distinguishable. Additional
 * tags can be supplied per metric.
 */
public final class MetricFactory {

    /** Tag key for the client instance name. */
    public static final String TAG_CLIENT = "client";

    private final MeterRegistry registry;
    private final String clientName;

    /**
     * Creates a MetricFactory bound to the given registry and client name.
     *
     * @param registry   the Micrometer meter registry
     * @param clientName logical client name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String clientName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (clientName == null || clientName.isBlank()) {
            throw new IllegalArgumentException("clientName must not be null or blank");
        }
        this.registry = registry;
        this.clientName = clientName;
    }

    /**
     * Creates (or looks up) a counter with the client tag.
     *
     * @param name        metric name (e.g., "beacon.events.dispatched")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     * @return the counter
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_CLIENT, clientName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
