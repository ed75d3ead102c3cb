package com.beacon.client;

import com.beacon.eventmodel.EventType;
import com.beacon.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;

import java.util.EnumMap;
import java.util.Map;

/** Per-event-type outcome counters of the dispatch gateway. */
final class DispatchMetrics {

    static final String DISPATCHED = "beacon.events.dispatched";
    static final String DROPPED = "beacon.events.dropped";
    static final String REJECTED = "beacon.events.rejected";

    private final Map<EventType, Counter> dispatched = new EnumMap<>(EventType.class);
    private final Map<EventType, Counter> dropped = new EnumMap<>(EventType.class);
    private final Map<EventType, Counter> rejected = new EnumMap<>(EventType.class);

    DispatchMetrics(MetricFactory metrics) {
        for (EventType type : EventType.values()) {
            dispatched.put(type, metrics.counter(DISPATCHED, "Events handed to the pipeline", "type", type.value()));
            dropped.put(type, metrics.counter(DROPPED, "Events dropped during enrichment or hand-off", "type", type.value()));
            rejected.put(type, metrics.counter(REJECTED, "Events rejected before dispatch", "type", type.value()));
        }
    }

    void dispatched(EventType type) {
        dispatched.get(type).increment();
    }

    void dropped(EventType type) {
        dropped.get(type).increment();
    }

    void rejected(EventType type) {
        rejected.get(type).increment();
    }
}
