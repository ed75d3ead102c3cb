package com.beacon.client;

import com.beacon.eventmodel.Event;

/**
 * Downstream delivery pipeline: batching, persistence, transport and retry all live behind this
 * entry point.
 * <p>
 * {@link #process(Event)} is called on the dispatching thread, after enrichment, once per event
 * and in the caller's program order. Implementations must only enqueue; anything slow belongs on
 * their own threads.
 */
@FunctionalInterface
public interface EventPipeline {

    void process(Event event);
}
