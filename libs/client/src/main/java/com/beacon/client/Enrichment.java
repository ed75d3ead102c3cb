package com.beacon.client;

import com.beacon.eventmodel.Event;

import java.util.Optional;

/**
 * A transformation applied to an event after construction and before it is handed to the
 * {@link EventPipeline}.
 * <p>
 * Return the event (or a modified copy of the same kind) to pass it on, or
 * {@link Optional#empty()} to drop it; a drop stops the chain. Enrichments must not emit events
 * through the {@link Analytics} they are given: that is rejected with a
 * {@link DispatchContractException}. Reading identity state from it is fine.
 */
@FunctionalInterface
public interface Enrichment {

    Optional<Event> enrich(Event event, Analytics analytics);
}
