package com.beacon.client;

import com.beacon.eventmodel.Event;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered enrichment application: pipeline-wide enrichments in registration order, then the
 * call-scoped ones in list order.
 * <p>
 * Pipeline-wide enrichments can be added and removed while other threads dispatch; each
 * application works on a stable snapshot of the list.
 */
public final class EnrichmentChain {

    private final List<Enrichment> pipelineWide = new CopyOnWriteArrayList<>();

    public void add(Enrichment enrichment) {
        if (enrichment == null) {
            throw new IllegalArgumentException("enrichment must not be null");
        }
        pipelineWide.add(enrichment);
    }

    public boolean remove(Enrichment enrichment) {
        return pipelineWide.remove(enrichment);
    }

    /**
     * Runs the chain.
     *
     * @param event      the constructed event
     * @param callScoped enrichments supplied with this call only; may be {@code null}
     * @param analytics  the client passed on to each enrichment
     * @return the final event, or empty if an enrichment dropped it
     * @throws DispatchContractException if an enrichment returns {@code null} or an event of
     *                                   another kind
     */
    public Optional<Event> apply(Event event, List<Enrichment> callScoped, Analytics analytics) {
        Event current = event;
        for (Enrichment enrichment : pipelineWide) {
            Optional<Event> next = applyOne(enrichment, current, analytics);
            if (next.isEmpty()) {
                return next;
            }
            current = next.get();
        }
        if (callScoped != null) {
            for (Enrichment enrichment : callScoped) {
                Optional<Event> next = applyOne(enrichment, current, analytics);
                if (next.isEmpty()) {
                    return next;
                }
                current = next.get();
            }
        }
        return Optional.of(current);
    }

    private static Optional<Event> applyOne(Enrichment enrichment, Event event, Analytics analytics) {
        Optional<Event> result = enrichment.enrich(event, analytics);
        if (result == null) {
            throw new DispatchContractException(
                    "Enrichment " + enrichment + " returned null; return Optional.empty() to drop an event");
        }
        result.ifPresent(enriched -> {
            if (enriched.type() != event.type()) {
                throw new DispatchContractException("Enrichment %s turned a %s event into a %s event"
                        .formatted(enrichment, event.type().value(), enriched.type().value()));
            }
        });
        return result;
    }
}
