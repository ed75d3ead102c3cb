package com.beacon.client.enrichment;

import com.beacon.client.Analytics;
import com.beacon.client.AnalyticsConfiguration;
import com.beacon.client.Enrichment;
import com.beacon.eventmodel.Event;
import com.beacon.eventmodel.ObjectValue;

import java.util.Map;
import java.util.Optional;

/**
 * Merges a fixed block of context (library name and version, app entries from the configuration)
 * into every event's envelope context. Entries already present on the event win.
 */
public final class ContextEnrichment implements Enrichment {

    public static final String LIBRARY_KEY = "library";

    private final ObjectValue context;

    public ContextEnrichment(ObjectValue context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        this.context = context;
    }

    /**
     * Builds the context a client stamps on its events: {@code library.name},
     * {@code library.version}, then the configured static entries as strings.
     */
    public static ObjectValue staticContext(AnalyticsConfiguration configuration) {
        var builder = ObjectValue.builder()
                .put(LIBRARY_KEY, ObjectValue.builder()
                        .put("name", Analytics.LIBRARY_NAME)
                        .put("version", Analytics.LIBRARY_VERSION)
                        .build());
        configuration.context().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> builder.put(entry.getKey(), entry.getValue()));
        return builder.build();
    }

    public ObjectValue context() {
        return context;
    }

    @Override
    public Optional<Event> enrich(Event event, Analytics analytics) {
        var envelope = event.envelope();
        return Optional.of(event.withEnvelope(envelope.withContext(context.merge(envelope.context()))));
    }

    @Override
    public String toString() {
        return "ContextEnrichment";
    }
}
