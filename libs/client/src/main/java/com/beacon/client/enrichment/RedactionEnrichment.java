package com.beacon.client.enrichment;

import com.beacon.client.Analytics;
import com.beacon.client.Enrichment;
import com.beacon.eventmodel.CanonicalValue;
import com.beacon.eventmodel.Event;
import com.beacon.eventmodel.ListValue;
import com.beacon.eventmodel.ObjectValue;
import com.beacon.eventmodel.PayloadEvent;
import com.beacon.eventmodel.StringValue;
import com.beacon.observability.SensitiveDataRedactor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Replaces the values of sensitive keys in properties and traits with
 * {@value SensitiveDataRedactor#REDACTED}, at any depth, including objects nested in lists.
 * Alias events carry no payload and pass through unchanged.
 */
public final class RedactionEnrichment implements Enrichment {

    private static final StringValue MASK = new StringValue(SensitiveDataRedactor.REDACTED);

    private final SensitiveDataRedactor redactor;

    public RedactionEnrichment(SensitiveDataRedactor redactor) {
        if (redactor == null) {
            throw new IllegalArgumentException("redactor must not be null");
        }
        this.redactor = redactor;
    }

    @Override
    public Optional<Event> enrich(Event event, Analytics analytics) {
        return Optional.of(redactPayload(event));
    }

    /** The event with its properties or traits masked; the same instance when nothing matched. */
    public Event redactPayload(Event event) {
        if (event instanceof PayloadEvent payloadEvent && payloadEvent.payload().isPresent()) {
            ObjectValue payload = payloadEvent.payload().get();
            ObjectValue redacted = redact(payload);
            return redacted == payload ? event : payloadEvent.withPayload(redacted);
        }
        return event;
    }

    /**
     * Masks every sensitive key of {@code object} at any depth. Returns the same instance when
     * nothing under it was sensitive, and {@code null} for {@code null}.
     */
    public ObjectValue redact(ObjectValue object) {
        if (object == null) {
            return null;
        }
        var copy = new LinkedHashMap<String, CanonicalValue>(object.size());
        boolean changed = false;
        for (var entry : object.fields().entrySet()) {
            CanonicalValue value = entry.getValue();
            CanonicalValue replacement = redactor.isSensitive(entry.getKey()) ? MASK : redactValue(value);
            changed |= replacement != value;
            copy.put(entry.getKey(), replacement);
        }
        return changed ? new ObjectValue(copy) : object;
    }

    private CanonicalValue redactValue(CanonicalValue value) {
        if (value instanceof ObjectValue object) {
            return redact(object);
        }
        if (value instanceof ListValue list) {
            var items = new ArrayList<CanonicalValue>(list.size());
            boolean changed = false;
            for (CanonicalValue item : list.elements()) {
                CanonicalValue replacement = redactValue(item);
                changed |= replacement != item;
                items.add(replacement);
            }
            return changed ? new ListValue(items) : list;
        }
        return value;
    }

    @Override
    public String toString() {
        return "RedactionEnrichment" + redactor.sensitivePatterns();
    }
}
