package com.beacon.eventmodel;

import java.util.Optional;

/**
 * An action performed by the user.
 *
 * @param envelope   shared fields
 * @param event      name of the action, e.g. "Purchased a T-Shirt"
 * @param properties event properties; {@code null} when absent
 */
public record TrackEvent(EventEnvelope envelope, String event, ObjectValue properties) implements PayloadEvent {

    public TrackEvent {
        Event.requireType(envelope, EventType.TRACK);
    }

    @Override
    public Optional<ObjectValue> payload() {
        return Optional.ofNullable(properties);
    }

    @Override
    public TrackEvent withPayload(ObjectValue payload) {
        return new TrackEvent(envelope, event, payload);
    }

    @Override
    public TrackEvent withEnvelope(EventEnvelope envelope) {
        return new TrackEvent(envelope, event, properties);
    }
}
