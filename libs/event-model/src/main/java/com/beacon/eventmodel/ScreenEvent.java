package com.beacon.eventmodel;

import java.util.Optional;

/**
 * A screen view.
 *
 * @param envelope   shared fields
 * @param name       title of the screen
 * @param category   screen category; {@code null} when not given
 * @param properties screen properties; {@code null} when absent
 */
public record ScreenEvent(EventEnvelope envelope, String name, String category, ObjectValue properties)
        implements PayloadEvent {

    public ScreenEvent {
        Event.requireType(envelope, EventType.SCREEN);
    }

    @Override
    public Optional<ObjectValue> payload() {
        return Optional.ofNullable(properties);
    }

    @Override
    public ScreenEvent withPayload(ObjectValue payload) {
        return new ScreenEvent(envelope, name, category, payload);
    }

    @Override
    public ScreenEvent withEnvelope(EventEnvelope envelope) {
        return new ScreenEvent(envelope, name, category, properties);
    }
}
