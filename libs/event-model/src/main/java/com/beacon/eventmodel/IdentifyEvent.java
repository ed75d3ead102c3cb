package com.beacon.eventmodel;

import java.util.Optional;

/**
 * Ties the current user to an id and/or a set of traits.
 *
 * @param envelope shared fields
 * @param userId   the user id named by the call; {@code null} for a traits-only identify
 * @param traits   traits; {@code null} when absent
 */
public record IdentifyEvent(EventEnvelope envelope, String userId, ObjectValue traits) implements PayloadEvent {

    public IdentifyEvent {
        Event.requireType(envelope, EventType.IDENTIFY);
    }

    @Override
    public Optional<ObjectValue> payload() {
        return Optional.ofNullable(traits);
    }

    @Override
    public IdentifyEvent withPayload(ObjectValue payload) {
        return new IdentifyEvent(envelope, userId, payload);
    }

    @Override
    public IdentifyEvent withEnvelope(EventEnvelope envelope) {
        return new IdentifyEvent(envelope, userId, traits);
    }
}
