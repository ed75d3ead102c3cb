package com.beacon.eventmodel;

/**
 * A canonical event record: one of the five closed variants plus the shared {@link EventEnvelope}.
 *
 * <p>Events are values. Nothing mutates one in place; enrichment builds a new event through the
 * {@code with*} methods.
 */
public sealed interface Event permits PayloadEvent, AliasEvent {

    EventEnvelope envelope();

    /** Returns a copy of this event carrying {@code envelope}, which must have the same type. */
    Event withEnvelope(EventEnvelope envelope);

    default EventType type() {
        return envelope().type();
    }

    default String messageId() {
        return envelope().messageId();
    }

    /** Guards the "type is fixed at construction" rule in the variants' compact constructors. */
    static EventEnvelope requireType(EventEnvelope envelope, EventType expected) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope must not be null");
        }
        if (envelope.type() != expected) {
            throw new IllegalArgumentException(
                    "envelope type %s does not match event type %s".formatted(envelope.type(), expected));
        }
        return envelope;
    }
}
