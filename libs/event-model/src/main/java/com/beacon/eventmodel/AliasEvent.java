package com.beacon.eventmodel;

/**
 * Links a new user id to the identity it replaces.
 *
 * @param envelope   shared fields
 * @param newId      the new user id
 * @param previousId the id being replaced, as it was before the call
 */
public record AliasEvent(EventEnvelope envelope, String newId, String previousId) implements Event {

    public AliasEvent {
        Event.requireType(envelope, EventType.ALIAS);
    }

    @Override
    public AliasEvent withEnvelope(EventEnvelope envelope) {
        return new AliasEvent(envelope, newId, previousId);
    }
}
