package com.beacon.eventmodel;

import java.util.Optional;

/**
 * Associates the user with a group (company, organization, project).
 *
 * @param envelope shared fields
 * @param groupId  id of the group
 * @param traits   group traits; {@code null} when absent
 */
public record GroupEvent(EventEnvelope envelope, String groupId, ObjectValue traits) implements PayloadEvent {

    public GroupEvent {
        Event.requireType(envelope, EventType.GROUP);
    }

    @Override
    public Optional<ObjectValue> payload() {
        return Optional.ofNullable(traits);
    }

    @Override
    public GroupEvent withPayload(ObjectValue payload) {
        return new GroupEvent(envelope, groupId, payload);
    }

    @Override
    public GroupEvent withEnvelope(EventEnvelope envelope) {
        return new GroupEvent(envelope, groupId, traits);
    }
}
