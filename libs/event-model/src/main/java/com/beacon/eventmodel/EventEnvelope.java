package com.beacon.eventmodel;

import java.time.Instant;

/**
 * Fields common to every event, whatever its kind.
 *
 * <p>Immutable like the events that carry it. Later pipeline stages that fill in device, library or
 * destination metadata produce a new envelope through {@link #withContext(ObjectValue)} and
 * {@link #withIntegrations(ObjectValue)}.
 *
 * @param messageId    unique id of this event, caller-supplied or a generated UUID
 * @param timestamp    capture time
 * @param type         the event kind, fixed at construction
 * @param anonymousId  anonymous id snapshotted from the identity state
 * @param userId       user id snapshotted from the identity state; {@code null} when unknown
 * @param context      contextual metadata, empty until an enrichment or pipeline stage fills it
 * @param integrations per-destination switches, empty until set downstream
 */
public record EventEnvelope(
        String messageId,
        Instant timestamp,
        EventType type,
        String anonymousId,
        String userId,
        ObjectValue context,
        ObjectValue integrations) {

    public EventEnvelope {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        context = context == null ? ObjectValue.empty() : context;
        integrations = integrations == null ? ObjectValue.empty() : integrations;
    }

    /** Returns a copy carrying a newer identity snapshot. */
    public EventEnvelope withIdentity(String anonymousId, String userId) {
        return new EventEnvelope(messageId, timestamp, type, anonymousId, userId, context, integrations);
    }

    public EventEnvelope withContext(ObjectValue context) {
        return new EventEnvelope(messageId, timestamp, type, anonymousId, userId, context, integrations);
    }

    public EventEnvelope withIntegrations(ObjectValue integrations) {
        return new EventEnvelope(messageId, timestamp, type, anonymousId, userId, context, integrations);
    }
}
