package com.beacon.eventmodel;

import java.time.Clock;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Builds events with their envelope filled in.
 * <p>
 * WHY a factory: encapsulates default value logic (message id generation, capture timestamp,
 * empty context and integrations) so the dispatch gateway has exactly one construction path per
 * event kind. The clock and id generator are injectable so tests can pin them.
 */
public final class EventFactory {

    private final Clock clock;
    private final Supplier<String> messageIdGenerator;

    /** Creates a factory using the UTC system clock and random UUID message ids. */
    public EventFactory() {
        this(Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    public EventFactory(Clock clock, Supplier<String> messageIdGenerator) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (messageIdGenerator == null) {
            throw new IllegalArgumentException("messageIdGenerator must not be null");
        }
        this.clock = clock;
        this.messageIdGenerator = messageIdGenerator;
    }

    /**
     * Creates an envelope stamped with the current time.
     *
     * @param messageId caller-supplied id, or {@code null} or blank to generate one
     */
    public EventEnvelope envelope(EventType type, String messageId, String anonymousId, String userId) {
        return new EventEnvelope(
                messageId != null && !messageId.isBlank() ? messageId : messageIdGenerator.get(),
                clock.instant(),
                type,
                anonymousId,
                userId,
                ObjectValue.empty(),
                ObjectValue.empty());
    }

    public TrackEvent track(String messageId, String name, ObjectValue properties, String anonymousId, String userId) {
        return new TrackEvent(envelope(EventType.TRACK, messageId, anonymousId, userId), name, properties);
    }

    /**
     * Creates an Identify event. The envelope's user id is the identity state's user id after the
     * call's own state change, which for a traits-only identify is the previously known id.
     */
    public IdentifyEvent identify(String userId, ObjectValue traits, String anonymousId, String stateUserId) {
        return new IdentifyEvent(envelope(EventType.IDENTIFY, null, anonymousId, stateUserId), userId, traits);
    }

    public ScreenEvent screen(String title, String category, ObjectValue properties, String anonymousId, String userId) {
        return new ScreenEvent(envelope(EventType.SCREEN, null, anonymousId, userId), title, category, properties);
    }

    public GroupEvent group(String groupId, ObjectValue traits, String anonymousId, String userId) {
        return new GroupEvent(envelope(EventType.GROUP, null, anonymousId, userId), groupId, traits);
    }

    public AliasEvent alias(String newId, String previousId, String anonymousId) {
        return new AliasEvent(envelope(EventType.ALIAS, null, anonymousId, newId), newId, previousId);
    }
}
