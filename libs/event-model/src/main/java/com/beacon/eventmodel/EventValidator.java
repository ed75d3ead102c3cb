package com.beacon.eventmodel;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the required identifiers of an {@link Event} and collects every problem at once.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    /**
     * Validates the envelope and the kind-specific identifiers. An identify event may omit its
     * userId (a traits-only call).
     */
    public static ValidationResult validate(Event event) {
        return validate(event, false);
    }

    /**
     * Validates the envelope and the kind-specific identifiers.
     *
     * @param event          the event to validate
     * @param userIdRequired for identify events, whether a missing userId is an error; set for
     *                       calls that were made with a userId argument
     */
    public static ValidationResult validate(Event event, boolean userIdRequired) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        var errors = new ArrayList<String>();
        EventEnvelope envelope = event.envelope();

        requireText(envelope.messageId(), "messageId", errors);
        if (envelope.timestamp() == null) {
            errors.add("timestamp must not be null");
        }
        requireText(envelope.anonymousId(), "anonymousId", errors);

        if (event instanceof TrackEvent track) {
            requireText(track.event(), "event name", errors);
        } else if (event instanceof IdentifyEvent identify) {
            if (userIdRequired) {
                requireText(identify.userId(), "userId", errors);
            } else if (identify.userId() != null && identify.userId().isBlank()) {
                errors.add("userId must not be blank");
            }
        } else if (event instanceof ScreenEvent screen) {
            requireText(screen.name(), "screen name", errors);
        } else if (event instanceof GroupEvent group) {
            requireText(group.groupId(), "groupId", errors);
        } else if (event instanceof AliasEvent alias) {
            requireText(alias.newId(), "alias newId", errors);
        }

        return ValidationResult.of(event.type(), errors);
    }

    private static void requireText(String value, String field, List<String> errors) {
        if (value == null || value.isBlank()) {
            errors.add(field + " must not be null or blank");
        }
    }
}
