package com.beacon.eventmodel;

import java.util.Optional;

/**
 * The five event kinds a client can emit.
 *
 * <p>WHY an enum: the set is closed and fixed at construction of every envelope. The {@code value}
 * field holds the tag written to the {@code type} field of the JSON wire form.
 */
public enum EventType {
    TRACK("track"),
    IDENTIFY("identify"),
    SCREEN("screen"),
    GROUP("group"),
    ALIAS("alias");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    /** The wire tag (e.g. "track"). */
    public String value() {
        return value;
    }

    /**
     * Looks up an EventType by its wire tag.
     *
     * @param value the tag to match (e.g. "identify")
     * @return the matching EventType, or empty if not found
     */
    public static Optional<EventType> fromString(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
