package com.beacon.eventmodel;

import java.util.List;

/**
 * Raised when an event is built with an invalid shape, e.g. a Track with an empty name. The
 * dispatch gateway reports it through the error sink instead of throwing.
 */
public class InvalidEventException extends RuntimeException {

    private final EventType type;
    private final List<String> errors;

    public InvalidEventException(EventType type, List<String> errors) {
        super("Invalid %s event: %s".formatted(type.value(), String.join("; ", errors)));
        this.type = type;
        this.errors = List.copyOf(errors);
    }

    public EventType type() {
        return type;
    }

    public List<String> errors() {
        return errors;
    }
}
