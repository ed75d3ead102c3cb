package com.beacon.eventmodel;

import java.util.List;

/**
 * Outcome of {@link EventValidator}: the kind that was checked and every missing or blank field
 * found on it. An empty error list means the event may be dispatched.
 */
public record ValidationResult(EventType type, List<String> errors) {

    public ValidationResult {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    static ValidationResult of(EventType type, List<String> errors) {
        return new ValidationResult(type, errors);
    }

    public boolean valid() {
        return errors.isEmpty();
    }

    /**
     * The failure as the exception the gateway hands to its error sink.
     *
     * @throws IllegalStateException when the result is valid
     */
    public InvalidEventException toException() {
        if (valid()) {
            throw new IllegalStateException("a valid %s event has no errors to report".formatted(type.value()));
        }
        return new InvalidEventException(type, errors);
    }
}
