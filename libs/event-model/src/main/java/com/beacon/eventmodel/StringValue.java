package com.beacon.eventmodel;


/**
 * A string leaf.
 *
 * @param value the wrapped string, never {@code null} (use {@link NullValue})
 */
public record StringValue(String value) implements CanonicalValue {

    public StringValue {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
    }

    @Override
    public String kind() {
        return "string";
    }
}
