package com.beacon.eventmodel;

/**
 * A boolean leaf.
 *
 * @param value the wrapped boolean
 */
public record BoolValue(boolean value) implements CanonicalValue {

    public static final BoolValue TRUE = new BoolValue(true);
    public static final BoolValue FALSE = new BoolValue(false);

    public static BoolValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public String kind() {
        return "boolean";
    }
}
