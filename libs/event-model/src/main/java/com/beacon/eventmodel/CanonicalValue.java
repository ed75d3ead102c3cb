package com.beacon.eventmodel;

/**
 * Normalized, serializable value tree used for every payload, trait set and metadata map once it
 * has left the caller's hands.
 *
 * <p>WHY a sealed interface: the JSON value space is closed (null, boolean, number, string, list,
 * object), so consumers can match exhaustively and no foreign implementation can sneak a mutable
 * value into an event. All implementations are immutable and compare structurally.
 */
public sealed interface CanonicalValue
        permits NullValue, BoolValue, NumberValue, StringValue, ListValue, ObjectValue {

    /** Short name of the value kind, used in error messages ("object", "string", ...). */
    String kind();

    /** Returns {@code true} for the {@link NullValue} singleton. */
    default boolean isNull() {
        return false;
    }

    /** Wraps a string, mapping Java {@code null} to {@link NullValue#INSTANCE}. */
    static CanonicalValue of(String value) {
        return value == null ? NullValue.INSTANCE : new StringValue(value);
    }

    /** Wraps a boolean. */
    static CanonicalValue of(boolean value) {
        return BoolValue.of(value);
    }

    /** Wraps an integral number. */
    static CanonicalValue of(long value) {
        return NumberValue.of(value);
    }

    /** Wraps a floating point number; non-finite values are rejected. */
    static CanonicalValue of(double value) {
        return NumberValue.of(value);
    }
}
