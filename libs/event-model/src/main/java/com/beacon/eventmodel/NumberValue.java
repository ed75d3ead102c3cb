package com.beacon.eventmodel;

import java.math.BigDecimal;

/**
 * A numeric leaf.
 *
 * <p>The value is held as a {@link BigDecimal} with trailing zeros stripped, so {@code 1},
 * {@code 1.0} and {@code 1.00} are the same value whether they came from an {@code int} field of a
 * record or a {@code Double} in an untyped map.
 *
 * @param value the normalized decimal value
 */
public record NumberValue(BigDecimal value) implements CanonicalValue {

    public NumberValue {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
        value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
    }

    public static NumberValue of(long value) {
        return new NumberValue(BigDecimal.valueOf(value));
    }

    /**
     * Wraps a double.
     *
     * @throws IllegalArgumentException for NaN and infinities, which have no JSON representation
     */
    public static NumberValue of(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Non-finite number has no canonical form: " + value);
        }
        return new NumberValue(BigDecimal.valueOf(value));
    }

    /** True when the value has no fractional part. */
    public boolean isIntegral() {
        return value.scale() <= 0;
    }

    @Override
    public String kind() {
        return "number";
    }

    @Override
    public String toString() {
        return value.toPlainString();
    }
}
