package com.beacon.eventmodel;

/** The JSON {@code null}. A singleton, so reference and structural equality coincide. */
public enum NullValue implements CanonicalValue {
    INSTANCE;

    @Override
    public String kind() {
        return "null";
    }

    @Override
    public boolean isNull() {
        return true;
    }
}
