package com.beacon.eventmodel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * An insertion-ordered map of string keys to values. This is the type of every event payload
 * (properties, traits) and of the envelope's context and integrations maps.
 *
 * <p>Keys are unique. Insertion order is kept so serialized output is stable, but equality is
 * structural and ignores order, like {@link Map#equals(Object)}.
 *
 * @param fields the entries; copied into an unmodifiable ordered map
 */
public record ObjectValue(Map<String, CanonicalValue> fields) implements CanonicalValue {

    private static final ObjectValue EMPTY = new ObjectValue(Map.of());

    public ObjectValue {
        if (fields == null || fields.isEmpty()) {
            fields = Map.of();
        } else {
            var copy = new LinkedHashMap<String, CanonicalValue>(fields.size());
            fields.forEach((key, value) -> {
                if (key == null) {
                    throw new IllegalArgumentException("key must not be null");
                }
                if (value == null) {
                    throw new IllegalArgumentException("value for key '" + key + "' must not be null");
                }
                copy.put(key, value);
            });
            fields = Collections.unmodifiableMap(copy);
        }
    }

    public static ObjectValue empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<CanonicalValue> get(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    /** Returns the string stored under {@code key}, if there is one and it is a string. */
    public Optional<String> string(String key) {
        return fields.get(key) instanceof StringValue s ? Optional.of(s.value()) : Optional.empty();
    }

    /** Returns the object stored under {@code key}, if there is one and it is an object. */
    public Optional<ObjectValue> object(String key) {
        return fields.get(key) instanceof ObjectValue o ? Optional.of(o) : Optional.empty();
    }

    public boolean containsKey(String key) {
        return fields.containsKey(key);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public int size() {
        return fields.size();
    }

    /** Returns a copy with {@code key} set to {@code value}; an existing key keeps its position. */
    public ObjectValue with(String key, CanonicalValue value) {
        var copy = new LinkedHashMap<>(fields);
        copy.put(key, value);
        return new ObjectValue(copy);
    }

    /** Returns a copy with every entry of {@code other} added, {@code other} winning on clashes. */
    public ObjectValue merge(ObjectValue other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        var copy = new LinkedHashMap<>(fields);
        copy.putAll(other.fields);
        return new ObjectValue(copy);
    }

    @Override
    public String kind() {
        return "object";
    }

    /** Mutable builder; {@link #build()} takes an immutable snapshot. */
    public static final class Builder {
        private final Map<String, CanonicalValue> fields = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String key, CanonicalValue value) {
            fields.put(key, value);
            return this;
        }

        public Builder put(String key, String value) {
            return put(key, CanonicalValue.of(value));
        }

        public Builder put(String key, long value) {
            return put(key, CanonicalValue.of(value));
        }

        public Builder put(String key, double value) {
            return put(key, CanonicalValue.of(value));
        }

        public Builder put(String key, boolean value) {
            return put(key, CanonicalValue.of(value));
        }

        public ObjectValue build() {
            return new ObjectValue(fields);
        }
    }
}
