package com.beacon.eventmodel;

/**
 * Converts arbitrary caller values (records, beans, untyped maps) into canonical value trees and
 * back.
 *
 * <p>The coercion rules are the implementation's business. The contract is only that the result
 * is a {@link CanonicalValue} or a {@link PayloadSerializationException}; the same logical data
 * must produce structurally equal trees whether it arrives typed or untyped.
 */
public interface PayloadSerializer {

    /**
     * Serializes any value.
     *
     * @throws PayloadSerializationException if the value cannot be represented
     */
    CanonicalValue serialize(Object value);

    /**
     * Reads a canonical value back into a Java type.
     *
     * @throws PayloadSerializationException if the tree does not fit {@code type}
     */
    <T> T deserialize(CanonicalValue value, Class<T> type);

    /**
     * Serializes a value that must come out as an object, as every event payload does.
     *
     * @throws PayloadSerializationException if the value cannot be represented or is not an object
     */
    default ObjectValue serializeObject(Object value) {
        CanonicalValue result = serialize(value);
        if (result instanceof ObjectValue object) {
            return object;
        }
        throw new PayloadSerializationException(
                "Payload of type %s serialized to a JSON %s, expected an object"
                        .formatted(value == null ? "null" : value.getClass().getName(), result.kind()));
    }
}
