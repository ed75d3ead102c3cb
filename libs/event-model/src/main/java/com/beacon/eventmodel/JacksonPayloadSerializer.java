package com.beacon.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;


/**
 * {@link PayloadSerializer} backed by Jackson.
 * <p>
 * WHY Jackson: it already converts records, beans, maps, {@code Optional} and {@code java.time}
 * values into a JSON tree, and fails loudly on values it cannot represent (empty beans, throwing
 * getters). Typed payloads and untyped maps both go through {@link ObjectMapper#valueToTree}, so
 * equal data gives equal trees.
 */
public final class JacksonPayloadSerializer implements PayloadSerializer {

    private final ObjectMapper mapper;

    /** Uses the shared mapper from {@link EventSerializer#objectMapper()}. */
    public JacksonPayloadSerializer() {
        this(EventSerializer.objectMapper());
    }

    public JacksonPayloadSerializer(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper must not be null");
        }
        this.mapper = mapper;
    }

    @Override
    public CanonicalValue serialize(Object value) {
        if (value == null) {
            return NullValue.INSTANCE;
        }
        if (value instanceof CanonicalValue canonical) {
            return canonical;
        }
        try {
            JsonNode tree = mapper.valueToTree(value);
            return CanonicalValues.fromJsonNode(tree);
        } catch (IllegalArgumentException e) {
            throw new PayloadSerializationException(
                    "Failed to serialize payload of type " + value.getClass().getName(), e);
        }
    }

    @Override
    public <T> T deserialize(CanonicalValue value, Class<T> type) {
        try {
            return mapper.treeToValue(CanonicalValues.toJsonNode(value), type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new PayloadSerializationException("Failed to read payload as " + type.getName(), e);
        }
    }
}
