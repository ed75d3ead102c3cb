package com.beacon.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * JSON serialization and deserialization for {@link Event}.
 * <p>
 * Events are written in the flat wire layout downstream collectors expect: envelope fields
 * ({@code type}, {@code messageId}, {@code timestamp}, {@code anonymousId}, {@code userId},
 * {@code context}, {@code integrations}) side by side with the kind-specific fields. Alias writes
 * its new id as {@code userId}.
 * <p>
 * {@code userId} is always the envelope's identity. An identify call's own userId is written as
 * {@value #IDENTIFY_USER_ID} only when it differs from that, as JSON {@code null} for a traits-only
 * call; without the key the two are the same, which is how other producers write identify.
 */
public final class EventSerializer {

    /** Wire key for an identify call's userId when it differs from the envelope's. */
    public static final String IDENTIFY_USER_ID = "identifyUserId";

    private static final ObjectMapper MAPPER = createMapper();

    private EventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new Jdk8Module())
                .registerModule(new CanonicalValueModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Serializes an event to its JSON wire form.
     *
     * @throws EventSerializationException if serialization fails
     */
    public static String serialize(Event event) {
        try {
            return MAPPER.writeValueAsString(toWire(event));
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize event: " + event.messageId(), e);
        }
    }

    /** Builds the flat wire object for an event without rendering it as text. */
    public static ObjectValue toWire(Event event) {
        EventEnvelope envelope = event.envelope();
        Map<String, CanonicalValue> wire = new LinkedHashMap<>();
        wire.put("type", new StringValue(envelope.type().value()));
        putIfPresent(wire, "messageId", envelope.messageId());
        if (envelope.timestamp() != null) {
            wire.put("timestamp", new StringValue(envelope.timestamp().toString()));
        }
        putIfPresent(wire, "anonymousId", envelope.anonymousId());
        putIfPresent(wire, "userId", envelope.userId());
        wire.put("context", envelope.context());
        wire.put("integrations", envelope.integrations());

        if (event instanceof TrackEvent track) {
            putIfPresent(wire, "event", track.event());
            putIfPresent(wire, "properties", track.properties());
        } else if (event instanceof IdentifyEvent identify) {
            if (!Objects.equals(identify.userId(), envelope.userId())) {
                wire.put(IDENTIFY_USER_ID,
                        identify.userId() == null ? NullValue.INSTANCE : new StringValue(identify.userId()));
            }
            putIfPresent(wire, "traits", identify.traits());
        } else if (event instanceof ScreenEvent screen) {
            putIfPresent(wire, "name", screen.name());
            putIfPresent(wire, "category", screen.category());
            putIfPresent(wire, "properties", screen.properties());
        } else if (event instanceof GroupEvent group) {
            putIfPresent(wire, "groupId", group.groupId());
            putIfPresent(wire, "traits", group.traits());
        } else if (event instanceof AliasEvent alias) {
            putIfPresent(wire, "userId", alias.newId());
            putIfPresent(wire, "previousId", alias.previousId());
        }
        return new ObjectValue(wire);
    }

    /**
     * Deserializes a JSON wire object into the event variant named by its {@code type} field.
     *
     * @throws EventSerializationException if the JSON is malformed or names an unknown type
     */
    public static Event deserialize(String json) {
        ObjectValue wire;
        try {
            wire = MAPPER.readValue(json, ObjectValue.class);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize event", e);
        }
        if (wire == null) {
            throw new EventSerializationException("Failed to deserialize event: empty document", null);
        }
        return fromWire(wire);
    }

    /** Rebuilds an event from its wire object. */
    public static Event fromWire(ObjectValue wire) {
        String tag = wire.string("type")
                .orElseThrow(() -> new EventSerializationException("Event has no type field", null));
        EventType type = EventType.fromString(tag)
                .orElseThrow(() -> new EventSerializationException("Unknown event type: " + tag, null));

        String userId = wire.string("userId").orElse(null);
        var envelope = new EventEnvelope(
                wire.string("messageId").orElse(null),
                wire.string("timestamp").map(EventSerializer::parseInstant).orElse(null),
                type,
                wire.string("anonymousId").orElse(null),
                userId,
                wire.object("context").orElse(null),
                wire.object("integrations").orElse(null));

        return switch (type) {
            case TRACK -> new TrackEvent(envelope,
                    wire.string("event").orElse(null), wire.object("properties").orElse(null));
            case IDENTIFY -> new IdentifyEvent(envelope, identifyUserId(wire, userId),
                    wire.object("traits").orElse(null));
            case SCREEN -> new ScreenEvent(envelope, wire.string("name").orElse(null),
                    wire.string("category").orElse(null), wire.object("properties").orElse(null));
            case GROUP -> new GroupEvent(envelope,
                    wire.string("groupId").orElse(null), wire.object("traits").orElse(null));
            case ALIAS -> new AliasEvent(envelope, userId, wire.string("previousId").orElse(null));
        };
    }

    /** Returns the shared ObjectMapper (for advanced use). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    private static String identifyUserId(ObjectValue wire, String envelopeUserId) {
        if (!wire.containsKey(IDENTIFY_USER_ID)) {
            return envelopeUserId;
        }
        return wire.string(IDENTIFY_USER_ID).orElse(null);
    }

    private static Instant parseInstant(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new EventSerializationException("Invalid timestamp: " + text, e);
        }
    }

    private static void putIfPresent(Map<String, CanonicalValue> wire, String key, String value) {
        if (value != null) {
            wire.put(key, new StringValue(value));
        }
    }

    private static void putIfPresent(Map<String, CanonicalValue> wire, String key, ObjectValue value) {
        if (value != null) {
            wire.put(key, value);
        }
    }

    /**
     * Exception thrown when event serialization/deserialization fails.
     */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
