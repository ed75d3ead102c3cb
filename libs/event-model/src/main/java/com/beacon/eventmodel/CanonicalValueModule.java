package com.beacon.eventmodel;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.io.IOException;

/**
 * Jackson module that reads and writes {@link CanonicalValue} trees as plain JSON.
 * <p>
 * Register it on any {@code ObjectMapper} that has to carry canonical values, e.g. a Spring MVC
 * mapper returning event payloads.
 */
public final class CanonicalValueModule extends SimpleModule {

    public CanonicalValueModule() {
        super("CanonicalValueModule");
        addSerializer(CanonicalValue.class, new CanonicalValueSerializer());
        addDeserializer(CanonicalValue.class, new CanonicalValueDeserializer());
        addDeserializer(ObjectValue.class, new ObjectValueDeserializer());
    }

    static final class CanonicalValueSerializer extends JsonSerializer<CanonicalValue> {
        @Override
        public void serialize(CanonicalValue value, JsonGenerator gen, SerializerProvider serializers)
                throws IOException {
            gen.writeTree(CanonicalValues.toJsonNode(value));
        }
    }

    static final class CanonicalValueDeserializer extends JsonDeserializer<CanonicalValue> {
        @Override
        public CanonicalValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode tree = p.readValueAsTree();
            try {
                return CanonicalValues.fromJsonNode(tree);
            } catch (IllegalArgumentException e) {
                return ctxt.reportInputMismatch(CanonicalValue.class, e.getMessage());
            }
        }

        @Override
        public CanonicalValue getNullValue(DeserializationContext ctxt) {
            return NullValue.INSTANCE;
        }
    }

    static final class ObjectValueDeserializer extends JsonDeserializer<ObjectValue> {
        @Override
        public ObjectValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode tree = p.readValueAsTree();
            if (!tree.isObject()) {
                return ctxt.reportInputMismatch(ObjectValue.class,
                        "Expected a JSON object but was %s", tree.getNodeType());
            }
            return (ObjectValue) CanonicalValues.fromJsonNode(tree);
        }
    }
}
