package com.beacon.eventmodel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conversions between Jackson's {@link JsonNode} tree and {@link CanonicalValue}.
 * <p>
 * WHY go through JsonNode: Jackson already knows how to turn records, beans, maps, collections,
 * {@code Optional} and {@code java.time} values into a tree. This class only has to map that tree
 * onto the closed canonical value space and refuse what has no JSON form (NaN, infinities).
 */
public final class CanonicalValues {

    private CanonicalValues() {
        // utility class
    }

    /**
     * Converts a Jackson tree into a canonical value.
     *
     * @throws IllegalArgumentException if the tree holds a value with no canonical form
     */
    public static CanonicalValue fromJsonNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NullValue.INSTANCE;
        }
        if (node.isBoolean()) {
            return BoolValue.of(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return new NumberValue(new BigDecimal(node.bigIntegerValue()));
        }
        if (node.isFloatingPointNumber()) {
            if (node.isDouble() || node.isFloat()) {
                return NumberValue.of(node.doubleValue());
            }
            return new NumberValue(node.decimalValue());
        }
        if (node.isTextual()) {
            return new StringValue(node.textValue());
        }
        if (node.isBinary()) {
            // Jackson renders byte[] as base64 text on the wire
            return new StringValue(node.asText());
        }
        if (node.isArray()) {
            var elements = new ArrayList<CanonicalValue>(node.size());
            for (JsonNode element : node) {
                elements.add(fromJsonNode(element));
            }
            return new ListValue(elements);
        }
        if (node.isObject()) {
            Map<String, CanonicalValue> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                fields.put(entry.getKey(), fromJsonNode(entry.getValue()));
            }
            return new ObjectValue(fields);
        }
        throw new IllegalArgumentException("Unsupported JSON node type: " + node.getNodeType());
    }

    /** Converts a canonical value into a Jackson tree. */
    public static JsonNode toJsonNode(CanonicalValue value) {
        return toJsonNode(value, JsonNodeFactory.instance);
    }

    static JsonNode toJsonNode(CanonicalValue value, JsonNodeFactory factory) {
        if (value instanceof NullValue) {
            return factory.nullNode();
        }
        if (value instanceof BoolValue b) {
            return factory.booleanNode(b.value());
        }
        if (value instanceof NumberValue n) {
            return numberNode(n, factory);
        }
        if (value instanceof StringValue s) {
            return factory.textNode(s.value());
        }
        if (value instanceof ListValue list) {
            ArrayNode array = factory.arrayNode(list.size());
            list.elements().forEach(element -> array.add(toJsonNode(element, factory)));
            return array;
        }
        ObjectNode object = factory.objectNode();
        ((ObjectValue) value).fields().forEach((key, field) -> object.set(key, toJsonNode(field, factory)));
        return object;
    }

    private static JsonNode numberNode(NumberValue number, JsonNodeFactory factory) {
        BigDecimal decimal = number.value();
        if (number.isIntegral()) {
            try {
                return factory.numberNode(decimal.longValueExact());
            } catch (ArithmeticException tooLarge) {
                return factory.numberNode(decimal.toBigIntegerExact());
            }
        }
        return factory.numberNode(decimal);
    }
}
