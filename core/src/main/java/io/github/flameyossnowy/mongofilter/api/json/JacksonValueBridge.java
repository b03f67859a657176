package io.github.flameyossnowy.mongofilter.api.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.flameyossnowy.mongofilter.api.exceptions.ShapeMismatchException;
import io.github.flameyossnowy.mongofilter.api.exceptions.json.JacksonJsonLocation;
import io.github.flameyossnowy.mongofilter.api.exceptions.json.JsonProcessException;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.ArrayValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.BooleanValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.NullValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.NumberValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.ObjectValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.StringValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between Jackson trees and {@link StructuredValue}s.
 */
public final class JacksonValueBridge {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JacksonValueBridge() {
        throw new AssertionError("No instances");
    }

    public static @NotNull StructuredValue fromJsonNode(@Nullable JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return NullValue.INSTANCE;

        return switch (node.getNodeType()) {
            case OBJECT -> {
                Map<String, StructuredValue> fields = new LinkedHashMap<>(node.size());
                Iterator<Map.Entry<String, JsonNode>> it = node.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> entry = it.next();
                    fields.put(entry.getKey(), fromJsonNode(entry.getValue()));
                }
                yield new ObjectValue(fields);
            }
            case ARRAY -> {
                List<StructuredValue> values = new ArrayList<>(node.size());
                for (JsonNode element : node) {
                    values.add(fromJsonNode(element));
                }
                yield new ArrayValue(values);
            }
            case STRING -> new StringValue(node.textValue());
            case BOOLEAN -> BooleanValue.of(node.booleanValue());
            case NUMBER -> new NumberValue(numberOf(node));
            default -> throw new ShapeMismatchException("JSON node of type " + node.getNodeType() + " has no structured form");
        };
    }

    private static Number numberOf(JsonNode node) {
        return switch (node.numberType()) {
            case INT -> node.intValue();
            case LONG -> node.longValue();
            case BIG_INTEGER -> new BigDecimal(node.bigIntegerValue());
            case FLOAT, DOUBLE -> node.doubleValue();
            case BIG_DECIMAL -> node.decimalValue();
        };
    }

    public static @NotNull JsonNode toJsonNode(@NotNull StructuredValue value) {
        if (value instanceof ObjectValue object) {
            ObjectNode node = NODES.objectNode();
            for (Map.Entry<String, StructuredValue> entry : object.fields().entrySet()) {
                node.set(entry.getKey(), toJsonNode(entry.getValue()));
            }
            return node;
        }
        if (value instanceof ArrayValue array) {
            ArrayNode node = NODES.arrayNode(array.size());
            for (StructuredValue element : array) {
                node.add(toJsonNode(element));
            }
            return node;
        }
        if (value instanceof StringValue string) return NODES.textNode(string.value());
        if (value instanceof BooleanValue bool) return NODES.booleanNode(bool.value());
        if (value instanceof NumberValue number) {
            Number n = number.value();
            if (n instanceof Integer i) return NODES.numberNode(i);
            if (n instanceof Long l) return NODES.numberNode(l);
            if (n instanceof Double d) return NODES.numberNode(d);
            return NODES.numberNode((BigDecimal) n);
        }
        return NODES.nullNode();
    }

    public static @NotNull String toJson(@NotNull StructuredValue value) {
        try {
            return MAPPER.writeValueAsString(toJsonNode(value));
        } catch (JsonProcessingException e) {
            throw new JsonProcessException(e.getMessage(), e, JacksonJsonLocation.from(e.getLocation()));
        }
    }

    public static @NotNull StructuredValue parse(@NotNull String json) {
        try {
            return fromJsonNode(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new JsonProcessException(e.getMessage(), e, JacksonJsonLocation.from(e.getLocation()));
        }
    }
}
