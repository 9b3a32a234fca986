package org.dooq.ddbjson.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dooq.ddbjson.ConversionException;
import org.dooq.ddbjson.ErrorKind;
import org.dooq.ddbjson.model.DecimalLiteral;
import org.dooq.ddbjson.model.NormalValue;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Jackson trees to plain values and back. Floats are written as decimal nodes carrying the same text
 * an {@code N} payload would, so they print without exponents.
 */
public final class NormalJson {

    private NormalJson() {
    }

    public static @NotNull NormalValue read(@NotNull JsonNode node) {
        try {
            return readNode(node);
        } catch (ConversionException ex) {
            throw ex.rooted();
        }
    }

    private static NormalValue readNode(JsonNode node) {
        switch (node.getNodeType()) {
            case NULL:
                return NormalValue.Null.INSTANCE;
            case BOOLEAN:
                return NormalValue.Bool.of(node.booleanValue());
            case NUMBER:
                return readNumber(node);
            case STRING:
                return new NormalValue.Text(node.textValue());
            case ARRAY:
                return readArray(node);
            case OBJECT:
                return readObject(node);
            default:
                throw new ConversionException(ErrorKind.UNSUPPORTED_NORMAL_VALUE_KIND, null,
                        "Unsupported JSON node: " + node.getNodeType());
        }
    }

    private static NormalValue readNumber(JsonNode node) {
        if (node.isIntegralNumber()) {
            return new NormalValue.Int(node.bigIntegerValue());
        }

        double value = node.doubleValue();

        if (!Double.isFinite(value)) {
            throw new ConversionException(ErrorKind.UNSUPPORTED_NORMAL_VALUE_KIND, null,
                    "Non-finite number: " + node.asText());
        }

        return new NormalValue.Float(value);
    }

    private static NormalValue readArray(JsonNode node) {
        List<NormalValue> elements = new ArrayList<>(node.size());

        for (int i = 0; i < node.size(); i++) {
            try {
                elements.add(readNode(node.get(i)));
            } catch (ConversionException ex) {
                throw ex.within("[" + i + "]");
            }
        }

        return new NormalValue.Sequence(elements);
    }

    private static NormalValue readObject(JsonNode node) {
        Map<String, NormalValue> entries = new LinkedHashMap<>(node.size());

        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            var entry = it.next();
            try {
                entries.put(entry.getKey(), readNode(entry.getValue()));
            } catch (ConversionException ex) {
                throw ex.within("." + entry.getKey());
            }
        }

        return new NormalValue.Mapping(entries);
    }

    public static @NotNull JsonNode write(@NotNull NormalValue value) {
        var nodes = JsonSupport.nodes();

        return switch (value.kind()) {
            case NULL -> nodes.nullNode();
            case BOOL -> nodes.booleanNode(((NormalValue.Bool) value).value());
            case INT -> nodes.numberNode(((NormalValue.Int) value).value());
            case FLOAT -> DecimalNode.valueOf(DecimalLiteral.of(((NormalValue.Float) value).value()).toBigDecimal());
            case TEXT -> nodes.textNode(((NormalValue.Text) value).value());
            case SEQUENCE -> {
                ArrayNode array = nodes.arrayNode();
                ((NormalValue.Sequence) value).elements().forEach(e -> array.add(write(e)));
                yield array;
            }
            case MAPPING -> {
                ObjectNode object = nodes.objectNode();
                ((NormalValue.Mapping) value).entries().forEach((k, v) -> object.set(k, write(v)));
                yield object;
            }
        };
    }
}
