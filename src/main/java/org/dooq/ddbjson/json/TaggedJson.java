package org.dooq.ddbjson.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dooq.ddbjson.ConversionException;
import org.dooq.ddbjson.ErrorKind;
import org.dooq.ddbjson.model.DecimalLiteral;
import org.dooq.ddbjson.model.Document;
import org.dooq.ddbjson.model.Tag;
import org.dooq.ddbjson.model.TaggedValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads and writes DynamoDB JSON. Reading validates every tag object and its payload shape;
 * failures carry the JSON path of the offending attribute, relative to the item.
 *
 * @author alex
 */
public final class TaggedJson {

    private TaggedJson() {
    }

    public static @NotNull Document readDocument(@NotNull JsonNode node, @NotNull EnvelopePolicy policy) {

        if (!node.isObject()) {
            throw new ConversionException(ErrorKind.MALFORMED_TAG_OBJECT, "$",
                    "DynamoDB item must be a JSON object, got " + describe(node));
        }

        boolean wrapped = policy == EnvelopePolicy.UNWRAP && ItemEnvelope.isWrapped(node);

        try {
            return new Document(readEntries(wrapped ? node.get(Document.ITEM_KEY) : node), wrapped);
        } catch (ConversionException ex) {
            throw ex.rooted();
        }
    }

    public static @NotNull TaggedValue readValue(@NotNull JsonNode node) {
        try {
            return readNode(node);
        } catch (ConversionException ex) {
            throw ex.rooted();
        }
    }

    private static Map<String, TaggedValue> readEntries(JsonNode object) {
        Map<String, TaggedValue> entries = new LinkedHashMap<>(object.size());

        for (Iterator<Map.Entry<String, JsonNode>> it = object.fields(); it.hasNext(); ) {
            var entry = it.next();
            try {
                entries.put(entry.getKey(), readNode(entry.getValue()));
            } catch (ConversionException ex) {
                throw ex.within("." + entry.getKey());
            }
        }

        return entries;
    }

    private static TaggedValue readNode(@Nullable JsonNode node) {

        if (node == null || !node.isObject()) {
            throw new ConversionException(ErrorKind.MALFORMED_TAG_OBJECT, null,
                    "Expected DynamoDB type object, got " + describe(node));
        }

        if (node.size() != 1) {
            throw new ConversionException(ErrorKind.MALFORMED_TAG_OBJECT, null,
                    "DynamoDB type object must have exactly one key, got %d".formatted(node.size()));
        }

        var entry = node.fields().next();
        var key = entry.getKey();
        var payload = entry.getValue();

        Tag tag = Tag.fromKey(key)
                .orElseThrow(() -> new ConversionException(ErrorKind.UNKNOWN_TAG, null,
                        "Unknown DynamoDB type descriptor '%s'".formatted(key)));

        return switch (tag) {
            case S -> new TaggedValue.S(text(payload, tag));
            case N -> new TaggedValue.N(literal(payload, tag));
            case BOOL -> {
                if (!payload.isBoolean()) {
                    throw mismatch(tag, "a boolean", payload);
                }
                yield new TaggedValue.Bool(payload.booleanValue());
            }
            case NULL -> TaggedValue.Null.INSTANCE;
            case M -> {
                if (!payload.isObject()) {
                    throw mismatch(tag, "an object", payload);
                }
                yield new TaggedValue.M(readEntries(payload));
            }
            case L -> new TaggedValue.L(elements(payload, tag, TaggedJson::readNode));
            case SS -> new TaggedValue.SS(elements(payload, tag, e -> text(e, tag)));
            case NS -> new TaggedValue.NS(elements(payload, tag, e -> literal(e, tag)));
            case BS -> new TaggedValue.BS(elements(payload, tag, e -> text(e, tag)));
            case B -> new TaggedValue.B(text(payload, tag));
        };
    }

    private static String text(JsonNode payload, Tag tag) {
        if (!payload.isTextual()) {
            throw mismatch(tag, "a string", payload);
        }

        return payload.textValue();
    }

    private static DecimalLiteral literal(JsonNode payload, Tag tag) {
        return new DecimalLiteral(text(payload, tag));
    }

    private static <T> List<T> elements(JsonNode payload, Tag tag, Function<JsonNode, T> reader) {
        if (!payload.isArray()) {
            throw mismatch(tag, "an array", payload);
        }

        List<T> result = new ArrayList<>(payload.size());

        for (int i = 0; i < payload.size(); i++) {
            try {
                result.add(reader.apply(payload.get(i)));
            } catch (ConversionException ex) {
                throw ex.within("[" + i + "]");
            }
        }

        return result;
    }

    private static ConversionException mismatch(Tag tag, String expected, JsonNode payload) {
        return new ConversionException(ErrorKind.TYPE_MISMATCH, null,
                "%s type expects %s value, got %s".formatted(tag.key(), expected, describe(payload)));
    }

    private static String describe(@Nullable JsonNode node) {
        return node == null ? "nothing" : node.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    public static @NotNull ObjectNode writeDocument(@NotNull Document document) {
        ObjectNode item = writeEntries(document.item());

        return document.wrapped() ? ItemEnvelope.wrap(item) : item;
    }

    public static @NotNull ObjectNode write(@NotNull TaggedValue value) {
        var nodes = JsonSupport.nodes();
        ObjectNode node = nodes.objectNode();
        String key = value.tag().key();

        switch (value.tag()) {
            case S -> node.put(key, ((TaggedValue.S) value).value());
            case N -> node.put(key, ((TaggedValue.N) value).value().text());
            case BOOL -> node.put(key, ((TaggedValue.Bool) value).value());
            case NULL -> node.put(key, true);
            case M -> node.set(key, writeEntries(((TaggedValue.M) value).entries()));
            case L -> {
                ArrayNode array = node.putArray(key);
                ((TaggedValue.L) value).elements().forEach(e -> array.add(write(e)));
            }
            case SS -> {
                ArrayNode array = node.putArray(key);
                ((TaggedValue.SS) value).values().forEach(array::add);
            }
            case NS -> {
                ArrayNode array = node.putArray(key);
                ((TaggedValue.NS) value).values().forEach(l -> array.add(l.text()));
            }
            case BS -> {
                ArrayNode array = node.putArray(key);
                ((TaggedValue.BS) value).values().forEach(array::add);
            }
            case B -> node.put(key, ((TaggedValue.B) value).base64());
        }

        return node;
    }

    private static ObjectNode writeEntries(Map<String, TaggedValue> entries) {
        ObjectNode object = JsonSupport.nodes().objectNode();
        entries.forEach((k, v) -> object.set(k, write(v)));
        return object;
    }
}
