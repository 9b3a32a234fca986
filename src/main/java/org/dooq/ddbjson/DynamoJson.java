package org.dooq.ddbjson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.dooq.ddbjson.json.EnvelopePolicy;
import org.dooq.ddbjson.json.Framing;
import org.dooq.ddbjson.json.JsonSupport;
import org.dooq.ddbjson.json.NormalJson;
import org.dooq.ddbjson.json.TaggedJson;
import org.dooq.ddbjson.model.NormalValue;
import org.dooq.ddbjson.sdk.AttributeValues;
import org.jetbrains.annotations.NotNull;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.Map;

/**
 * Entry points working on Jackson trees, JSON text and SDK item maps.
 * <p>
 * {@code fromTagged} expects an item at the root, optionally inside the {@code Item} envelope.
 * A single typed value at the root goes through {@link #fromTaggedValue(JsonNode)} instead.
 */
public final class DynamoJson {

    private static final ItemConverter DEFAULT = new DynamoJsonConverter();

    private DynamoJson() {
    }

    public static @NotNull ItemConverter getConverter() {
        return DEFAULT;
    }

    public static @NotNull JsonNode fromTagged(@NotNull JsonNode document) {
        return fromTagged(document, EnvelopePolicy.UNWRAP, DEFAULT);
    }

    public static @NotNull JsonNode fromTagged(@NotNull JsonNode document, @NotNull EnvelopePolicy policy,
                                               @NotNull ItemConverter converter) {
        return NormalJson.write(converter.unmarshallItem(TaggedJson.readDocument(document, policy)));
    }

    public static @NotNull JsonNode fromTaggedValue(@NotNull JsonNode value) {
        return NormalJson.write(DEFAULT.unmarshallValue(TaggedJson.readValue(value)));
    }

    public static @NotNull JsonNode toTagged(@NotNull JsonNode normal, boolean wrapItem) {
        return toTagged(normal, wrapItem, DEFAULT);
    }

    /**
     * An object becomes an item, anything else a single typed value and {@code wrapItem} does not apply.
     */
    public static @NotNull JsonNode toTagged(@NotNull JsonNode normal, boolean wrapItem, @NotNull ItemConverter converter) {
        NormalValue value = NormalJson.read(normal);

        if (value instanceof NormalValue.Mapping item) {
            return TaggedJson.writeDocument(converter.marshallItem(item, wrapItem));
        }

        return TaggedJson.write(converter.marshallValue(value));
    }

    public static @NotNull String fromTagged(@NotNull String json) throws JsonProcessingException {
        return JsonSupport.write(fromTagged(JsonSupport.parse(json)), false);
    }

    public static @NotNull String toTagged(@NotNull String json, boolean wrapItem) throws JsonProcessingException {
        return JsonSupport.write(toTagged(JsonSupport.parse(json), wrapItem), false);
    }

    public static boolean looksLikeSingleJsonValue(@NotNull String probe) {
        return Framing.looksLikeSingleJsonValue(probe);
    }

    public static @NotNull NormalValue.Mapping fromAttributeMap(@NotNull Map<String, AttributeValue> item) {
        return DEFAULT.unmarshallItem(AttributeValues.fromItem(item));
    }

    public static @NotNull Map<String, AttributeValue> toAttributeMap(@NotNull NormalValue.Mapping item) {
        return AttributeValues.toItem(DEFAULT.marshallItem(item, false));
    }
}
