package org.dooq.ddbjson.sdk;

import org.dooq.ddbjson.ConversionException;
import org.dooq.ddbjson.ErrorKind;
import org.dooq.ddbjson.model.DecimalLiteral;
import org.dooq.ddbjson.model.Document;
import org.dooq.ddbjson.model.TaggedValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bridges typed values to the AWS SDK v2 {@link AttributeValue} model.
 * <p>
 * The SDK holds binary as raw bytes, so this is the one place base64 is decoded and encoded.
 */
public final class AttributeValues {

    private AttributeValues() {
    }

    public static @NotNull Map<String, AttributeValue> toItem(@NotNull Document document) {
        Map<String, AttributeValue> item = new LinkedHashMap<>(document.item().size());

        for (Map.Entry<String, TaggedValue> entry : document.item().entrySet()) {
            try {
                item.put(entry.getKey(), toAttributeValue(entry.getValue()));
            } catch (ConversionException ex) {
                throw ex.within("." + entry.getKey());
            }
        }

        return item;
    }

    public static @NotNull Document fromItem(@NotNull Map<String, AttributeValue> item) {
        try {
            return Document.of(fromEntries(item));
        } catch (ConversionException ex) {
            throw ex.rooted();
        }
    }

    public static @NotNull AttributeValue toAttributeValue(@NotNull TaggedValue value) {
        return switch (value.tag()) {
            case S -> AttributeValue.fromS(((TaggedValue.S) value).value());
            case N -> AttributeValue.fromN(((TaggedValue.N) value).value().text());
            case BOOL -> AttributeValue.fromBool(((TaggedValue.Bool) value).value());
            case NULL -> AttributeValue.fromNul(true);
            case M -> {
                Map<String, AttributeValue> map = new LinkedHashMap<>();
                for (Map.Entry<String, TaggedValue> entry : ((TaggedValue.M) value).entries().entrySet()) {
                    try {
                        map.put(entry.getKey(), toAttributeValue(entry.getValue()));
                    } catch (ConversionException ex) {
                        throw ex.within("." + entry.getKey());
                    }
                }
                yield AttributeValue.fromM(map);
            }
            case L -> {
                var elements = ((TaggedValue.L) value).elements();
                List<AttributeValue> list = new ArrayList<>(elements.size());
                for (int i = 0; i < elements.size(); i++) {
                    try {
                        list.add(toAttributeValue(elements.get(i)));
                    } catch (ConversionException ex) {
                        throw ex.within("[" + i + "]");
                    }
                }
                yield AttributeValue.fromL(list);
            }
            case SS -> AttributeValue.fromSs(((TaggedValue.SS) value).values());
            case NS -> AttributeValue.fromNs(((TaggedValue.NS) value).values()
                    .stream()
                    .map(DecimalLiteral::text)
                    .toList());
            case BS -> AttributeValue.fromBs(((TaggedValue.BS) value).values()
                    .stream()
                    .map(AttributeValues::decode)
                    .toList());
            case B -> AttributeValue.fromB(decode(((TaggedValue.B) value).base64()));
        };
    }

    public static @NotNull TaggedValue fromAttributeValue(@Nullable AttributeValue value) {

        if (value == null || value.type() == null) {
            throw new ConversionException(ErrorKind.MALFORMED_TAG_OBJECT, null, "AttributeValue without a type");
        }

        return switch (value.type()) {
            case S -> new TaggedValue.S(value.s());
            case N -> new TaggedValue.N(new DecimalLiteral(value.n()));
            case BOOL -> new TaggedValue.Bool(value.bool());
            case NUL -> TaggedValue.Null.INSTANCE;
            case M -> new TaggedValue.M(fromEntries(value.m()));
            case L -> {
                var elements = value.l();
                List<TaggedValue> list = new ArrayList<>(elements.size());
                for (int i = 0; i < elements.size(); i++) {
                    try {
                        list.add(fromAttributeValue(elements.get(i)));
                    } catch (ConversionException ex) {
                        throw ex.within("[" + i + "]");
                    }
                }
                yield new TaggedValue.L(list);
            }
            case SS -> new TaggedValue.SS(value.ss());
            case NS -> new TaggedValue.NS(value.ns()
                    .stream()
                    .map(DecimalLiteral::new)
                    .toList());
            case BS -> new TaggedValue.BS(value.bs()
                    .stream()
                    .map(AttributeValues::encode)
                    .toList());
            case B -> new TaggedValue.B(encode(value.b()));
            default -> throw new ConversionException(ErrorKind.UNKNOWN_TAG, null,
                    "Unknown DynamoDB type descriptor '%s'".formatted(value.type()));
        };
    }

    private static Map<String, TaggedValue> fromEntries(Map<String, AttributeValue> attributes) {
        Map<String, TaggedValue> entries = new LinkedHashMap<>(attributes.size());

        for (Map.Entry<String, AttributeValue> entry : attributes.entrySet()) {
            try {
                entries.put(entry.getKey(), fromAttributeValue(entry.getValue()));
            } catch (ConversionException ex) {
                throw ex.within("." + entry.getKey());
            }
        }

        return entries;
    }

    private static SdkBytes decode(String base64) {
        try {
            return SdkBytes.fromByteArray(Base64.getDecoder().decode(base64));
        } catch (IllegalArgumentException ex) {
            throw new ConversionException(ErrorKind.TYPE_MISMATCH, null, "Binary value is not valid base64", ex);
        }
    }

    private static String encode(SdkBytes bytes) {
        return Base64.getEncoder().encodeToString(bytes.asByteArray());
    }
}
