package org.dooq.ddbjson;

import org.dooq.ddbjson.converters.CollectionConverter;
import org.dooq.ddbjson.model.Document;
import org.dooq.ddbjson.model.NormalValue;
import org.dooq.ddbjson.model.TaggedValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Marshalls plain values into DynamoDB typed values and back.
 * <p>
 * Stateless and safe to share between threads. Subclasses may override any of the protected
 * {@code parseX}/{@code writeX} methods, the dispatch below always goes through them.
 *
 * @author alex
 */
public class DynamoJsonConverter extends CollectionConverter implements ItemConverter {

    @Override
    public @NotNull NormalValue.Mapping unmarshallItem(@NotNull Document document) {
        try {
            return parseEntries(document.item());
        } catch (ConversionException ex) {
            throw ex.rooted();
        }
    }

    @Override
    public @NotNull NormalValue unmarshallValue(@NotNull TaggedValue value) {
        try {
            return parseValue(value);
        } catch (ConversionException ex) {
            throw ex.rooted();
        }
    }

    @Override
    public @NotNull Document marshallItem(@NotNull NormalValue.Mapping item, boolean wrapItem) {
        try {
            return new Document(writeEntries(item), wrapItem);
        } catch (ConversionException ex) {
            throw ex.rooted();
        }
    }

    @Override
    public @NotNull TaggedValue marshallValue(@NotNull NormalValue value) {
        try {
            return lookUp(value);
        } catch (ConversionException ex) {
            throw ex.rooted();
        }
    }

    @Override
    protected TaggedValue lookUp(@Nullable NormalValue value) {

        if (value == null) {
            throw new ConversionException(ErrorKind.UNSUPPORTED_NORMAL_VALUE_KIND, null, "Missing value");
        }

        return switch (value.kind()) {
            case NULL -> writeNull((NormalValue.Null) value);
            case BOOL -> writeBool((NormalValue.Bool) value);
            case INT -> writeInt((NormalValue.Int) value);
            case FLOAT -> writeFloat((NormalValue.Float) value);
            case TEXT -> writeString((NormalValue.Text) value);
            case SEQUENCE -> writeList((NormalValue.Sequence) value);
            case MAPPING -> writeMap((NormalValue.Mapping) value);
        };
    }

    @Override
    protected NormalValue parseValue(@Nullable TaggedValue value) {

        if (value == null) {
            throw new ConversionException(ErrorKind.MALFORMED_TAG_OBJECT, null, "Missing DynamoDB type object");
        }

        return switch (value.tag()) {
            case S -> parseString((TaggedValue.S) value);
            case N -> parseNumber((TaggedValue.N) value);
            case BOOL -> parseBool((TaggedValue.Bool) value);
            case NULL -> parseNull((TaggedValue.Null) value);
            case M -> parseMap((TaggedValue.M) value);
            case L -> parseList((TaggedValue.L) value);
            case SS -> parseStringSet((TaggedValue.SS) value);
            case NS -> parseNumberSet((TaggedValue.NS) value);
            case BS -> parseBinarySet((TaggedValue.BS) value);
            case B -> parseBinary((TaggedValue.B) value);
        };
    }
}
