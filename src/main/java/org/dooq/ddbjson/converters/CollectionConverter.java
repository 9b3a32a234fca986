package org.dooq.ddbjson.converters;

import org.dooq.ddbjson.ConversionException;
import org.dooq.ddbjson.model.DecimalLiteral;
import org.dooq.ddbjson.model.NormalValue;
import org.dooq.ddbjson.model.TaggedValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Containers and sets. Sets always come back as plain sequences and are never written,
 * every sequence is written as {@code L}.
 */
public abstract class CollectionConverter extends NumberConverter {

    protected abstract TaggedValue lookUp(@Nullable NormalValue value);

    protected abstract NormalValue parseValue(@Nullable TaggedValue value);

    protected NormalValue parseMap(@NotNull TaggedValue.M value) {
        return parseEntries(value.entries());
    }

    protected NormalValue.Mapping parseEntries(@NotNull Map<String, TaggedValue> entries) {
        Map<String, NormalValue> resultMap = new LinkedHashMap<>(entries.size());

        for (Map.Entry<String, TaggedValue> entry : entries.entrySet()) {
            try {
                resultMap.put(entry.getKey(), parseValue(entry.getValue()));
            } catch (ConversionException ex) {
                throw ex.within(field(entry.getKey()));
            }
        }

        return new NormalValue.Mapping(resultMap);
    }

    protected NormalValue parseList(@NotNull TaggedValue.L value) {
        var elements = value.elements();
        List<NormalValue> result = new ArrayList<>(elements.size());

        for (int i = 0; i < elements.size(); i++) {
            try {
                result.add(parseValue(elements.get(i)));
            } catch (ConversionException ex) {
                throw ex.within(index(i));
            }
        }

        return new NormalValue.Sequence(result);
    }

    protected NormalValue parseStringSet(@NotNull TaggedValue.SS value) {
        return new NormalValue.Sequence(value.values()
                .stream()
                .map(s -> parseString(new TaggedValue.S(s)))
                .toList());
    }

    protected NormalValue parseNumberSet(@NotNull TaggedValue.NS value) {
        var literals = value.values();
        List<NormalValue> result = new ArrayList<>(literals.size());

        for (int i = 0; i < literals.size(); i++) {
            DecimalLiteral literal = literals.get(i);
            try {
                result.add(parseLiteral(literal));
            } catch (ConversionException ex) {
                throw ex.within(index(i));
            }
        }

        return new NormalValue.Sequence(result);
    }

    protected NormalValue parseBinarySet(@NotNull TaggedValue.BS value) {
        return new NormalValue.Sequence(value.values()
                .stream()
                .map(s -> parseBinary(new TaggedValue.B(s)))
                .toList());
    }

    protected TaggedValue writeList(@NotNull NormalValue.Sequence value) {
        var elements = value.elements();
        List<TaggedValue> result = new ArrayList<>(elements.size());

        for (int i = 0; i < elements.size(); i++) {
            try {
                result.add(lookUp(elements.get(i)));
            } catch (ConversionException ex) {
                throw ex.within(index(i));
            }
        }

        return new TaggedValue.L(result);
    }

    protected TaggedValue writeMap(@NotNull NormalValue.Mapping value) {
        return new TaggedValue.M(writeEntries(value));
    }

    protected Map<String, TaggedValue> writeEntries(@NotNull NormalValue.Mapping value) {
        Map<String, TaggedValue> resultMap = new LinkedHashMap<>(value.entries().size());

        for (Map.Entry<String, NormalValue> entry : value.entries().entrySet()) {
            try {
                resultMap.put(entry.getKey(), lookUp(entry.getValue()));
            } catch (ConversionException ex) {
                throw ex.within(field(entry.getKey()));
            }
        }

        return resultMap;
    }
}
