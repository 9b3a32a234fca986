package org.dooq.ddbjson.converters;

import org.dooq.ddbjson.model.NormalValue;
import org.dooq.ddbjson.model.TaggedValue;
import org.jetbrains.annotations.NotNull;

public class BooleanConverter extends ConverterHelper {

    protected NormalValue parseBool(@NotNull TaggedValue.Bool value) {
        return NormalValue.Bool.of(value.value());
    }

    protected TaggedValue writeBool(@NotNull NormalValue.Bool value) {
        return new TaggedValue.Bool(value.value());
    }

    /**
     * The payload of a NULL tag is not looked at.
     */
    protected NormalValue parseNull(@NotNull TaggedValue.Null value) {
        return NormalValue.Null.INSTANCE;
    }

    protected TaggedValue writeNull(@NotNull NormalValue.Null value) {
        return TaggedValue.Null.INSTANCE;
    }
}
