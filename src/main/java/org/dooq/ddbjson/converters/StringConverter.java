package org.dooq.ddbjson.converters;

import org.dooq.ddbjson.model.NormalValue;
import org.dooq.ddbjson.model.TaggedValue;
import org.jetbrains.annotations.NotNull;

public class StringConverter extends BooleanConverter {

    protected NormalValue parseString(@NotNull TaggedValue.S value) {
        return new NormalValue.Text(value.value());
    }

    protected TaggedValue writeString(@NotNull NormalValue.Text value) {
        return new TaggedValue.S(value.value());
    }

    /**
     * Binary comes out as its base64 text, undecoded.
     */
    protected NormalValue parseBinary(@NotNull TaggedValue.B value) {
        return new NormalValue.Text(value.base64());
    }
}
