package org.dooq.ddbjson.converters;

import org.dooq.ddbjson.model.DecimalLiteral;
import org.dooq.ddbjson.model.NormalValue;
import org.dooq.ddbjson.model.TaggedValue;
import org.jetbrains.annotations.NotNull;

public class NumberConverter extends StringConverter {

    protected NormalValue parseNumber(@NotNull TaggedValue.N value) {
        return parseLiteral(value.value());
    }

    protected NormalValue parseLiteral(@NotNull DecimalLiteral literal) {
        return literal.toNormal();
    }

    protected TaggedValue writeInt(@NotNull NormalValue.Int value) {
        return new TaggedValue.N(DecimalLiteral.of(value.value()));
    }

    protected TaggedValue writeFloat(@NotNull NormalValue.Float value) {
        return new TaggedValue.N(DecimalLiteral.of(value.value()));
    }
}
