package org.dooq.tests;

import org.dooq.ddbjson.DynamoJsonConverter;
import org.dooq.ddbjson.model.NormalValue;
import org.dooq.ddbjson.model.TaggedValue;
import org.jetbrains.annotations.NotNull;

public class CustomStringConverter extends DynamoJsonConverter {

    @Override
    protected TaggedValue writeString(@NotNull NormalValue.Text value) {
        return new TaggedValue.S("custom");
    }

    @Override
    protected NormalValue parseBinary(@NotNull TaggedValue.B value) {
        return new NormalValue.Text("binary:" + value.base64());
    }
}
