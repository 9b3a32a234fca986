package org.dooq.ddbjson.converters;

import org.jetbrains.annotations.NotNull;

public class ConverterHelper {

    protected @NotNull String field(@NotNull String key) {
        return "." + key;
    }

    protected @NotNull String index(int index) {
        return "[" + index + "]";
    }
}
