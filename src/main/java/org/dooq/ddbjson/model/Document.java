package org.dooq.ddbjson.model;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A top level DynamoDB item, optionally travelling inside the {@code {"Item": ...}} envelope.
 *
 * @param item    attribute name to typed value
 * @param wrapped whether the item is written under the {@code Item} key
 */
public record Document(@NotNull Map<String, TaggedValue> item, boolean wrapped) {

    public static final String ITEM_KEY = "Item";

    public Document {
        item = Collections.unmodifiableMap(new LinkedHashMap<>(item));
    }

    @Contract("_ -> new")
    public static @NotNull Document of(@NotNull Map<String, TaggedValue> item) {
        return new Document(item, false);
    }

    public @NotNull Document wrap() {
        return wrapped ? this : new Document(item, true);
    }

    public @NotNull Document unwrap() {
        return wrapped ? new Document(item, false) : this;
    }
}
