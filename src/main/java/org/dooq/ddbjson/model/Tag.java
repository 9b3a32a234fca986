package org.dooq.ddbjson.model;

import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * DynamoDB type descriptors, the only keys allowed in a tag object.
 */
public enum Tag {
    S("S"),
    N("N"),
    BOOL("BOOL"),
    NULL("NULL"),
    M("M"),
    L("L"),
    SS("SS"),
    NS("NS"),
    BS("BS"),
    B("B");

    private static final Map<String, Tag> BY_KEY = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(Tag::key, Function.identity()));

    private final String key;

    Tag(String key) {
        this.key = key;
    }

    public @NotNull String key() {
        return key;
    }

    /**
     * Keys are case-sensitive, {@code "s"} is not a tag.
     */
    public static @NotNull Optional<Tag> fromKey(@NotNull String key) {
        return Optional.ofNullable(BY_KEY.get(key));
    }
}
