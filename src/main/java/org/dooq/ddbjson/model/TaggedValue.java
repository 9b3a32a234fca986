package org.dooq.ddbjson.model;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A DynamoDB typed value, one record per {@link Tag}.
 * <p>
 * Binary payloads ({@link B}, {@link BS}) stay base64 text; nothing here decodes them.
 */
public sealed interface TaggedValue {

    @NotNull Tag tag();

    record S(@NotNull String value) implements TaggedValue {

        public S {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public @NotNull Tag tag() {
            return Tag.S;
        }
    }

    record N(@NotNull DecimalLiteral value) implements TaggedValue {

        public N {
            Objects.requireNonNull(value, "value");
        }

        public static @NotNull N of(@NotNull String literal) {
            return new N(new DecimalLiteral(literal));
        }

        @Override
        public @NotNull Tag tag() {
            return Tag.N;
        }
    }

    record Bool(boolean value) implements TaggedValue {

        @Override
        public @NotNull Tag tag() {
            return Tag.BOOL;
        }
    }

    /**
     * Always written as {@code {"NULL": true}}.
     */
    record Null() implements TaggedValue {

        public static final Null INSTANCE = new Null();

        @Override
        public @NotNull Tag tag() {
            return Tag.NULL;
        }
    }

    record M(@NotNull Map<String, TaggedValue> entries) implements TaggedValue {

        public M {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public @NotNull Tag tag() {
            return Tag.M;
        }
    }

    record L(@NotNull List<TaggedValue> elements) implements TaggedValue {

        public L {
            elements = List.copyOf(elements);
        }

        public static @NotNull L of(TaggedValue... elements) {
            return new L(List.of(elements));
        }

        @Override
        public @NotNull Tag tag() {
            return Tag.L;
        }
    }

    record SS(@NotNull List<String> values) implements TaggedValue {

        public SS {
            values = List.copyOf(values);
        }

        @Override
        public @NotNull Tag tag() {
            return Tag.SS;
        }
    }

    record NS(@NotNull List<DecimalLiteral> values) implements TaggedValue {

        public NS {
            values = List.copyOf(values);
        }

        @Override
        public @NotNull Tag tag() {
            return Tag.NS;
        }
    }

    record BS(@NotNull List<String> values) implements TaggedValue {

        public BS {
            values = List.copyOf(values);
        }

        @Override
        public @NotNull Tag tag() {
            return Tag.BS;
        }
    }

    record B(@NotNull String base64) implements TaggedValue {

        public B {
            Objects.requireNonNull(base64, "base64");
        }

        @Override
        public @NotNull Tag tag() {
            return Tag.B;
        }
    }
}
