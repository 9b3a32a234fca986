package org.dooq.ddbjson.model;

import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A plain JSON value.
 */
public sealed interface NormalValue {

    enum Kind {
        NULL, BOOL, INT, FLOAT, TEXT, SEQUENCE, MAPPING
    }

    @NotNull Kind kind();

    record Null() implements NormalValue {

        public static final Null INSTANCE = new Null();

        @Override
        public @NotNull Kind kind() {
            return Kind.NULL;
        }
    }

    record Bool(boolean value) implements NormalValue {

        public static final Bool TRUE = new Bool(true);
        public static final Bool FALSE = new Bool(false);

        public static @NotNull Bool of(boolean value) {
            return value ? TRUE : FALSE;
        }

        @Override
        public @NotNull Kind kind() {
            return Kind.BOOL;
        }
    }

    record Int(@NotNull BigInteger value) implements NormalValue {

        public Int {
            Objects.requireNonNull(value, "value");
        }

        public static @NotNull Int of(long value) {
            return new Int(BigInteger.valueOf(value));
        }

        @Override
        public @NotNull Kind kind() {
            return Kind.INT;
        }
    }

    /**
     * JSON has no NaN or infinity, neither does this.
     */
    record Float(double value) implements NormalValue {

        public Float {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Non-finite float: " + value);
            }
        }

        @Override
        public @NotNull Kind kind() {
            return Kind.FLOAT;
        }
    }

    record Text(@NotNull String value) implements NormalValue {

        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public @NotNull Kind kind() {
            return Kind.TEXT;
        }
    }

    record Sequence(@NotNull List<NormalValue> elements) implements NormalValue {

        public Sequence {
            elements = List.copyOf(elements);
        }

        public static @NotNull Sequence of(NormalValue... elements) {
            return new Sequence(List.of(elements));
        }

        @Override
        public @NotNull Kind kind() {
            return Kind.SEQUENCE;
        }
    }

    /**
     * Entries keep insertion order so output is stable.
     */
    record Mapping(@NotNull Map<String, NormalValue> entries) implements NormalValue {

        public Mapping {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public @NotNull Kind kind() {
            return Kind.MAPPING;
        }
    }
}
