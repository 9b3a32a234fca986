package org.dooq.ddbjson.model;

import org.dooq.ddbjson.ConversionException;
import org.dooq.ddbjson.ErrorKind;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Number payload of an {@code N} or {@code NS} tag, kept as text so no precision is lost on the way through.
 * <p>
 * A literal containing {@code .} or an exponent marker reads back as a {@link NormalValue.Float},
 * anything else as a {@link NormalValue.Int}. This means {@code "1e0"} comes back as {@code 1.0}, not {@code 1}.
 *
 * @param text the literal exactly as it appears on the wire
 */
public record DecimalLiteral(@NotNull String text) {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    public DecimalLiteral {
        if (!isValid(text)) {
            throw new ConversionException(ErrorKind.INVALID_NUMBER_LITERAL, null,
                    "Invalid number format: '%s'".formatted(text));
        }
    }

    @Contract(pure = true)
    public static boolean isValid(@NotNull String text) {
        return DECIMAL.matcher(text).matches();
    }

    @Contract("_ -> new")
    public static @NotNull DecimalLiteral of(@NotNull BigInteger value) {
        return new DecimalLiteral(value.toString());
    }

    /**
     * Shortest decimal text of the double, never in exponent form, e.g. {@code 12345678.5} or {@code 0.0005}.
     * A fraction is always present so the literal keeps reading back as a float.
     */
    @Contract("_ -> new")
    public static @NotNull DecimalLiteral of(double value) {
        if (!Double.isFinite(value)) {
            throw new ConversionException(ErrorKind.UNSUPPORTED_NORMAL_VALUE_KIND, null,
                    "Non-finite number has no decimal literal: " + value);
        }

        String plain = new BigDecimal(Double.toString(value)).stripTrailingZeros().toPlainString();

        return new DecimalLiteral(plain.indexOf('.') < 0 ? plain + ".0" : plain);
    }

    public boolean isIntegral() {
        return text.indexOf('.') < 0 && text.toLowerCase(Locale.ROOT).indexOf('e') < 0;
    }

    public @NotNull NormalValue toNormal() {
        if (isIntegral()) {
            return new NormalValue.Int(new BigInteger(text));
        }

        double value = Double.parseDouble(text);

        if (Double.isInfinite(value)) {
            throw new ConversionException(ErrorKind.INVALID_NUMBER_LITERAL, null,
                    "Number out of range: '%s'".formatted(text));
        }

        return new NormalValue.Float(value);
    }

    public @NotNull BigDecimal toBigDecimal() {
        return new BigDecimal(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
