package org.dooq.tests;

import org.dooq.ddbjson.ConversionException;
import org.dooq.ddbjson.ErrorKind;
import org.dooq.ddbjson.model.DecimalLiteral;
import org.dooq.ddbjson.model.NormalValue;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

public class DecimalLiteralTests {

    @Test
    void validLiterals() {
        for (var text : List.of("0", "-0", "+5", "007", "3.14", "1.", ".5", "-2.5e-3", "6E+10", "1e0")) {
            Assertions.assertTrue(DecimalLiteral.isValid(text), text);
        }
    }

    @Test
    void invalidLiterals() {
        for (var text : List.of("", " 1", "1 ", "abc", "1_000", "0x1F", "NaN", "Infinity", "1e", "e5", ".", "1.2.3", "--1", "1f")) {
            var ex = Assertions.assertThrows(ConversionException.class, () -> new DecimalLiteral(text), text);
            Assertions.assertEquals(ErrorKind.INVALID_NUMBER_LITERAL, ex.getKind());
        }
    }

    @Test
    void integralHeuristic() {
        Assertions.assertTrue(new DecimalLiteral("42").isIntegral());
        Assertions.assertFalse(new DecimalLiteral("42.0").isIntegral());
        Assertions.assertFalse(new DecimalLiteral("42e0").isIntegral());
        Assertions.assertFalse(new DecimalLiteral("42E0").isIntegral());
    }

    @Test
    void toNormal() {
        Assertions.assertEquals(NormalValue.Int.of(4), new DecimalLiteral("4").toNormal());
        Assertions.assertEquals(new NormalValue.Float(4.0), new DecimalLiteral("4.0").toNormal());
        Assertions.assertEquals(new NormalValue.Float(400.0), new DecimalLiteral("4e2").toNormal());
        Assertions.assertEquals(NormalValue.Int.of(5), new DecimalLiteral("+5").toNormal());
        Assertions.assertEquals(new NormalValue.Int(new BigInteger("123456789012345678901234567890")),
                new DecimalLiteral("123456789012345678901234567890").toNormal());
    }

    @Test
    void outOfRangeFloat() {
        var ex = Assertions.assertThrows(ConversionException.class, () -> new DecimalLiteral("1e400").toNormal());

        Assertions.assertEquals(ErrorKind.INVALID_NUMBER_LITERAL, ex.getKind());
    }

    @Test
    void fromNumbers() {
        Assertions.assertEquals("3.0", DecimalLiteral.of(3.0).text());
        Assertions.assertEquals("-0.5", DecimalLiteral.of(-0.5).text());
        Assertions.assertEquals("0.0000001", DecimalLiteral.of(1e-7).text());
        Assertions.assertEquals("12345678.5", DecimalLiteral.of(12345678.5).text());
        Assertions.assertEquals("0.0005", DecimalLiteral.of(0.0005).text());
        Assertions.assertEquals("100000000000000000000.0", DecimalLiteral.of(1e20).text());
        Assertions.assertEquals("0.0", DecimalLiteral.of(0.0).text());
        Assertions.assertEquals("12", DecimalLiteral.of(BigInteger.valueOf(12)).text());

        Assertions.assertFalse(DecimalLiteral.of(3.0).isIntegral());
        Assertions.assertEquals(new BigDecimal("2.50"), new DecimalLiteral("2.50").toBigDecimal());
    }

    @Test
    void nonFiniteHasNoLiteral() {
        Assertions.assertThrows(ConversionException.class, () -> DecimalLiteral.of(Double.NaN));
        Assertions.assertThrows(ConversionException.class, () -> DecimalLiteral.of(Double.POSITIVE_INFINITY));
    }
}
