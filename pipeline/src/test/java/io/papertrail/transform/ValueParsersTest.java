package io.papertrail.transform;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ValueParsersTest {

    @Test
    void integers_are_strict() {
        assertEquals(42L, ValueParsers.parseInteger("42"));
        assertEquals(-7L, ValueParsers.parseInteger(" -7 "));
        assertEquals(3L, ValueParsers.parseInteger("+3"));
        assertThrows(NumberFormatException.class, () -> ValueParsers.parseInteger("10.0"));
        assertThrows(NumberFormatException.class, () -> ValueParsers.parseInteger("0x1F"));
        assertThrows(NumberFormatException.class, () -> ValueParsers.parseInteger(""));
    }

    @Test
    void floats_accept_decimal_and_exponent_forms() {
        assertEquals(10.0, ValueParsers.parseFloat("10"));
        assertEquals(0.5, ValueParsers.parseFloat(".5"));
        assertEquals(1500.0, ValueParsers.parseFloat("1.5e3"));
        assertTrue(Double.isNaN(ValueParsers.parseFloat("NaN")));
        assertEquals(Double.NEGATIVE_INFINITY, ValueParsers.parseFloat("-inf"));
    }

    @Test
    void floats_reject_java_literal_forms() {
        assertThrows(NumberFormatException.class, () -> ValueParsers.parseFloat("1.0d"));
        assertThrows(NumberFormatException.class, () -> ValueParsers.parseFloat("0x1p3"));
        assertThrows(NumberFormatException.class, () -> ValueParsers.parseFloat("abc"));
        assertThrows(NumberFormatException.class, () -> ValueParsers.parseFloat("1,000"));
    }
}
