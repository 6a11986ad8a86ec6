package com.flagship.transaction_engine.mutation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AmountsTest {

    @Test
    @DisplayName("Decimal text is scaled to 1/10,000 units")
    void testParse() {
        assertEquals(50_000, Amounts.parse("5"));
        assertEquals(50_000, Amounts.parse("5.0"));
        assertEquals(15_000, Amounts.parse("1.5"));
        assertEquals(1, Amounts.parse("0.0001"));
        assertEquals(27_182, Amounts.parse(" 2.7182 "));
        assertEquals(0, Amounts.parse("0"));
    }

    @Test
    @DisplayName("Digits past the fourth decimal place are truncated")
    void testParseTruncates() {
        assertEquals(12_345, Amounts.parse("1.23459"));
        assertEquals(0, Amounts.parse("0.00009"));
    }

    @Test
    @DisplayName("Negative or non-numeric text is rejected")
    void testParseRejects() {
        assertThrows(NumberFormatException.class, () -> Amounts.parse("-1.0"));
        assertThrows(NumberFormatException.class, () -> Amounts.parse("abc"));
        assertThrows(ArithmeticException.class, () -> Amounts.parse("99999999999999999999999"));
    }

    @Test
    @DisplayName("Units are rendered with exactly four decimals")
    void testFormat() {
        assertEquals("5.0000", Amounts.format(50_000));
        assertEquals("0.0000", Amounts.format(0));
        assertEquals("0.0001", Amounts.format(1));
        assertEquals("1234.5678", Amounts.format(12_345_678));
    }
}
