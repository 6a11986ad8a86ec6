package com.flagship.transaction_engine.mutation;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point codec for monetary amounts.
 *
 * Amounts are held as a count of 1/10,000 currency units. Text is only
 * converted at the edges of the engine (CSV in, CSV out, log messages).
 */
public final class Amounts {

    public static final int SCALE = 4;

    private Amounts() {
        // Utility class
    }

    /**
     * Parses decimal text into units, truncating anything past the fourth decimal place.
     *
     * @throws NumberFormatException if the text is not a non-negative decimal
     * @throws ArithmeticException if the value does not fit in a long
     */
    public static long parse(String text) {
        BigDecimal value = new BigDecimal(text.trim());
        if (value.signum() < 0) {
            throw new NumberFormatException("Amount must not be negative: " + text);
        }
        return value.movePointRight(SCALE)
            .setScale(0, RoundingMode.DOWN)
            .longValueExact();
    }

    /**
     * Renders units with exactly four decimal places, e.g. 50000 -> "5.0000".
     */
    public static String format(long units) {
        return BigDecimal.valueOf(units, SCALE).toPlainString();
    }
}
