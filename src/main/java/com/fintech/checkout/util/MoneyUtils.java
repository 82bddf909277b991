package com.fintech.checkout.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class MoneyUtils {

    private static final int MINOR_UNIT_DIGITS = 2;

    private MoneyUtils() {
    }

    /**
     * Converts a major-unit amount (e.g. rupees) to the gateway's minor unit (paise),
     * i.e. {@code round(amount * 100)} with halves rounded up.
     *
     * @throws ArithmeticException if the result does not fit in a {@code long}
     */
    public static long toMinorUnits(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("amount is null");
        }
        return amount
                .movePointRight(MINOR_UNIT_DIGITS)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
    }

    /**
     * Minor-unit amount as a major-unit decimal, for display.
     */
    public static BigDecimal fromMinorUnits(long minor) {
        return BigDecimal.valueOf(minor, MINOR_UNIT_DIGITS);
    }
}
