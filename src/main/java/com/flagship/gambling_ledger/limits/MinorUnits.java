package com.flagship.gambling_ledger.limits;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversions between limit-currency amounts and the integer cents the
 * daily stats are kept in.
 */
public final class MinorUnits {

    private static final int SCALE = 2;

    private MinorUnits() {
    }

    /**
     * @throws IllegalArgumentException if the amount does not fit in a long
     *                                  number of cents
     */
    public static long toCents(BigDecimal amount) {
        try {
            return amount.setScale(SCALE, RoundingMode.HALF_UP).movePointRight(SCALE).longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Amount is too large: " + amount.toPlainString(), e);
        }
    }

    /**
     * Converts an asset amount using the asset's reference rate.
     */
    public static long toCents(BigDecimal assetAmount, BigDecimal referenceRate) {
        return toCents(assetAmount.multiply(referenceRate));
    }

    public static BigDecimal fromCents(long cents) {
        return BigDecimal.valueOf(cents, SCALE);
    }
}
