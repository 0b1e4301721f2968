package com.trading.amm.core;

import java.math.BigInteger;

/**
 * Unsigned fixed-width arithmetic helpers over {@link BigInteger}.
 *
 * All divisions floor, matching the integer semantics the accounting rules are
 * written against.
 */
public final class UintMath {
    public static final BigInteger U128_MAX = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);
    public static final BigInteger BPS = BigInteger.valueOf(10_000);
    public static final BigInteger WAD = BigInteger.TEN.pow(18);

    private UintMath() {
        // Utility class
    }

    public static boolean fitsU128(BigInteger v) {
        return v.signum() >= 0 && v.compareTo(U128_MAX) <= 0;
    }

    /** floor(a * b / d); {@code d} must be positive. */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger d) {
        if (d.signum() <= 0)
            throw new ArithmeticException("mulDiv by non-positive divisor: " + d);
        return a.multiply(b).divide(d);
    }

    /** floor(sqrt(v)) for non-negative {@code v}. */
    public static BigInteger sqrt(BigInteger v) {
        if (v.signum() < 0)
            throw new ArithmeticException("sqrt of negative value");
        return v.sqrt();
    }

    public static BigInteger min(BigInteger a, BigInteger b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static boolean isPositive(BigInteger v) {
        return v != null && v.signum() > 0;
    }
}
