package com.fixedrate.common;

import java.math.BigInteger;

/**
 * Integer fixed-point helpers over unsigned 256-bit words. Values are {@link BigInteger} but every result is
 * range-checked against [0, 2^256 - 1]; leaving the range throws {@link ArithmeticException} instead of
 * wrapping or saturating. No floating point.
 */
public final class FixedPointMath {

    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    /** Scalar for 18-decimal fixed-point ratios (1.0 == 1e18). */
    public static final BigInteger WAD = BigInteger.TEN.pow(18);

    private FixedPointMath() {
    }

    /**
     * Rejects values outside the uint256 range.
     */
    public static BigInteger checked(BigInteger value) {
        if (value == null) {
            throw new ArithmeticException("uint256 value is null");
        }
        if (value.signum() < 0) {
            throw new ArithmeticException("uint256 underflow: " + value);
        }
        if (value.compareTo(MAX_UINT256) > 0) {
            throw new ArithmeticException("uint256 overflow");
        }
        return value;
    }

    public static BigInteger add(BigInteger a, BigInteger b) {
        return checked(checked(a).add(checked(b)));
    }

    public static BigInteger sub(BigInteger a, BigInteger b) {
        return checked(checked(a).subtract(checked(b)));
    }

    public static BigInteger mul(BigInteger a, BigInteger b) {
        return checked(checked(a).multiply(checked(b)));
    }

    /**
     * {@code x * y / denominator}, rounded toward zero. The intermediate product must itself fit in uint256.
     */
    public static BigInteger mulDivDown(BigInteger x, BigInteger y, BigInteger denominator) {
        BigInteger product = mul(x, y);
        return product.divide(nonZero(denominator));
    }

    /**
     * {@code x * y / denominator}, rounded away from zero.
     */
    public static BigInteger mulDivUp(BigInteger x, BigInteger y, BigInteger denominator) {
        BigInteger product = mul(x, y);
        BigInteger d = nonZero(denominator);
        if (product.signum() == 0) {
            return BigInteger.ZERO;
        }
        return product.subtract(BigInteger.ONE).divide(d).add(BigInteger.ONE);
    }

    public static BigInteger mulWadDown(BigInteger x, BigInteger y) {
        return mulDivDown(x, y, WAD);
    }

    public static BigInteger mulWadUp(BigInteger x, BigInteger y) {
        return mulDivUp(x, y, WAD);
    }

    public static BigInteger divWadDown(BigInteger x, BigInteger y) {
        return mulDivDown(x, WAD, y);
    }

    public static BigInteger min(BigInteger a, BigInteger b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static BigInteger nonZero(BigInteger denominator) {
        checked(denominator);
        if (denominator.signum() == 0) {
            throw new ArithmeticException("division by zero");
        }
        return denominator;
    }
}
