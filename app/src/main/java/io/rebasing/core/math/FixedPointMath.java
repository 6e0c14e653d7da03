package io.rebasing.core.math;

import io.rebasing.core.protocol.LedgerError;
import io.rebasing.core.protocol.LedgerException;

import java.math.BigInteger;

/**
 * The two rounding operators of the ledger. Both truncate toward zero, so every
 * credit/balance conversion loses precision downward.
 */
public final class FixedPointMath {
    private FixedPointMath() {}

    /** Fixed-point scale of every multiplier: 10^18. */
    public static final BigInteger PRECISION = BigInteger.TEN.pow(18);

    /** Largest value a ledger quantity may hold: 2^256 - 1. */
    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    /** {@code floor(x * multiplier / PRECISION)}. */
    public static BigInteger mulTruncate(BigInteger x, BigInteger multiplier) {
        BigInteger product = checked(requireUnsigned(x).multiply(requireUnsigned(multiplier)), "mulTruncate");
        return product.divide(PRECISION);
    }

    /** {@code floor(x * PRECISION / divisor)}. */
    public static BigInteger divPrecisely(BigInteger x, BigInteger divisor) {
        requireUnsigned(divisor);
        if (divisor.signum() == 0) {
            throw new LedgerException(LedgerError.DIVISION_BY_ZERO, "divPrecisely by zero");
        }
        BigInteger scaled = checked(requireUnsigned(x).multiply(PRECISION), "divPrecisely");
        return scaled.divide(divisor);
    }

    /** Fails with ARITHMETIC_OVERFLOW unless {@code value} fits in an unsigned 256-bit word. */
    public static BigInteger requireUnsigned(BigInteger value) {
        if (value == null) {
            throw new LedgerException(LedgerError.INVALID_ARGUMENT, "Missing operand");
        }
        if (value.signum() < 0) {
            throw new LedgerException(LedgerError.ARITHMETIC_OVERFLOW, "Negative operand " + value);
        }
        return checked(value, "operand");
    }

    /** Sum of two unsigned values; overflow above 2^256 - 1 fails. */
    public static BigInteger add(BigInteger a, BigInteger b) {
        return checked(requireUnsigned(a).add(requireUnsigned(b)), "add");
    }

    /** Difference of two unsigned values; fails with ARITHMETIC_OVERFLOW when {@code b > a}. */
    public static BigInteger sub(BigInteger a, BigInteger b) {
        BigInteger diff = requireUnsigned(a).subtract(requireUnsigned(b));
        if (diff.signum() < 0) {
            throw new LedgerException(LedgerError.ARITHMETIC_OVERFLOW, "Underflow: " + a + " - " + b);
        }
        return diff;
    }

    private static BigInteger checked(BigInteger value, String op) {
        if (value.compareTo(MAX_UINT256) > 0) {
            throw new LedgerException(LedgerError.ARITHMETIC_OVERFLOW, op + " overflows uint256");
        }
        return value;
    }
}
