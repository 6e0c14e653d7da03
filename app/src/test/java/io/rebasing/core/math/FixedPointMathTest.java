package io.rebasing.core.math;

import io.rebasing.core.protocol.LedgerError;
import io.rebasing.core.protocol.LedgerException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static io.rebasing.core.math.FixedPointMath.*;
import static org.junit.jupiter.api.Assertions.*;

class FixedPointMathTest {

    @Test
    void mulTruncateRoundsDown() {
        BigInteger half = PRECISION.divide(BigInteger.TWO);
        assertEquals(BigInteger.ONE, mulTruncate(BigInteger.valueOf(3), half));
        assertEquals(BigInteger.ZERO, mulTruncate(BigInteger.ONE, half));
        assertEquals(BigInteger.valueOf(42), mulTruncate(BigInteger.valueOf(42), PRECISION));
    }

    @Test
    void divPreciselyRoundsDown() {
        BigInteger twoThirds = new BigInteger("666666666666666666");
        assertEquals(twoThirds, divPrecisely(BigInteger.TWO, BigInteger.valueOf(3)));
        assertEquals(BigInteger.ONE, divPrecisely(BigInteger.ONE, twoThirds));
        assertEquals(BigInteger.valueOf(3), divPrecisely(BigInteger.TWO, twoThirds));
    }

    @Test
    void divisionByZeroIsReported() {
        LedgerException ex = assertThrows(LedgerException.class, () -> divPrecisely(BigInteger.ONE, BigInteger.ZERO));
        assertEquals(LedgerError.DIVISION_BY_ZERO, ex.error());
    }

    @Test
    void intermediateOverflowIsReported() {
        LedgerException mul = assertThrows(LedgerException.class, () -> mulTruncate(MAX_UINT256, BigInteger.TWO));
        assertEquals(LedgerError.ARITHMETIC_OVERFLOW, mul.error());

        LedgerException div = assertThrows(LedgerException.class, () -> divPrecisely(MAX_UINT256, BigInteger.ONE));
        assertEquals(LedgerError.ARITHMETIC_OVERFLOW, div.error());

        LedgerException add = assertThrows(LedgerException.class, () -> add(MAX_UINT256, BigInteger.ONE));
        assertEquals(LedgerError.ARITHMETIC_OVERFLOW, add.error());
    }

    @Test
    void rejectsNegativeOperandsAndUnderflow() {
        LedgerException neg = assertThrows(LedgerException.class, () -> mulTruncate(BigInteger.valueOf(-1), PRECISION));
        assertEquals(LedgerError.ARITHMETIC_OVERFLOW, neg.error());

        LedgerException under = assertThrows(LedgerException.class, () -> sub(BigInteger.ONE, BigInteger.TWO));
        assertEquals(LedgerError.ARITHMETIC_OVERFLOW, under.error());
        assertEquals(BigInteger.ONE, sub(BigInteger.TWO, BigInteger.ONE));
    }
}
