package io.rebasing.core.state;

import io.rebasing.core.math.FixedPointMath;
import io.rebasing.core.protocol.LedgerError;
import io.rebasing.core.protocol.LedgerException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class AccountLedgerTest {

    private final AccountLedger accounts = new AccountLedger();

    @Test
    void unknownAccountIsEmptyAndRebasing() {
        StagedState s = LedgerState.empty(FixedPointMath.PRECISION).stage();
        assertEquals(BigInteger.ZERO, accounts.balanceOf(s, "nobody"));
        assertEquals(FixedPointMath.PRECISION, accounts.creditsPerToken(s, "nobody"));
        assertFalse(s.account("nobody").nonRebasing());
    }

    @Test
    void nonRebasingAccountUsesLockedMultiplier() {
        LedgerState state = LedgerState.empty(FixedPointMath.PRECISION);
        StagedState s = state.stage();
        BigInteger locked = FixedPointMath.PRECISION.divide(BigInteger.TWO);
        s.putAccount("alice", Account.nonRebasing(BigInteger.valueOf(10), locked));

        assertEquals(locked, accounts.creditsPerToken(s, "alice"));
        assertEquals(BigInteger.valueOf(20), accounts.balanceOf(s, "alice"));
    }

    @Test
    void subCreditsFailsOnUnderflow() {
        StagedState s = LedgerState.empty(FixedPointMath.PRECISION).stage();
        accounts.addCredits(s, "alice", BigInteger.valueOf(5));

        LedgerException ex = assertThrows(LedgerException.class,
                () -> accounts.subCredits(s, "alice", BigInteger.valueOf(6)));
        assertEquals(LedgerError.INSUFFICIENT_CREDITS, ex.error());
        assertEquals(BigInteger.valueOf(5), accounts.creditsOf(s, "alice"));

        accounts.subCredits(s, "alice", BigInteger.valueOf(5));
        assertEquals(BigInteger.ZERO, accounts.creditsOf(s, "alice"));
    }

    @Test
    void stagedWritesStayInvisibleUntilApplied() {
        LedgerState state = LedgerState.empty(FixedPointMath.PRECISION);
        StagedState s = state.stage();
        accounts.addCredits(s, "alice", BigInteger.valueOf(7));

        assertEquals(BigInteger.valueOf(7), accounts.creditsOf(s, "alice"));
        assertEquals(BigInteger.ZERO, state.account("alice").credits());
        assertEquals(0, state.size());

        state.apply(s.changeset());
        assertEquals(BigInteger.valueOf(7), state.account("alice").credits());
        assertEquals(1, state.size());
    }

    @Test
    void accountRejectsInconsistentLockedMultiplier() {
        assertThrows(IllegalArgumentException.class, () -> new Account(BigInteger.ONE, true, null));
        assertThrows(IllegalArgumentException.class, () -> new Account(BigInteger.ONE, true, BigInteger.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new Account(BigInteger.ONE, false, BigInteger.TEN));
    }
}
