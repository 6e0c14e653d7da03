package io.rebasing.core.state;

import io.rebasing.core.math.FixedPointMath;
import io.rebasing.core.protocol.LedgerError;
import io.rebasing.core.protocol.LedgerException;

import java.math.BigInteger;

/**
 * Per-account credit storage and the rebasing/non-rebasing classification.
 * Raw credit mutation is meant for the supply, transfer and opt controllers only;
 * none of these methods touch the global aggregates.
 */
public final class AccountLedger {

    /** Multiplier applying to {@code id}: its locked snapshot if non-rebasing, else the global one. */
    public BigInteger creditsPerToken(StagedState state, String id) {
        Account account = state.account(id);
        return account.nonRebasing() ? account.lockedCreditsPerToken() : state.global().rebasingCreditsPerToken();
    }

    public BigInteger balanceOf(StagedState state, String id) {
        return FixedPointMath.divPrecisely(state.account(id).credits(), creditsPerToken(state, id));
    }

    public BigInteger creditsOf(StagedState state, String id) {
        return state.account(id).credits();
    }

    public void addCredits(StagedState state, String id, BigInteger amount) {
        Account account = state.account(id);
        state.putAccount(id, account.withCredits(FixedPointMath.add(account.credits(), amount)));
    }

    public void subCredits(StagedState state, String id, BigInteger amount) {
        Account account = state.account(id);
        if (account.credits().compareTo(amount) < 0) {
            throw new LedgerException(LedgerError.INSUFFICIENT_CREDITS,
                    "Account " + id + " holds " + account.credits() + " credits, cannot remove " + amount);
        }
        state.putAccount(id, account.withCredits(account.credits().subtract(amount)));
    }

    /** Replaces the whole record; used when an account changes its rebasing class. */
    public void replace(StagedState state, String id, Account account) {
        state.putAccount(id, account);
    }
}
