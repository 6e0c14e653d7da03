package io.rebasing.core.transfer;

import io.rebasing.core.protocol.LedgerError;
import io.rebasing.core.protocol.LedgerException;
import io.rebasing.core.protocol.TransferReceipt;
import io.rebasing.core.state.AccountLedger;
import io.rebasing.core.state.StagedState;
import io.rebasing.core.supply.SupplyController;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Moves value between two accounts that may sit under different multipliers.
 * Rebasing sides adjust the rebasing credits; non-rebasing sides adjust the non-rebasing
 * supply by the balance change the account really saw.
 */
public final class TransferEngine {

    private final AccountLedger accounts;
    private final SupplyController supply;
    private final TransferRoundingStrategy rounding;

    public TransferEngine(AccountLedger accounts, SupplyController supply, TransferRoundingStrategy rounding) {
        this.accounts = Objects.requireNonNull(accounts, "accounts");
        this.supply = Objects.requireNonNull(supply, "supply");
        this.rounding = Objects.requireNonNull(rounding, "rounding");
    }

    public TransferReceipt transfer(StagedState state, String from, String to, BigInteger amount) {
        BigInteger fromBalance = accounts.balanceOf(state, from);
        if (amount.compareTo(fromBalance) > 0) {
            throw new LedgerException(LedgerError.INSUFFICIENT_BALANCE,
                    "Transfer of " + amount + " exceeds balance " + fromBalance + " of " + from);
        }

        CreditMovement movement = rounding.plan(amount,
                accounts.creditsPerToken(state, from),
                accounts.creditsPerToken(state, to));
        if (accounts.creditsOf(state, from).compareTo(movement.deducted()) < 0) {
            throw new LedgerException(LedgerError.INSUFFICIENT_BALANCE,
                    "Transfer needs " + movement.deducted() + " credits, " + from + " holds " + accounts.creditsOf(state, from));
        }

        accounts.subCredits(state, from, movement.deducted());
        BigInteger fromAfter = accounts.balanceOf(state, from);
        if (state.account(from).nonRebasing()) {
            supply.subNonRebasingSupply(state, fromBalance.subtract(fromAfter));
        } else {
            supply.subRebasingCredits(state, movement.deducted());
        }

        // read after the debit so a self-transfer sees its own write
        BigInteger toBefore = accounts.balanceOf(state, to);
        accounts.addCredits(state, to, movement.credited());
        BigInteger toAfter = accounts.balanceOf(state, to);
        if (state.account(to).nonRebasing()) {
            supply.addNonRebasingSupply(state, toAfter.subtract(toBefore));
        } else {
            supply.addRebasingCredits(state, movement.credited());
        }

        return new TransferReceipt(from, accounts.balanceOf(state, from), to, toAfter);
    }
}
