package io.rebasing.core.issuance;

import io.rebasing.core.math.FixedPointMath;
import io.rebasing.core.protocol.LedgerError;
import io.rebasing.core.protocol.LedgerException;
import io.rebasing.core.state.AccountLedger;
import io.rebasing.core.state.StagedState;
import io.rebasing.core.supply.SupplyController;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Mint and burn: converts a token amount into credits at the account's multiplier and routes
 * the change into the rebasing or non-rebasing aggregate.
 */
public final class IssuanceController {

    private final AccountLedger accounts;
    private final SupplyController supply;
    private final BurnPolicy burnPolicy;

    public IssuanceController(AccountLedger accounts, SupplyController supply, BurnPolicy burnPolicy) {
        this.accounts = Objects.requireNonNull(accounts, "accounts");
        this.supply = Objects.requireNonNull(supply, "supply");
        this.burnPolicy = Objects.requireNonNull(burnPolicy, "burnPolicy");
    }

    /** Returns the balance of {@code account} after the mint. */
    public BigInteger mint(StagedState state, String account, BigInteger amount) {
        BigInteger creditsPerToken = accounts.creditsPerToken(state, account);
        BigInteger creditAmount = FixedPointMath.mulTruncate(amount, creditsPerToken);

        accounts.addCredits(state, account, creditAmount);
        if (state.account(account).nonRebasing()) {
            supply.addNonRebasingSupply(state, amount);
        } else {
            supply.addRebasingCredits(state, creditAmount);
        }
        supply.increaseTotalSupply(state, amount);
        return accounts.balanceOf(state, account);
    }

    /** Returns the balance of {@code account} after the burn. */
    public BigInteger burn(StagedState state, String account, BigInteger amount) {
        BigInteger creditsPerToken = accounts.creditsPerToken(state, account);
        BigInteger creditAmount = FixedPointMath.mulTruncate(amount, creditsPerToken);
        burnPolicy.checkCreditAmount(account, amount, creditAmount);

        BigInteger balance = accounts.balanceOf(state, account);
        if (amount.compareTo(balance) > 0 || accounts.creditsOf(state, account).compareTo(creditAmount) < 0) {
            throw new LedgerException(LedgerError.INSUFFICIENT_BALANCE,
                    "Cannot burn " + amount + " from " + account + " holding " + balance);
        }
        if (amount.compareTo(state.global().totalSupply()) > 0) {
            throw new LedgerException(LedgerError.INSUFFICIENT_BALANCE,
                    "Cannot burn " + amount + " with total supply " + state.global().totalSupply());
        }

        accounts.subCredits(state, account, creditAmount);
        if (state.account(account).nonRebasing()) {
            BigInteger reduction = burnPolicy.nonRebasingReduction(amount, creditAmount, creditsPerToken);
            if (reduction.compareTo(state.global().nonRebasingSupply()) > 0) {
                throw new LedgerException(LedgerError.INSUFFICIENT_BALANCE,
                        "Burn of " + reduction + " exceeds non-rebasing supply " + state.global().nonRebasingSupply());
            }
            supply.subNonRebasingSupply(state, reduction);
        } else {
            supply.subRebasingCredits(state, creditAmount);
        }
        supply.decreaseTotalSupply(state, amount);
        return accounts.balanceOf(state, account);
    }
}
