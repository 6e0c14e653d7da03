package io.rebasing.core.ledger;

import io.rebasing.core.protocol.AccountView;
import io.rebasing.core.protocol.CreditBalance;
import io.rebasing.core.protocol.LedgerResult;
import io.rebasing.core.protocol.TransferReceipt;
import io.rebasing.core.state.AccountLedger;
import io.rebasing.core.state.LedgerState;
import io.rebasing.core.state.StagedState;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Set;

/**
 * Decorator that measures the rounding loss of mint, burn and transfer and folds it into a signed
 * accumulator.
 *
 * <p>Each recorded delta is the balance change the touched accounts really saw minus the change
 * in cached supply the operation booked. {@link #totalSupply()} reports the cached supply plus
 * that accumulator, floored at zero, so outside of rebases it equals the sum of balances.
 * The delta is staged with the operation it measures and persisted in the same write.
 *
 * <p>Supply changes pass straight through: measuring their loss means summing every balance
 * before and after, the very pass the multiplier scheme exists to avoid.
 */
public final class RoundingErrorTracker implements RebasingLedger {
    private final Ledger delegate;
    private final AccountLedger accounts = new AccountLedger();

    public RoundingErrorTracker(Ledger delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public Ledger delegate() {
        return delegate;
    }

    @Override
    public LedgerResult<BigInteger> mint(String account, BigInteger amount) {
        return delegate.mint(account, amount, staged -> {
            BigInteger before = balanceOrZero(staged, account);
            return after -> after.subtract(before).subtract(amount);
        });
    }

    @Override
    public LedgerResult<BigInteger> burn(String account, BigInteger amount) {
        return delegate.burn(account, amount, staged -> {
            BigInteger before = balanceOrZero(staged, account);
            return after -> after.subtract(before).add(amount);
        });
    }

    @Override
    public LedgerResult<TransferReceipt> transfer(String from, String to, BigInteger amount) {
        return delegate.transfer(from, to, amount, staged -> {
            BigInteger fromBefore = balanceOrZero(staged, from);
            BigInteger toBefore = balanceOrZero(staged, to);
            return receipt -> {
                BigInteger delta = receipt.fromBalance().subtract(fromBefore);
                if (!from.equals(to)) {
                    delta = delta.add(receipt.toBalance().subtract(toBefore));
                }
                return delta;
            };
        });
    }

    @Override
    public LedgerResult<AccountView> optIn(String account) {
        return delegate.optIn(account);
    }

    @Override
    public LedgerResult<AccountView> optOut(String account) {
        return delegate.optOut(account);
    }

    @Override
    public LedgerResult<BigInteger> changeSupply(BigInteger newTotalSupply) {
        return delegate.changeSupply(newTotalSupply);
    }

    @Override
    public BigInteger balanceOf(String account) {
        return delegate.balanceOf(account);
    }

    /** Cached supply plus the accumulator, never below zero. */
    @Override
    public BigInteger totalSupply() {
        synchronized (delegate) {
            return delegate.totalSupply().add(delegate.roundingErrorAccumulator()).max(BigInteger.ZERO);
        }
    }

    public BigInteger roundingError() {
        return delegate.roundingErrorAccumulator();
    }

    @Override
    public CreditBalance creditsBalanceOf(String account) {
        return delegate.creditsBalanceOf(account);
    }

    @Override
    public boolean isNonRebasing(String account) {
        return delegate.isNonRebasing(account);
    }

    @Override
    public BigInteger rebasingCredits() {
        return delegate.rebasingCredits();
    }

    @Override
    public BigInteger rebasingCreditsPerToken() {
        return delegate.rebasingCreditsPerToken();
    }

    @Override
    public BigInteger nonRebasingSupply() {
        return delegate.nonRebasingSupply();
    }

    @Override
    public Set<String> accountIds() {
        return delegate.accountIds();
    }

    @Override
    public LedgerState snapshot() {
        return delegate.snapshot();
    }

    private BigInteger balanceOrZero(StagedState staged, String account) {
        return account == null ? BigInteger.ZERO : accounts.balanceOf(staged, account);
    }
}
