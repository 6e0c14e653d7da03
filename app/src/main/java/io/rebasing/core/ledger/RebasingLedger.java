package io.rebasing.core.ledger;

import io.rebasing.core.protocol.AccountView;
import io.rebasing.core.protocol.CreditBalance;
import io.rebasing.core.protocol.LedgerResult;
import io.rebasing.core.protocol.TransferReceipt;
import io.rebasing.core.state.LedgerState;

import java.math.BigInteger;
import java.util.Set;

/**
 * Synchronous call interface of the rebasing ledger. Operations run one at a time; a failed
 * operation leaves no trace in the state.
 */
public interface RebasingLedger {

    /** Mint {@code amount} tokens to {@code account}; returns its new balance. */
    LedgerResult<BigInteger> mint(String account, BigInteger amount);

    /** Burn {@code amount} tokens from {@code account}; returns its new balance. */
    LedgerResult<BigInteger> burn(String account, BigInteger amount);

    LedgerResult<TransferReceipt> transfer(String from, String to, BigInteger amount);

    /** Put a non-rebasing account back on the global multiplier. */
    LedgerResult<AccountView> optIn(String account);

    /** Freeze the account's multiplier at the current global value. */
    LedgerResult<AccountView> optOut(String account);

    /** Rebase to {@code newTotalSupply}; returns the new rebasing multiplier. */
    LedgerResult<BigInteger> changeSupply(BigInteger newTotalSupply);

    BigInteger balanceOf(String account);

    /** Reported total supply. */
    BigInteger totalSupply();

    CreditBalance creditsBalanceOf(String account);

    boolean isNonRebasing(String account);

    BigInteger rebasingCredits();

    BigInteger rebasingCreditsPerToken();

    BigInteger nonRebasingSupply();

    /** Every account ever touched. */
    Set<String> accountIds();

    /** Detached copy of the current state. */
    LedgerState snapshot();
}
