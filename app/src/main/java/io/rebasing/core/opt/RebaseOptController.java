package io.rebasing.core.opt;

import io.rebasing.core.math.FixedPointMath;
import io.rebasing.core.protocol.AccountView;
import io.rebasing.core.protocol.LedgerError;
import io.rebasing.core.protocol.LedgerException;
import io.rebasing.core.state.Account;
import io.rebasing.core.state.AccountLedger;
import io.rebasing.core.state.StagedState;
import io.rebasing.core.supply.SupplyController;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Switches an account between the global multiplier (rebasing) and a frozen personal one
 * (non-rebasing).
 *
 * <p>Opting in re-expresses the credits under the global multiplier, which may move the balance
 * by a unit. The cached total supply absorbs that difference here even though the supply-change
 * caller otherwise owns it.
 */
public final class RebaseOptController {

    private final AccountLedger accounts;
    private final SupplyController supply;

    public RebaseOptController(AccountLedger accounts, SupplyController supply) {
        this.accounts = Objects.requireNonNull(accounts, "accounts");
        this.supply = Objects.requireNonNull(supply, "supply");
    }

    public AccountView optOut(StagedState state, String id) {
        Account account = state.account(id);
        if (account.nonRebasing()) {
            throw new LedgerException(LedgerError.ALREADY_IN_STATE, "Account " + id + " is already non-rebasing");
        }
        BigInteger balance = accounts.balanceOf(state, id);
        BigInteger snapshot = state.global().rebasingCreditsPerToken();

        accounts.replace(state, id, Account.nonRebasing(account.credits(), snapshot));
        supply.subRebasingCredits(state, account.credits());
        supply.addNonRebasingSupply(state, balance);
        return new AccountView(id, accounts.balanceOf(state, id), true);
    }

    public AccountView optIn(StagedState state, String id) {
        Account account = state.account(id);
        if (!account.nonRebasing()) {
            throw new LedgerException(LedgerError.ALREADY_IN_STATE, "Account " + id + " is already rebasing");
        }
        BigInteger oldBalance = accounts.balanceOf(state, id);
        BigInteger rebasingCreditsPerToken = state.global().rebasingCreditsPerToken();

        BigInteger credits;
        if (account.lockedCreditsPerToken().equals(rebasingCreditsPerToken)) {
            credits = account.credits();
        } else {
            credits = FixedPointMath.mulTruncate(
                    FixedPointMath.divPrecisely(account.credits(), account.lockedCreditsPerToken()),
                    rebasingCreditsPerToken);
        }

        accounts.replace(state, id, Account.rebasing(credits));
        BigInteger newBalance = accounts.balanceOf(state, id);

        supply.subNonRebasingSupply(state, oldBalance);
        supply.addRebasingCredits(state, credits);
        supply.adjustTotalSupply(state, newBalance.subtract(oldBalance));
        return new AccountView(id, newBalance, false);
    }
}
