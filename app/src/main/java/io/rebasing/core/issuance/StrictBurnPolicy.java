package io.rebasing.core.issuance;

import io.rebasing.core.math.FixedPointMath;
import io.rebasing.core.protocol.LedgerError;
import io.rebasing.core.protocol.LedgerException;

import java.math.BigInteger;

/**
 * Refuses dust burns and reduces the non-rebasing supply by the balance actually removed.
 */
public final class StrictBurnPolicy implements BurnPolicy {

    @Override
    public void checkCreditAmount(String account, BigInteger amount, BigInteger creditAmount) {
        if (amount.signum() > 0 && creditAmount.signum() == 0) {
            throw new LedgerException(LedgerError.DUST_AMOUNT_BURN,
                    "Burning " + amount + " from " + account + " removes no credits");
        }
    }

    @Override
    public BigInteger nonRebasingReduction(BigInteger amount, BigInteger creditAmount, BigInteger creditsPerToken) {
        return FixedPointMath.divPrecisely(creditAmount, creditsPerToken);
    }
}
