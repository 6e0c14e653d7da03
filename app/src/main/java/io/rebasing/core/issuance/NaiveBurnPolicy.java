package io.rebasing.core.issuance;

import java.math.BigInteger;

/**
 * Historical burn: accepts amounts that truncate to zero credits and books the nominal amount.
 * A dust burn therefore shrinks the total supply while the balance stays put.
 */
public final class NaiveBurnPolicy implements BurnPolicy {

    @Override
    public void checkCreditAmount(String account, BigInteger amount, BigInteger creditAmount) {
        // any amount goes
    }

    @Override
    public BigInteger nonRebasingReduction(BigInteger amount, BigInteger creditAmount, BigInteger creditsPerToken) {
        return amount;
    }
}
