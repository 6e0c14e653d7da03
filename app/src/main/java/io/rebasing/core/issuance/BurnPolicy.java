package io.rebasing.core.issuance;

import java.math.BigInteger;

/**
 * Rules a burn applies on top of the common balance checks.
 */
public interface BurnPolicy {

    /** Rejects a burn whose token amount does not translate into credits, if the policy cares. */
    void checkCreditAmount(String account, BigInteger amount, BigInteger creditAmount);

    /** Amount to take off the non-rebasing supply when a non-rebasing account burns. */
    BigInteger nonRebasingReduction(BigInteger amount, BigInteger creditAmount, BigInteger creditsPerToken);
}
