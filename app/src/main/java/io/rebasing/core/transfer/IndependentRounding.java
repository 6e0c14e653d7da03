package io.rebasing.core.transfer;

import io.rebasing.core.math.FixedPointMath;

import java.math.BigInteger;

/** Historical behaviour: each side truncates the nominal amount on its own. */
public final class IndependentRounding implements TransferRoundingStrategy {

    @Override
    public CreditMovement plan(BigInteger amount, BigInteger fromCreditsPerToken, BigInteger toCreditsPerToken) {
        return new CreditMovement(
                FixedPointMath.mulTruncate(amount, fromCreditsPerToken),
                FixedPointMath.mulTruncate(amount, toCreditsPerToken));
    }
}
