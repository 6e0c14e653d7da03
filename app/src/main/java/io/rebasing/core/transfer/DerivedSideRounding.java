package io.rebasing.core.transfer;

import io.rebasing.core.math.FixedPointMath;

import java.math.BigInteger;

/**
 * Converts the amount on the side with the coarser multiplier first, then re-derives the other
 * side from the tokens that conversion actually represents. Debit and credit then describe the
 * same token quantity wherever truncation allows it.
 */
public final class DerivedSideRounding implements TransferRoundingStrategy {

    @Override
    public CreditMovement plan(BigInteger amount, BigInteger fromCreditsPerToken, BigInteger toCreditsPerToken) {
        int cmp = fromCreditsPerToken.compareTo(toCreditsPerToken);
        if (cmp == 0) {
            BigInteger credits = FixedPointMath.mulTruncate(amount, fromCreditsPerToken);
            return new CreditMovement(credits, credits);
        }
        if (cmp > 0) {
            BigInteger credited = FixedPointMath.mulTruncate(amount, toCreditsPerToken);
            BigInteger tokens = FixedPointMath.divPrecisely(credited, toCreditsPerToken);
            return new CreditMovement(FixedPointMath.mulTruncate(tokens, fromCreditsPerToken), credited);
        }
        BigInteger deducted = FixedPointMath.mulTruncate(amount, fromCreditsPerToken);
        BigInteger tokens = FixedPointMath.divPrecisely(deducted, fromCreditsPerToken);
        return new CreditMovement(deducted, FixedPointMath.mulTruncate(tokens, toCreditsPerToken));
    }
}
