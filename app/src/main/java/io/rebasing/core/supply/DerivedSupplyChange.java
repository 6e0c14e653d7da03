package io.rebasing.core.supply;

import io.rebasing.core.math.FixedPointMath;

import java.math.BigInteger;

/**
 * Derives the cached total supply back from the multiplier it just set, so the cache agrees
 * with what the rebasing balances add up to before per-account truncation.
 */
public final class DerivedSupplyChange implements SupplyChangeStrategy {

    @Override
    public BigInteger resolveTotalSupply(BigInteger rebasingCredits,
                                         BigInteger rebasingCreditsPerToken,
                                         BigInteger nonRebasingSupply,
                                         BigInteger requestedTotalSupply) {
        return FixedPointMath.add(
                FixedPointMath.divPrecisely(rebasingCredits, rebasingCreditsPerToken),
                nonRebasingSupply);
    }
}
