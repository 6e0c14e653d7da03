package io.rebasing.core.supply;

import java.math.BigInteger;

/**
 * Decides which total supply to cache once a supply change has fixed the new multiplier.
 */
public interface SupplyChangeStrategy {

    /**
     * @param rebasingCredits          credits held by rebasing accounts
     * @param rebasingCreditsPerToken  multiplier just computed for the requested supply
     * @param nonRebasingSupply        token supply held by non-rebasing accounts
     * @param requestedTotalSupply     supply asked for by the caller (already capped)
     * @return total supply to cache
     */
    BigInteger resolveTotalSupply(BigInteger rebasingCredits,
                                  BigInteger rebasingCreditsPerToken,
                                  BigInteger nonRebasingSupply,
                                  BigInteger requestedTotalSupply);
}
