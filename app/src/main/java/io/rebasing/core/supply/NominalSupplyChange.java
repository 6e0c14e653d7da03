package io.rebasing.core.supply;

import java.math.BigInteger;

/** Historical behaviour: caches the requested supply as-is. */
public final class NominalSupplyChange implements SupplyChangeStrategy {

    @Override
    public BigInteger resolveTotalSupply(BigInteger rebasingCredits,
                                         BigInteger rebasingCreditsPerToken,
                                         BigInteger nonRebasingSupply,
                                         BigInteger requestedTotalSupply) {
        return requestedTotalSupply;
    }
}
