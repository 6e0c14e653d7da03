package io.rebasing.core.state;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Ledger-wide aggregates. {@code totalSupply} is cached and maintained by every operation,
 * never recomputed from the accounts.
 */
public record GlobalState(BigInteger rebasingCredits,
                          BigInteger rebasingCreditsPerToken,
                          BigInteger nonRebasingSupply,
                          BigInteger totalSupply,
                          BigInteger roundingErrorAccumulator) {

    public GlobalState {
        Objects.requireNonNull(rebasingCredits, "rebasingCredits");
        Objects.requireNonNull(rebasingCreditsPerToken, "rebasingCreditsPerToken");
        Objects.requireNonNull(nonRebasingSupply, "nonRebasingSupply");
        Objects.requireNonNull(totalSupply, "totalSupply");
        Objects.requireNonNull(roundingErrorAccumulator, "roundingErrorAccumulator");
        if (rebasingCreditsPerToken.signum() <= 0) {
            throw new IllegalArgumentException("rebasingCreditsPerToken must be > 0");
        }
        if (rebasingCredits.signum() < 0 || nonRebasingSupply.signum() < 0 || totalSupply.signum() < 0) {
            throw new IllegalArgumentException("aggregates must be >= 0");
        }
    }

    /** Empty ledger starting at the given multiplier. */
    public static GlobalState initial(BigInteger rebasingCreditsPerToken) {
        return new GlobalState(BigInteger.ZERO, rebasingCreditsPerToken, BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO);
    }

    public GlobalState withRebasingCredits(BigInteger v) {
        return new GlobalState(v, rebasingCreditsPerToken, nonRebasingSupply, totalSupply, roundingErrorAccumulator);
    }

    public GlobalState withRebasingCreditsPerToken(BigInteger v) {
        return new GlobalState(rebasingCredits, v, nonRebasingSupply, totalSupply, roundingErrorAccumulator);
    }

    public GlobalState withNonRebasingSupply(BigInteger v) {
        return new GlobalState(rebasingCredits, rebasingCreditsPerToken, v, totalSupply, roundingErrorAccumulator);
    }

    public GlobalState withTotalSupply(BigInteger v) {
        return new GlobalState(rebasingCredits, rebasingCreditsPerToken, nonRebasingSupply, v, roundingErrorAccumulator);
    }

    public GlobalState withRoundingErrorAccumulator(BigInteger v) {
        return new GlobalState(rebasingCredits, rebasingCreditsPerToken, nonRebasingSupply, totalSupply, v);
    }
}
