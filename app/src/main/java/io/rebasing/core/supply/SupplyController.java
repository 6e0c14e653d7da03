package io.rebasing.core.supply;

import io.rebasing.core.math.FixedPointMath;
import io.rebasing.core.protocol.LedgerError;
import io.rebasing.core.protocol.LedgerException;
import io.rebasing.core.state.GlobalState;
import io.rebasing.core.state.StagedState;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Owner of the global aggregates: the rebasing multiplier, rebasing credits, non-rebasing supply
 * and the cached total supply.
 *
 * <p>A supply change rewrites only the shared multiplier, which is what keeps a rebase O(1).
 * Individual rebasing balances are then truncated independently, so their sum may fall short of
 * the cached total by up to {@code accounts - 1} units. Measuring that shortfall would need a pass
 * over every account, which is why supply changes never report to the rounding-error tracker.
 */
public final class SupplyController {

    private final SupplyChangeStrategy strategy;
    private final BigInteger maxSupply;

    public SupplyController(SupplyChangeStrategy strategy, BigInteger maxSupply) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.maxSupply = FixedPointMath.requireUnsigned(maxSupply);
    }

    public BigInteger maxSupply() {
        return maxSupply;
    }

    /** Moves the total supply to {@code requested} (capped at the max supply); returns the new multiplier. */
    public BigInteger changeSupply(StagedState state, BigInteger requested) {
        GlobalState g = state.global();
        if (g.totalSupply().signum() == 0) {
            throw new LedgerException(LedgerError.INVALID_SUPPLY_CHANGE, "Cannot change the supply of an empty ledger");
        }
        BigInteger newTotalSupply = requested.min(maxSupply);
        if (newTotalSupply.equals(g.totalSupply())) {
            return g.rebasingCreditsPerToken();
        }
        if (newTotalSupply.compareTo(g.nonRebasingSupply()) <= 0) {
            throw new LedgerException(LedgerError.INVALID_SUPPLY_CHANGE,
                    "New supply " + newTotalSupply + " leaves nothing for rebasing accounts (non-rebasing supply "
                            + g.nonRebasingSupply() + ")");
        }
        BigInteger rebasingSupply = newTotalSupply.subtract(g.nonRebasingSupply());
        BigInteger creditsPerToken = FixedPointMath.divPrecisely(g.rebasingCredits(), rebasingSupply);
        if (creditsPerToken.signum() == 0) {
            throw new LedgerException(LedgerError.INVALID_SUPPLY_CHANGE,
                    "Supply " + newTotalSupply + " drives the rebasing multiplier to zero");
        }
        BigInteger totalSupply = strategy.resolveTotalSupply(
                g.rebasingCredits(), creditsPerToken, g.nonRebasingSupply(), newTotalSupply);
        if (totalSupply.compareTo(maxSupply) > 0) {
            throw new LedgerException(LedgerError.INVALID_SUPPLY_CHANGE,
                    "Supply " + newTotalSupply + " resolves to " + totalSupply + " above max supply " + maxSupply);
        }
        state.setGlobal(g.withRebasingCreditsPerToken(creditsPerToken).withTotalSupply(totalSupply));
        return creditsPerToken;
    }

    public void addRebasingCredits(StagedState state, BigInteger credits) {
        GlobalState g = state.global();
        state.setGlobal(g.withRebasingCredits(FixedPointMath.add(g.rebasingCredits(), credits)));
    }

    public void subRebasingCredits(StagedState state, BigInteger credits) {
        GlobalState g = state.global();
        state.setGlobal(g.withRebasingCredits(FixedPointMath.sub(g.rebasingCredits(), credits)));
    }

    public void addNonRebasingSupply(StagedState state, BigInteger amount) {
        GlobalState g = state.global();
        state.setGlobal(g.withNonRebasingSupply(FixedPointMath.add(g.nonRebasingSupply(), amount)));
    }

    public void subNonRebasingSupply(StagedState state, BigInteger amount) {
        GlobalState g = state.global();
        state.setGlobal(g.withNonRebasingSupply(FixedPointMath.sub(g.nonRebasingSupply(), amount)));
    }

    public void increaseTotalSupply(StagedState state, BigInteger amount) {
        GlobalState g = state.global();
        BigInteger total = FixedPointMath.add(g.totalSupply(), amount);
        if (total.compareTo(maxSupply) > 0) {
            throw new LedgerException(LedgerError.ARITHMETIC_OVERFLOW,
                    "Total supply " + total + " exceeds max supply " + maxSupply);
        }
        state.setGlobal(g.withTotalSupply(total));
    }

    public void decreaseTotalSupply(StagedState state, BigInteger amount) {
        GlobalState g = state.global();
        state.setGlobal(g.withTotalSupply(FixedPointMath.sub(g.totalSupply(), amount)));
    }

    /** Applies a signed correction to the cached total supply. */
    public void adjustTotalSupply(StagedState state, BigInteger delta) {
        if (delta.signum() >= 0) {
            increaseTotalSupply(state, delta);
        } else {
            decreaseTotalSupply(state, delta.negate());
        }
    }
}
