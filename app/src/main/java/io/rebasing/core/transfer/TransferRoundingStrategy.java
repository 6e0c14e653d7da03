package io.rebasing.core.transfer;

import java.math.BigInteger;

/**
 * Converts a token amount into the credits to move, given both parties' multipliers.
 */
public interface TransferRoundingStrategy {
    CreditMovement plan(BigInteger amount, BigInteger fromCreditsPerToken, BigInteger toCreditsPerToken);
}
