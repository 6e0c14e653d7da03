package io.rebasing.core.protocol;

import java.math.BigInteger;

/** Raw credits of an account together with the multiplier that converts them to tokens. */
public record CreditBalance(BigInteger credits, BigInteger creditsPerToken) {
}
