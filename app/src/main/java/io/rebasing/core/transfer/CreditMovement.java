package io.rebasing.core.transfer;

import java.math.BigInteger;

/** Credits taken from the sender and credits given to the recipient for one transfer. */
public record CreditMovement(BigInteger deducted, BigInteger credited) {
}
