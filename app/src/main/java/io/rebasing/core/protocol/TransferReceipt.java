package io.rebasing.core.protocol;

import java.math.BigInteger;

/** Balances of both parties after a transfer. */
public record TransferReceipt(String from, BigInteger fromBalance, String to, BigInteger toBalance) {
}
