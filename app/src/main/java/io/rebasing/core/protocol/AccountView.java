package io.rebasing.core.protocol;

import java.math.BigInteger;

/** Balance and rebasing class of an account after an opt-in or opt-out. */
public record AccountView(String account, BigInteger balance, boolean nonRebasing) {
}
