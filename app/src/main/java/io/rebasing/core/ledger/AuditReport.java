package io.rebasing.core.ledger;

import java.math.BigInteger;

/**
 * Result of summing every balance against the reported total supply.
 * {@code drift = totalSupply - sumOfBalances}; positive when supply exceeds what accounts hold.
 */
public record AuditReport(int accounts, BigInteger sumOfBalances, BigInteger totalSupply, BigInteger drift) {

    /** Whether the drift stays within one unit per account beyond the first. */
    public boolean withinDustBound() {
        return drift.abs().compareTo(BigInteger.valueOf(Math.max(0, accounts - 1))) <= 0;
    }

    public boolean balanced() {
        return drift.signum() == 0;
    }
}
