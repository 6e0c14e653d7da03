package io.rebasing.core.ledger;

import java.math.BigInteger;

/**
 * Full pass over every account comparing the balance sum with the reported supply.
 * O(n): meant for tooling and tests, never for the operations themselves.
 */
public final class LedgerAuditor {
    private LedgerAuditor() {}

    public static AuditReport audit(RebasingLedger ledger) {
        synchronized (ledger instanceof RoundingErrorTracker ? ((RoundingErrorTracker) ledger).delegate() : ledger) {
            BigInteger sum = BigInteger.ZERO;
            int n = 0;
            for (String account : ledger.accountIds()) {
                sum = sum.add(ledger.balanceOf(account));
                n++;
            }
            BigInteger totalSupply = ledger.totalSupply();
            return new AuditReport(n, sum, totalSupply, totalSupply.subtract(sum));
        }
    }
}
