package io.rebasing.core.sim;

import io.rebasing.core.ledger.AuditReport;
import io.rebasing.core.ledger.LedgerAuditor;
import io.rebasing.core.ledger.RebasingLedger;
import io.rebasing.core.protocol.LedgerError;
import io.rebasing.core.protocol.LedgerResult;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Drives a seeded random sequence of operations against a ledger and audits the
 * sum-of-balances invariant after every step. Same seed, same sequence.
 */
public final class LedgerSimulation {
    private static final Logger LOG = Logger.getLogger(LedgerSimulation.class.getName());

    private static final long MAX_MINT = 1_000_000_000L;

    private final RebasingLedger ledger;
    private final long seed;
    private final Random random;
    private final List<String> accounts;
    private boolean rebases = true;
    private boolean optChanges = true;

    public LedgerSimulation(RebasingLedger ledger, long seed, int accountCount) {
        if (accountCount < 1) {
            throw new IllegalArgumentException("accountCount must be >= 1");
        }
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.seed = seed;
        this.random = new Random(seed);
        this.accounts = new ArrayList<>(accountCount);
        for (int i = 0; i < accountCount; i++) {
            accounts.add("acct-" + i);
        }
    }

    /** Include {@code changeSupply} steps (on by default). */
    public LedgerSimulation withRebases(boolean enabled) {
        this.rebases = enabled;
        return this;
    }

    /** Include opt-in / opt-out steps (on by default). */
    public LedgerSimulation withOptChanges(boolean enabled) {
        this.optChanges = enabled;
        return this;
    }

    public SimulationReport run(int steps) {
        Map<String, Integer> operations = new TreeMap<>();
        Map<LedgerError, Integer> failures = new EnumMap<>(LedgerError.class);
        BigInteger maxDrift = BigInteger.ZERO;
        int succeeded = 0;
        int overBound = 0;

        for (int i = 0; i < steps; i++) {
            String op = pickOperation();
            operations.merge(op, 1, Integer::sum);
            LedgerResult<?> result = apply(op);
            if (result.isOk()) {
                succeeded++;
            } else {
                failures.merge(result.error(), 1, Integer::sum);
            }

            AuditReport audit = LedgerAuditor.audit(ledger);
            maxDrift = maxDrift.max(audit.drift().abs());
            if (!audit.withinDustBound()) {
                overBound++;
            }
        }

        AuditReport finalAudit = LedgerAuditor.audit(ledger);
        SimulationReport report = new SimulationReport(seed, steps, succeeded, operations, failures, maxDrift, overBound, finalAudit);
        LOG.info("Simulation finished: " + report.summary());
        if (overBound > 0) {
            LOG.warning(overBound + " steps left the ledger outside the dust bound (max drift " + maxDrift + ")");
        }
        return report;
    }

    private String pickOperation() {
        while (true) {
            int roll = random.nextInt(100);
            if (roll < 30) return "mint";
            if (roll < 65) return "transfer";
            if (roll < 80) return "burn";
            if (roll < 87) {
                if (optChanges) return "optOut";
            } else if (roll < 94) {
                if (optChanges) return "optIn";
            } else if (rebases) {
                return "changeSupply";
            }
        }
    }

    private LedgerResult<?> apply(String op) {
        String account = randomAccount();
        switch (op) {
            case "mint":
                return ledger.mint(account, BigInteger.valueOf(1 + Math.floorMod(random.nextLong(), MAX_MINT)));
            case "burn":
                return ledger.burn(account, portionOf(ledger.balanceOf(account)));
            case "transfer": {
                String to = randomAccount();
                return ledger.transfer(account, to, portionOf(ledger.balanceOf(account)));
            }
            case "optOut":
                return ledger.optOut(account);
            case "optIn":
                return ledger.optIn(account);
            case "changeSupply": {
                // grow by up to 5%, at least one unit
                BigInteger current = ledger.totalSupply();
                BigInteger growth = current.multiply(BigInteger.valueOf(random.nextInt(51))).divide(BigInteger.valueOf(1000));
                return ledger.changeSupply(current.add(growth).add(BigInteger.ONE));
            }
            default:
                throw new IllegalStateException("Unknown operation " + op);
        }
    }

    private String randomAccount() {
        return accounts.get(random.nextInt(accounts.size()));
    }

    /** Random amount in [0, balance]; occasionally the full balance or a single unit. */
    private BigInteger portionOf(BigInteger balance) {
        if (balance.signum() == 0) {
            return BigInteger.ONE;
        }
        int roll = random.nextInt(10);
        if (roll == 0) return balance;
        if (roll == 1) return BigInteger.ONE;
        return balance.multiply(BigInteger.valueOf(random.nextInt(1001))).divide(BigInteger.valueOf(1000));
    }
}
