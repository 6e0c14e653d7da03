package io.rebasing.core.sim;

import io.rebasing.core.ledger.AuditReport;
import io.rebasing.core.protocol.LedgerError;

import java.math.BigInteger;
import java.util.Map;

/** Outcome of a randomized run: operation counts, the worst drift seen and the final audit. */
public record SimulationReport(long seed,
                               int steps,
                               int succeeded,
                               Map<String, Integer> operations,
                               Map<LedgerError, Integer> failures,
                               BigInteger maxAbsDrift,
                               int dustBoundViolations,
                               AuditReport finalAudit) {

    public SimulationReport {
        operations = Map.copyOf(operations);
        failures = Map.copyOf(failures);
    }

    public String summary() {
        return "seed=" + seed
                + " steps=" + steps
                + " ok=" + succeeded
                + " ops=" + operations
                + " failures=" + failures
                + " maxDrift=" + maxAbsDrift
                + " overBound=" + dustBoundViolations
                + " final=" + finalAudit;
    }
}
