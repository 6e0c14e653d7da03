package io.rebasing.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.math.BigInteger;
import java.util.function.Supplier;

public final class LedgerMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Timer operationTime = registry.timer("ledger.operation.time");
    private static final DistributionSummary roundingError = DistributionSummary.builder("ledger.rounding.error")
            .baseUnit("minor")
            .description("Absolute rounding deltas recorded by the tracker")
            .register(registry);

    private LedgerMetrics() {}

    public static <T> T recordOperation(Supplier<T> operation) {
        return operationTime.record(operation);
    }

    /** Counts one finished operation; {@code outcome} is "ok" or the error kind. */
    public static void countOperation(String operation, String outcome) {
        Counter.builder("ledger.operations")
                .description("Ledger operations by outcome")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public static void recordRoundingError(BigInteger delta) {
        roundingError.record(delta.abs().doubleValue());
    }

    public static double operationCount(String operation, String outcome) {
        Counter counter = registry.find("ledger.operations")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .counter();
        return counter == null ? 0.0 : counter.count();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                for (Tag tag : m.getId().getTags()) {
                    sb.append(' ').append(tag.getKey()).append('=').append(tag.getValue());
                }
                sb.append(" {stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
