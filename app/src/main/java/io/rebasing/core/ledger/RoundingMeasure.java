package io.rebasing.core.ledger;

import io.rebasing.core.state.StagedState;

import java.math.BigInteger;
import java.util.function.Function;

/**
 * Measures the rounding loss of one operation inside its staged state.
 * {@link #begin} sees the state before the operation runs and returns the function that turns
 * the operation's result into the signed delta for the accumulator.
 */
@FunctionalInterface
interface RoundingMeasure<T> {

    Function<T, BigInteger> begin(StagedState staged);

    static <T> RoundingMeasure<T> none() {
        return staged -> result -> BigInteger.ZERO;
    }
}
