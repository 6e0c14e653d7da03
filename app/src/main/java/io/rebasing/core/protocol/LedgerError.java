package io.rebasing.core.protocol;

/**
 * Failure kinds a ledger operation can report. None of them is transient:
 * each one means the requested operation is invalid against the current state.
 */
public enum LedgerError {
    // math layer
    ARITHMETIC_OVERFLOW,
    DIVISION_BY_ZERO,

    // ledger layer
    INSUFFICIENT_BALANCE,
    INSUFFICIENT_CREDITS,
    DUST_AMOUNT_BURN,
    ALREADY_IN_STATE,
    INVALID_SUPPLY_CHANGE,
    INVALID_ARGUMENT
}
