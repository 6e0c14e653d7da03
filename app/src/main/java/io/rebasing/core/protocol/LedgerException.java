package io.rebasing.core.protocol;

/**
 * Thrown by ledger components to abort the operation in progress.
 * The ledger facade turns it into a {@link LedgerResult} once the staged writes are dropped.
 */
public final class LedgerException extends RuntimeException {
    private final LedgerError error;

    public LedgerException(LedgerError error, String message) {
        super(message);
        this.error = error;
    }

    public LedgerError error() {
        return error;
    }
}
