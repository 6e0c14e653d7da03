package io.rebasing.core.protocol;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Outcome of a ledger operation: either a value or a {@link LedgerError} with a message.
 */
public final class LedgerResult<T> {
    private final T value;
    private final LedgerError error;
    private final String message;

    private LedgerResult(T value, LedgerError error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static <T> LedgerResult<T> ok(T value) {
        return new LedgerResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> LedgerResult<T> error(LedgerError error, String message) {
        return new LedgerResult<>(null, Objects.requireNonNull(error, "error"), message);
    }

    public boolean isOk() { return error == null; }
    public LedgerError error() { return error; }
    public String message() { return message; }

    /** The success value; throws if this result is a failure. */
    public T value() {
        if (error != null) {
            throw new NoSuchElementException("No value for failed result " + this);
        }
        return value;
    }

    public T orElse(T fallback) {
        return error == null ? value : fallback;
    }

    @Override public String toString() {
        return isOk() ? ("OK[" + value + "]") : ("ERR[" + error + "]: " + message);
    }
}
