package io.rebasing.core.storage;

import io.rebasing.core.state.Changeset;
import io.rebasing.core.state.LedgerState;

import java.util.Optional;

/**
 * Persistence port for the account table and the global record.
 * A changeset is written atomically: either every record in it is stored or none is.
 */
public interface LedgerStore {

    /** Everything persisted so far; empty if the store has never been written. */
    Optional<LedgerState> loadState();

    /** Persist the records of one committed operation. */
    void write(Changeset changes);

    /** Number of stored accounts (debug/metrics). */
    long size();
}
