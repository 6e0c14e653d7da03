package io.rebasing.core.storage;

import io.rebasing.core.state.Account;
import io.rebasing.core.state.Changeset;
import io.rebasing.core.state.GlobalState;
import io.rebasing.core.state.LedgerState;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Non-persistent LedgerStore. Resets every process run.
 */
public final class InMemoryLedgerStore implements LedgerStore {

    private final Map<String, Account> accounts = new LinkedHashMap<>();
    private GlobalState global;

    @Override
    public synchronized Optional<LedgerState> loadState() {
        if (global == null) {
            return Optional.empty();
        }
        return Optional.of(new LedgerState(accounts, global));
    }

    @Override
    public synchronized void write(Changeset changes) {
        if (changes == null) return;
        accounts.putAll(changes.accounts());
        global = changes.global();
    }

    @Override
    public synchronized long size() {
        return accounts.size();
    }
}
