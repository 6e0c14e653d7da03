package io.rebasing.core.state;

import java.util.Map;

/** Writes produced by one operation, committed to the store and to memory as a unit. */
public record Changeset(Map<String, Account> accounts, GlobalState global) {
    public Changeset {
        accounts = Map.copyOf(accounts);
    }

    public boolean touchesAccounts() {
        return !accounts.isEmpty();
    }
}
