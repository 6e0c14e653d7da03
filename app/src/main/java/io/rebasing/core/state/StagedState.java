package io.rebasing.core.state;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Write overlay over a {@link LedgerState}. Reads see staged values first; nothing reaches the
 * underlying state until the overlay is turned into a {@link Changeset} and applied.
 * Dropping the overlay discards every write of the operation.
 */
public final class StagedState {

    private final LedgerState base;
    private final Map<String, Account> touched = new LinkedHashMap<>();
    private GlobalState global;

    StagedState(LedgerState base) {
        this.base = base;
        this.global = base.global();
    }

    public Account account(String id) {
        Account staged = touched.get(id);
        return staged != null ? staged : base.account(id);
    }

    public void putAccount(String id, Account account) {
        touched.put(Objects.requireNonNull(id, "id"), Objects.requireNonNull(account, "account"));
    }

    public GlobalState global() {
        return global;
    }

    public void setGlobal(GlobalState global) {
        this.global = Objects.requireNonNull(global, "global");
    }

    public Changeset changeset() {
        return new Changeset(touched, global);
    }
}
