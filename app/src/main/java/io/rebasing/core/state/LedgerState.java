package io.rebasing.core.state;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Account table plus global aggregates. Constructed explicitly and owned by one ledger;
 * mutated only by applying a {@link Changeset}.
 */
public final class LedgerState {

    private final Map<String, Account> accounts;
    private GlobalState global;

    public LedgerState(Map<String, Account> accounts, GlobalState global) {
        this.accounts = new LinkedHashMap<>(Objects.requireNonNull(accounts, "accounts"));
        this.global = Objects.requireNonNull(global, "global");
    }

    public static LedgerState empty(BigInteger initialCreditsPerToken) {
        return new LedgerState(Map.of(), GlobalState.initial(initialCreditsPerToken));
    }

    /** Account record, or {@link Account#EMPTY} for an address never touched. */
    public Account account(String id) {
        return accounts.getOrDefault(id, Account.EMPTY);
    }

    public GlobalState global() {
        return global;
    }

    public Set<String> accountIds() {
        return Set.copyOf(accounts.keySet());
    }

    public Map<String, Account> accounts() {
        return Map.copyOf(accounts);
    }

    public int size() {
        return accounts.size();
    }

    /** Start an isolated set of writes against this state. */
    public StagedState stage() {
        return new StagedState(this);
    }

    public void apply(Changeset changes) {
        accounts.putAll(changes.accounts());
        global = changes.global();
    }
}
