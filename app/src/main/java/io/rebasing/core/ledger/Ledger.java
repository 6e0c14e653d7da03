package io.rebasing.core.ledger;

import io.rebasing.core.config.LedgerConfig;
import io.rebasing.core.issuance.IssuanceController;
import io.rebasing.core.math.FixedPointMath;
import io.rebasing.core.metrics.LedgerMetrics;
import io.rebasing.core.opt.RebaseOptController;
import io.rebasing.core.protocol.AccountView;
import io.rebasing.core.protocol.CreditBalance;
import io.rebasing.core.protocol.LedgerError;
import io.rebasing.core.protocol.LedgerException;
import io.rebasing.core.protocol.LedgerResult;
import io.rebasing.core.protocol.TransferReceipt;
import io.rebasing.core.state.AccountLedger;
import io.rebasing.core.state.Changeset;
import io.rebasing.core.state.LedgerState;
import io.rebasing.core.state.StagedState;
import io.rebasing.core.storage.InMemoryLedgerStore;
import io.rebasing.core.storage.LedgerStore;
import io.rebasing.core.supply.SupplyController;
import io.rebasing.core.transfer.TransferEngine;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Wires the ledger components over one {@link LedgerState} and serialises every call on this
 * object's monitor.
 *
 * <p>Each mutating operation runs against a fresh {@link StagedState}. On success the staged
 * changeset is persisted first and then applied in memory; on a {@link LedgerException} the
 * overlay is dropped and the error is returned as a {@link LedgerResult}.
 */
public final class Ledger implements RebasingLedger {
    private static final Logger LOG = Logger.getLogger(Ledger.class.getName());

    private final LedgerState state;
    private final LedgerStore store;
    private final LedgerConfig config;

    private final AccountLedger accounts;
    private final SupplyController supply;
    private final IssuanceController issuance;
    private final TransferEngine transfers;
    private final RebaseOptController opts;

    public Ledger(LedgerState state, LedgerStore store, LedgerConfig config) {
        this.state = Objects.requireNonNull(state, "state");
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.accounts = new AccountLedger();
        this.supply = new SupplyController(config.supplyChangeMode.strategy(), config.maxSupply);
        this.issuance = new IssuanceController(accounts, supply, config.burnMode.policy());
        this.transfers = new TransferEngine(accounts, supply, config.transferRoundingMode.strategy());
        this.opts = new RebaseOptController(accounts, supply);
    }

    /** Loads the persisted state, or seeds an empty one at the configured multiplier. */
    public static Ledger open(LedgerStore store, LedgerConfig config) {
        LedgerState state = store.loadState().orElse(null);
        if (state == null) {
            state = LedgerState.empty(config.initialCreditsPerToken);
            store.write(new Changeset(Map.of(), state.global()));
            LOG.info("Initialised empty ledger (" + config + ")");
        } else {
            LOG.info("Loaded ledger with " + state.size() + " accounts, total supply " + state.global().totalSupply());
        }
        return new Ledger(state, store, config);
    }

    /** Convenience factory for a non-persistent ledger. */
    public static Ledger inMemory(LedgerConfig config) {
        return open(new InMemoryLedgerStore(), config);
    }

    /** The ledger the config asks for: wrapped in a {@link RoundingErrorTracker} when tracking is on. */
    public static RebasingLedger assemble(LedgerStore store, LedgerConfig config) {
        Ledger core = open(store, config);
        return config.trackRoundingError ? new RoundingErrorTracker(core) : core;
    }

    public LedgerConfig config() {
        return config;
    }

    // -------------- operations ----------------

    @Override
    public LedgerResult<BigInteger> mint(String account, BigInteger amount) {
        return mint(account, amount, RoundingMeasure.none());
    }

    LedgerResult<BigInteger> mint(String account, BigInteger amount, RoundingMeasure<BigInteger> measure) {
        return execute("mint", measure, s -> {
            requireAccount(account);
            requireAmount(amount);
            return issuance.mint(s, account, amount);
        });
    }

    @Override
    public LedgerResult<BigInteger> burn(String account, BigInteger amount) {
        return burn(account, amount, RoundingMeasure.none());
    }

    LedgerResult<BigInteger> burn(String account, BigInteger amount, RoundingMeasure<BigInteger> measure) {
        return execute("burn", measure, s -> {
            requireAccount(account);
            requireAmount(amount);
            return issuance.burn(s, account, amount);
        });
    }

    @Override
    public LedgerResult<TransferReceipt> transfer(String from, String to, BigInteger amount) {
        return transfer(from, to, amount, RoundingMeasure.none());
    }

    LedgerResult<TransferReceipt> transfer(String from, String to, BigInteger amount,
                                           RoundingMeasure<TransferReceipt> measure) {
        return execute("transfer", measure, s -> {
            requireAccount(from);
            requireAccount(to);
            requireAmount(amount);
            return transfers.transfer(s, from, to, amount);
        });
    }

    @Override
    public LedgerResult<AccountView> optIn(String account) {
        return execute("optIn", RoundingMeasure.none(), s -> {
            requireAccount(account);
            return opts.optIn(s, account);
        });
    }

    @Override
    public LedgerResult<AccountView> optOut(String account) {
        return execute("optOut", RoundingMeasure.none(), s -> {
            requireAccount(account);
            return opts.optOut(s, account);
        });
    }

    @Override
    public LedgerResult<BigInteger> changeSupply(BigInteger newTotalSupply) {
        return execute("changeSupply", RoundingMeasure.none(), s -> {
            requireAmount(newTotalSupply);
            return supply.changeSupply(s, newTotalSupply);
        });
    }

    // -------------- views ----------------

    @Override
    public synchronized BigInteger balanceOf(String account) {
        return accounts.balanceOf(state.stage(), Objects.requireNonNull(account, "account"));
    }

    /** Cached total supply, without the rounding-error accumulator. */
    @Override
    public synchronized BigInteger totalSupply() {
        return state.global().totalSupply();
    }

    public synchronized BigInteger roundingErrorAccumulator() {
        return state.global().roundingErrorAccumulator();
    }

    @Override
    public synchronized CreditBalance creditsBalanceOf(String account) {
        StagedState view = state.stage();
        Objects.requireNonNull(account, "account");
        return new CreditBalance(accounts.creditsOf(view, account), accounts.creditsPerToken(view, account));
    }

    @Override
    public synchronized boolean isNonRebasing(String account) {
        return state.account(account).nonRebasing();
    }

    @Override
    public synchronized BigInteger rebasingCredits() {
        return state.global().rebasingCredits();
    }

    @Override
    public synchronized BigInteger rebasingCreditsPerToken() {
        return state.global().rebasingCreditsPerToken();
    }

    @Override
    public synchronized BigInteger nonRebasingSupply() {
        return state.global().nonRebasingSupply();
    }

    @Override
    public synchronized Set<String> accountIds() {
        return state.accountIds();
    }

    @Override
    public synchronized LedgerState snapshot() {
        return new LedgerState(state.accounts(), state.global());
    }

    // -------------- helpers ----------------

    private synchronized <T> LedgerResult<T> execute(String operation,
                                                     RoundingMeasure<T> measure,
                                                     Function<StagedState, T> body) {
        StagedState staged = state.stage();
        T value;
        BigInteger delta;
        try {
            Function<T, BigInteger> roundingDelta = measure.begin(staged);
            value = LedgerMetrics.recordOperation(() -> body.apply(staged));
            delta = roundingDelta.apply(value);
        } catch (LedgerException e) {
            LedgerMetrics.countOperation(operation, e.error().name());
            LOG.fine(() -> operation + " rejected: " + e.error() + " " + e.getMessage());
            return LedgerResult.error(e.error(), e.getMessage());
        }
        if (delta.signum() != 0) {
            // accumulator rides in the same changeset as the operation
            staged.setGlobal(staged.global().withRoundingErrorAccumulator(
                    staged.global().roundingErrorAccumulator().add(delta)));
        }
        commit(staged.changeset());
        LedgerMetrics.countOperation(operation, "ok");
        if (delta.signum() != 0) {
            BigInteger recorded = delta;
            LedgerMetrics.recordRoundingError(recorded);
            LOG.fine(() -> operation + " rounding delta " + recorded + ", accumulator " + state.global().roundingErrorAccumulator());
        }
        T committed = value;
        LOG.fine(() -> operation + " -> " + committed);
        return LedgerResult.ok(committed);
    }

    private void commit(Changeset changes) {
        // persist before touching memory so a store failure leaves both in the old state
        store.write(changes);
        state.apply(changes);
    }

    private static void requireAccount(String account) {
        if (account == null || account.isBlank()) {
            throw new LedgerException(LedgerError.INVALID_ARGUMENT, "Account id required");
        }
    }

    private static void requireAmount(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new LedgerException(LedgerError.INVALID_ARGUMENT, "Amount must be a non-negative integer, got " + amount);
        }
        FixedPointMath.requireUnsigned(amount);
    }
}
