package io.rebasing.core.storage;

import io.rebasing.core.state.Account;
import io.rebasing.core.state.Changeset;
import io.rebasing.core.state.GlobalState;
import io.rebasing.core.state.LedgerState;
import org.rocksdb.*;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Persistent LedgerStore using RocksDB.
 *
 * Layout (column families):
 *  - "accounts" : key = account id (UTF-8), val = LedgerCodec.encodeAccount
 *  - "meta"     : key = "global",           val = LedgerCodec.encodeGlobal
 */
public final class RocksDBLedgerStore implements LedgerStore, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(RocksDBLedgerStore.class.getName());
    private static final byte[] GLOBAL_KEY = "global".getBytes(StandardCharsets.UTF_8);

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final ColumnFamilyHandle cfDefault;
    private final ColumnFamilyHandle cfAccounts;
    private final ColumnFamilyHandle cfMeta;
    private final DBOptions dbOptions;

    private RocksDBLedgerStore(RocksDB db,
                               ColumnFamilyHandle cfDefault,
                               ColumnFamilyHandle cfAccounts,
                               ColumnFamilyHandle cfMeta,
                               DBOptions dbOptions) {
        this.db = db;
        this.cfDefault = cfDefault;
        this.cfAccounts = cfAccounts;
        this.cfMeta = cfMeta;
        this.dbOptions = dbOptions;
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBLedgerStore open(String dataDir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        try {
            List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                    new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                    new ColumnFamilyDescriptor("accounts".getBytes(StandardCharsets.UTF_8)),
                    new ColumnFamilyDescriptor("meta".getBytes(StandardCharsets.UTF_8))
            );
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();

            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            LOG.info("Opened ledger store at " + dataDir);
            return new RocksDBLedgerStore(db, cfHandles.get(0), cfHandles.get(1), cfHandles.get(2), dbOpts);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new IllegalStateException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    // -------------- LedgerStore API ----------------

    @Override
    public synchronized Optional<LedgerState> loadState() {
        try {
            byte[] globalBytes = db.get(cfMeta, GLOBAL_KEY);
            if (globalBytes == null) {
                return Optional.empty();
            }
            GlobalState global = LedgerCodec.decodeGlobal(globalBytes);
            Map<String, Account> accounts = new LinkedHashMap<>();
            try (RocksIterator it = db.newIterator(cfAccounts)) {
                for (it.seekToFirst(); it.isValid(); it.next()) {
                    accounts.put(new String(it.key(), StandardCharsets.UTF_8), LedgerCodec.decodeAccount(it.value()));
                }
            }
            return Optional.of(new LedgerState(accounts, global));
        } catch (RocksDBException e) {
            throw new IllegalStateException("loadState failed", e);
        }
    }

    @Override
    public synchronized void write(Changeset changes) {
        if (changes == null) return;
        try (WriteOptions wo = new WriteOptions().setSync(false);
             WriteBatch batch = new WriteBatch()) {
            for (Map.Entry<String, Account> entry : changes.accounts().entrySet()) {
                batch.put(cfAccounts, entry.getKey().getBytes(StandardCharsets.UTF_8), LedgerCodec.encodeAccount(entry.getValue()));
            }
            batch.put(cfMeta, GLOBAL_KEY, LedgerCodec.encodeGlobal(changes.global()));
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new IllegalStateException("write failed", e);
        }
    }

    @Override
    public synchronized long size() {
        try (RocksIterator it = db.newIterator(cfAccounts)) {
            long n = 0;
            for (it.seekToFirst(); it.isValid(); it.next()) n++;
            return n;
        }
    }

    @Override
    public synchronized void close() {
        // handles before the DB, the DB before its options
        cfAccounts.close();
        cfMeta.close();
        cfDefault.close();
        db.close();
        dbOptions.close();
    }
}
