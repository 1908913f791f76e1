package io.energytoken.core.storage;

import io.energytoken.core.config.LedgerConfig;
import io.energytoken.core.protocol.MintRecord;
import io.energytoken.core.state.StateBatch;
import io.energytoken.core.state.StateStore;
import org.rocksdb.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent StateStore using RocksDB.
 *
 * Layout (column families):
 *  - "balances" : key = account (utf-8),  val = balance(8)
 *  - "records"  : key = proofId(8),       val = MintRecord
 *  - "history"  : key = account (utf-8),  val = proof id list
 *  - "meta"     : keys "supply", "minted", "config"
 */
public final class RocksDBStateStore implements StateStore, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(RocksDBStateStore.class.getName());

    private static final byte[] KEY_SUPPLY = "supply".getBytes();
    private static final byte[] KEY_MINTED = "minted".getBytes();
    private static final byte[] KEY_CONFIG = "config".getBytes();

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final ColumnFamilyHandle cfBalances;
    private final ColumnFamilyHandle cfRecords;
    private final ColumnFamilyHandle cfHistory;
    private final ColumnFamilyHandle cfMeta;
    private final List<ColumnFamilyHandle> handles;
    private final DBOptions dbOptions;

    private RocksDBStateStore(RocksDB db, List<ColumnFamilyHandle> handles, DBOptions dbOptions) {
        this.db = db;
        this.handles = handles;
        this.dbOptions = dbOptions;
        // index 0 is the default CF
        this.cfBalances = handles.get(1);
        this.cfRecords = handles.get(2);
        this.cfHistory = handles.get(3);
        this.cfMeta = handles.get(4);
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBStateStore open(String dataDir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                new ColumnFamilyDescriptor("balances".getBytes()),
                new ColumnFamilyDescriptor("records".getBytes()),
                new ColumnFamilyDescriptor("history".getBytes()),
                new ColumnFamilyDescriptor("meta".getBytes())
        );
        List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
        try {
            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            LOG.info("Opened ledger state at " + dataDir);
            return new RocksDBStateStore(db, cfHandles, dbOpts);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new IllegalStateException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    @Override
    public synchronized long getBalance(String account) {
        if (account == null) return 0L;
        byte[] v = get(cfBalances, StateCodec.stringKey(account), "getBalance");
        return v == null ? 0L : StateCodec.bytesToLong(v);
    }

    @Override
    public synchronized Map<String, Long> getBalances() {
        Map<String, Long> out = new TreeMap<>();
        try (RocksIterator it = db.newIterator(cfBalances)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                out.put(StateCodec.keyToString(it.key()), StateCodec.bytesToLong(it.value()));
            }
        }
        return out;
    }

    @Override
    public synchronized long getTotalSupply() {
        byte[] v = get(cfMeta, KEY_SUPPLY, "getTotalSupply");
        return v == null ? 0L : StateCodec.bytesToLong(v);
    }

    @Override
    public synchronized long getTotalMinted() {
        byte[] v = get(cfMeta, KEY_MINTED, "getTotalMinted");
        return v == null ? 0L : StateCodec.bytesToLong(v);
    }

    @Override
    public synchronized Optional<MintRecord> getMintRecord(long proofId) {
        byte[] v = get(cfRecords, StateCodec.longToBytes(proofId), "getMintRecord");
        return v == null ? Optional.empty() : Optional.of(StateCodec.decodeRecord(v));
    }

    @Override
    public synchronized List<Long> getMintHistory(String account) {
        if (account == null) return List.of();
        byte[] v = get(cfHistory, StateCodec.stringKey(account), "getMintHistory");
        return v == null ? List.of() : StateCodec.decodeHistory(v);
    }

    @Override
    public synchronized Optional<LedgerConfig> getConfig() {
        byte[] v = get(cfMeta, KEY_CONFIG, "getConfig");
        return v == null ? Optional.empty() : Optional.of(StateCodec.decodeConfig(v));
    }

    @Override
    public synchronized void commit(StateBatch batch) {
        if (batch == null || batch.isEmpty()) return;
        try (WriteOptions wo = new WriteOptions().setSync(false);
             WriteBatch wb = new WriteBatch()) {
            for (Map.Entry<String, Long> e : batch.balances().entrySet()) {
                byte[] key = StateCodec.stringKey(e.getKey());
                if (e.getValue() == 0L) {
                    wb.delete(cfBalances, key);
                } else {
                    wb.put(cfBalances, key, StateCodec.longToBytes(e.getValue()));
                }
            }
            for (Map.Entry<Long, MintRecord> e : batch.mintRecords().entrySet()) {
                wb.put(cfRecords, StateCodec.longToBytes(e.getKey()), StateCodec.encodeRecord(e.getValue()));
            }
            for (Long proofId : batch.removedMintRecords()) {
                wb.delete(cfRecords, StateCodec.longToBytes(proofId));
            }
            for (Map.Entry<String, List<Long>> e : batch.mintHistories().entrySet()) {
                wb.put(cfHistory, StateCodec.stringKey(e.getKey()), StateCodec.encodeHistory(e.getValue()));
            }
            if (batch.totalSupply().isPresent()) {
                wb.put(cfMeta, KEY_SUPPLY, StateCodec.longToBytes(batch.totalSupply().get()));
            }
            if (batch.totalMinted().isPresent()) {
                wb.put(cfMeta, KEY_MINTED, StateCodec.longToBytes(batch.totalMinted().get()));
            }
            if (batch.config().isPresent()) {
                wb.put(cfMeta, KEY_CONFIG, StateCodec.encodeConfig(batch.config().get()));
            }
            db.write(wo, wb);
        } catch (RocksDBException e) {
            throw new IllegalStateException("commit failed", e);
        }
    }

    @Override
    public void close() {
        // handles before the DB, options last
        for (ColumnFamilyHandle h : handles) {
            h.close();
        }
        try {
            db.closeE();
        } catch (RocksDBException e) {
            LOG.log(Level.WARNING, "RocksDB close failed", e);
        } finally {
            dbOptions.close();
        }
    }

    private byte[] get(ColumnFamilyHandle cf, byte[] key, String op) {
        try {
            return db.get(cf, key);
        } catch (RocksDBException e) {
            throw new IllegalStateException(op + " failed", e);
        }
    }
}
