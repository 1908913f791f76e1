package io.energytoken.core.state;

import io.energytoken.core.config.LedgerConfig;
import io.energytoken.core.protocol.MintRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Staged writes for one ledger operation. Values are absolute (new balance, new supply),
 * never deltas, so applying a batch twice is harmless.
 */
public final class StateBatch {

    private final Map<String, Long> balances = new LinkedHashMap<>();
    private final Map<Long, MintRecord> records = new LinkedHashMap<>();
    private final Map<String, List<Long>> histories = new LinkedHashMap<>();
    private final Set<Long> removedRecords = new LinkedHashSet<>();
    private Long totalSupply;
    private Long totalMinted;
    private LedgerConfig config;

    public StateBatch putBalance(String account, long balance) {
        if (balance < 0) throw new IllegalArgumentException("negative balance for " + account);
        balances.put(account, balance);
        return this;
    }

    public StateBatch putTotalSupply(long supply) {
        if (supply < 0) throw new IllegalArgumentException("negative total supply");
        this.totalSupply = supply;
        return this;
    }

    public StateBatch putTotalMinted(long minted) {
        if (minted < 0) throw new IllegalArgumentException("negative total minted");
        this.totalMinted = minted;
        return this;
    }

    public StateBatch putMintRecord(long proofId, MintRecord record) {
        removedRecords.remove(proofId);
        records.put(proofId, record);
        return this;
    }

    /** Only used to undo the first mint against a proof. */
    public StateBatch removeMintRecord(long proofId) {
        records.remove(proofId);
        removedRecords.add(proofId);
        return this;
    }

    public StateBatch putMintHistory(String account, List<Long> history) {
        histories.put(account, List.copyOf(history));
        return this;
    }

    public StateBatch putConfig(LedgerConfig config) {
        this.config = config;
        return this;
    }

    public Map<String, Long> balances() { return Collections.unmodifiableMap(balances); }
    public Map<Long, MintRecord> mintRecords() { return Collections.unmodifiableMap(records); }
    public Map<String, List<Long>> mintHistories() { return Collections.unmodifiableMap(histories); }
    public Set<Long> removedMintRecords() { return Collections.unmodifiableSet(removedRecords); }
    public Optional<Long> totalSupply() { return Optional.ofNullable(totalSupply); }
    public Optional<Long> totalMinted() { return Optional.ofNullable(totalMinted); }
    public Optional<LedgerConfig> config() { return Optional.ofNullable(config); }

    public boolean isEmpty() {
        return balances.isEmpty() && records.isEmpty() && removedRecords.isEmpty() && histories.isEmpty()
                && totalSupply == null && totalMinted == null && config == null;
    }
}
