package io.energytoken.core.state;

import io.energytoken.core.config.LedgerConfig;
import io.energytoken.core.protocol.MintRecord;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory implementation of StateStore.
 * Not persistent; resets every process run.
 */
public final class InMemoryStateStore implements StateStore {

    private final Map<String, Long> balances = new HashMap<>();
    private final Map<Long, MintRecord> records = new HashMap<>();
    private final Map<String, List<Long>> histories = new HashMap<>();
    private long totalSupply;
    private long totalMinted;
    private LedgerConfig config; // null until genesis

    @Override
    public synchronized long getBalance(String address) {
        return balances.getOrDefault(address, 0L);
    }

    @Override
    public synchronized Map<String, Long> getBalances() {
        return new TreeMap<>(balances);
    }

    @Override
    public synchronized long getTotalSupply() {
        return totalSupply;
    }

    @Override
    public synchronized long getTotalMinted() {
        return totalMinted;
    }

    @Override
    public synchronized Optional<MintRecord> getMintRecord(long proofId) {
        return Optional.ofNullable(records.get(proofId));
    }

    @Override
    public synchronized List<Long> getMintHistory(String account) {
        return histories.getOrDefault(account, List.of());
    }

    @Override
    public synchronized Optional<LedgerConfig> getConfig() {
        return Optional.ofNullable(config);
    }

    @Override
    public synchronized void commit(StateBatch batch) {
        if (batch == null || batch.isEmpty()) return;
        // nothing below can fail, so the batch lands whole
        for (Map.Entry<String, Long> e : batch.balances().entrySet()) {
            if (e.getValue() == 0L) {
                balances.remove(e.getKey());
            } else {
                balances.put(e.getKey(), e.getValue());
            }
        }
        records.putAll(batch.mintRecords());
        batch.removedMintRecords().forEach(records::remove);
        histories.putAll(batch.mintHistories());
        batch.totalSupply().ifPresent(v -> totalSupply = v);
        batch.totalMinted().ifPresent(v -> totalMinted = v);
        batch.config().ifPresent(c -> config = c);
    }
}
