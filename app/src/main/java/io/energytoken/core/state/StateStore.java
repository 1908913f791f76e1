package io.energytoken.core.state;

import io.energytoken.core.config.LedgerConfig;
import io.energytoken.core.protocol.MintRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ledger state: balances, supply counters, per-proof mint records, per-account mint history
 * and the current configuration record.
 * Writes only go through {@link #commit(StateBatch)}, which applies a batch all-or-nothing.
 */
public interface StateStore {
    long getBalance(String account);

    /** Snapshot of every non-zero balance. */
    Map<String, Long> getBalances();

    long getTotalSupply();

    /** Cumulative issuance; burns do not decrease it. */
    long getTotalMinted();

    Optional<MintRecord> getMintRecord(long proofId);

    /** Proof ids consumed by {@code account}, oldest first. Empty if none. */
    List<Long> getMintHistory(String account);

    /** Empty until genesis has been written. */
    Optional<LedgerConfig> getConfig();

    /** Apply every staged write atomically. */
    void commit(StateBatch batch);
}
