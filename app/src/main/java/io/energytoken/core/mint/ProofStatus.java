package io.energytoken.core.mint;

import io.energytoken.core.protocol.MintRecord;

import java.util.Optional;

/** Issuance view of one proof, taken under the ledger lock. */
public final class ProofStatus {

    private final long proofId;
    private final long mintable;
    private final MintRecord record; // null until first mint

    ProofStatus(long proofId, long mintable, Optional<MintRecord> record) {
        this.proofId = proofId;
        this.mintable = mintable;
        this.record = record.orElse(null);
    }

    public long proofId() { return proofId; }
    public long mintable() { return mintable; }
    public boolean minted() { return record != null; }
    public Optional<MintRecord> record() { return Optional.ofNullable(record); }
}
