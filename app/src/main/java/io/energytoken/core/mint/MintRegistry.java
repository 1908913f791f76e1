package io.energytoken.core.mint;

import io.energytoken.core.protocol.MintRecord;
import io.energytoken.core.protocol.Proof;
import io.energytoken.core.state.StateStore;

import java.util.Optional;

/**
 * Per-proof issuance bookkeeping. A proof's capacity is its attested output minus everything
 * already minted against it; burns never restore capacity.
 */
public final class MintRegistry {

    private final StateStore state;

    public MintRegistry(StateStore state) {
        this.state = state;
    }

    public Optional<MintRecord> getMintRecord(long proofId) {
        return state.getMintRecord(proofId);
    }

    public boolean isProofMinted(long proofId) {
        return state.getMintRecord(proofId).isPresent();
    }

    /** Existing record, or an all-zero one for a proof never minted against. */
    MintRecord recordOrEmpty(long proofId) {
        return state.getMintRecord(proofId).orElse(MintRecord.empty());
    }

    /** {@code max(0, excessOutput - cumulativeMinted)}. */
    public long remainingCapacity(long proofId, Proof proof) {
        long minted = recordOrEmpty(proofId).cumulativeMinted();
        return Math.max(0L, proof.excessOutput() - minted);
    }
}
