package io.energytoken.core.external;

import io.energytoken.core.protocol.Proof;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Proof store kept in memory. Proofs are immutable once attested, so re-attesting an
 * existing id with different content is refused.
 */
public final class InMemoryProofStore implements ProofStore {

    private final Map<Long, Proof> proofs = new HashMap<>();

    public synchronized void attest(long proofId, Proof proof) {
        Objects.requireNonNull(proof, "proof");
        Proof existing = proofs.putIfAbsent(proofId, proof);
        if (existing != null && !existing.equals(proof)) {
            throw new IllegalArgumentException("Proof " + proofId + " already attested");
        }
    }

    @Override
    public synchronized Optional<Proof> getProof(long proofId) {
        return Optional.ofNullable(proofs.get(proofId));
    }
}
