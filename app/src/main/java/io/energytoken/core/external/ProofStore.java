package io.energytoken.core.external;

import io.energytoken.core.protocol.Proof;

import java.util.Optional;

/**
 * Attestation service that publishes proofs of producer output. Trusted: the ledger takes
 * whatever it returns at face value.
 */
public interface ProofStore {
    Optional<Proof> getProof(long proofId);
}
