package io.energytoken.core.external;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Binds principal addresses to the external services deployed there. The ledger
 * configuration names an attester and a registry address; the directory resolves
 * those names to the instances the minter actually calls.
 */
public final class ContractDirectory {

    private final Map<String, ProofStore> proofStores = new HashMap<>();
    private final Map<String, ProducerRegistry> registries = new HashMap<>();

    public synchronized ContractDirectory bindProofStore(String address, ProofStore store) {
        proofStores.put(requireAddress(address), Objects.requireNonNull(store, "store"));
        return this;
    }

    public synchronized ContractDirectory bindRegistry(String address, ProducerRegistry registry) {
        registries.put(requireAddress(address), Objects.requireNonNull(registry, "registry"));
        return this;
    }

    public synchronized Optional<ProofStore> proofStore(String address) {
        return Optional.ofNullable(proofStores.get(address));
    }

    public synchronized Optional<ProducerRegistry> registry(String address) {
        return Optional.ofNullable(registries.get(address));
    }

    private static String requireAddress(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Address required");
        }
        return address;
    }
}
