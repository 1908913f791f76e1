package io.energytoken.core.config;

import java.util.Objects;

/**
 * Versioned, immutable ledger configuration. Every owner command produces a new record
 * with {@code version + 1}; nothing mutates a record in place.
 */
public final class LedgerConfig {

    private final String owner;
    private final boolean paused;
    private final String attester;
    private final String registry;
    private final String feeRecipient;
    private final long version;

    public LedgerConfig(String owner, boolean paused, String attester, String registry, String feeRecipient, long version) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.paused = paused;
        this.attester = Objects.requireNonNull(attester, "attester");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.feeRecipient = Objects.requireNonNull(feeRecipient, "feeRecipient");
        this.version = version;
    }

    /** Genesis record: unpaused, version 0. */
    public static LedgerConfig genesis(String owner, String attester, String registry, String feeRecipient) {
        return new LedgerConfig(owner, false, attester, registry, feeRecipient, 0L);
    }

    public String owner() { return owner; }
    public boolean paused() { return paused; }
    public String attester() { return attester; }
    public String registry() { return registry; }
    public String feeRecipient() { return feeRecipient; }
    public long version() { return version; }

    public LedgerConfig withOwner(String newOwner) {
        return new LedgerConfig(newOwner, paused, attester, registry, feeRecipient, version + 1);
    }

    public LedgerConfig withPaused(boolean newPaused) {
        return new LedgerConfig(owner, newPaused, attester, registry, feeRecipient, version + 1);
    }

    public LedgerConfig withAttester(String newAttester) {
        return new LedgerConfig(owner, paused, newAttester, registry, feeRecipient, version + 1);
    }

    public LedgerConfig withRegistry(String newRegistry) {
        return new LedgerConfig(owner, paused, attester, newRegistry, feeRecipient, version + 1);
    }

    public LedgerConfig withFeeRecipient(String newFeeRecipient) {
        return new LedgerConfig(owner, paused, attester, registry, newFeeRecipient, version + 1);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LedgerConfig)) return false;
        LedgerConfig other = (LedgerConfig) o;
        return paused == other.paused
                && version == other.version
                && owner.equals(other.owner)
                && attester.equals(other.attester)
                && registry.equals(other.registry)
                && feeRecipient.equals(other.feeRecipient);
    }

    @Override public int hashCode() {
        return Objects.hash(owner, paused, attester, registry, feeRecipient, version);
    }

    @Override public String toString() {
        return "LedgerConfig{v" + version + ", owner=" + owner + ", paused=" + paused
                + ", attester=" + attester + ", registry=" + registry + ", feeRecipient=" + feeRecipient + "}";
    }
}
