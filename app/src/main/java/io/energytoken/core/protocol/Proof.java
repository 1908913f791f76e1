package io.energytoken.core.protocol;

import java.util.Objects;

/**
 * Attested claim that a producer generated {@code excessOutput} units at a given block height.
 * Owned by the proof store; the ledger only reads it.
 */
public final class Proof {

    private final long excessOutput;
    private final long attestedAt;
    private final String producerId;

    public Proof(long excessOutput, long attestedAt, String producerId) {
        this.excessOutput = excessOutput;
        this.attestedAt = attestedAt;
        this.producerId = producerId;
        basicValidate();
    }

    public long excessOutput() { return excessOutput; }
    public long attestedAt() { return attestedAt; }
    public String producerId() { return producerId; }

    /** Blocks elapsed between attestation and {@code height}. */
    public long ageAt(long height) {
        return height - attestedAt;
    }

    public void basicValidate() {
        if (excessOutput < 0) throw new IllegalArgumentException("excessOutput must be >= 0");
        if (attestedAt < 0) throw new IllegalArgumentException("attestedAt must be >= 0");
        if (producerId == null || producerId.isBlank()) throw new IllegalArgumentException("Missing producer");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Proof)) return false;
        Proof other = (Proof) o;
        return excessOutput == other.excessOutput
                && attestedAt == other.attestedAt
                && producerId.equals(other.producerId);
    }

    @Override public int hashCode() {
        return Objects.hash(excessOutput, attestedAt, producerId);
    }

    @Override public String toString() {
        return "Proof{excessOutput=" + excessOutput + ", attestedAt=" + attestedAt + ", producer=" + producerId + "}";
    }
}
