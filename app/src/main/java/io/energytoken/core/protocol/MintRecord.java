package io.energytoken.core.protocol;

/**
 * Cumulative issuance against one proof. Created on the first successful mint and
 * replaced (never removed) on every later one.
 */
public final class MintRecord {

    private final long cumulativeMinted;
    private final long lastMintHeight;

    public MintRecord(long cumulativeMinted, long lastMintHeight) {
        if (cumulativeMinted < 0) throw new IllegalArgumentException("cumulativeMinted must be >= 0");
        if (lastMintHeight < 0) throw new IllegalArgumentException("lastMintHeight must be >= 0");
        this.cumulativeMinted = cumulativeMinted;
        this.lastMintHeight = lastMintHeight;
    }

    public static MintRecord empty() {
        return new MintRecord(0L, 0L);
    }

    public long cumulativeMinted() { return cumulativeMinted; }
    public long lastMintHeight() { return lastMintHeight; }

    /** Record after minting {@code net} more units at {@code height}. */
    public MintRecord plus(long net, long height) {
        return new MintRecord(Math.addExact(cumulativeMinted, net), height);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MintRecord)) return false;
        MintRecord other = (MintRecord) o;
        return cumulativeMinted == other.cumulativeMinted && lastMintHeight == other.lastMintHeight;
    }

    @Override public int hashCode() {
        return Long.hashCode(cumulativeMinted) * 31 + Long.hashCode(lastMintHeight);
    }

    @Override public String toString() {
        return "MintRecord{minted=" + cumulativeMinted + ", lastMintHeight=" + lastMintHeight + "}";
    }
}
