package io.energytoken.core.protocol;

public final class ProtocolLimits {
    private ProtocolLimits(){}

    public static final long BPS_DENOMINATOR = 10_000L;
    public static final long DEFAULT_FEE_BPS = 100L;                    // 1%
    public static final long DEFAULT_EXPIRY_BLOCKS = 144L;              // ~1 day of blocks
    public static final long DEFAULT_MAX_PER_PROOF = 1_000_000L;
    public static final long DEFAULT_MAX_SUPPLY = 1_000_000_000_000L;
    public static final int DEFAULT_HISTORY_LIMIT = 100;

    public static final int MAX_ADDRESS_LEN = 128;         // sanity cap
    public static final int MIN_ADDRESS_LEN = 3;
}
