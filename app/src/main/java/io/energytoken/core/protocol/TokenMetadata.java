package io.energytoken.core.protocol;

/** Static token metadata. */
public final class TokenMetadata {
    private TokenMetadata(){}

    public static final String NAME = "ExcessEnergyToken";
    public static final String SYMBOL = "EET";
    public static final int DECIMALS = 6;
    public static final String TOKEN_URI = "https://example.com/eet-metadata.json";
}
