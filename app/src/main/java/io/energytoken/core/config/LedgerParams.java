package io.energytoken.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.energytoken.core.protocol.Address;
import io.energytoken.core.protocol.ProtocolLimits;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Protocol constants and genesis principals for one ledger instance.
 * Immutable; use the {@code with*} copies to override individual values.
 */
public final class LedgerParams {
    public final long feeBps;
    public final long expiryBlocks;
    public final long maxPerProof;
    public final long maxSupply;
    public final int historyLimit;
    public final HistoryOverflowPolicy historyOverflow;

    // genesis configuration
    public final String owner;
    public final String attester;
    public final String registry;
    public final String feeRecipient;

    public LedgerParams(long feeBps, long expiryBlocks, long maxPerProof, long maxSupply,
                        int historyLimit, HistoryOverflowPolicy historyOverflow,
                        String owner, String attester, String registry, String feeRecipient) {
        this.feeBps = feeBps;
        this.expiryBlocks = expiryBlocks;
        this.maxPerProof = maxPerProof;
        this.maxSupply = maxSupply;
        this.historyLimit = historyLimit;
        this.historyOverflow = historyOverflow;
        this.owner = owner;
        this.attester = attester;
        this.registry = registry;
        this.feeRecipient = feeRecipient;
        validate();
    }

    public static LedgerParams defaultLocal() {
        return new LedgerParams(
                ProtocolLimits.DEFAULT_FEE_BPS,
                ProtocolLimits.DEFAULT_EXPIRY_BLOCKS,
                ProtocolLimits.DEFAULT_MAX_PER_PROOF,
                ProtocolLimits.DEFAULT_MAX_SUPPLY,
                ProtocolLimits.DEFAULT_HISTORY_LIMIT,
                HistoryOverflowPolicy.REJECT,
                "ST1OWNER",
                "ST1ORACLE",
                "ST1REGISTRY",
                "ST1OWNER"     // fees go to the owner until changed
        );
    }

    /**
     * Read overrides from a JSON file; keys that are absent keep their
     * {@link #defaultLocal()} value and unknown keys are ignored.
     */
    public static LedgerParams load(Path file) throws IOException {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        ParamsFile f;
        try (var in = Files.newInputStream(file)) {
            f = mapper.readValue(in, ParamsFile.class);
        }
        LedgerParams d = defaultLocal();
        if (f == null) {
            return d;
        }
        return new LedgerParams(
                f.feeBps != null ? f.feeBps : d.feeBps,
                f.expiryBlocks != null ? f.expiryBlocks : d.expiryBlocks,
                f.maxPerProof != null ? f.maxPerProof : d.maxPerProof,
                f.maxSupply != null ? f.maxSupply : d.maxSupply,
                f.historyLimit != null ? f.historyLimit : d.historyLimit,
                f.historyOverflow != null ? f.historyOverflow : d.historyOverflow,
                f.owner != null ? f.owner : d.owner,
                f.attester != null ? f.attester : d.attester,
                f.registry != null ? f.registry : d.registry,
                f.feeRecipient != null ? f.feeRecipient : d.feeRecipient
        );
    }

    public LedgerParams withGenesis(String owner, String attester, String registry, String feeRecipient) {
        return new LedgerParams(feeBps, expiryBlocks, maxPerProof, maxSupply, historyLimit, historyOverflow,
                owner, attester, registry, feeRecipient);
    }

    public LedgerParams withHistory(int historyLimit, HistoryOverflowPolicy historyOverflow) {
        return new LedgerParams(feeBps, expiryBlocks, maxPerProof, maxSupply, historyLimit, historyOverflow,
                owner, attester, registry, feeRecipient);
    }

    public LedgerParams withMaxSupply(long maxSupply) {
        return new LedgerParams(feeBps, expiryBlocks, maxPerProof, maxSupply, historyLimit, historyOverflow,
                owner, attester, registry, feeRecipient);
    }

    public LedgerParams withFeeBps(long feeBps) {
        return new LedgerParams(feeBps, expiryBlocks, maxPerProof, maxSupply, historyLimit, historyOverflow,
                owner, attester, registry, feeRecipient);
    }

    /** The genesis configuration record these params describe. */
    public LedgerConfig genesisConfig() {
        return LedgerConfig.genesis(owner, attester, registry, feeRecipient);
    }

    private void validate() {
        if (feeBps < 0 || feeBps >= ProtocolLimits.BPS_DENOMINATOR) {
            throw new IllegalArgumentException("feeBps must be in [0, " + ProtocolLimits.BPS_DENOMINATOR + ")");
        }
        if (expiryBlocks < 0) throw new IllegalArgumentException("expiryBlocks must be >= 0");
        if (maxPerProof <= 0) throw new IllegalArgumentException("maxPerProof must be > 0");
        if (maxSupply <= 0) throw new IllegalArgumentException("maxSupply must be > 0");
        if (historyLimit <= 0) throw new IllegalArgumentException("historyLimit must be > 0");
        if (historyOverflow == null) throw new IllegalArgumentException("historyOverflow required");
        requireAddress("owner", owner);
        requireAddress("attester", attester);
        requireAddress("registry", registry);
        requireAddress("feeRecipient", feeRecipient);
    }

    private static void requireAddress(String field, String value) {
        if (!Address.isValid(value)) {
            throw new IllegalArgumentException("Invalid " + field + " address: " + value);
        }
    }

    /** JSON shape of a params file; every field optional. */
    public static class ParamsFile {
        public Long feeBps;
        public Long expiryBlocks;
        public Long maxPerProof;
        public Long maxSupply;
        public Integer historyLimit;
        public HistoryOverflowPolicy historyOverflow;
        public String owner;
        public String attester;
        public String registry;
        public String feeRecipient;
    }
}
