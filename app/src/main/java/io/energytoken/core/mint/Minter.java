package io.energytoken.core.mint;

import io.energytoken.core.config.ConfigStore;
import io.energytoken.core.config.LedgerConfig;
import io.energytoken.core.config.LedgerParams;
import io.energytoken.core.error.AuthorizationException;
import io.energytoken.core.error.ErrorCode;
import io.energytoken.core.error.LedgerException;
import io.energytoken.core.error.ProofException;
import io.energytoken.core.error.StateException;
import io.energytoken.core.error.SupplyException;
import io.energytoken.core.error.TransferException;
import io.energytoken.core.error.ValidationException;
import io.energytoken.core.events.EventLog;
import io.energytoken.core.events.MintEvent;
import io.energytoken.core.external.ContractDirectory;
import io.energytoken.core.external.ProducerRegistry;
import io.energytoken.core.external.SettlementRail;
import io.energytoken.core.ledger.Ledger;
import io.energytoken.core.metrics.LedgerMetrics;
import io.energytoken.core.protocol.BlockClock;
import io.energytoken.core.protocol.MintRecord;
import io.energytoken.core.protocol.Proof;
import io.energytoken.core.state.StateBatch;
import io.energytoken.core.state.StateStore;

import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Issues tokens against attested proofs.
 * <p>
 * A mint is validated in a fixed order and fails on the first broken rule, leaving no trace:
 * <ol>
 *   <li>ledger not paused ({@link StateException})</li>
 *   <li>caller is a registered producer ({@link AuthorizationException})</li>
 *   <li>the proof exists ({@link ProofException})</li>
 *   <li>fee and net are computed: {@code fee = floor(amount * feeBps / 10000)}</li>
 *   <li>the proof belongs to the caller, {@code 0 < net <= maxPerProof}, the proof is not
 *       older than the expiry window and has at least {@code net} capacity left
 *       ({@link ProofException})</li>
 *   <li>{@code totalMinted + net <= maxSupply} ({@link SupplyException})</li>
 *   <li>the caller's mint history can take one more entry ({@link ValidationException})</li>
 * </ol>
 * Then balance, supply, mint record and history are committed in one batch and the fee is
 * settled on the {@link SettlementRail}. If settlement fails, a second batch restores the
 * prior values and the mint is refused.
 * <p>
 * All mutations serialize on the state store monitor, which {@link Ledger} and
 * {@link ConfigStore} share, so two mints can never validate the same proof's record
 * concurrently.
 */
public final class Minter {
    private static final Logger LOG = Logger.getLogger(Minter.class.getName());

    private final StateStore state;
    private final ConfigStore config;
    private final ContractDirectory contracts;
    private final SettlementRail settlement;
    private final Ledger ledger;
    private final MintRegistry registry;
    private final MintHistory history;
    private final EventLog events;
    private final BlockClock clock;
    private final FeeSchedule fees;
    private final long expiryBlocks;
    private final long maxPerProof;
    private final long maxSupply;

    public Minter(StateStore state, ConfigStore config, ContractDirectory contracts, SettlementRail settlement,
                  Ledger ledger, EventLog events, BlockClock clock, LedgerParams params) {
        this.state = state;
        this.config = config;
        this.contracts = contracts;
        this.settlement = settlement;
        this.ledger = ledger;
        this.events = events;
        this.clock = clock;
        this.registry = new MintRegistry(state);
        this.history = new MintHistory(state, params.historyLimit, params.historyOverflow);
        this.fees = new FeeSchedule(params.feeBps);
        this.expiryBlocks = params.expiryBlocks;
        this.maxPerProof = params.maxPerProof;
        this.maxSupply = params.maxSupply;
    }

    /**
     * Mint against {@code proofId} on behalf of {@code caller}.
     *
     * @param amount gross amount; the fee is taken out of it
     * @return net amount credited to the caller
     */
    public long mint(long amount, long proofId, String caller) {
        synchronized (state) {
            try {
                return doMint(amount, proofId, caller);
            } catch (LedgerException e) {
                LOG.fine("mint rejected: " + e);
                LedgerMetrics.recordRejection("mint", e.code());
                throw e;
            }
        }
    }

    /** Same as {@link Ledger#burn(long, String)}; burning never frees proof capacity. */
    public long burn(long amount, String caller) {
        return ledger.burn(amount, caller);
    }

    private long doMint(long amount, long proofId, String caller) {
        if (amount < 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "amount must be >= 0");
        }
        LedgerConfig cfg = config.current();

        // 1) pause
        if (cfg.paused()) {
            throw new StateException(ErrorCode.PAUSED, "mint blocked: ledger is paused");
        }

        // 2) producer registration
        Optional<ProducerRegistry> producers = contracts.registry(cfg.registry());
        if (producers.isEmpty() || !producers.get().isRegistered(caller)) {
            throw new AuthorizationException(ErrorCode.NOT_REGISTERED, "not a registered producer: " + caller);
        }

        // 3) proof lookup
        Proof proof = lookupProof(cfg, proofId);

        // 4) fee split
        long fee = fees.feeOf(amount);
        long net = amount - fee;

        // 5) proof sufficiency
        long height = clock.currentHeight();
        MintRecord prior = registry.recordOrEmpty(proofId);
        if (!proof.producerId().equals(caller)) {
            throw insufficient(proofId, "attested for " + proof.producerId());
        }
        if (net <= 0) {
            throw insufficient(proofId, "net amount is zero");
        }
        if (net > maxPerProof) {
            throw insufficient(proofId, "net " + net + " exceeds per-proof cap " + maxPerProof);
        }
        long age = proof.ageAt(height);
        if (age < 0) {
            throw insufficient(proofId, "attested in the future (height " + proof.attestedAt() + ")");
        }
        if (age > expiryBlocks) {
            throw insufficient(proofId, "expired " + (age - expiryBlocks) + " blocks ago");
        }
        long remaining = proof.excessOutput() - prior.cumulativeMinted();
        if (remaining < net) {
            throw insufficient(proofId, "remaining capacity " + remaining + " < net " + net);
        }

        // 6) supply cap
        long totalMinted = state.getTotalMinted();
        if (net > maxSupply - totalMinted) {
            throw new SupplyException(ErrorCode.SUPPLY_EXCEEDED,
                    "minting " + net + " would exceed max supply " + maxSupply);
        }

        // 7) history room
        List<Long> nextHistory = history.appended(caller, proofId);

        long priorBalance = state.getBalance(caller);
        long priorSupply = state.getTotalSupply();
        StateBatch batch = new StateBatch()
                .putBalance(caller, Math.addExact(priorBalance, net))
                .putTotalSupply(Math.addExact(priorSupply, net))
                .putTotalMinted(totalMinted + net)
                .putMintRecord(proofId, prior.plus(net, height))
                .putMintHistory(caller, nextHistory);

        // absolute prior values; applied only if the fee cannot be settled
        StateBatch undo = new StateBatch()
                .putBalance(caller, priorBalance)
                .putTotalSupply(priorSupply)
                .putTotalMinted(totalMinted)
                .putMintHistory(caller, state.getMintHistory(caller));
        Optional<MintRecord> priorRecord = registry.getMintRecord(proofId);
        if (priorRecord.isPresent()) {
            undo.putMintRecord(proofId, priorRecord.get());
        } else {
            undo.removeMintRecord(proofId);
        }

        state.commit(batch);
        if (fee > 0) {
            try {
                settlement.transfer(fee, caller, cfg.feeRecipient());
            } catch (RuntimeException e) {
                revert(undo, proofId);
                throw new TransferException(ErrorCode.SETTLEMENT_FAILED,
                        "fee settlement of " + fee + " to " + cfg.feeRecipient() + " failed", e);
            }
        }

        events.emit(new MintEvent(height, net, fee, proofId, caller));
        LedgerMetrics.recordMint(net, fee);
        LOG.info("mint " + net + " (fee " + fee + ") to " + caller + " against proof " + proofId + " at height " + height);
        return net;
    }

    /**
     * Capacity left on {@code proofId}: {@code max(0, excessOutput - cumulativeMinted)}.
     * Does not consider expiry or ownership.
     */
    public long getMintableAmount(long proofId) {
        synchronized (state) {
            Proof proof = lookupProof(config.current(), proofId);
            return registry.remainingCapacity(proofId, proof);
        }
    }

    /** Capacity, minted flag and record of {@code proofId}, read in one step. */
    public ProofStatus getProofStatus(long proofId) {
        synchronized (state) {
            Proof proof = lookupProof(config.current(), proofId);
            return new ProofStatus(proofId, registry.remainingCapacity(proofId, proof),
                    registry.getMintRecord(proofId));
        }
    }

    public boolean isProofMinted(long proofId) {
        return registry.isProofMinted(proofId);
    }

    public Optional<MintRecord> getMintRecord(long proofId) {
        return registry.getMintRecord(proofId);
    }

    public List<Long> getMintHistory(String account) {
        return history.getMintHistory(account);
    }

    private void revert(StateBatch undo, long proofId) {
        try {
            state.commit(undo);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "could not revert mint against proof " + proofId + " after failed fee settlement", e);
            throw e;
        }
    }

    private Proof lookupProof(LedgerConfig cfg, long proofId) {
        return contracts.proofStore(cfg.attester())
                .flatMap(store -> store.getProof(proofId))
                .orElseThrow(() -> new ProofException(ErrorCode.INVALID_PROOF_ID, "unknown proof " + proofId));
    }

    private static ProofException insufficient(long proofId, String reason) {
        return new ProofException(ErrorCode.INSUFFICIENT_PROOF, "insufficient proof " + proofId + ": " + reason);
    }
}
