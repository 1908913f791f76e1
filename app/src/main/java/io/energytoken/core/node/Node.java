package io.energytoken.core.node;

import io.energytoken.core.config.ConfigStore;
import io.energytoken.core.config.LedgerParams;
import io.energytoken.core.events.EventLog;
import io.energytoken.core.external.ContractDirectory;
import io.energytoken.core.external.InMemoryProducerRegistry;
import io.energytoken.core.external.InMemoryProofStore;
import io.energytoken.core.external.RecordingSettlementRail;
import io.energytoken.core.external.SettlementRail;
import io.energytoken.core.ledger.Ledger;
import io.energytoken.core.mint.Minter;
import io.energytoken.core.state.InMemoryStateStore;
import io.energytoken.core.state.StateAudit;
import io.energytoken.core.state.StateStore;
import io.energytoken.core.storage.RocksDBStateStore;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires state, configuration, external services, ledger and minter.
 * Start once, then call tick() for every block the host chain produces.
 * <p>
 * A node carries a local proof store and producer registry bound at the genesis attester
 * and registry addresses; hosts can bind other implementations through {@link #contracts()}.
 */
public final class Node {
    private static final Logger LOG = Logger.getLogger(Node.class.getName());

    private final StateStore state;
    private final LedgerParams params;
    private final ChainClock clock;
    private final ContractDirectory contracts;
    private final InMemoryProofStore localProofs;
    private final InMemoryProducerRegistry localProducers;
    private final SettlementRail settlement;
    private final EventLog events;
    private final ConfigStore config;
    private final Ledger ledger;
    private final Minter minter;

    public Node(StateStore state, SettlementRail settlement, LedgerParams params, long startHeight) {
        this.state = state;
        this.params = params;
        this.settlement = settlement;
        this.clock = new ChainClock(startHeight);
        this.localProofs = new InMemoryProofStore();
        this.localProducers = new InMemoryProducerRegistry();
        this.contracts = new ContractDirectory()
                .bindProofStore(params.attester, localProofs)
                .bindRegistry(params.registry, localProducers);
        this.events = new EventLog();
        this.config = new ConfigStore(state);
        this.ledger = new Ledger(state, config, events, clock);
        this.minter = new Minter(state, config, contracts, settlement, ledger, events, clock, params);
    }

    /** Convenience factory for an in-memory local node. */
    public static Node inMemory(LedgerParams params) {
        return new Node(new InMemoryStateStore(), new RecordingSettlementRail(), params, 0L);
    }

    /** Convenience factory for a RocksDB-backed node. */
    public static Node rocks(LedgerParams params, String dataDir, SettlementRail settlement, long startHeight) {
        return new Node(RocksDBStateStore.open(dataDir), settlement, params, startHeight);
    }

    /** Ensure genesis exists and audit the loaded state. Safe to call multiple times. */
    public void start() {
        if (!GenesisBuilder.initIfNeeded(state, params)) {
            LOG.info("Loaded existing ledger state: " + config.current());
        }
        List<String> problems = StateAudit.check(state, params.maxSupply);
        if (!problems.isEmpty()) {
            LOG.warning("Ledger state audit found " + problems.size() + " problem(s): " + String.join("; ", problems));
        }
    }

    /** Advance one block; returns the new height. */
    public long tick() {
        return clock.advance();
    }

    public long height() {
        return clock.currentHeight();
    }

    /** Close underlying resources if any (e.g., RocksDB). */
    public void close() {
        if (state instanceof AutoCloseable) {
            try {
                ((AutoCloseable) state).close();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Failed to close state store", e);
            }
        }
    }

    public StateStore state() { return state; }
    public LedgerParams params() { return params; }
    public ChainClock clock() { return clock; }
    public ContractDirectory contracts() { return contracts; }
    public InMemoryProofStore proofs() { return localProofs; }
    public InMemoryProducerRegistry producers() { return localProducers; }
    public SettlementRail settlement() { return settlement; }
    public EventLog events() { return events; }
    public ConfigStore config() { return config; }
    public Ledger ledger() { return ledger; }
    public Minter minter() { return minter; }
}
