package io.energytoken.core.node;

import io.energytoken.core.config.LedgerConfig;
import io.energytoken.core.config.LedgerParams;
import io.energytoken.core.state.StateBatch;
import io.energytoken.core.state.StateStore;

import java.util.logging.Logger;

/**
 * Writes the genesis configuration record:
 * - owner, attester, registry and fee recipient from the params
 * - unpaused, version 0
 * - no balances, zero supply
 */
public final class GenesisBuilder {
    private static final Logger LOG = Logger.getLogger(GenesisBuilder.class.getName());

    private GenesisBuilder(){}

    /**
     * If the store has no configuration yet, write the genesis record.
     * Idempotent: an existing configuration is left untouched.
     *
     * @return true if genesis was written by this call
     */
    public static boolean initIfNeeded(StateStore state, LedgerParams params) {
        synchronized (state) {
            if (state.getConfig().isPresent()) return false;
            LedgerConfig genesis = params.genesisConfig();
            state.commit(new StateBatch()
                    .putConfig(genesis)
                    .putTotalSupply(0L)
                    .putTotalMinted(0L));
            LOG.info("Genesis written: " + genesis);
            return true;
        }
    }
}
