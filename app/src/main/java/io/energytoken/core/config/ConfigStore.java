package io.energytoken.core.config;

import io.energytoken.core.error.AuthorizationException;
import io.energytoken.core.error.ErrorCode;
import io.energytoken.core.error.LedgerException;
import io.energytoken.core.error.ValidationException;
import io.energytoken.core.metrics.LedgerMetrics;
import io.energytoken.core.protocol.Address;
import io.energytoken.core.state.StateBatch;
import io.energytoken.core.state.StateStore;

import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Owner-gated access to the ledger configuration record.
 * <p>
 * Every command checks {@code caller == owner}, writes exactly one field through a new
 * {@link LedgerConfig} version and has no other side effect. Commands serialize on the
 * state store monitor together with all balance-affecting operations. None of them is
 * blocked by the pause flag, otherwise a paused ledger could never be unpaused.
 */
public final class ConfigStore {
    private static final Logger LOG = Logger.getLogger(ConfigStore.class.getName());

    private final StateStore state;

    public ConfigStore(StateStore state) {
        this.state = state;
    }

    /** Current configuration. Fails if genesis was never written. */
    public LedgerConfig current() {
        return state.getConfig()
                .orElseThrow(() -> new IllegalStateException("Ledger configuration not initialized"));
    }

    public LedgerConfig getConfig() {
        return current();
    }

    public boolean isPaused() {
        return current().paused();
    }

    public String getOwner() {
        return current().owner();
    }

    public boolean pause(String caller) {
        return apply("pause", caller, cfg -> cfg.withPaused(true));
    }

    public boolean unpause(String caller) {
        return apply("unpause", caller, cfg -> cfg.withPaused(false));
    }

    public boolean setFeeRecipient(String recipient, String caller) {
        return apply("setFeeRecipient", caller, cfg -> cfg.withFeeRecipient(requireAddress(recipient, ErrorCode.INVALID_RECIPIENT)));
    }

    public boolean setAttester(String attester, String caller) {
        return apply("setAttester", caller, cfg -> cfg.withAttester(requireAddress(attester, ErrorCode.INVALID_RECIPIENT)));
    }

    public boolean setRegistry(String registry, String caller) {
        return apply("setRegistry", caller, cfg -> cfg.withRegistry(requireAddress(registry, ErrorCode.INVALID_RECIPIENT)));
    }

    public boolean transferOwnership(String newOwner, String caller) {
        return apply("transferOwnership", caller, cfg -> {
            if (caller.equals(newOwner)) {
                throw new ValidationException(ErrorCode.INVALID_OWNER, "new owner must differ from current owner");
            }
            return cfg.withOwner(requireAddress(newOwner, ErrorCode.INVALID_OWNER));
        });
    }

    private boolean apply(String command, String caller, UnaryOperator<LedgerConfig> change) {
        synchronized (state) {
            try {
                LedgerConfig cfg = current();
                if (caller == null || !caller.equals(cfg.owner())) {
                    throw new AuthorizationException(ErrorCode.NOT_AUTHORIZED, command + " requires the owner");
                }
                LedgerConfig next = change.apply(cfg);
                state.commit(new StateBatch().putConfig(next));
                LOG.info(command + " by " + caller + " -> " + next);
                return true;
            } catch (LedgerException e) {
                LOG.fine(command + " rejected: " + e);
                LedgerMetrics.recordRejection(command, e.code());
                throw e;
            }
        }
    }

    private static String requireAddress(String address, ErrorCode code) {
        if (!Address.isValid(address)) {
            throw new ValidationException(code, "malformed address: " + address);
        }
        return address;
    }
}
