package io.energytoken.core.ledger;

import io.energytoken.core.config.ConfigStore;
import io.energytoken.core.error.AuthorizationException;
import io.energytoken.core.error.ErrorCode;
import io.energytoken.core.error.LedgerException;
import io.energytoken.core.error.StateException;
import io.energytoken.core.error.TransferException;
import io.energytoken.core.error.ValidationException;
import io.energytoken.core.events.BurnEvent;
import io.energytoken.core.events.EventLog;
import io.energytoken.core.events.TransferEvent;
import io.energytoken.core.metrics.LedgerMetrics;
import io.energytoken.core.protocol.Address;
import io.energytoken.core.protocol.BlockClock;
import io.energytoken.core.protocol.TokenMetadata;
import io.energytoken.core.state.StateBatch;
import io.energytoken.core.state.StateStore;

import java.util.logging.Logger;

/**
 * Token balances and total supply. Holder-initiated operations (transfer, burn) live here;
 * issuance goes through the Minter.
 */
public final class Ledger {
    private static final Logger LOG = Logger.getLogger(Ledger.class.getName());

    private final StateStore state;
    private final ConfigStore config;
    private final EventLog events;
    private final BlockClock clock;

    public Ledger(StateStore state, ConfigStore config, EventLog events, BlockClock clock) {
        this.state = state;
        this.config = config;
        this.events = events;
        this.clock = clock;
    }

    public long getBalance(String account) {
        return state.getBalance(account);
    }

    public long getTotalSupply() {
        return state.getTotalSupply();
    }

    public long getTotalMinted() {
        return state.getTotalMinted();
    }

    public String getName() { return TokenMetadata.NAME; }
    public String getSymbol() { return TokenMetadata.SYMBOL; }
    public int getDecimals() { return TokenMetadata.DECIMALS; }
    public String getTokenUri() { return TokenMetadata.TOKEN_URI; }

    /**
     * Move {@code amount} from {@code sender} to {@code recipient}. Only the sender may move
     * its own balance; there are no delegated allowances.
     */
    public boolean transfer(long amount, String sender, String recipient, String caller) {
        synchronized (state) {
            try {
                requireNotPaused("transfer");
                if (caller == null || !caller.equals(sender)) {
                    throw new AuthorizationException(ErrorCode.NOT_AUTHORIZED, "caller may only transfer its own balance");
                }
                if (amount <= 0) {
                    throw new ValidationException(ErrorCode.ZERO_AMOUNT, "amount must be > 0");
                }
                if (!Address.isValid(recipient) || recipient.equals(sender)) {
                    throw new ValidationException(ErrorCode.INVALID_RECIPIENT, "invalid recipient: " + recipient);
                }
                long senderBal = state.getBalance(sender);
                if (senderBal < amount) {
                    throw new TransferException(ErrorCode.TRANSFER_FAILED, "insufficient balance: " + senderBal + " < " + amount);
                }
                long recipientBal = state.getBalance(recipient);
                StateBatch batch = new StateBatch()
                        .putBalance(sender, senderBal - amount)
                        .putBalance(recipient, Math.addExact(recipientBal, amount));
                state.commit(batch);

                long height = clock.currentHeight();
                events.emit(new TransferEvent(height, amount, sender, recipient));
                LedgerMetrics.recordTransfer();
                LOG.info("transfer " + amount + " " + sender + " -> " + recipient + " at height " + height);
                return true;
            } catch (LedgerException e) {
                rejected("transfer", e);
                throw e;
            }
        }
    }

    /** Destroy {@code amount} of the caller's tokens. Proof capacity is never given back. */
    public long burn(long amount, String caller) {
        synchronized (state) {
            try {
                requireNotPaused("burn");
                if (amount <= 0) {
                    throw new ValidationException(ErrorCode.ZERO_AMOUNT, "amount must be > 0");
                }
                long balance = state.getBalance(caller);
                if (balance < amount) {
                    throw new TransferException(ErrorCode.BURN_FAILED, "insufficient balance: " + balance + " < " + amount);
                }
                StateBatch batch = new StateBatch()
                        .putBalance(caller, balance - amount)
                        .putTotalSupply(state.getTotalSupply() - amount);
                state.commit(batch);

                long height = clock.currentHeight();
                events.emit(new BurnEvent(height, amount, caller));
                LedgerMetrics.recordBurn();
                LOG.info("burn " + amount + " by " + caller + " at height " + height);
                return amount;
            } catch (LedgerException e) {
                rejected("burn", e);
                throw e;
            }
        }
    }

    private void requireNotPaused(String operation) {
        if (config.isPaused()) {
            throw new StateException(ErrorCode.PAUSED, operation + " blocked: ledger is paused");
        }
    }

    private static void rejected(String operation, LedgerException e) {
        LOG.fine(operation + " rejected: " + e);
        LedgerMetrics.recordRejection(operation, e.code());
    }
}
