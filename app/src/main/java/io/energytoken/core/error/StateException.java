package io.energytoken.core.error;

/** Operation blocked by the ledger's pause flag. */
public class StateException extends LedgerException {
    public StateException(ErrorCode code, String message) {
        super(code, message);
    }
}
