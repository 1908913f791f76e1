package io.energytoken.core.error;

/** Insufficient balance, or the fee could not be settled. */
public class TransferException extends LedgerException {
    public TransferException(ErrorCode code, String message) {
        super(code, message);
    }

    public TransferException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
