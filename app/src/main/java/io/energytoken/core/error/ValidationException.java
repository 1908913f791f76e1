package io.energytoken.core.error;

/** Malformed, zero or out-of-range input; self-transfers and self-handover. */
public class ValidationException extends LedgerException {
    public ValidationException(ErrorCode code, String message) {
        super(code, message);
    }
}
