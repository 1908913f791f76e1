package io.energytoken.core.error;

/** Caller lacks the role or ownership an operation requires. */
public class AuthorizationException extends LedgerException {
    public AuthorizationException(ErrorCode code, String message) {
        super(code, message);
    }
}
