package io.energytoken.core.error;

/** Missing, expired, foreign or exhausted claim. */
public class ProofException extends LedgerException {
    public ProofException(ErrorCode code, String message) {
        super(code, message);
    }
}
