package io.energytoken.core.error;

/** Issuance would exceed the hard supply cap. */
public class SupplyException extends LedgerException {
    public SupplyException(ErrorCode code, String message) {
        super(code, message);
    }
}
