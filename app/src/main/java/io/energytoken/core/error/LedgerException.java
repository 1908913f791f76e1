package io.energytoken.core.error;

import java.util.Objects;

/**
 * Base class for rejected ledger operations. A rejection never leaves partial state behind.
 */
public abstract class LedgerException extends RuntimeException {

    private final ErrorCode code;

    protected LedgerException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    protected LedgerException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode code() { return code; }

    @Override public String toString() {
        return getClass().getSimpleName() + "[" + code + "/" + code.code() + "]: " + getMessage();
    }
}
