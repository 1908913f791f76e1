package io.energytoken.core.error;

/**
 * Stable numeric codes surfaced to callers and indexers.
 */
public enum ErrorCode {
    NOT_REGISTERED(200),
    INSUFFICIENT_PROOF(201),
    INVALID_AMOUNT(202),
    SUPPLY_EXCEEDED(203),
    NOT_AUTHORIZED(204),
    PAUSED(205),
    HISTORY_FULL(206),
    INVALID_PROOF_ID(207),
    BURN_FAILED(208),
    TRANSFER_FAILED(209),
    SETTLEMENT_FAILED(210),
    INVALID_RECIPIENT(211),
    ZERO_AMOUNT(212),
    INVALID_OWNER(213);

    private final int code;

    ErrorCode(int code) {
        this.code = code;
    }

    public int code() { return code; }
}
