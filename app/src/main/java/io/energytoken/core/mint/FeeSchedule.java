package io.energytoken.core.mint;

import io.energytoken.core.error.ErrorCode;
import io.energytoken.core.error.ValidationException;
import io.energytoken.core.protocol.ProtocolLimits;

/** Issuance fee in basis points, rounded down. */
public final class FeeSchedule {

    private final long feeBps;

    public FeeSchedule(long feeBps) {
        if (feeBps < 0 || feeBps >= ProtocolLimits.BPS_DENOMINATOR) {
            throw new IllegalArgumentException("feeBps out of range: " + feeBps);
        }
        this.feeBps = feeBps;
    }

    /** {@code floor(amount * feeBps / 10000)}. */
    public long feeOf(long amount) {
        try {
            return Math.multiplyExact(amount, feeBps) / ProtocolLimits.BPS_DENOMINATOR;
        } catch (ArithmeticException e) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "amount too large: " + amount);
        }
    }
}
