package io.energytoken.core.external;

/**
 * Native-asset rail the issuance fee is paid on. Implementations throw to refuse a transfer;
 * the ledger then aborts the operation that needed it.
 */
public interface SettlementRail {
    void transfer(long amount, String from, String to);
}
