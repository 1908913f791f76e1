package io.energytoken.core.external;

import java.util.ArrayList;
import java.util.List;

/**
 * Settlement rail that accepts every transfer and keeps a log of them.
 * Stands in for the chain's native asset when the ledger is embedded or under test.
 */
public final class RecordingSettlementRail implements SettlementRail {

    private final List<Transfer> transfers = new ArrayList<>();

    @Override
    public synchronized void transfer(long amount, String from, String to) {
        if (amount <= 0) throw new IllegalArgumentException("amount must be > 0");
        transfers.add(new Transfer(amount, from, to));
    }

    public synchronized List<Transfer> transfers() {
        return List.copyOf(transfers);
    }

    public static final class Transfer {
        public final long amount;
        public final String from;
        public final String to;

        public Transfer(long amount, String from, String to) {
            this.amount = amount;
            this.from = from;
            this.to = to;
        }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Transfer)) return false;
            Transfer other = (Transfer) o;
            return amount == other.amount && from.equals(other.from) && to.equals(other.to);
        }

        @Override public int hashCode() {
            return java.util.Objects.hash(amount, from, to);
        }

        @Override public String toString() {
            return "Transfer{" + amount + " " + from + " -> " + to + "}";
        }
    }
}
