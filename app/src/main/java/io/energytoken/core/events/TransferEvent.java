package io.energytoken.core.events;

public final class TransferEvent extends LedgerEvent {
    private final long amount;
    private final String from;
    private final String to;

    public TransferEvent(long height, long amount, String from, String to) {
        super(height);
        this.amount = amount;
        this.from = from;
        this.to = to;
    }

    public long amount() { return amount; }
    public String from() { return from; }
    public String to() { return to; }

    @Override public String type() { return "transfer"; }

    @Override public String toString() {
        return "TransferEvent{amount=" + amount + ", from=" + from + ", to=" + to + ", height=" + height() + "}";
    }
}
