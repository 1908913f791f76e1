package io.energytoken.core.events;

public final class BurnEvent extends LedgerEvent {
    private final long amount;
    private final String burner;

    public BurnEvent(long height, long amount, String burner) {
        super(height);
        this.amount = amount;
        this.burner = burner;
    }

    public long amount() { return amount; }
    public String burner() { return burner; }

    @Override public String type() { return "burn"; }

    @Override public String toString() {
        return "BurnEvent{amount=" + amount + ", burner=" + burner + ", height=" + height() + "}";
    }
}
