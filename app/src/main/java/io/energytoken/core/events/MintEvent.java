package io.energytoken.core.events;

public final class MintEvent extends LedgerEvent {
    private final long net;
    private final long fee;
    private final long proofId;
    private final String minter;

    public MintEvent(long height, long net, long fee, long proofId, String minter) {
        super(height);
        this.net = net;
        this.fee = fee;
        this.proofId = proofId;
        this.minter = minter;
    }

    public long net() { return net; }
    public long fee() { return fee; }
    public long proofId() { return proofId; }
    public String minter() { return minter; }

    @Override public String type() { return "mint"; }

    @Override public String toString() {
        return "MintEvent{net=" + net + ", fee=" + fee + ", proofId=" + proofId + ", minter=" + minter + ", height=" + height() + "}";
    }
}
