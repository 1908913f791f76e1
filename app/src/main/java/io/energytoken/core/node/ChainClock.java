package io.energytoken.core.node;

import io.energytoken.core.protocol.BlockClock;

import java.util.concurrent.atomic.AtomicLong;

/** Block height counter driven by the node: one {@link #advance()} per block. */
public final class ChainClock implements BlockClock {

    private final AtomicLong height;

    public ChainClock(long startHeight) {
        if (startHeight < 0) throw new IllegalArgumentException("startHeight must be >= 0");
        this.height = new AtomicLong(startHeight);
    }

    @Override
    public long currentHeight() {
        return height.get();
    }

    public long advance() {
        return height.incrementAndGet();
    }

    /** Jump forward to {@code target}, e.g. after syncing with the host chain. Never moves back. */
    public long advanceTo(long target) {
        return height.accumulateAndGet(target, Math::max);
    }
}
