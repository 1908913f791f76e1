package io.energytoken.core.protocol;

/** Source of the current block height supplied by the hosting chain. */
@FunctionalInterface
public interface BlockClock {
    long currentHeight();
}
