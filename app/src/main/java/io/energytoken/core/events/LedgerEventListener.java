package io.energytoken.core.events;

@FunctionalInterface
public interface LedgerEventListener {
    void onEvent(LedgerEvent event);
}
