package io.energytoken.core.external;

import java.util.HashSet;
import java.util.Set;

public final class InMemoryProducerRegistry implements ProducerRegistry {

    private final Set<String> producers = new HashSet<>();

    public synchronized boolean register(String principal) {
        if (principal == null || principal.isBlank()) {
            throw new IllegalArgumentException("Principal required");
        }
        return producers.add(principal);
    }

    public synchronized boolean deregister(String principal) {
        return producers.remove(principal);
    }

    @Override
    public synchronized boolean isRegistered(String principal) {
        return principal != null && producers.contains(principal);
    }
}
