package io.energytoken.core.external;

/** Membership check for principals allowed to mint. */
public interface ProducerRegistry {
    boolean isRegistered(String principal);
}
