package io.energytoken.core.events;

/**
 * Balance-affecting event emitted after a successful commit, for external indexers.
 */
public abstract class LedgerEvent {

    private final long height;

    protected LedgerEvent(long height) {
        this.height = height;
    }

    /** Block height the operation was applied at. */
    public long height() { return height; }

    /** Short event name: "mint", "burn" or "transfer". */
    public abstract String type();
}
