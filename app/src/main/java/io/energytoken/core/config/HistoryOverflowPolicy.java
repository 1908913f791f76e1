package io.energytoken.core.config;

/** What a full per-account mint history does with one more entry. */
public enum HistoryOverflowPolicy {
    /** Refuse the mint that would overflow the history. */
    REJECT,
    /** Evict the oldest entry to make room. */
    DROP_OLDEST
}
