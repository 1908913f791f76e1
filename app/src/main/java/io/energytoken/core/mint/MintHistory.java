package io.energytoken.core.mint;

import io.energytoken.core.config.HistoryOverflowPolicy;
import io.energytoken.core.error.ErrorCode;
import io.energytoken.core.error.ValidationException;
import io.energytoken.core.state.StateStore;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded, append-only audit trail of the proof ids each account has minted against.
 * The same id appears once per mint, so repeated mints on one proof show up repeatedly.
 */
public final class MintHistory {

    private final StateStore state;
    private final int capacity;
    private final HistoryOverflowPolicy overflow;

    public MintHistory(StateStore state, int capacity, HistoryOverflowPolicy overflow) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.state = state;
        this.capacity = capacity;
        this.overflow = overflow;
    }

    public List<Long> getMintHistory(String account) {
        return state.getMintHistory(account);
    }

    /**
     * The history {@code account} would have after one more mint against {@code proofId}.
     * Nothing is written; the caller stages the result.
     */
    List<Long> appended(String account, long proofId) {
        List<Long> current = state.getMintHistory(account);
        List<Long> next = new ArrayList<>(current.size() + 1);
        next.addAll(current);
        if (next.size() >= capacity) {
            if (overflow == HistoryOverflowPolicy.REJECT) {
                throw new ValidationException(ErrorCode.HISTORY_FULL,
                        "mint history full for " + account + " (" + capacity + " entries)");
            }
            next.subList(0, next.size() - capacity + 1).clear();
        }
        next.add(proofId);
        return next;
    }
}
