package io.energytoken.core.state;

import io.energytoken.core.protocol.MintRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStateStoreTest {

    @Test
    void commitAppliesWholeBatch() {
        InMemoryStateStore store = new InMemoryStateStore();
        store.commit(new StateBatch()
                .putBalance("ST1A", 70)
                .putBalance("ST1B", 30)
                .putTotalSupply(100)
                .putTotalMinted(100)
                .putMintRecord(5, new MintRecord(100, 3))
                .putMintHistory("ST1A", List.of(5L)));

        assertEquals(70, store.getBalance("ST1A"));
        assertEquals(Map.of("ST1A", 70L, "ST1B", 30L), store.getBalances());
        assertEquals(100, store.getTotalSupply());
        assertEquals(new MintRecord(100, 3), store.getMintRecord(5).orElseThrow());
        assertEquals(List.of(5L), store.getMintHistory("ST1A"));
        assertTrue(store.getConfig().isEmpty());
        assertTrue(StateAudit.check(store, 1000).isEmpty());
    }

    @Test
    void zeroBalancesAreDropped() {
        InMemoryStateStore store = new InMemoryStateStore();
        store.commit(new StateBatch().putBalance("ST1A", 10).putTotalSupply(10).putTotalMinted(10));
        store.commit(new StateBatch().putBalance("ST1A", 0).putTotalSupply(0));

        assertEquals(0, store.getBalance("ST1A"));
        assertTrue(store.getBalances().isEmpty());
    }

    @Test
    void batchRefusesNegativeBalance() {
        assertThrows(IllegalArgumentException.class, () -> new StateBatch().putBalance("ST1A", -1));
    }

    @Test
    void removedMintRecordIsDeleted() {
        InMemoryStateStore store = new InMemoryStateStore();
        store.commit(new StateBatch().putMintRecord(5, new MintRecord(10, 1)));

        StateBatch removal = new StateBatch().removeMintRecord(5);
        assertFalse(removal.isEmpty());
        store.commit(removal);

        assertTrue(store.getMintRecord(5).isEmpty());
        assertTrue(new StateBatch().isEmpty());
    }

    @Test
    void auditReportsInconsistentCounters() {
        InMemoryStateStore store = new InMemoryStateStore();
        store.commit(new StateBatch().putBalance("ST1A", 50).putTotalSupply(40).putTotalMinted(30));

        List<String> problems = StateAudit.check(store, 35);
        assertEquals(3, problems.size());
    }
}
