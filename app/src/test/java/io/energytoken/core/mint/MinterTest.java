package io.energytoken.core.mint;

import io.energytoken.core.config.HistoryOverflowPolicy;
import io.energytoken.core.config.LedgerConfig;
import io.energytoken.core.config.LedgerParams;
import io.energytoken.core.error.AuthorizationException;
import io.energytoken.core.error.ErrorCode;
import io.energytoken.core.error.ProofException;
import io.energytoken.core.error.StateException;
import io.energytoken.core.error.SupplyException;
import io.energytoken.core.error.TransferException;
import io.energytoken.core.error.ValidationException;
import io.energytoken.core.events.LedgerEvent;
import io.energytoken.core.events.MintEvent;
import io.energytoken.core.external.InMemoryProofStore;
import io.energytoken.core.external.RecordingSettlementRail;
import io.energytoken.core.node.Node;
import io.energytoken.core.protocol.MintRecord;
import io.energytoken.core.protocol.Proof;
import io.energytoken.core.state.InMemoryStateStore;
import io.energytoken.core.state.StateAudit;
import io.energytoken.core.state.StateBatch;
import io.energytoken.core.state.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class MinterTest {

    private static final String OWNER = "ST1OWNER";
    private static final String PRODUCER = "ST1MINTER";

    private Node node;
    private Minter minter;

    @BeforeEach
    void setUp() {
        node = newNode(LedgerParams.defaultLocal());
        minter = node.minter();
    }

    private static Node newNode(LedgerParams params) {
        Node n = Node.inMemory(params);
        n.start();
        n.producers().register(PRODUCER);
        return n;
    }

    private RecordingSettlementRail rail() {
        return (RecordingSettlementRail) node.settlement();
    }

    @Test
    void mintsNetOfFeeAndRecordsEverything() {
        node.proofs().attest(1, new Proof(1000, 0, PRODUCER));

        long net = minter.mint(1000, 1, PRODUCER);

        assertEquals(990, net);
        assertEquals(990, node.ledger().getBalance(PRODUCER));
        assertEquals(990, node.ledger().getTotalSupply());
        assertEquals(990, node.ledger().getTotalMinted());
        assertEquals(new MintRecord(990, 0), minter.getMintRecord(1).orElseThrow());
        assertEquals(List.of(1L), minter.getMintHistory(PRODUCER));
        assertEquals(List.of(new RecordingSettlementRail.Transfer(10, PRODUCER, OWNER)), rail().transfers());

        List<LedgerEvent> events = node.events().events();
        assertEquals(1, events.size());
        MintEvent event = (MintEvent) events.get(0);
        assertEquals(990, event.net());
        assertEquals(10, event.fee());
        assertEquals(1, event.proofId());
        assertEquals(PRODUCER, event.minter());
    }

    @Test
    void capacityAccumulatesAcrossMintsOnSameProof() {
        node.proofs().attest(1, new Proof(1000, 0, PRODUCER));
        minter.mint(1000, 1, PRODUCER);
        node.tick();

        ProofException ex = assertThrows(ProofException.class, () -> minter.mint(50, 1, PRODUCER));
        assertEquals(ErrorCode.INSUFFICIENT_PROOF, ex.code());
        assertEquals(990, node.ledger().getBalance(PRODUCER));
        assertEquals(new MintRecord(990, 0), minter.getMintRecord(1).orElseThrow());
        assertEquals(List.of(1L), minter.getMintHistory(PRODUCER));

        // the last 10 units are still available; fee rounds down to zero
        assertEquals(10, minter.mint(10, 1, PRODUCER));
        assertEquals(new MintRecord(1000, 1), minter.getMintRecord(1).orElseThrow());
        assertEquals(0, minter.getMintableAmount(1));
        assertEquals(List.of(1L, 1L), minter.getMintHistory(PRODUCER));
        assertThrows(ProofException.class, () -> minter.mint(1, 1, PRODUCER));
    }

    @Test
    void zeroFeeMintSkipsSettlement() {
        node.proofs().attest(1, new Proof(1000, 0, PRODUCER));

        assertEquals(99, minter.mint(99, 1, PRODUCER));
        assertTrue(rail().transfers().isEmpty());
    }

    @Test
    void rejectsUnregisteredCaller() {
        node.proofs().attest(1, new Proof(1000, 0, "ST2OUTSIDER"));

        AuthorizationException ex = assertThrows(AuthorizationException.class,
                () -> minter.mint(1000, 1, "ST2OUTSIDER"));
        assertEquals(ErrorCode.NOT_REGISTERED, ex.code());
        assertEquals(0, node.ledger().getTotalSupply());
    }

    @Test
    void rejectsUnknownProofWithoutStateChange() {
        ProofException ex = assertThrows(ProofException.class, () -> minter.mint(1000, 999, PRODUCER));
        assertEquals(ErrorCode.INVALID_PROOF_ID, ex.code());
        assertEquals(0, node.ledger().getTotalSupply());
        assertFalse(minter.isProofMinted(999));
        assertTrue(minter.getMintHistory(PRODUCER).isEmpty());
        assertTrue(rail().transfers().isEmpty());
        assertEquals(0, node.events().size());
    }

    @Test
    void rejectsProofAttestedForAnotherProducer() {
        node.producers().register("ST2OTHER");
        node.proofs().attest(1, new Proof(1000, 0, "ST2OTHER"));

        ProofException ex = assertThrows(ProofException.class, () -> minter.mint(1000, 1, PRODUCER));
        assertEquals(ErrorCode.INSUFFICIENT_PROOF, ex.code());
    }

    @Test
    void rejectsAmountExceedingProof() {
        node.proofs().attest(1, new Proof(1000, 0, PRODUCER));

        ProofException ex = assertThrows(ProofException.class, () -> minter.mint(2000, 1, PRODUCER));
        assertEquals(ErrorCode.INSUFFICIENT_PROOF, ex.code());
    }

    @Test
    void rejectsZeroNetAmount() {
        node.proofs().attest(1, new Proof(1000, 0, PRODUCER));

        assertThrows(ProofException.class, () -> minter.mint(0, 1, PRODUCER));
        assertFalse(minter.isProofMinted(1));
        assertEquals(0, node.ledger().getBalance(PRODUCER));
    }

    @Test
    void rejectsNegativeAmount() {
        node.proofs().attest(1, new Proof(1000, 0, PRODUCER));

        ValidationException ex = assertThrows(ValidationException.class, () -> minter.mint(-5, 1, PRODUCER));
        assertEquals(ErrorCode.INVALID_AMOUNT, ex.code());
    }

    @Test
    void rejectsNetAbovePerProofCap() {
        node.proofs().attest(1, new Proof(5_000_000, 0, PRODUCER));

        // 1_010_101 - 10_101 = 1_000_000 is exactly the cap
        assertEquals(1_000_000, minter.mint(1_010_101, 1, PRODUCER));
        assertThrows(ProofException.class, () -> minter.mint(1_010_203, 1, PRODUCER));
    }

    @Test
    void proofUsableUpToExpiryWindowInclusive() {
        node.proofs().attest(1, new Proof(1000, 0, PRODUCER));
        node.proofs().attest(2, new Proof(1000, 0, PRODUCER));

        node.clock().advanceTo(144);
        assertEquals(990, minter.mint(1000, 1, PRODUCER));

        node.tick();
        ProofException ex = assertThrows(ProofException.class, () -> minter.mint(1000, 2, PRODUCER));
        assertEquals(ErrorCode.INSUFFICIENT_PROOF, ex.code());
        // capacity is untouched, the proof just cannot back new mints
        assertEquals(1000, minter.getMintableAmount(2));
    }

    @Test
    void rejectsProofAttestedAfterCurrentHeight() {
        node.proofs().attest(1, new Proof(1000, 10, PRODUCER));

        assertThrows(ProofException.class, () -> minter.mint(100, 1, PRODUCER));
        node.clock().advanceTo(10);
        assertEquals(99, minter.mint(100, 1, PRODUCER));
    }

    @Test
    void enforcesMaxSupplyOnCumulativeIssuance() {
        node = newNode(LedgerParams.defaultLocal().withMaxSupply(1000));
        minter = node.minter();
        node.proofs().attest(1, new Proof(5000, 0, PRODUCER));

        assertEquals(990, minter.mint(1000, 1, PRODUCER));
        // burning does not make room under the cap
        node.ledger().burn(500, PRODUCER);

        SupplyException ex = assertThrows(SupplyException.class, () -> minter.mint(20, 1, PRODUCER));
        assertEquals(ErrorCode.SUPPLY_EXCEEDED, ex.code());
        assertEquals(10, minter.mint(10, 1, PRODUCER));
        assertEquals(1000, node.ledger().getTotalMinted());
        assertEquals(500, node.ledger().getTotalSupply());
    }

    @Test
    void pausedLedgerRejectsMintUntilUnpaused() {
        node.proofs().attest(1, new Proof(1000, 0, PRODUCER));
        node.config().pause(OWNER);

        StateException ex = assertThrows(StateException.class, () -> minter.mint(1000, 1, PRODUCER));
        assertEquals(ErrorCode.PAUSED, ex.code());
        assertEquals(0, node.ledger().getTotalSupply());

        node.config().unpause(OWNER);
        assertEquals(990, minter.mint(1000, 1, PRODUCER));
    }

    @Test
    void pauseIsCheckedBeforeRegistration() {
        node.config().pause(OWNER);
        assertThrows(StateException.class, () -> minter.mint(1000, 1, "ST2OUTSIDER"));
    }

    @Test
    void settlementFailureAbortsMint() {
        InMemoryStateStore state = new InMemoryStateStore();
        node = new Node(state, (amount, from, to) -> {
            throw new IllegalStateException("rail down");
        }, LedgerParams.defaultLocal(), 0L);
        node.start();
        node.producers().register(PRODUCER);
        node.proofs().attest(1, new Proof(1000, 0, PRODUCER));

        TransferException ex = assertThrows(TransferException.class, () -> node.minter().mint(1000, 1, PRODUCER));
        assertEquals(ErrorCode.SETTLEMENT_FAILED, ex.code());
        assertEquals(0, state.getBalance(PRODUCER));
        assertFalse(node.minter().isProofMinted(1));
        assertTrue(node.minter().getMintHistory(PRODUCER).isEmpty());
    }

    @Test
    void settlementFailureRestoresEarlierMintRecord() {
        AtomicBoolean railDown = new AtomicBoolean(false);
        RecordingSettlementRail recorder = new RecordingSettlementRail();
        node = new Node(new InMemoryStateStore(), (amount, from, to) -> {
            if (railDown.get()) throw new IllegalStateException("rail down");
            recorder.transfer(amount, from, to);
        }, LedgerParams.defaultLocal(), 0L);
        node.start();
        node.producers().register(PRODUCER);
        node.proofs().attest(1, new Proof(1000, 0, PRODUCER));
        assertEquals(99, node.minter().mint(100, 1, PRODUCER));
        node.tick();

        railDown.set(true);
        assertThrows(TransferException.class, () -> node.minter().mint(200, 1, PRODUCER));

        assertEquals(99, node.ledger().getBalance(PRODUCER));
        assertEquals(99, node.ledger().getTotalSupply());
        assertEquals(99, node.ledger().getTotalMinted());
        assertEquals(new MintRecord(99, 0), node.minter().getMintRecord(1).orElseThrow());
        assertEquals(List.of(1L), node.minter().getMintHistory(PRODUCER));
        assertEquals(1, node.events().size());
        assertEquals(List.of(new RecordingSettlementRail.Transfer(1, PRODUCER, OWNER)), recorder.transfers());
        assertTrue(StateAudit.check(node.state(), node.params().maxSupply).isEmpty());
    }

    @Test
    void failedCommitLeavesFeeUnpaid() {
        FailingCommitStore state = new FailingCommitStore();
        node = new Node(state, new RecordingSettlementRail(), LedgerParams.defaultLocal(), 0L);
        node.start();
        node.producers().register(PRODUCER);
        node.proofs().attest(1, new Proof(1000, 0, PRODUCER));

        state.failCommits = true;
        assertThrows(IllegalStateException.class, () -> node.minter().mint(1000, 1, PRODUCER));

        assertTrue(rail().transfers().isEmpty());
        assertEquals(0, node.ledger().getBalance(PRODUCER));
        assertFalse(node.minter().isProofMinted(1));
        assertEquals(0, node.events().size());
    }

    @Test
    void proofStatusIsOneConsistentView() {
        node.proofs().attest(1, new Proof(1000, 0, PRODUCER));

        ProofStatus fresh = minter.getProofStatus(1);
        assertEquals(1000, fresh.mintable());
        assertFalse(fresh.minted());
        assertTrue(fresh.record().isEmpty());

        minter.mint(500, 1, PRODUCER);

        ProofStatus after = minter.getProofStatus(1);
        assertEquals(505, after.mintable());
        assertTrue(after.minted());
        assertEquals(new MintRecord(495, 0), after.record().orElseThrow());
        assertThrows(ProofException.class, () -> minter.getProofStatus(999));
    }

    /** In-memory store whose commits can be switched to fail like a broken disk. */
    private static final class FailingCommitStore implements StateStore {
        private final InMemoryStateStore delegate = new InMemoryStateStore();
        volatile boolean failCommits;

        @Override public long getBalance(String account) { return delegate.getBalance(account); }
        @Override public Map<String, Long> getBalances() { return delegate.getBalances(); }
        @Override public long getTotalSupply() { return delegate.getTotalSupply(); }
        @Override public long getTotalMinted() { return delegate.getTotalMinted(); }
        @Override public Optional<MintRecord> getMintRecord(long proofId) { return delegate.getMintRecord(proofId); }
        @Override public List<Long> getMintHistory(String account) { return delegate.getMintHistory(account); }
        @Override public Optional<LedgerConfig> getConfig() { return delegate.getConfig(); }

        @Override
        public void commit(StateBatch batch) {
            if (failCommits) throw new IllegalStateException("write failed");
            delegate.commit(batch);
        }
    }

    @Test
    void mintableAmountTracksIssuance() {
        node.proofs().attest(1, new Proof(1000, 0, PRODUCER));

        assertEquals(1000, minter.getMintableAmount(1));
        assertFalse(minter.isProofMinted(1));

        minter.mint(500, 1, PRODUCER);

        assertEquals(505, minter.getMintableAmount(1));
        assertTrue(minter.isProofMinted(1));
        assertEquals(new MintRecord(495, 0), minter.getMintRecord(1).orElseThrow());
        assertThrows(ProofException.class, () -> minter.getMintableAmount(999));
    }

    @Test
    void followsConfiguredAttester() {
        node.proofs().attest(1, new Proof(1000, 0, PRODUCER));
        node.config().setAttester("ST2ORACLE", OWNER);

        // nothing is bound at the new address yet
        assertThrows(ProofException.class, () -> minter.getMintableAmount(1));
        assertThrows(ProofException.class, () -> minter.mint(1000, 1, PRODUCER));

        InMemoryProofStore replacement = new InMemoryProofStore();
        replacement.attest(1, new Proof(300, 0, PRODUCER));
        node.contracts().bindProofStore("ST2ORACLE", replacement);

        assertEquals(300, minter.getMintableAmount(1));
        assertEquals(297, minter.mint(300, 1, PRODUCER));
    }

    @Test
    void followsConfiguredRegistry() {
        node.proofs().attest(1, new Proof(1000, 0, PRODUCER));
        node.config().setRegistry("ST2REGISTRY", OWNER);

        AuthorizationException ex = assertThrows(AuthorizationException.class, () -> minter.mint(1000, 1, PRODUCER));
        assertEquals(ErrorCode.NOT_REGISTERED, ex.code());

        node.contracts().bindRegistry("ST2REGISTRY", principal -> PRODUCER.equals(principal));
        assertEquals(990, minter.mint(1000, 1, PRODUCER));
    }

    @Test
    void fullHistoryRejectsMintUnderRejectPolicy() {
        node = newNode(LedgerParams.defaultLocal().withHistory(2, HistoryOverflowPolicy.REJECT));
        minter = node.minter();
        for (long id = 1; id <= 3; id++) {
            node.proofs().attest(id, new Proof(1000, 0, PRODUCER));
        }
        minter.mint(100, 1, PRODUCER);
        minter.mint(100, 2, PRODUCER);

        ValidationException ex = assertThrows(ValidationException.class, () -> minter.mint(100, 3, PRODUCER));
        assertEquals(ErrorCode.HISTORY_FULL, ex.code());
        assertFalse(minter.isProofMinted(3));
        assertEquals(198, node.ledger().getBalance(PRODUCER));
    }

    @Test
    void fullHistoryDropsOldestUnderDropPolicy() {
        node = newNode(LedgerParams.defaultLocal().withHistory(2, HistoryOverflowPolicy.DROP_OLDEST));
        minter = node.minter();
        for (long id = 1; id <= 3; id++) {
            node.proofs().attest(id, new Proof(1000, 0, PRODUCER));
            minter.mint(100, id, PRODUCER);
        }

        assertEquals(List.of(2L, 3L), minter.getMintHistory(PRODUCER));
        assertTrue(minter.isProofMinted(1));
    }

    @Test
    void burnDoesNotRestoreProofCapacity() {
        node.proofs().attest(1, new Proof(1000, 0, PRODUCER));
        minter.mint(1000, 1, PRODUCER);

        assertEquals(990, minter.burn(990, PRODUCER));

        assertEquals(0, node.ledger().getTotalSupply());
        assertEquals(10, minter.getMintableAmount(1));
        assertEquals(new MintRecord(990, 0), minter.getMintRecord(1).orElseThrow());
    }
}
