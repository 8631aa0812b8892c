package io.platformvm.core.acceptance;

import io.platformvm.core.metrics.AcceptanceCounter;
import io.platformvm.core.metrics.Metric;
import io.platformvm.core.metrics.MetricSet;
import io.platformvm.core.metrics.RecordingRegisterer;
import io.platformvm.core.protocol.AbortBlock;
import io.platformvm.core.protocol.AtomicBlock;
import io.platformvm.core.protocol.BlockKind;
import io.platformvm.core.protocol.CommitBlock;
import io.platformvm.core.protocol.ProposalBlock;
import io.platformvm.core.protocol.TxKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static io.platformvm.core.protocol.TestBlocks.*;
import static org.junit.jupiter.api.Assertions.*;

class BlockAcceptanceDispatcherTest {

    private MetricSet metrics;
    private BlockAcceptanceDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        metrics = new MetricSet();
        metrics.initialize("platformvm", new RecordingRegisterer());
        dispatcher = new BlockAcceptanceDispatcher(metrics, new TransactionAcceptanceDispatcher(metrics));
    }

    @Test
    void abortAndCommitCountOnlyTheirBlockCounter() {
        dispatcher.acceptBlock(new AbortBlock(PARENT, 3));
        dispatcher.acceptBlock(new CommitBlock(PARENT, 3));
        dispatcher.acceptBlock(new CommitBlock(PARENT, 4));

        Map<String, Long> expected = zeroCounts();
        expected.put("platformvm_abort_blks_accepted", 1L);
        expected.put("platformvm_commit_blks_accepted", 2L);
        assertEquals(expected, counts());
    }

    @Test
    void proposalBlockCountsItsTransaction() {
        dispatcher.acceptBlock(new ProposalBlock(PARENT, 2, advanceTime(1_700_000_000L)));

        Map<String, Long> expected = zeroCounts();
        expected.put("platformvm_proposal_blks_accepted", 1L);
        expected.put("platformvm_advance_time_txs_accepted", 1L);
        assertEquals(expected, counts());
    }

    @Test
    void atomicBlockCountsItsTransaction() {
        dispatcher.acceptBlock(new AtomicBlock(PARENT, 2, importTx()));

        assertEquals(1, metrics.blockCounter(BlockKind.ATOMIC).count());
        assertEquals(1, metrics.txCounter(TxKind.IMPORT).count());
        assertEquals(0, metrics.txCounter(TxKind.EXPORT).count());
    }

    @Test
    void standardBlockCountsEveryTransaction() {
        dispatcher.acceptBlock(standard(addValidator(), export()));

        Map<String, Long> expected = zeroCounts();
        expected.put("platformvm_standard_blks_accepted", 1L);
        expected.put("platformvm_add_validator_txs_accepted", 1L);
        expected.put("platformvm_export_txs_accepted", 1L);
        assertEquals(expected, counts());
    }

    @Test
    void standardBlockCountsRepeatedKinds() {
        dispatcher.acceptBlock(standard(createSubnet(), createChain(), createChain(), addSubnetValidator()));

        assertEquals(1, metrics.blockCounter(BlockKind.STANDARD).count());
        assertEquals(1, metrics.txCounter(TxKind.CREATE_SUBNET).count());
        assertEquals(2, metrics.txCounter(TxKind.CREATE_CHAIN).count());
        assertEquals(1, metrics.txCounter(TxKind.ADD_SUBNET_VALIDATOR).count());
    }

    @Test
    void emptyStandardBlockCountsOnlyTheBlock() {
        dispatcher.acceptBlock(standard());

        Map<String, Long> expected = zeroCounts();
        expected.put("platformvm_standard_blks_accepted", 1L);
        assertEquals(expected, counts());
    }

    @Test
    void unknownBlockLeavesEveryCounterUnchanged() {
        UnknownBlockTypeException e = assertThrows(UnknownBlockTypeException.class,
                () -> dispatcher.acceptBlock(unknownBlock()));

        assertTrue(e.getMessage().startsWith("unknown block type"));
        assertEquals(zeroCounts(), counts());
    }

    @Test
    void nullBlockIsAnUnknownBlock() {
        UnknownBlockTypeException e = assertThrows(UnknownBlockTypeException.class,
                () -> dispatcher.acceptBlock(null));
        assertEquals("null", e.typeName());
        assertEquals(zeroCounts(), counts());
    }

    @Test
    void standardBlockStopsAtFirstUnknownTransaction() {
        UnknownTransactionTypeException e = assertThrows(UnknownTransactionTypeException.class,
                () -> dispatcher.acceptBlock(standard(addValidator(), unknownTx(), export())));

        assertTrue(e.getMessage().startsWith("unknown transaction type"));
        Map<String, Long> expected = zeroCounts();
        expected.put("platformvm_standard_blks_accepted", 1L);
        expected.put("platformvm_add_validator_txs_accepted", 1L);
        assertEquals(expected, counts());
    }

    @Test
    void proposalBlockPropagatesUnknownTransaction() {
        assertThrows(UnknownTransactionTypeException.class,
                () -> dispatcher.acceptBlock(new ProposalBlock(PARENT, 2, unknownTx())));

        assertEquals(1, metrics.blockCounter(BlockKind.PROPOSAL).count());
        for (TxKind kind : TxKind.values()) {
            assertEquals(0, metrics.txCounter(kind).count(), kind.name());
        }
    }

    @Test
    void atomicBlockPropagatesUnknownTransaction() {
        assertThrows(UnknownTransactionTypeException.class,
                () -> dispatcher.acceptBlock(new AtomicBlock(PARENT, 2, unknownTx())));

        assertEquals(1, metrics.blockCounter(BlockKind.ATOMIC).count());
        for (TxKind kind : TxKind.values()) {
            assertEquals(0, metrics.txCounter(kind).count(), kind.name());
        }
    }

    @Test
    void acceptingBeforeInitializationFails() {
        MetricSet uninitialized = new MetricSet();
        BlockAcceptanceDispatcher early = new BlockAcceptanceDispatcher(
                uninitialized, new TransactionAcceptanceDispatcher(uninitialized));

        assertThrows(IllegalStateException.class, () -> early.acceptBlock(new CommitBlock(PARENT, 1)));
    }

    private Map<String, Long> counts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Metric metric : metrics.metrics()) {
            if (metric instanceof AcceptanceCounter counter) {
                counts.put(counter.descriptor().fullName(), counter.count());
            }
        }
        return counts;
    }

    private Map<String, Long> zeroCounts() {
        Map<String, Long> zeros = new LinkedHashMap<>();
        for (String name : counts().keySet()) {
            zeros.put(name, 0L);
        }
        return zeros;
    }
}
