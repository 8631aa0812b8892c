package io.platformvm.core.acceptance;

import io.platformvm.core.metrics.MetricSet;
import io.platformvm.core.protocol.AtomicBlock;
import io.platformvm.core.protocol.Block;
import io.platformvm.core.protocol.BlockKind;
import io.platformvm.core.protocol.PlatformBlock;
import io.platformvm.core.protocol.ProposalBlock;
import io.platformvm.core.protocol.SignedTx;
import io.platformvm.core.protocol.StandardBlock;

import java.util.List;
import java.util.logging.Logger;

/**
 * Counts accepted blocks by kind and hands their embedded transactions, in order,
 * to the {@link TransactionAcceptanceDispatcher}.
 */
public final class BlockAcceptanceDispatcher {
    private static final Logger LOG = Logger.getLogger(BlockAcceptanceDispatcher.class.getName());

    private final MetricSet metrics;
    private final TransactionAcceptanceDispatcher txDispatcher;

    public BlockAcceptanceDispatcher(MetricSet metrics, TransactionAcceptanceDispatcher txDispatcher) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics required");
        }
        if (txDispatcher == null) {
            throw new IllegalArgumentException("transaction dispatcher required");
        }
        this.metrics = metrics;
        this.txDispatcher = txDispatcher;
    }

    /**
     * Records one accepted block and every transaction it carries.
     * <p>
     * The block counter is incremented before its transactions are dispatched. For a
     * standard block the first transaction that fails stops the dispatch and its
     * exception propagates; the transactions after it are not counted.
     *
     * @throws UnknownBlockTypeException if the block is not a platform block;
     *         no counter is touched in that case
     * @throws UnknownTransactionTypeException from an embedded transaction
     */
    public void acceptBlock(Block block) {
        if (!(block instanceof PlatformBlock platformBlock)) {
            throw new UnknownBlockTypeException(block);
        }
        BlockKind kind = platformBlock.kind();
        metrics.blockCounter(kind).increment();

        List<SignedTx> embedded = switch (kind) {
            case ABORT, COMMIT -> List.of();
            case ATOMIC -> List.of(((AtomicBlock) platformBlock).tx());
            case PROPOSAL -> List.of(((ProposalBlock) platformBlock).tx());
            case STANDARD -> ((StandardBlock) platformBlock).transactions();
        };
        for (SignedTx tx : embedded) {
            txDispatcher.acceptTx(tx);
        }
        LOG.fine(() -> "Accepted " + kind.metricName() + " block " + platformBlock.id().hex()
                + " at height " + platformBlock.height() + " with " + embedded.size() + " tx(s)");
    }
}
