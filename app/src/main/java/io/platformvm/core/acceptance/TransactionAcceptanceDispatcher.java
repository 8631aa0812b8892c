package io.platformvm.core.acceptance;

import io.platformvm.core.metrics.MetricSet;
import io.platformvm.core.protocol.PlatformTx;
import io.platformvm.core.protocol.SignedTx;
import io.platformvm.core.protocol.UnsignedTx;

import java.util.logging.Logger;

/** Counts accepted transactions by the kind of their unsigned payload. */
public final class TransactionAcceptanceDispatcher {
    private static final Logger LOG = Logger.getLogger(TransactionAcceptanceDispatcher.class.getName());

    private final MetricSet metrics;

    public TransactionAcceptanceDispatcher(MetricSet metrics) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics required");
        }
        this.metrics = metrics;
    }

    /**
     * Records one accepted transaction.
     *
     * @throws UnknownTransactionTypeException if the payload is not a platform transaction;
     *         no counter is touched in that case
     * @throws IllegalStateException if the metric set is not initialized
     */
    public void acceptTx(SignedTx tx) {
        if (tx == null) {
            throw new IllegalArgumentException("Transaction required");
        }
        UnsignedTx unsigned = tx.unsignedTx();
        if (!(unsigned instanceof PlatformTx platformTx)) {
            throw new UnknownTransactionTypeException(unsigned);
        }
        metrics.txCounter(platformTx.kind()).increment();
        LOG.fine(() -> "Accepted " + platformTx.kind().metricName() + " tx " + tx.id().hex());
    }
}
