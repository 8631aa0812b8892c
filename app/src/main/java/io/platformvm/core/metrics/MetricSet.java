package io.platformvm.core.metrics;

import io.platformvm.core.protocol.BlockKind;
import io.platformvm.core.protocol.TxKind;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Acceptance counters and stake gauges of the platform chain.
 * <p>
 * One counter per {@link BlockKind} and per {@link TxKind}, named
 * {@code <kind>_blks_accepted} / {@code <kind>_txs_accepted}, plus the
 * {@code percent_connected} and {@code total_staked} gauges. Call
 * {@link #initialize(String, Registerer)} once before handing the set to the
 * acceptance dispatchers; reads and increments after that need no locking.
 */
public final class MetricSet {
    private static final Logger LOG = Logger.getLogger(MetricSet.class.getName());

    private final AtomicBoolean initialized = new AtomicBoolean();
    private volatile Tables tables;

    /**
     * Builds every metric, installs the API interceptor and registers the metrics.
     * All registrations are attempted; failures are reported together. Metrics that
     * did register stay usable even when this throws.
     *
     * @throws RegistrationException if one or more registrations failed
     * @throws IllegalStateException if called a second time
     */
    public void initialize(String namespace, Registerer registerer) {
        if (registerer == null) {
            throw new IllegalArgumentException("registerer required");
        }
        StakeGauge percentConnected = new StakeGauge(
                new MetricDescriptor(namespace, "percent_connected", "Percent of connected stake"),
                BigDecimal.ONE);
        StakeGauge totalStake = new StakeGauge(
                new MetricDescriptor(namespace, "total_staked", "Total amount of AVAX staked"));

        Map<BlockKind, AcceptanceCounter> blocks = new EnumMap<>(BlockKind.class);
        for (BlockKind kind : BlockKind.values()) {
            blocks.put(kind, new AcceptanceCounter(new MetricDescriptor(
                    namespace,
                    kind.metricName() + "_blks_accepted",
                    "Number of " + kind.metricName() + " blocks accepted")));
        }
        Map<TxKind, AcceptanceCounter> txs = new EnumMap<>(TxKind.class);
        for (TxKind kind : TxKind.values()) {
            txs.put(kind, new AcceptanceCounter(new MetricDescriptor(
                    namespace,
                    kind.metricName() + "_txs_accepted",
                    "Number of " + kind.metricName() + " transactions accepted")));
        }

        if (!initialized.compareAndSet(false, true)) {
            throw new IllegalStateException("metrics already initialized");
        }

        RegistrationErrors errors = new RegistrationErrors();
        Tables built = new Tables(percentConnected, totalStake, blocks, txs, null);
        ApiInterceptor interceptor = null;
        try {
            try {
                interceptor = new ApiInterceptor(namespace, registerer.meterRegistry());
            } catch (RuntimeException e) {
                errors.add("api_interceptor", e);
            }
            for (Metric metric : built.all) {
                errors.attempt(metric.descriptor().fullName(), () -> registerer.register(metric));
            }
        } finally {
            // also reached when a registerer throws an Error
            tables = built.withInterceptor(interceptor);
        }

        if (errors.size() == 0) {
            LOG.info(() -> "Registered " + built.all.size() + " platform metrics"
                    + (namespace == null || namespace.isEmpty() ? "" : " under namespace '" + namespace + "'"));
        } else {
            LOG.warning(() -> errors.size() + " of " + built.all.size() + " platform metric registrations failed");
        }
        errors.throwIfAny();
    }

    public boolean isInitialized() {
        return tables != null;
    }

    public AcceptanceCounter blockCounter(BlockKind kind) {
        return tables().blocks.get(kind);
    }

    public AcceptanceCounter txCounter(TxKind kind) {
        return tables().txs.get(kind);
    }

    public StakeGauge percentConnected() {
        return tables().percentConnected;
    }

    public StakeGauge totalStake() {
        return tables().totalStake;
    }

    public ApiInterceptor apiInterceptor() {
        ApiInterceptor interceptor = tables().apiInterceptor;
        if (interceptor == null) {
            throw new IllegalStateException("API interceptor not installed");
        }
        return interceptor;
    }

    /** Every metric in registration order: gauges, block counters, transaction counters. */
    public List<Metric> metrics() {
        return tables().all;
    }

    private Tables tables() {
        Tables t = tables;
        if (t == null) {
            throw new IllegalStateException("metrics not initialized");
        }
        return t;
    }

    private static final class Tables {
        final StakeGauge percentConnected;
        final StakeGauge totalStake;
        final Map<BlockKind, AcceptanceCounter> blocks;
        final Map<TxKind, AcceptanceCounter> txs;
        final ApiInterceptor apiInterceptor;
        final List<Metric> all;

        Tables(StakeGauge percentConnected,
               StakeGauge totalStake,
               Map<BlockKind, AcceptanceCounter> blocks,
               Map<TxKind, AcceptanceCounter> txs,
               ApiInterceptor apiInterceptor) {
            this.percentConnected = percentConnected;
            this.totalStake = totalStake;
            this.blocks = Collections.unmodifiableMap(blocks);
            this.txs = Collections.unmodifiableMap(txs);
            this.apiInterceptor = apiInterceptor;
            List<Metric> metrics = new ArrayList<>();
            metrics.add(percentConnected);
            metrics.add(totalStake);
            metrics.addAll(blocks.values());
            metrics.addAll(txs.values());
            this.all = List.copyOf(metrics);
        }

        Tables withInterceptor(ApiInterceptor interceptor) {
            return new Tables(percentConnected, totalStake, blocks, txs, interceptor);
        }
    }
}
