package io.platformvm.core.node;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.platformvm.core.acceptance.BlockAcceptanceDispatcher;
import io.platformvm.core.acceptance.TransactionAcceptanceDispatcher;
import io.platformvm.core.acceptance.UnknownTypeException;
import io.platformvm.core.metrics.MeterRegistryRegisterer;
import io.platformvm.core.metrics.MetricSet;
import io.platformvm.core.protocol.Block;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires the meter registry, the platform metric set and the acceptance dispatchers.
 * Start once, then feed every block the consensus engine accepts to {@link #accept(Block)}.
 */
public final class PlatformNode {
    private static final Logger LOG = Logger.getLogger(PlatformNode.class.getName());

    private final NodeConfig config;
    private final MeterRegistry registry;
    private final MetricSet metrics;
    private final BlockAcceptanceDispatcher blockDispatcher;

    public PlatformNode(NodeConfig config, MeterRegistry registry) {
        if (config == null) throw new IllegalArgumentException("config required");
        if (registry == null) throw new IllegalArgumentException("registry required");
        this.config = config;
        this.registry = registry;
        this.metrics = new MetricSet();
        this.blockDispatcher = new BlockAcceptanceDispatcher(metrics, new TransactionAcceptanceDispatcher(metrics));
    }

    /** Convenience factory for a node reporting into an in-process registry. */
    public static PlatformNode inMemory(NodeConfig config) {
        return new PlatformNode(config, new SimpleMeterRegistry());
    }

    /**
     * Initializes the metric set. A {@link io.platformvm.core.metrics.RegistrationException}
     * propagates, but the node is started and counts with whatever did register.
     */
    public void start() {
        metrics.initialize(config.namespace, new MeterRegistryRegisterer(registry));
    }

    /** Records one accepted block; unknown kinds are logged and rethrown. */
    public void accept(Block block) {
        try {
            blockDispatcher.acceptBlock(block);
        } catch (UnknownTypeException e) {
            LOG.log(Level.WARNING, "Accepted block " + block + " could not be accounted", e);
            throw e;
        }
    }

    public NodeConfig config() { return config; }
    public MeterRegistry registry() { return registry; }
    public MetricSet metrics() { return metrics; }
    public BlockAcceptanceDispatcher blockDispatcher() { return blockDispatcher; }
}
