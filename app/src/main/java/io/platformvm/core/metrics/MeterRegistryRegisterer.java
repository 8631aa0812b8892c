package io.platformvm.core.metrics;

import io.micrometer.core.instrument.MeterRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * {@link Registerer} over a Micrometer registry. Micrometer hands back the existing meter
 * when a name is reused; this rejects the second registration instead. Names must also be
 * valid Prometheus metric names.
 */
public final class MeterRegistryRegisterer implements Registerer {
    private static final Pattern VALID_NAME = Pattern.compile("[a-zA-Z_:][a-zA-Z0-9_:]*");

    private final MeterRegistry registry;
    private final Map<String, Metric> registered = new ConcurrentHashMap<>();

    public MeterRegistryRegisterer(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry required");
        }
        this.registry = registry;
    }

    @Override
    public void register(Metric metric) {
        if (metric == null) {
            throw new IllegalArgumentException("metric required");
        }
        String name = metric.descriptor().fullName();
        if (!VALID_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid metric name: " + name);
        }
        if (registry.find(name).meter() != null || registered.putIfAbsent(name, metric) != null) {
            throw new DuplicateMetricException(name);
        }
        try {
            metric.bindTo(registry);
        } catch (RuntimeException e) {
            registered.remove(name, metric);
            throw e;
        }
    }

    @Override
    public MeterRegistry meterRegistry() {
        return registry;
    }
}
