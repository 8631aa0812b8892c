package io.platformvm.core.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.concurrent.atomic.LongAdder;

/**
 * Monotonic count of accepted blocks or transactions of one kind.
 * Only ever incremented by one; safe for concurrent increments without locking.
 */
public final class AcceptanceCounter implements Metric {
    private final MetricDescriptor descriptor;
    private final LongAdder count = new LongAdder();

    public AcceptanceCounter(MetricDescriptor descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor required");
        }
        this.descriptor = descriptor;
    }

    public void increment() {
        count.increment();
    }

    public long count() {
        return count.sum();
    }

    @Override
    public MetricDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        FunctionCounter.builder(descriptor.fullName(), count, LongAdder::doubleValue)
                .description(descriptor.help())
                .register(registry);
    }

    @Override
    public String toString() {
        return descriptor.fullName() + "=" + count();
    }
}
