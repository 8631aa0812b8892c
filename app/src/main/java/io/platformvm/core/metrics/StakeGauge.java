package io.platformvm.core.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Point-in-time stake figure set by the stake tracker. Values are kept at full
 * precision; the registry sees them as doubles.
 */
public final class StakeGauge implements Metric {
    private final MetricDescriptor descriptor;
    private final BigDecimal max;
    private final AtomicReference<BigDecimal> value = new AtomicReference<>(BigDecimal.ZERO);

    public StakeGauge(MetricDescriptor descriptor) {
        this(descriptor, null);
    }

    /** @param max inclusive upper bound, or null for unbounded */
    public StakeGauge(MetricDescriptor descriptor, BigDecimal max) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor required");
        }
        this.descriptor = descriptor;
        this.max = max;
    }

    public void set(BigDecimal newValue) {
        if (newValue == null) {
            throw new IllegalArgumentException(descriptor.fullName() + " value required");
        }
        if (newValue.signum() < 0) {
            throw new IllegalArgumentException(descriptor.fullName() + " must be >= 0");
        }
        if (max != null && newValue.compareTo(max) > 0) {
            throw new IllegalArgumentException(descriptor.fullName() + " must be <= " + max.toPlainString());
        }
        value.set(newValue);
    }

    public BigDecimal value() {
        return value.get();
    }

    @Override
    public MetricDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder(descriptor.fullName(), this, g -> g.value().doubleValue())
                .description(descriptor.help())
                .strongReference(true)
                .register(registry);
    }

    @Override
    public String toString() {
        return descriptor.fullName() + "=" + value().toPlainString();
    }
}
