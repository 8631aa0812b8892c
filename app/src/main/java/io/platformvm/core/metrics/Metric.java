package io.platformvm.core.metrics;

import io.micrometer.core.instrument.binder.MeterBinder;

/** A metric handle owned by {@link MetricSet}; binding it to a registry is its registration. */
public interface Metric extends MeterBinder {
    MetricDescriptor descriptor();
}
