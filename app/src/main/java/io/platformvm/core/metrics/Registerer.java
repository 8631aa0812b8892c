package io.platformvm.core.metrics;

import io.micrometer.core.instrument.MeterRegistry;

/** Attaches metrics to the reporting backend. */
public interface Registerer {

    /**
     * Registers one metric.
     *
     * @throws RuntimeException if the metric cannot be registered, for example
     *         {@link DuplicateMetricException} when its name is already taken
     */
    void register(Metric metric);

    /** Registry for collaborators that create their own meters, such as {@link ApiInterceptor}. */
    MeterRegistry meterRegistry();
}
