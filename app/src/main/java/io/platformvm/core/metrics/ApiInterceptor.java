package io.platformvm.core.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/** Times API requests into {@code <namespace>_api_request_duration}, tagged by method, path and status. */
public final class ApiInterceptor {
    private final MeterRegistry registry;
    private final String timerName;

    public ApiInterceptor(String namespace, MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("meter registry required");
        }
        this.registry = registry;
        this.timerName = MetricDescriptor.fullName(namespace, "api_request_duration");
    }

    public Timer.Sample start() {
        return Timer.start(registry);
    }

    public void stop(Timer.Sample sample, String method, String path, int status) {
        Timer timer = Timer
                .builder(timerName)
                .description("API request duration")
                .tag("method", method)
                .tag("path", path)
                .tag("status", Integer.toString(status))
                .register(registry);
        sample.stop(timer);
    }
}
