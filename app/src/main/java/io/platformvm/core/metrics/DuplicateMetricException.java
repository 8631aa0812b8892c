package io.platformvm.core.metrics;

public class DuplicateMetricException extends IllegalArgumentException {

    public DuplicateMetricException(String name) {
        super("duplicate metrics collector registration attempted: " + name);
    }
}
