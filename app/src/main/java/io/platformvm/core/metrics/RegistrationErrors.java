package io.platformvm.core.metrics;

import java.util.ArrayList;
import java.util.List;

/** Runs every registration step and keeps the failures for one combined report. */
final class RegistrationErrors {
    private final List<RegistrationException.Failure> failures = new ArrayList<>();

    void attempt(String name, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            add(name, e);
        }
    }

    void add(String name, RuntimeException cause) {
        failures.add(new RegistrationException.Failure(name, cause));
    }

    int size() {
        return failures.size();
    }

    void throwIfAny() {
        if (!failures.isEmpty()) {
            throw new RegistrationException(failures);
        }
    }
}
