package io.platformvm.core.metrics;

import java.util.List;

/**
 * One or more metrics failed to register. Carries every failure, not just the first;
 * each cause is also attached as a suppressed exception.
 */
public class RegistrationException extends RuntimeException {
    private final List<Failure> failures;

    public RegistrationException(List<Failure> failures) {
        super(message(failures));
        this.failures = List.copyOf(failures);
        for (Failure failure : this.failures) {
            addSuppressed(failure.cause());
        }
    }

    public List<Failure> failures() {
        return failures;
    }

    public record Failure(String name, RuntimeException cause) {}

    private static String message(List<Failure> failures) {
        StringBuilder sb = new StringBuilder("failed to register ")
                .append(failures.size())
                .append(failures.size() == 1 ? " metric: " : " metrics: ");
        boolean first = true;
        for (Failure failure : failures) {
            if (!first) {
                sb.append("; ");
            }
            first = false;
            sb.append(failure.name()).append(" (").append(failure.cause().getMessage()).append(')');
        }
        return sb.toString();
    }
}
