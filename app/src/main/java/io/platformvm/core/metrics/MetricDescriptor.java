package io.platformvm.core.metrics;

/**
 * Namespace, name and help text of one metric. The registered name is
 * {@code namespace_name}, or just {@code name} when the namespace is empty.
 */
public record MetricDescriptor(String namespace, String name, String help) {
    public MetricDescriptor {
        namespace = namespace == null ? "" : namespace;
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Metric name required");
        }
        help = help == null ? "" : help;
    }

    public String fullName() {
        return fullName(namespace, name);
    }

    static String fullName(String namespace, String name) {
        if (namespace == null || namespace.isEmpty()) {
            return name;
        }
        return namespace + "_" + name;
    }
}
