package io.platformvm.core.protocol;

import java.util.Optional;

/** Closed set of platform chain block kinds. */
public enum BlockKind {
    ABORT("abort"),
    ATOMIC("atomic"),
    COMMIT("commit"),
    PROPOSAL("proposal"),
    STANDARD("standard");

    private final String metricName;

    BlockKind(String metricName) {
        this.metricName = metricName;
    }

    /** Lower snake case name used in metric names and the acceptance log. */
    public String metricName() {
        return metricName;
    }

    public static Optional<BlockKind> fromName(String name) {
        for (BlockKind kind : values()) {
            if (kind.metricName.equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
