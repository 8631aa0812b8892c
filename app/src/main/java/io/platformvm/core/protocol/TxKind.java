package io.platformvm.core.protocol;

import java.util.Optional;

/** Closed set of platform chain unsigned transaction kinds. */
public enum TxKind {
    ADD_DELEGATOR("add_delegator"),
    ADD_SUBNET_VALIDATOR("add_subnet_validator"),
    ADD_VALIDATOR("add_validator"),
    ADVANCE_TIME("advance_time"),
    CREATE_CHAIN("create_chain"),
    CREATE_SUBNET("create_subnet"),
    EXPORT("export"),
    IMPORT("import"),
    REWARD_VALIDATOR("reward_validator");

    private final String metricName;

    TxKind(String metricName) {
        this.metricName = metricName;
    }

    public String metricName() {
        return metricName;
    }

    public static Optional<TxKind> fromName(String name) {
        for (TxKind kind : values()) {
            if (kind.metricName.equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
