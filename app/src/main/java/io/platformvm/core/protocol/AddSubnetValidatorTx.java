package io.platformvm.core.protocol;

import java.util.Objects;

/** Adds a validator to a subnet with the given sampling weight. */
public record AddSubnetValidatorTx(String nodeId,
                                   long startTime,
                                   long endTime,
                                   long weight,
                                   Hash subnetId) implements PlatformTx {

    public AddSubnetValidatorTx {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(subnetId, "subnetId");
    }

    @Override
    public TxKind kind() {
        return TxKind.ADD_SUBNET_VALIDATOR;
    }

    @Override
    public byte[] bytes() {
        return TxEncoder.of(kind())
                .putStr(nodeId)
                .putLong(startTime)
                .putLong(endTime)
                .putLong(weight)
                .putHash(subnetId)
                .toBytes();
    }
}
